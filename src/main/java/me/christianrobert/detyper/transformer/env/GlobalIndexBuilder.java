package me.christianrobert.detyper.transformer.env;

import me.christianrobert.detyper.term.InductiveRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link GlobalIndex} from declaration lists.
 *
 * <p>Usage:
 * <pre>
 * GlobalIndex index = new GlobalIndexBuilder()
 *     .inductive(new InductiveDeclaration(bool, "bool", List.of("true", "false"), 0))
 *     .sectionVariable("A")
 *     .build();
 * </pre>
 */
public class GlobalIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(GlobalIndexBuilder.class);

    private final Map<InductiveRef, InductiveDeclaration> inductives = new HashMap<>();
    private final Set<String> sectionVariables = new HashSet<>();

    public GlobalIndexBuilder inductive(InductiveDeclaration declaration) {
        if (declaration == null) {
            throw new IllegalArgumentException("Inductive declaration cannot be null");
        }
        InductiveDeclaration previous = inductives.put(declaration.getInductive(), declaration);
        if (previous != null) {
            log.debug("Replacing declaration of {}", declaration.getInductive());
        }
        return this;
    }

    public GlobalIndexBuilder inductives(List<InductiveDeclaration> declarations) {
        for (InductiveDeclaration declaration : declarations) {
            inductive(declaration);
        }
        return this;
    }

    public GlobalIndexBuilder sectionVariable(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Section variable cannot be null or empty");
        }
        sectionVariables.add(id);
        return this;
    }

    public GlobalIndex build() {
        log.info("Global index built: {} inductives, {} section variables",
                inductives.size(), sectionVariables.size());
        return new GlobalIndex(inductives, sectionVariables);
    }
}
