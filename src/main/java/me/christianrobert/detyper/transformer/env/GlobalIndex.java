package me.christianrobert.detyper.transformer.env;

import me.christianrobert.detyper.term.InductiveRef;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory {@link GlobalEnvironment} backed by immutable hash indices.
 *
 * <p>Built once by {@link GlobalIndexBuilder} and reused across detyping calls.
 * Useful on its own in tests, where a minimal index replaces the real symbol table.</p>
 */
public class GlobalIndex implements GlobalEnvironment {

    // Inductive identity -> display facts
    private final Map<InductiveRef, InductiveDeclaration> inductives;

    // Identifiers of section variables
    private final Set<String> sectionVariables;

    public GlobalIndex(Map<InductiveRef, InductiveDeclaration> inductives, Set<String> sectionVariables) {
        this.inductives = Map.copyOf(inductives);
        this.sectionVariables = Set.copyOf(sectionVariables);
    }

    public static GlobalIndex empty() {
        return new GlobalIndex(Map.of(), Set.of());
    }

    @Override
    public Optional<InductiveDeclaration> lookupInductive(InductiveRef inductive) {
        return Optional.ofNullable(inductives.get(inductive));
    }

    @Override
    public boolean isSectionVariable(String id) {
        return sectionVariables.contains(id);
    }

    public int getInductiveCount() {
        return inductives.size();
    }

    public int getSectionVariableCount() {
        return sectionVariables.size();
    }
}
