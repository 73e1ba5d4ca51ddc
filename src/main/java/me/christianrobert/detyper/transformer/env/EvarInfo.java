package me.christianrobert.detyper.transformer.env;

import me.christianrobert.detyper.term.NamedDeclaration;

import java.util.List;

/**
 * Existential variable as seen by the printer.
 *
 * <p>{@code instanceContext} lists the hypotheses the evar was created in, in
 * the same order as the arguments of an {@code Evar} term instantiating it.</p>
 */
public class EvarInfo {

    private final String identifier;
    private final String suggestedName;
    private final List<NamedDeclaration> instanceContext;

    public EvarInfo(String identifier, String suggestedName, List<NamedDeclaration> instanceContext) {
        this.identifier = identifier;
        this.suggestedName = suggestedName;
        this.instanceContext = List.copyOf(instanceContext);
    }

    /**
     * User-given name ({@code ?x}), or null.
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * Name derived from the evar's origin, or null.
     */
    public String getSuggestedName() {
        return suggestedName;
    }

    public List<NamedDeclaration> getInstanceContext() {
        return instanceContext;
    }
}
