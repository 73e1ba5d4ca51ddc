package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * Declaration of a named context (evar instances are interpreted against these).
 */
public class NamedDeclaration {

    private final String id;
    private final boolean definition;

    public NamedDeclaration(String id, boolean definition) {
        this.id = Objects.requireNonNull(id, "id");
        this.definition = definition;
    }

    public static NamedDeclaration assumption(String id) {
        return new NamedDeclaration(id, false);
    }

    public static NamedDeclaration definition(String id) {
        return new NamedDeclaration(id, true);
    }

    public String getId() {
        return id;
    }

    public boolean isDefinition() {
        return definition;
    }

    @Override
    public String toString() {
        return (definition ? "def " : "") + id;
    }
}
