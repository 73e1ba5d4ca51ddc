package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * Declaration of a de Bruijn context: an assumption, or a local definition
 * when {@code value} is present.
 */
public class RelDeclaration {

    private final Name name;
    private final Term value;
    private final Term type;

    public RelDeclaration(Name name, Term value, Term type) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
        this.type = Objects.requireNonNull(type, "type");
    }

    public static RelDeclaration assumption(Name name, Term type) {
        return new RelDeclaration(name, null, type);
    }

    public static RelDeclaration definition(Name name, Term value, Term type) {
        return new RelDeclaration(name, Objects.requireNonNull(value, "value"), type);
    }

    public Name getName() {
        return name;
    }

    /**
     * Gets the defined value, or null for an assumption.
     */
    public Term getValue() {
        return value;
    }

    public Term getType() {
        return type;
    }

    public boolean isDefinition() {
        return value != null;
    }

    @Override
    public String toString() {
        return name + (value != null ? " := " + value : "") + " : " + type;
    }
}
