package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.ConstructorRef;
import me.christianrobert.detyper.term.InductiveRef;

import java.util.Objects;

/**
 * Global object a {@link GRef} points to.
 */
public final class GlobalReference {

    public enum Kind {
        VARIABLE,
        CONSTANT,
        INDUCTIVE,
        CONSTRUCTOR
    }

    private final Kind kind;
    private final String name;
    private final InductiveRef inductive;
    private final ConstructorRef constructor;

    private GlobalReference(Kind kind, String name, InductiveRef inductive, ConstructorRef constructor) {
        this.kind = kind;
        this.name = name;
        this.inductive = inductive;
        this.constructor = constructor;
    }

    public static GlobalReference ofVariable(String id) {
        return new GlobalReference(Kind.VARIABLE, Objects.requireNonNull(id, "id"), null, null);
    }

    public static GlobalReference ofConstant(String name) {
        return new GlobalReference(Kind.CONSTANT, Objects.requireNonNull(name, "name"), null, null);
    }

    public static GlobalReference ofInductive(InductiveRef inductive) {
        return new GlobalReference(Kind.INDUCTIVE, null, Objects.requireNonNull(inductive, "inductive"), null);
    }

    public static GlobalReference ofConstructor(ConstructorRef constructor) {
        return new GlobalReference(Kind.CONSTRUCTOR, null, null, Objects.requireNonNull(constructor, "constructor"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Gets the variable or constant name (null for inductives and constructors).
     */
    public String getName() {
        return name;
    }

    public InductiveRef getInductive() {
        return inductive;
    }

    public ConstructorRef getConstructor() {
        return constructor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GlobalReference that = (GlobalReference) o;
        return kind == that.kind && Objects.equals(name, that.name)
                && Objects.equals(inductive, that.inductive)
                && Objects.equals(constructor, that.constructor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, inductive, constructor);
    }

    @Override
    public String toString() {
        switch (kind) {
            case INDUCTIVE:
                return inductive.toString();
            case CONSTRUCTOR:
                return constructor.toString();
            default:
                return name;
        }
    }
}
