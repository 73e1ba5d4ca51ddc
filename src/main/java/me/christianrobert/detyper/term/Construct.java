package me.christianrobert.detyper.term;

import java.util.List;
import java.util.Objects;

public final class Construct extends GlobalTerm {

    private final ConstructorRef constructor;

    public Construct(ConstructorRef constructor, List<String> instance) {
        super(instance);
        this.constructor = Objects.requireNonNull(constructor, "constructor");
    }

    public Construct(ConstructorRef constructor) {
        this(constructor, List.of());
    }

    public ConstructorRef getConstructor() {
        return constructor;
    }

    @Override
    public TermKind getKind() {
        return TermKind.CONSTRUCT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Construct that = (Construct) o;
        return constructor.equals(that.constructor) && getInstance().equals(that.getInstance());
    }

    @Override
    public int hashCode() {
        return Objects.hash(constructor, getInstance());
    }

    @Override
    public String toString() {
        return "Construct(" + constructor + ")";
    }
}
