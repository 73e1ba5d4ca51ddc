package me.christianrobert.detyper.term;

import java.util.List;
import java.util.Objects;

/**
 * Constant reference by fully qualified name (e.g. {@code Coq.Init.Nat.add}).
 */
public final class Const extends GlobalTerm {

    private final String name;

    public Const(String name, List<String> instance) {
        super(instance);
        this.name = Objects.requireNonNull(name, "name");
    }

    public Const(String name) {
        this(name, List.of());
    }

    public String getName() {
        return name;
    }

    @Override
    public TermKind getKind() {
        return TermKind.CONST;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Const that = (Const) o;
        return name.equals(that.name) && getInstance().equals(that.getInstance());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, getInstance());
    }

    @Override
    public String toString() {
        return "Const(" + name + ")";
    }
}
