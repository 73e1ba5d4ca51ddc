package me.christianrobert.detyper.term;

import java.util.List;
import java.util.Objects;

public final class Ind extends GlobalTerm {

    private final InductiveRef inductive;

    public Ind(InductiveRef inductive, List<String> instance) {
        super(instance);
        this.inductive = Objects.requireNonNull(inductive, "inductive");
    }

    public Ind(InductiveRef inductive) {
        this(inductive, List.of());
    }

    public InductiveRef getInductive() {
        return inductive;
    }

    @Override
    public TermKind getKind() {
        return TermKind.IND;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Ind that = (Ind) o;
        return inductive.equals(that.inductive) && getInstance().equals(that.getInstance());
    }

    @Override
    public int hashCode() {
        return Objects.hash(inductive, getInstance());
    }

    @Override
    public String toString() {
        return "Ind(" + inductive + ")";
    }
}
