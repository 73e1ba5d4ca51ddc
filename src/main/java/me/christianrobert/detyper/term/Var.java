package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * Named variable (hypothesis of the named context or section variable).
 */
public final class Var extends Term {

    private final String id;

    public Var(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    @Override
    public TermKind getKind() {
        return TermKind.VAR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Var) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Var(" + id + ")";
    }
}
