package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * Primitive projection applied to its principal (record) argument.
 */
public final class Proj extends Term {

    private final Projection projection;
    private final Term term;

    public Proj(Projection projection, Term term) {
        this.projection = Objects.requireNonNull(projection, "projection");
        this.term = Objects.requireNonNull(term, "term");
    }

    public Projection getProjection() {
        return projection;
    }

    public Term getTerm() {
        return term;
    }

    @Override
    public TermKind getKind() {
        return TermKind.PROJ;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Proj proj = (Proj) o;
        return projection.equals(proj.projection) && term.equals(proj.term);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projection, term);
    }

    @Override
    public String toString() {
        return "Proj(" + projection + ", " + term + ")";
    }
}
