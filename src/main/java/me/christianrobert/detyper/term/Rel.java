package me.christianrobert.detyper.term;

/**
 * Bound variable as a 1-based de Bruijn index ({@code Rel 1} is the innermost binder).
 */
public final class Rel extends Term {

    private final int index;

    public Rel(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public TermKind getKind() {
        return TermKind.REL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return index == ((Rel) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return "Rel(" + index + ")";
    }
}
