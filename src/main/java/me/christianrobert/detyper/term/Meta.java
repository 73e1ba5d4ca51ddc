package me.christianrobert.detyper.term;

/**
 * Meta-variable used by term matching. {@link #SPECIAL} marks the context hole.
 */
public final class Meta extends Term {

    public static final int SPECIAL = -1;

    private final int number;

    public Meta(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    @Override
    public TermKind getKind() {
        return TermKind.META;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return number == ((Meta) o).number;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(number);
    }

    @Override
    public String toString() {
        return "Meta(" + number + ")";
    }
}
