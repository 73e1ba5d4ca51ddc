package me.christianrobert.detyper.term;

/**
 * Primitive 63-bit machine integer.
 */
public final class IntLit extends Term {

    private final long value;

    public IntLit(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public TermKind getKind() {
        return TermKind.INT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((IntLit) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
