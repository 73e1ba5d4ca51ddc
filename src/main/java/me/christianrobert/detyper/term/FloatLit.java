package me.christianrobert.detyper.term;

/**
 * Primitive binary64 float.
 */
public final class FloatLit extends Term {

    private final double value;

    public FloatLit(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public TermKind getKind() {
        return TermKind.FLOAT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Double.compare(value, ((FloatLit) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
