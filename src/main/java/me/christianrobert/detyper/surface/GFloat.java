package me.christianrobert.detyper.surface;

public final class GFloat extends SurfaceTerm {

    private final double value;

    public GFloat(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.FLOAT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Double.compare(value, ((GFloat) o).value) == 0;
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
