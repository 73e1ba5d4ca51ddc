package me.christianrobert.detyper.surface;

public final class GInt extends SurfaceTerm {

    private final long value;

    public GInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.INT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((GInt) o).value;
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
