package me.christianrobert.detyper.surface;

import java.util.Objects;

public final class GVar extends SurfaceTerm {

    private final String id;

    public GVar(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.VAR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((GVar) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
