package me.christianrobert.detyper.surface;

import java.util.Objects;

public final class GCast extends SurfaceTerm {

    private final SurfaceTerm term;
    private final SurfaceCastKind castKind;
    private final SurfaceTerm type;

    public GCast(SurfaceTerm term, SurfaceCastKind castKind, SurfaceTerm type) {
        this.term = Objects.requireNonNull(term, "term");
        this.castKind = Objects.requireNonNull(castKind, "castKind");
        this.type = Objects.requireNonNull(type, "type");
    }

    public SurfaceTerm getTerm() {
        return term;
    }

    public SurfaceCastKind getCastKind() {
        return castKind;
    }

    public SurfaceTerm getType() {
        return type;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.CAST;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GCast that = (GCast) o;
        return term.equals(that.term) && castKind == that.castKind && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, castKind, type);
    }

    @Override
    public String toString() {
        return "(" + term + " : " + type + ")";
    }
}
