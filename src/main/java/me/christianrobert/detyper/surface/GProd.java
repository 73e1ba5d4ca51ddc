package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.Name;

public final class GProd extends GBinderTerm {

    public GProd(Name name, SurfaceTerm type, SurfaceTerm body) {
        super(name, type, body);
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.PROD;
    }

    @Override
    public String toString() {
        return "forall " + getName() + " : " + getType() + ", " + getBody();
    }
}
