package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.Name;

public final class GLambda extends GBinderTerm {

    public GLambda(Name name, SurfaceTerm type, SurfaceTerm body) {
        super(name, type, body);
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.LAMBDA;
    }

    @Override
    public String toString() {
        return "fun " + getName() + " : " + getType() + " => " + getBody();
    }
}
