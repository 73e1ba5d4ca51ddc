package me.christianrobert.detyper.surface;

/**
 * Base class of the named surface syntax tree produced by detyping.
 *
 * <p>Surface terms are immutable once built. {@link #equals(Object)} is
 * structural and is what match-clause factorization uses to decide whether two
 * right-hand sides are the same.</p>
 */
public abstract class SurfaceTerm {

    public abstract SurfaceKind getKind();

    public boolean is(SurfaceKind kind) {
        return getKind() == kind;
    }
}
