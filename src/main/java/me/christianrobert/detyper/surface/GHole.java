package me.christianrobert.detyper.surface;

/**
 * Placeholder {@code _} left for the elaborator to infer.
 */
public final class GHole extends SurfaceTerm {

    public static final GHole INSTANCE = new GHole();

    private GHole() {
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.HOLE;
    }

    @Override
    public String toString() {
        return "_";
    }
}
