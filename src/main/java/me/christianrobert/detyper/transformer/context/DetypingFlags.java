package me.christianrobert.detyper.transformer.context;

/**
 * Per-position flags threaded through the translation.
 *
 * <p>{@code goal} is true only while displaying the conclusion of a proof
 * state; binder types and values are always translated with it off.
 * {@code lax} asks for the cheapest display of primitive projections.</p>
 */
public final class DetypingFlags {

    private static final DetypingFlags[] CACHE = {
            new DetypingFlags(false, false),
            new DetypingFlags(false, true),
            new DetypingFlags(true, false),
            new DetypingFlags(true, true)
    };

    private final boolean goal;
    private final boolean lax;

    private DetypingFlags(boolean goal, boolean lax) {
        this.goal = goal;
        this.lax = lax;
    }

    public static DetypingFlags of(boolean goal, boolean lax) {
        return CACHE[(goal ? 2 : 0) + (lax ? 1 : 0)];
    }

    public boolean isGoal() {
        return goal;
    }

    public boolean isLax() {
        return lax;
    }

    public DetypingFlags notGoal() {
        return goal ? of(false, lax) : this;
    }

    @Override
    public String toString() {
        return "DetypingFlags{goal=" + goal + ", lax=" + lax + '}';
    }
}
