package me.christianrobert.detyper.surface;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Surface term whose construction is postponed until first forced.
 *
 * <p>The result is memoized: subsequent calls to {@link #force()} return the
 * same instance without running the translation again.</p>
 */
public final class DelayedSurfaceTerm {

    private Supplier<SurfaceTerm> pending;
    private SurfaceTerm value;

    public DelayedSurfaceTerm(Supplier<SurfaceTerm> supplier) {
        this.pending = Objects.requireNonNull(supplier, "supplier");
    }

    public static DelayedSurfaceTerm ready(SurfaceTerm term) {
        DelayedSurfaceTerm delayed = new DelayedSurfaceTerm(() -> term);
        delayed.force();
        return delayed;
    }

    public synchronized SurfaceTerm force() {
        if (pending != null) {
            value = pending.get();
            pending = null;
        }
        return value;
    }

    public synchronized boolean isForced() {
        return pending == null;
    }

    @Override
    public String toString() {
        return isForced() ? "Delayed[" + value + "]" : "Delayed[<pending>]";
    }
}
