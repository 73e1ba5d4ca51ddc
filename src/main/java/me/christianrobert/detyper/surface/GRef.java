package me.christianrobert.detyper.surface;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a global. The universe instance is null when it is not displayed.
 */
public final class GRef extends SurfaceTerm {

    private final GlobalReference reference;
    private final List<String> instance;

    public GRef(GlobalReference reference, List<String> instance) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.instance = instance == null ? null : List.copyOf(instance);
    }

    public GRef(GlobalReference reference) {
        this(reference, null);
    }

    public GlobalReference getReference() {
        return reference;
    }

    public List<String> getInstance() {
        return instance;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.REF;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GRef gRef = (GRef) o;
        return reference.equals(gRef.reference) && Objects.equals(instance, gRef.instance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, instance);
    }

    @Override
    public String toString() {
        return instance == null ? reference.toString() : reference + "@{" + String.join(" ", instance) + "}";
    }
}
