package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.SortFamily;

import java.util.List;
import java.util.Objects;

/**
 * Displayed sort. For {@code Type}, a null level list stands for an anonymous
 * rigid universe ({@code Type} printed without annotation).
 */
public final class GSort extends SurfaceTerm {

    public static final GSort SPROP = new GSort(SortFamily.SPROP, null);
    public static final GSort PROP = new GSort(SortFamily.PROP, null);
    public static final GSort SET = new GSort(SortFamily.SET, null);
    public static final GSort ANONYMOUS_TYPE = new GSort(SortFamily.TYPE, null);

    private final SortFamily family;
    private final List<GSortLevel> levels;

    public GSort(SortFamily family, List<GSortLevel> levels) {
        this.family = Objects.requireNonNull(family, "family");
        this.levels = levels == null ? null : List.copyOf(levels);
    }

    public SortFamily getFamily() {
        return family;
    }

    public List<GSortLevel> getLevels() {
        return levels;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.SORT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GSort that = (GSort) o;
        return family == that.family && Objects.equals(levels, that.levels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, levels);
    }

    @Override
    public String toString() {
        switch (family) {
            case SPROP:
                return "SProp";
            case PROP:
                return "Prop";
            case SET:
                return "Set";
            default:
                return levels == null ? "Type" : "Type@{" + levels + "}";
        }
    }
}
