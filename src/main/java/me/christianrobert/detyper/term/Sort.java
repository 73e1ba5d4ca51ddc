package me.christianrobert.detyper.term;

import java.util.List;
import java.util.Objects;

/**
 * Sort term. Only {@link SortFamily#TYPE} carries a universe (max of its levels).
 */
public final class Sort extends Term {

    public static final Sort SPROP = new Sort(SortFamily.SPROP, List.of());
    public static final Sort PROP = new Sort(SortFamily.PROP, List.of());
    public static final Sort SET = new Sort(SortFamily.SET, List.of());

    private final SortFamily family;
    private final List<UniverseLevel> universe;

    public Sort(SortFamily family, List<UniverseLevel> universe) {
        this.family = Objects.requireNonNull(family, "family");
        this.universe = List.copyOf(universe);
    }

    public static Sort type(UniverseLevel... levels) {
        return new Sort(SortFamily.TYPE, List.of(levels));
    }

    public SortFamily getFamily() {
        return family;
    }

    public List<UniverseLevel> getUniverse() {
        return universe;
    }

    @Override
    public TermKind getKind() {
        return TermKind.SORT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sort sort = (Sort) o;
        return family == sort.family && universe.equals(sort.universe);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, universe);
    }

    @Override
    public String toString() {
        return "Sort(" + family + (universe.isEmpty() ? "" : " " + universe) + ")";
    }
}
