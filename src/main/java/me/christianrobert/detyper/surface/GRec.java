package me.christianrobert.detyper.surface;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Block of mutually (co)recursive functions, selecting function {@code index}.
 *
 * <p>For a fixpoint, {@code recIndices} holds the position of the decreasing
 * argument of each function; it is empty for a cofixpoint. Types and bodies
 * are expressed after the function's own argument binders.</p>
 */
public final class GRec extends SurfaceTerm {

    private final RecKind recKind;
    private final List<Integer> recIndices;
    private final int index;
    private final List<String> names;
    private final List<List<SurfaceBinder>> binders;
    private final List<SurfaceTerm> types;
    private final List<SurfaceTerm> bodies;

    public GRec(RecKind recKind, List<Integer> recIndices, int index, List<String> names,
                List<List<SurfaceBinder>> binders, List<SurfaceTerm> types, List<SurfaceTerm> bodies) {
        this.recKind = Objects.requireNonNull(recKind, "recKind");
        this.recIndices = List.copyOf(recIndices);
        this.index = index;
        this.names = List.copyOf(names);
        List<List<SurfaceBinder>> copy = new ArrayList<>();
        for (List<SurfaceBinder> list : binders) {
            copy.add(List.copyOf(list));
        }
        this.binders = List.copyOf(copy);
        this.types = List.copyOf(types);
        this.bodies = List.copyOf(bodies);
    }

    public RecKind getRecKind() {
        return recKind;
    }

    public List<Integer> getRecIndices() {
        return recIndices;
    }

    public int getIndex() {
        return index;
    }

    public List<String> getNames() {
        return names;
    }

    public List<List<SurfaceBinder>> getBinders() {
        return binders;
    }

    public List<SurfaceTerm> getTypes() {
        return types;
    }

    public List<SurfaceTerm> getBodies() {
        return bodies;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.REC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GRec that = (GRec) o;
        return recKind == that.recKind && index == that.index
                && recIndices.equals(that.recIndices) && names.equals(that.names)
                && binders.equals(that.binders) && types.equals(that.types) && bodies.equals(that.bodies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recKind, recIndices, index, names, binders, types, bodies);
    }

    @Override
    public String toString() {
        return recKind.name().toLowerCase() + " " + names + " {" + index + "}";
    }
}
