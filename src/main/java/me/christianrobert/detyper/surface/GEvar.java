package me.christianrobert.detyper.surface;

import java.util.List;
import java.util.Objects;

public final class GEvar extends SurfaceTerm {

    private final String id;
    private final List<EvarArgument> arguments;

    public GEvar(String id, List<EvarArgument> arguments) {
        this.id = Objects.requireNonNull(id, "id");
        this.arguments = List.copyOf(arguments);
    }

    public String getId() {
        return id;
    }

    public List<EvarArgument> getArguments() {
        return arguments;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.EVAR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GEvar gEvar = (GEvar) o;
        return id.equals(gEvar.id) && arguments.equals(gEvar.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, arguments);
    }

    @Override
    public String toString() {
        return "?" + id + (arguments.isEmpty() ? "" : arguments.toString());
    }
}
