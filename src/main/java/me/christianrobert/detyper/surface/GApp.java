package me.christianrobert.detyper.surface;

import java.util.List;
import java.util.Objects;

public final class GApp extends SurfaceTerm {

    private final SurfaceTerm head;
    private final List<SurfaceTerm> arguments;

    public GApp(SurfaceTerm head, List<SurfaceTerm> arguments) {
        this.head = Objects.requireNonNull(head, "head");
        this.arguments = List.copyOf(arguments);
    }

    public SurfaceTerm getHead() {
        return head;
    }

    public List<SurfaceTerm> getArguments() {
        return arguments;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.APP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GApp gApp = (GApp) o;
        return head.equals(gApp.head) && arguments.equals(gApp.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(head, arguments);
    }

    @Override
    public String toString() {
        return "(" + head + " " + arguments + ")";
    }
}
