package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.Name;

import java.util.Objects;

/**
 * Shared shape of {@link GProd} and {@link GLambda}.
 */
public abstract class GBinderTerm extends SurfaceTerm {

    private final Name name;
    private final SurfaceTerm type;
    private final SurfaceTerm body;

    protected GBinderTerm(Name name, SurfaceTerm type, SurfaceTerm body) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.body = Objects.requireNonNull(body, "body");
    }

    public Name getName() {
        return name;
    }

    public SurfaceTerm getType() {
        return type;
    }

    public SurfaceTerm getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GBinderTerm that = (GBinderTerm) o;
        return name.equals(that.name) && type.equals(that.type) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), name, type, body);
    }
}
