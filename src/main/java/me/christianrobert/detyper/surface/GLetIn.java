package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.Name;

import java.util.Objects;

/**
 * {@code let name : type := value in body}; the type is null when not displayed.
 */
public final class GLetIn extends SurfaceTerm {

    private final Name name;
    private final SurfaceTerm value;
    private final SurfaceTerm type;
    private final SurfaceTerm body;

    public GLetIn(Name name, SurfaceTerm value, SurfaceTerm type, SurfaceTerm body) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
        this.type = type;
        this.body = Objects.requireNonNull(body, "body");
    }

    public Name getName() {
        return name;
    }

    public SurfaceTerm getValue() {
        return value;
    }

    public SurfaceTerm getType() {
        return type;
    }

    public SurfaceTerm getBody() {
        return body;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.LET_IN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GLetIn that = (GLetIn) o;
        return name.equals(that.name) && value.equals(that.value)
                && Objects.equals(type, that.type) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, type, body);
    }

    @Override
    public String toString() {
        return "let " + name + (type != null ? " : " + type : "") + " := " + value + " in " + body;
    }
}
