package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.Name;

import java.util.Objects;

/**
 * Argument binder of a recursive function: {@code (x : T)} or {@code (x : T := v)}.
 */
public final class SurfaceBinder {

    private final Name name;
    private final SurfaceTerm value;
    private final SurfaceTerm type;

    public SurfaceBinder(Name name, SurfaceTerm value, SurfaceTerm type) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
        this.type = Objects.requireNonNull(type, "type");
    }

    public static SurfaceBinder assumption(Name name, SurfaceTerm type) {
        return new SurfaceBinder(name, null, type);
    }

    public Name getName() {
        return name;
    }

    /**
     * Gets the let value, or null for an ordinary argument.
     */
    public SurfaceTerm getValue() {
        return value;
    }

    public SurfaceTerm getType() {
        return type;
    }

    public boolean isDefinition() {
        return value != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SurfaceBinder that = (SurfaceBinder) o;
        return name.equals(that.name) && Objects.equals(value, that.value) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, type);
    }

    @Override
    public String toString() {
        return "(" + name + " : " + type + (value != null ? " := " + value : "") + ")";
    }
}
