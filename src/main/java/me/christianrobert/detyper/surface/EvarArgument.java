package me.christianrobert.detyper.surface;

import java.util.Objects;

/**
 * Displayed instance argument {@code id := value} of an existential variable.
 */
public final class EvarArgument {

    private final String id;
    private final SurfaceTerm value;

    public EvarArgument(String id, SurfaceTerm value) {
        this.id = Objects.requireNonNull(id, "id");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getId() {
        return id;
    }

    public SurfaceTerm getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EvarArgument that = (EvarArgument) o;
        return id.equals(that.id) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, value);
    }

    @Override
    public String toString() {
        return id + " := " + value;
    }
}
