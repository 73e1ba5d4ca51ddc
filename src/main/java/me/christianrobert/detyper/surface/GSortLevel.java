package me.christianrobert.detyper.surface;

import java.util.Objects;

/**
 * Displayed universe level {@code name + increment}.
 */
public final class GSortLevel {

    private final String name;
    private final int increment;

    public GSortLevel(String name, int increment) {
        this.name = Objects.requireNonNull(name, "name");
        this.increment = increment;
    }

    public String getName() {
        return name;
    }

    public int getIncrement() {
        return increment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GSortLevel that = (GSortLevel) o;
        return increment == that.increment && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, increment);
    }

    @Override
    public String toString() {
        return increment == 0 ? name : name + "+" + increment;
    }
}
