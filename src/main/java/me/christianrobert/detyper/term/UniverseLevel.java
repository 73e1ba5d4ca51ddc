package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * One component {@code level + increment} of an algebraic universe.
 *
 * <p>The level names {@code "Prop"} and {@code "Set"} denote the predicative
 * base levels; any other name is a (possibly qualified) universe variable.</p>
 */
public final class UniverseLevel {

    private final String level;
    private final int increment;

    public UniverseLevel(String level, int increment) {
        this.level = Objects.requireNonNull(level, "level");
        this.increment = increment;
    }

    public static UniverseLevel of(String level) {
        return new UniverseLevel(level, 0);
    }

    public String getLevel() {
        return level;
    }

    public int getIncrement() {
        return increment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UniverseLevel that = (UniverseLevel) o;
        return increment == that.increment && level.equals(that.level);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, increment);
    }

    @Override
    public String toString() {
        return increment == 0 ? level : level + "+" + increment;
    }
}
