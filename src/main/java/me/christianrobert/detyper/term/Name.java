package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * Binder name: either a concrete identifier or anonymous.
 *
 * <p>Anonymous names are displayed as {@code _} and never resolve a reference.</p>
 */
public final class Name {

    public static final Name ANONYMOUS = new Name(null);

    private final String id;

    private Name(String id) {
        this.id = id;
    }

    /**
     * Creates a concrete name.
     *
     * @param id Identifier (must not be empty)
     * @return Named binder name
     */
    public static Name of(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return new Name(id);
    }

    public boolean isAnonymous() {
        return id == null;
    }

    public boolean isNamed() {
        return id != null;
    }

    /**
     * Gets the identifier, or null for an anonymous name.
     */
    public String getId() {
        return id;
    }

    /**
     * Picks this name unless it is anonymous, in which case the other one is used.
     */
    public Name orElse(Name other) {
        return isNamed() ? this : other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((Name) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return id == null ? "_" : id;
    }
}
