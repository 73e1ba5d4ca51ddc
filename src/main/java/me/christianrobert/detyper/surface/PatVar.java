package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.Name;

import java.util.Objects;

/**
 * Variable pattern, or {@code _} when anonymous. Also stands for a constructor's let-bound
 * argument, which carries no value in the pattern itself.
 */
public final class PatVar extends Pattern {

    public static final PatVar WILDCARD = new PatVar(Name.ANONYMOUS);

    private final Name name;

    public PatVar(Name name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Name getName() {
        return name;
    }

    @Override
    public boolean isVariable() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((PatVar) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name.toString();
    }
}
