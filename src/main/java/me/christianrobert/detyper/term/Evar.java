package me.christianrobert.detyper.term;

import java.util.List;
import java.util.Objects;

/**
 * Existential variable applied to its instance (one argument per declaration
 * of the evar's named context, in the same order).
 */
public final class Evar extends Term {

    private final int id;
    private final List<Term> arguments;

    public Evar(int id, List<Term> arguments) {
        this.id = id;
        this.arguments = List.copyOf(arguments);
    }

    public int getId() {
        return id;
    }

    public List<Term> getArguments() {
        return arguments;
    }

    @Override
    public TermKind getKind() {
        return TermKind.EVAR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Evar evar = (Evar) o;
        return id == evar.id && arguments.equals(evar.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, arguments);
    }

    @Override
    public String toString() {
        return "Evar(" + id + ", " + arguments + ")";
    }
}
