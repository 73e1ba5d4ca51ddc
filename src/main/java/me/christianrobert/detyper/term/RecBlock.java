package me.christianrobert.detyper.term;

import java.util.List;
import java.util.Objects;

/**
 * Mutually recursive block shared by {@link Fix} and {@link CoFix}.
 *
 * <p>Types live in the outer context; bodies live under the block's own
 * function binders (the first name is the outermost, so inside a body
 * {@code Rel n} with {@code n = size} refers to the first function).</p>
 */
public class RecBlock {

    private final List<Name> names;
    private final List<Term> types;
    private final List<Term> bodies;

    public RecBlock(List<Name> names, List<Term> types, List<Term> bodies) {
        if (names.size() != types.size() || names.size() != bodies.size()) {
            throw new IllegalArgumentException("Recursive block requires as many names, types and bodies");
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Recursive block cannot be empty");
        }
        this.names = List.copyOf(names);
        this.types = List.copyOf(types);
        this.bodies = List.copyOf(bodies);
    }

    public List<Name> getNames() {
        return names;
    }

    public List<Term> getTypes() {
        return types;
    }

    public List<Term> getBodies() {
        return bodies;
    }

    public int size() {
        return names.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecBlock recBlock = (RecBlock) o;
        return names.equals(recBlock.names) && types.equals(recBlock.types) && bodies.equals(recBlock.bodies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, types, bodies);
    }
}
