package me.christianrobert.detyper.transformer.builder.cases;

import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.InductiveRef;
import me.christianrobert.detyper.term.Name;

import java.util.List;

/**
 * {@code as alias in I names return type} part of a match.
 */
public final class ReturnClause {

    private final Name alias;
    private final InductiveRef inductive;
    private final List<Name> inNames;
    private final SurfaceTerm type;

    public ReturnClause(Name alias, InductiveRef inductive, List<Name> inNames, SurfaceTerm type) {
        this.alias = alias;
        this.inductive = inductive;
        this.inNames = List.copyOf(inNames);
        this.type = type;
    }

    public Name getAlias() {
        return alias;
    }

    public InductiveRef getInductive() {
        return inductive;
    }

    public List<Name> getInNames() {
        return inNames;
    }

    public SurfaceTerm getType() {
        return type;
    }

    /**
     * True when an {@code in} pattern is worth showing, i.e. some real argument is named.
     */
    public boolean hasInNames() {
        for (Name name : inNames) {
            if (name.isNamed()) {
                return true;
            }
        }
        return false;
    }
}
