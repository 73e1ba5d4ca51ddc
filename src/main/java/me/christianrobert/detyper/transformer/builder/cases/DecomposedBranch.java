package me.christianrobert.detyper.transformer.builder.cases;

import me.christianrobert.detyper.term.Name;

import java.util.List;

/**
 * Names given to the argument slots of a branch, outermost first, and what is left of it.
 */
public final class DecomposedBranch {

    private final List<Name> names;
    private final BranchState rest;

    public DecomposedBranch(List<Name> names, BranchState rest) {
        this.names = List.copyOf(names);
        this.rest = rest;
    }

    public List<Name> getNames() {
        return names;
    }

    public BranchState getRest() {
        return rest;
    }
}
