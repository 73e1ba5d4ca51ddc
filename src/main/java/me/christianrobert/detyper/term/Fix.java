package me.christianrobert.detyper.term;

import java.util.List;
import java.util.Objects;

/**
 * Fixpoint block; {@code recIndices.get(i)} is the 0-based position of the
 * decreasing argument of the i-th function, {@code index} the selected function.
 */
public final class Fix extends Term {

    private final List<Integer> recIndices;
    private final int index;
    private final RecBlock block;

    public Fix(List<Integer> recIndices, int index, RecBlock block) {
        this.block = Objects.requireNonNull(block, "block");
        if (recIndices.size() != block.size()) {
            throw new IllegalArgumentException("Fixpoint requires one decreasing argument per function");
        }
        this.recIndices = List.copyOf(recIndices);
        this.index = index;
    }

    public List<Integer> getRecIndices() {
        return recIndices;
    }

    public int getIndex() {
        return index;
    }

    public RecBlock getBlock() {
        return block;
    }

    @Override
    public TermKind getKind() {
        return TermKind.FIX;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Fix fix = (Fix) o;
        return index == fix.index && recIndices.equals(fix.recIndices) && block.equals(fix.block);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recIndices, index, block);
    }

    @Override
    public String toString() {
        return "Fix(" + block.getNames() + ", " + index + ")";
    }
}
