package me.christianrobert.detyper.term;

import java.util.Objects;

public final class CoFix extends Term {

    private final int index;
    private final RecBlock block;

    public CoFix(int index, RecBlock block) {
        this.index = index;
        this.block = Objects.requireNonNull(block, "block");
    }

    public int getIndex() {
        return index;
    }

    public RecBlock getBlock() {
        return block;
    }

    @Override
    public TermKind getKind() {
        return TermKind.COFIX;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CoFix coFix = (CoFix) o;
        return index == coFix.index && block.equals(coFix.block);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, block);
    }

    @Override
    public String toString() {
        return "CoFix(" + block.getNames() + ", " + index + ")";
    }
}
