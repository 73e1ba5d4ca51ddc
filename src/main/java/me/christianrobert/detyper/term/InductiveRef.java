package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * Reference to the {@code index}-th inductive of a (mutual) inductive block.
 */
public final class InductiveRef {

    private final String block;
    private final int index;

    public InductiveRef(String block, int index) {
        this.block = Objects.requireNonNull(block, "block");
        this.index = index;
    }

    public static InductiveRef of(String block) {
        return new InductiveRef(block, 0);
    }

    public String getBlock() {
        return block;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Reference to the {@code number}-th constructor (1-based) of this inductive.
     */
    public ConstructorRef constructor(int number) {
        return new ConstructorRef(this, number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InductiveRef that = (InductiveRef) o;
        return index == that.index && block.equals(that.block);
    }

    @Override
    public int hashCode() {
        return Objects.hash(block, index);
    }

    @Override
    public String toString() {
        return index == 0 ? block : block + "#" + index;
    }
}
