package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * Reference to a constructor; {@code number} is 1-based.
 */
public final class ConstructorRef {

    private final InductiveRef inductive;
    private final int number;

    public ConstructorRef(InductiveRef inductive, int number) {
        this.inductive = Objects.requireNonNull(inductive, "inductive");
        if (number < 1) {
            throw new IllegalArgumentException("Constructor numbers start at 1, got " + number);
        }
        this.number = number;
    }

    public InductiveRef getInductive() {
        return inductive;
    }

    public int getNumber() {
        return number;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstructorRef that = (ConstructorRef) o;
        return number == that.number && inductive.equals(that.inductive);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inductive, number);
    }

    @Override
    public String toString() {
        return inductive + "." + number;
    }
}
