package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * Primitive projection of a record field.
 *
 * <p>{@code constant} is the accessor constant the projection unfolds to,
 * {@code parameterCount} the number of record parameters the accessor expects
 * before the record value.</p>
 */
public class Projection {

    private final String constant;
    private final InductiveRef inductive;
    private final int parameterCount;
    private final int fieldIndex;

    public Projection(String constant, InductiveRef inductive, int parameterCount, int fieldIndex) {
        this.constant = Objects.requireNonNull(constant, "constant");
        this.inductive = Objects.requireNonNull(inductive, "inductive");
        this.parameterCount = parameterCount;
        this.fieldIndex = fieldIndex;
    }

    public String getConstant() {
        return constant;
    }

    public InductiveRef getInductive() {
        return inductive;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    public int getFieldIndex() {
        return fieldIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Projection that = (Projection) o;
        return parameterCount == that.parameterCount && fieldIndex == that.fieldIndex
                && constant.equals(that.constant) && inductive.equals(that.inductive);
    }

    @Override
    public int hashCode() {
        return Objects.hash(constant, inductive, parameterCount, fieldIndex);
    }

    @Override
    public String toString() {
        return constant;
    }
}
