package me.christianrobert.detyper.term;

/**
 * Kind of a type ascription, named after the checker that re-verifies it.
 * {@link #REVERT} is the internal cast used for universe bookkeeping.
 */
public enum CastKind {
    DEFAULT,
    VM,
    NATIVE,
    REVERT
}
