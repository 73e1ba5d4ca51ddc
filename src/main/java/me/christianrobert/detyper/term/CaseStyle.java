package me.christianrobert.detyper.term;

/**
 * Notation a case expression was originally written with.
 */
public enum CaseStyle {
    /** Plain {@code match}. */
    REGULAR,
    /** {@code let (a, b) := t in ...}. */
    LET,
    /** {@code if t then a else b}. */
    IF,
    /** {@code let 'pat := t in ...}, kept as is. */
    LET_PATTERN,
    /** Already a surface match produced by the pattern-matching compiler. */
    MATCH
}
