package me.christianrobert.detyper.surface;

/**
 * Surface pattern: a variable (anonymous means wildcard) or a constructor pattern.
 */
public abstract class Pattern {

    public abstract boolean isVariable();
}
