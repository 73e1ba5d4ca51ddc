package me.christianrobert.detyper.transformer.naming;

/**
 * Position a binder is displayed in; decides its default stem and whether it may become a wildcard.
 */
public enum BinderRole {
    /** Hypotheses and conclusion of a proof state. */
    GOAL,
    /** Argument slot of a reconstructed match pattern. */
    PATTERN,
    /** Any other term position. */
    ELSEWHERE;

    public static final String NON_DEPENDENT_STEM = "H";
    public static final String DEPENDENT_STEM = "x";

    /**
     * Stem used for an anonymous binder that still needs a name.
     */
    public String defaultStem() {
        return this == PATTERN ? DEPENDENT_STEM : NON_DEPENDENT_STEM;
    }
}
