package me.christianrobert.detyper.term;

/**
 * Discriminator for the core term variants.
 */
public enum TermKind {
    REL,
    VAR,
    META,
    EVAR,
    SORT,
    CAST,
    PROD,
    LAMBDA,
    LET_IN,
    APP,
    CONST,
    IND,
    CONSTRUCT,
    CASE,
    FIX,
    COFIX,
    INT,
    FLOAT,
    PROJ
}
