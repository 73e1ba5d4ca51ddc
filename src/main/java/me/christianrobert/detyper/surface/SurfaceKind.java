package me.christianrobert.detyper.surface;

public enum SurfaceKind {
    VAR,
    REF,
    EVAR,
    APP,
    PROD,
    LAMBDA,
    LET_IN,
    CASES,
    LET_TUPLE,
    IF,
    REC,
    SORT,
    HOLE,
    CAST,
    INT,
    FLOAT
}
