package me.christianrobert.detyper.term;

public enum SortFamily {
    SPROP,
    PROP,
    SET,
    TYPE
}
