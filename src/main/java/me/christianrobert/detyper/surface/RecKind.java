package me.christianrobert.detyper.surface;

public enum RecKind {
    FIX,
    COFIX
}
