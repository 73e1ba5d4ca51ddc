package me.christianrobert.detyper.surface;

public enum SurfaceCastKind {
    CONV,
    VM,
    NATIVE
}
