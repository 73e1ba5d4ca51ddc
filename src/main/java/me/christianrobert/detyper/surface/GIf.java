package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.Name;

import java.util.Objects;

/**
 * {@code if scrutinee as alias return type then a else b}.
 */
public final class GIf extends SurfaceTerm {

    private final SurfaceTerm scrutinee;
    private final Name alias;
    private final SurfaceTerm returnType;
    private final SurfaceTerm thenBranch;
    private final SurfaceTerm elseBranch;

    public GIf(SurfaceTerm scrutinee, Name alias, SurfaceTerm returnType,
               SurfaceTerm thenBranch, SurfaceTerm elseBranch) {
        this.scrutinee = Objects.requireNonNull(scrutinee, "scrutinee");
        this.alias = Objects.requireNonNull(alias, "alias");
        this.returnType = returnType;
        this.thenBranch = Objects.requireNonNull(thenBranch, "thenBranch");
        this.elseBranch = Objects.requireNonNull(elseBranch, "elseBranch");
    }

    public SurfaceTerm getScrutinee() {
        return scrutinee;
    }

    public Name getAlias() {
        return alias;
    }

    public SurfaceTerm getReturnType() {
        return returnType;
    }

    public SurfaceTerm getThenBranch() {
        return thenBranch;
    }

    public SurfaceTerm getElseBranch() {
        return elseBranch;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.IF;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GIf that = (GIf) o;
        return scrutinee.equals(that.scrutinee) && alias.equals(that.alias)
                && Objects.equals(returnType, that.returnType)
                && thenBranch.equals(that.thenBranch) && elseBranch.equals(that.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scrutinee, alias, returnType, thenBranch, elseBranch);
    }

    @Override
    public String toString() {
        return "if " + scrutinee + " then " + thenBranch + " else " + elseBranch;
    }
}
