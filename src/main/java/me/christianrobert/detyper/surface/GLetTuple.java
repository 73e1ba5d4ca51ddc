package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.Name;

import java.util.List;
import java.util.Objects;

/**
 * {@code let (x1, .., xn) as alias return type := scrutinee in body}.
 */
public final class GLetTuple extends SurfaceTerm {

    private final List<Name> names;
    private final Name alias;
    private final SurfaceTerm returnType;
    private final SurfaceTerm scrutinee;
    private final SurfaceTerm body;

    public GLetTuple(List<Name> names, Name alias, SurfaceTerm returnType, SurfaceTerm scrutinee, SurfaceTerm body) {
        this.names = List.copyOf(names);
        this.alias = Objects.requireNonNull(alias, "alias");
        this.returnType = returnType;
        this.scrutinee = Objects.requireNonNull(scrutinee, "scrutinee");
        this.body = Objects.requireNonNull(body, "body");
    }

    public List<Name> getNames() {
        return names;
    }

    public Name getAlias() {
        return alias;
    }

    public SurfaceTerm getReturnType() {
        return returnType;
    }

    public SurfaceTerm getScrutinee() {
        return scrutinee;
    }

    public SurfaceTerm getBody() {
        return body;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.LET_TUPLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GLetTuple that = (GLetTuple) o;
        return names.equals(that.names) && alias.equals(that.alias)
                && Objects.equals(returnType, that.returnType)
                && scrutinee.equals(that.scrutinee) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, alias, returnType, scrutinee, body);
    }

    @Override
    public String toString() {
        return "let " + names + " := " + scrutinee + " in " + body;
    }
}
