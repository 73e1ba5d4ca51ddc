package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.CaseStyle;

import java.util.List;
import java.util.Objects;

/**
 * {@code match scrutinees return type with clauses end}; the return type is null when hidden.
 */
public final class GCases extends SurfaceTerm {

    private final CaseStyle style;
    private final SurfaceTerm returnType;
    private final List<CasesScrutinee> scrutinees;
    private final List<CasesClause> clauses;

    public GCases(CaseStyle style, SurfaceTerm returnType, List<CasesScrutinee> scrutinees, List<CasesClause> clauses) {
        this.style = Objects.requireNonNull(style, "style");
        this.returnType = returnType;
        this.scrutinees = List.copyOf(scrutinees);
        this.clauses = List.copyOf(clauses);
    }

    public CaseStyle getStyle() {
        return style;
    }

    public SurfaceTerm getReturnType() {
        return returnType;
    }

    public List<CasesScrutinee> getScrutinees() {
        return scrutinees;
    }

    public List<CasesClause> getClauses() {
        return clauses;
    }

    @Override
    public SurfaceKind getKind() {
        return SurfaceKind.CASES;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GCases that = (GCases) o;
        return style == that.style && Objects.equals(returnType, that.returnType)
                && scrutinees.equals(that.scrutinees) && clauses.equals(that.clauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(style, returnType, scrutinees, clauses);
    }

    @Override
    public String toString() {
        return "match " + scrutinees + (returnType != null ? " return " + returnType : "") + " with " + clauses;
    }
}
