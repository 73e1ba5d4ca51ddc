package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.InductiveRef;
import me.christianrobert.detyper.term.Name;

import java.util.List;
import java.util.Objects;

/**
 * One matched item of a {@link GCases}: {@code term as alias in I names}.
 *
 * <p>The {@code in} part is present only when the return clause is displayed
 * and mentions the inductive's real arguments; otherwise {@link #getInInductive()}
 * is null.</p>
 */
public final class CasesScrutinee {

    private final SurfaceTerm term;
    private final Name alias;
    private final InductiveRef inInductive;
    private final List<Name> inNames;

    public CasesScrutinee(SurfaceTerm term, Name alias, InductiveRef inInductive, List<Name> inNames) {
        this.term = Objects.requireNonNull(term, "term");
        this.alias = Objects.requireNonNull(alias, "alias");
        this.inInductive = inInductive;
        this.inNames = inNames == null ? List.of() : List.copyOf(inNames);
    }

    public static CasesScrutinee of(SurfaceTerm term) {
        return new CasesScrutinee(term, Name.ANONYMOUS, null, null);
    }

    public SurfaceTerm getTerm() {
        return term;
    }

    public Name getAlias() {
        return alias;
    }

    public InductiveRef getInInductive() {
        return inInductive;
    }

    public List<Name> getInNames() {
        return inNames;
    }

    public boolean hasInClause() {
        return inInductive != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CasesScrutinee that = (CasesScrutinee) o;
        return term.equals(that.term) && alias.equals(that.alias)
                && Objects.equals(inInductive, that.inInductive) && inNames.equals(that.inNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, alias, inInductive, inNames);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(term.toString());
        if (alias.isNamed()) {
            sb.append(" as ").append(alias);
        }
        if (inInductive != null) {
            sb.append(" in ").append(inInductive).append(' ').append(inNames);
        }
        return sb.toString();
    }
}
