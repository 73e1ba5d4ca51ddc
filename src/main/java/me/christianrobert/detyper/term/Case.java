package me.christianrobert.detyper.term;

import java.util.List;
import java.util.Objects;

/**
 * Primitive case expression. Each branch is a function over the constructor
 * arguments (lambda or let binders following the constructor tags); the
 * motive abstracts over the inductive's real arguments and the matched value.
 */
public final class Case extends Term {

    private final CaseInfo info;
    private final Term motive;
    private final Term scrutinee;
    private final List<Term> branches;

    public Case(CaseInfo info, Term motive, Term scrutinee, List<Term> branches) {
        this.info = Objects.requireNonNull(info, "info");
        this.motive = Objects.requireNonNull(motive, "motive");
        this.scrutinee = Objects.requireNonNull(scrutinee, "scrutinee");
        this.branches = List.copyOf(branches);
    }

    public CaseInfo getInfo() {
        return info;
    }

    public Term getMotive() {
        return motive;
    }

    public Term getScrutinee() {
        return scrutinee;
    }

    public List<Term> getBranches() {
        return branches;
    }

    @Override
    public TermKind getKind() {
        return TermKind.CASE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Case that = (Case) o;
        return info.equals(that.info) && motive.equals(that.motive)
                && scrutinee.equals(that.scrutinee) && branches.equals(that.branches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(info, motive, scrutinee, branches);
    }

    @Override
    public String toString() {
        return "Case(" + scrutinee + ", " + branches + ")";
    }
}
