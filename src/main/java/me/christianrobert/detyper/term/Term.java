package me.christianrobert.detyper.term;

/**
 * Base class of the core calculus terms.
 *
 * <p>Terms are immutable and locally nameless: bound variables are de Bruijn
 * indices ({@link Rel}), binder names are only hints for display. Structural
 * equality ({@link #equals(Object)}) compares names too, which is what the
 * case-tree reconstruction needs when it checks whether a nested scrutinee is
 * exactly a bound variable.</p>
 *
 * @see Terms
 */
public abstract class Term {

    public abstract TermKind getKind();

    public boolean is(TermKind kind) {
        return getKind() == kind;
    }
}
