package me.christianrobert.detyper.term;

import java.util.Objects;

public final class Cast extends Term {

    private final Term term;
    private final CastKind castKind;
    private final Term type;

    public Cast(Term term, CastKind castKind, Term type) {
        this.term = Objects.requireNonNull(term, "term");
        this.castKind = Objects.requireNonNull(castKind, "castKind");
        this.type = Objects.requireNonNull(type, "type");
    }

    public Term getTerm() {
        return term;
    }

    public CastKind getCastKind() {
        return castKind;
    }

    public Term getType() {
        return type;
    }

    @Override
    public TermKind getKind() {
        return TermKind.CAST;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Cast cast = (Cast) o;
        return castKind == cast.castKind && term.equals(cast.term) && type.equals(cast.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, castKind, type);
    }

    @Override
    public String toString() {
        return "Cast(" + term + ", " + castKind + ", " + type + ")";
    }
}
