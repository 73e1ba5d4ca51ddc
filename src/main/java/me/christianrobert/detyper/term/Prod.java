package me.christianrobert.detyper.term;

public final class Prod extends BinderTerm {

    public Prod(Name name, Term type, Term body) {
        super(name, type, body);
    }

    @Override
    public TermKind getKind() {
        return TermKind.PROD;
    }
}
