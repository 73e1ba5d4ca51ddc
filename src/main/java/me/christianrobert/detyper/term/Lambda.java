package me.christianrobert.detyper.term;

public final class Lambda extends BinderTerm {

    public Lambda(Name name, Term type, Term body) {
        super(name, type, body);
    }

    @Override
    public TermKind getKind() {
        return TermKind.LAMBDA;
    }
}
