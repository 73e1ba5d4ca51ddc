package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * Common shape of the assumption binders {@link Prod} and {@link Lambda}.
 */
public abstract class BinderTerm extends Term {

    private final Name name;
    private final Term type;
    private final Term body;

    protected BinderTerm(Name name, Term type, Term body) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.body = Objects.requireNonNull(body, "body");
    }

    public Name getName() {
        return name;
    }

    public Term getType() {
        return type;
    }

    /**
     * Body of the binder, one de Bruijn level deeper than the type.
     */
    public Term getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BinderTerm that = (BinderTerm) o;
        return name.equals(that.name) && type.equals(that.type) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), name, type, body);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + " : " + type + ", " + body + ")";
    }
}
