package me.christianrobert.detyper.term;

import java.util.Objects;

/**
 * Local definition {@code let name : type := value in body}.
 */
public final class LetIn extends Term {

    private final Name name;
    private final Term value;
    private final Term type;
    private final Term body;

    public LetIn(Name name, Term value, Term type, Term body) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
        this.type = Objects.requireNonNull(type, "type");
        this.body = Objects.requireNonNull(body, "body");
    }

    public Name getName() {
        return name;
    }

    public Term getValue() {
        return value;
    }

    public Term getType() {
        return type;
    }

    public Term getBody() {
        return body;
    }

    @Override
    public TermKind getKind() {
        return TermKind.LET_IN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LetIn letIn = (LetIn) o;
        return name.equals(letIn.name) && value.equals(letIn.value)
                && type.equals(letIn.type) && body.equals(letIn.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, type, body);
    }

    @Override
    public String toString() {
        return "LetIn(" + name + " := " + value + " : " + type + ", " + body + ")";
    }
}
