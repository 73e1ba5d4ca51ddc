package me.christianrobert.detyper.term;

import java.util.List;
import java.util.Objects;

/**
 * Application of a head to a non-empty argument list.
 */
public final class App extends Term {

    private final Term head;
    private final List<Term> arguments;

    public App(Term head, List<Term> arguments) {
        this.head = Objects.requireNonNull(head, "head");
        if (arguments == null || arguments.isEmpty()) {
            throw new IllegalArgumentException("Application requires at least one argument");
        }
        this.arguments = List.copyOf(arguments);
    }

    public Term getHead() {
        return head;
    }

    public List<Term> getArguments() {
        return arguments;
    }

    @Override
    public TermKind getKind() {
        return TermKind.APP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        App app = (App) o;
        return head.equals(app.head) && arguments.equals(app.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(head, arguments);
    }

    @Override
    public String toString() {
        return "App(" + head + ", " + arguments + ")";
    }
}
