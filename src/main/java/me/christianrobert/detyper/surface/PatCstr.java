package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.ConstructorRef;
import me.christianrobert.detyper.term.Name;

import java.util.List;
import java.util.Objects;

/**
 * Constructor pattern {@code (C p1 .. pn) as alias}.
 */
public final class PatCstr extends Pattern {

    private final ConstructorRef constructor;
    private final List<Pattern> arguments;
    private final Name alias;

    public PatCstr(ConstructorRef constructor, List<Pattern> arguments, Name alias) {
        this.constructor = Objects.requireNonNull(constructor, "constructor");
        this.arguments = List.copyOf(arguments);
        this.alias = Objects.requireNonNull(alias, "alias");
    }

    public ConstructorRef getConstructor() {
        return constructor;
    }

    public List<Pattern> getArguments() {
        return arguments;
    }

    public Name getAlias() {
        return alias;
    }

    @Override
    public boolean isVariable() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PatCstr that = (PatCstr) o;
        return constructor.equals(that.constructor) && arguments.equals(that.arguments)
                && alias.equals(that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(constructor, arguments, alias);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(constructor);
        for (Pattern p : arguments) {
            sb.append(' ').append(p);
        }
        sb.append(')');
        if (alias.isNamed()) {
            sb.append(" as ").append(alias);
        }
        return sb.toString();
    }
}
