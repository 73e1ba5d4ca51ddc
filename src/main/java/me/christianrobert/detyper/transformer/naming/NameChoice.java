package me.christianrobert.detyper.transformer.naming;

import me.christianrobert.detyper.term.Name;

import java.util.Objects;

/**
 * Name picked for a binder together with the avoidance state after the pick.
 */
public final class NameChoice {

    private final Name name;
    private final NameAvoidance avoidance;

    public NameChoice(Name name, NameAvoidance avoidance) {
        this.name = Objects.requireNonNull(name, "name");
        this.avoidance = Objects.requireNonNull(avoidance, "avoidance");
    }

    public Name getName() {
        return name;
    }

    public NameAvoidance getAvoidance() {
        return avoidance;
    }

    @Override
    public String toString() {
        return "NameChoice{" + name + '}';
    }
}
