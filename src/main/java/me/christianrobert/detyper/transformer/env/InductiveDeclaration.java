package me.christianrobert.detyper.transformer.env;

import me.christianrobert.detyper.term.InductiveRef;

import java.util.List;
import java.util.Objects;

/**
 * Display-relevant facts about one inductive type: its short name, the short
 * names of its constructors (in declaration order) and its parameter count.
 */
public class InductiveDeclaration {

    private final InductiveRef inductive;
    private final String name;
    private final List<String> constructorNames;
    private final int parameterCount;

    public InductiveDeclaration(InductiveRef inductive, String name, List<String> constructorNames, int parameterCount) {
        this.inductive = Objects.requireNonNull(inductive, "inductive");
        this.name = Objects.requireNonNull(name, "name");
        this.constructorNames = List.copyOf(constructorNames);
        this.parameterCount = parameterCount;
    }

    public InductiveRef getInductive() {
        return inductive;
    }

    public String getName() {
        return name;
    }

    public List<String> getConstructorNames() {
        return constructorNames;
    }

    public int getConstructorCount() {
        return constructorNames.size();
    }

    public int getParameterCount() {
        return parameterCount;
    }

    @Override
    public String toString() {
        return "InductiveDeclaration{" + name + " " + constructorNames + "}";
    }
}
