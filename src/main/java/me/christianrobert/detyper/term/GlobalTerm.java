package me.christianrobert.detyper.term;

import java.util.List;

/**
 * Reference to a global object, with its universe instance (empty when the
 * object is not universe polymorphic).
 */
public abstract class GlobalTerm extends Term {

    private final List<String> instance;

    protected GlobalTerm(List<String> instance) {
        this.instance = instance == null ? List.of() : List.copyOf(instance);
    }

    public List<String> getInstance() {
        return instance;
    }
}
