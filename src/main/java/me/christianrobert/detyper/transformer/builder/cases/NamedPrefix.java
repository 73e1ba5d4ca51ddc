package me.christianrobert.detyper.transformer.builder.cases;

import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.Name;

import java.util.List;

/**
 * Binder names read off the front of a surface term, and the rest of it.
 */
public final class NamedPrefix {

    private final List<Name> names;
    private final SurfaceTerm body;

    public NamedPrefix(List<Name> names, SurfaceTerm body) {
        this.names = List.copyOf(names);
        this.body = body;
    }

    public List<Name> getNames() {
        return names;
    }

    public SurfaceTerm getBody() {
        return body;
    }

    public boolean allAnonymous() {
        for (Name name : names) {
            if (name.isNamed()) {
                return false;
            }
        }
        return true;
    }
}
