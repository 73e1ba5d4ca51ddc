package me.christianrobert.detyper.transformer.context;

import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Term;

import java.util.ArrayList;
import java.util.List;

/**
 * Persistent stack of the names chosen for the binders crossed so far.
 *
 * <p>The innermost binder is on top, so {@code Rel n} resolves to the entry
 * {@code n - 1} steps below the top. The size always equals the de Bruijn
 * depth of the term being translated. Pushing returns a new context and
 * leaves the receiver untouched, so sibling subterms can share a prefix.</p>
 *
 * <p>Entries may carry the core type and, for let-bound entries, the value
 * of the binder; the retyping oracle uses them, the translation itself
 * only reads names.</p>
 */
public final class NamingContext {

    private static final NamingContext EMPTY = new NamingContext(null, null, null, null, 0);

    private final Name name;
    private final Term value;
    private final Term type;
    private final NamingContext parent;
    private final int size;

    private NamingContext(Name name, Term value, Term type, NamingContext parent, int size) {
        this.name = name;
        this.value = value;
        this.type = type;
        this.parent = parent;
        this.size = size;
    }

    public static NamingContext empty() {
        return EMPTY;
    }

    /**
     * Builds a context from names listed outermost first.
     */
    public static NamingContext of(List<Name> outermostFirst) {
        NamingContext ctx = EMPTY;
        for (Name n : outermostFirst) {
            ctx = ctx.push(n);
        }
        return ctx;
    }

    public NamingContext push(Name name) {
        return new NamingContext(name, null, null, this, size + 1);
    }

    public NamingContext push(Name name, Term type) {
        return new NamingContext(name, null, type, this, size + 1);
    }

    public NamingContext pushDefinition(Name name, Term value, Term type) {
        return new NamingContext(name, value, type, this, size + 1);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Resolves {@code Rel n}.
     *
     * @return the name bound at that depth, or null when {@code n} is out of range
     */
    public Name lookup(int rel) {
        NamingContext entry = entry(rel);
        return entry == null ? null : entry.name;
    }

    /**
     * Gets the let value bound by {@code Rel n}, or null when it is not let-bound.
     * The value lives in the context below that entry.
     */
    public Term lookupValue(int rel) {
        NamingContext entry = entry(rel);
        return entry == null ? null : entry.value;
    }

    public Term lookupType(int rel) {
        NamingContext entry = entry(rel);
        return entry == null ? null : entry.type;
    }

    /**
     * Finds the innermost entry named {@code id}.
     *
     * @return its de Bruijn index (1 = innermost), or -1 when absent
     */
    public int indexOf(String id) {
        NamingContext current = this;
        int rel = 1;
        while (current.size > 0) {
            if (current.name.isNamed() && current.name.getId().equals(id)) {
                return rel;
            }
            current = current.parent;
            rel++;
        }
        return -1;
    }

    /**
     * Finds the innermost entry equal to {@code name}; an anonymous name matches the innermost anonymous entry.
     *
     * @return its de Bruijn index (1 = innermost), or -1 when absent
     */
    public int indexOf(Name name) {
        NamingContext current = this;
        int rel = 1;
        while (current.size > 0) {
            if (current.name.equals(name)) {
                return rel;
            }
            current = current.parent;
            rel++;
        }
        return -1;
    }

    /**
     * Lists the names innermost first.
     */
    public List<Name> names() {
        List<Name> result = new ArrayList<>(size);
        NamingContext current = this;
        while (current.size > 0) {
            result.add(current.name);
            current = current.parent;
        }
        return result;
    }

    /**
     * Collects the concrete identifiers of all entries.
     */
    public List<String> identifiers() {
        List<String> result = new ArrayList<>();
        for (Name n : names()) {
            if (n.isNamed()) {
                result.add(n.getId());
            }
        }
        return result;
    }

    private NamingContext entry(int rel) {
        if (rel < 1 || rel > size) {
            return null;
        }
        NamingContext current = this;
        for (int i = 1; i < rel; i++) {
            current = current.parent;
        }
        return current;
    }

    @Override
    public String toString() {
        return "NamingContext" + names();
    }
}
