package me.christianrobert.detyper.transformer.naming;

import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Terms;
import me.christianrobert.detyper.transformer.context.NamingContext;

import java.util.HashSet;
import java.util.Set;

/**
 * Avoidance over the exact set of identifiers already in use.
 */
public final class PreciseNameAvoidance implements NameAvoidance {

    private final Set<String> forbidden;
    private final DisplayedNameComputer oracle;

    private PreciseNameAvoidance(Set<String> forbidden, DisplayedNameComputer oracle) {
        this.forbidden = forbidden;
        this.oracle = oracle;
    }

    public static PreciseNameAvoidance of(Set<String> seed, DisplayedNameComputer oracle) {
        if (oracle == null) {
            throw new IllegalArgumentException("Precise naming requires a displayed-name computer");
        }
        return new PreciseNameAvoidance(Set.copyOf(seed), oracle);
    }

    @Override
    public NameChoice nextNameAway(Name hint) {
        String id = hint.isNamed() ? hint.getId() : BinderRole.NON_DEPENDENT_STEM;
        while (forbidden.contains(id)) {
            id = Subscripts.increment(id);
        }
        return new NameChoice(Name.of(id), reserve(id));
    }

    @Override
    public NameChoice computeName(Name hint, BinderRole role, boolean letIn, NamingContext names, Term body) {
        boolean unused = !letIn && Terms.noccurn(1, body);
        if (unused && hint.isAnonymous()) {
            return new NameChoice(Name.ANONYMOUS, this);
        }
        String id = oracle.nextNameForDisplay(hint, role, body, forbidden::contains);
        PreciseNameAvoidance next = reserve(id);
        if (unused && oracle.anonymizesUnused(role)) {
            return new NameChoice(Name.ANONYMOUS, next);
        }
        return new NameChoice(Name.of(id), next);
    }

    @Override
    public boolean isReserved(String id) {
        return forbidden.contains(id);
    }

    private PreciseNameAvoidance reserve(String id) {
        Set<String> extended = new HashSet<>(forbidden);
        extended.add(id);
        return new PreciseNameAvoidance(Set.copyOf(extended), oracle);
    }

    @Override
    public String toString() {
        return "PreciseNameAvoidance" + forbidden;
    }
}
