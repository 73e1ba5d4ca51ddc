package me.christianrobert.detyper.transformer.naming;

import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.transformer.context.NamingContext;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Avoidance that only remembers, per stem, the highest subscript handed out.
 *
 * <p>Reservation never inspects the body, so it is cheap on large terms. The
 * price is an overapproximation: once {@code x3} is reserved, {@code x0} to
 * {@code x2} are never produced either, even if they are free. Binders are
 * never displayed anonymously in this mode.</p>
 */
public final class FastNameAvoidance implements NameAvoidance {

    private final Map<String, BigInteger> ceilings;

    private FastNameAvoidance(Map<String, BigInteger> ceilings) {
        this.ceilings = ceilings;
    }

    public static FastNameAvoidance of(Set<String> seed) {
        Map<String, BigInteger> ceilings = new HashMap<>();
        for (String id : seed) {
            ceilings.merge(Subscripts.stem(id), Subscripts.subscript(id), BigInteger::max);
        }
        return new FastNameAvoidance(Map.copyOf(ceilings));
    }

    @Override
    public NameChoice nextNameAway(Name hint) {
        return reserve(hint.isNamed() ? hint.getId() : BinderRole.NON_DEPENDENT_STEM);
    }

    @Override
    public NameChoice computeName(Name hint, BinderRole role, boolean letIn, NamingContext names, Term body) {
        return reserve(hint.isNamed() ? hint.getId() : role.defaultStem());
    }

    @Override
    public boolean isReserved(String id) {
        BigInteger ceiling = ceilings.get(Subscripts.stem(id));
        return ceiling != null && Subscripts.subscript(id).compareTo(ceiling) <= 0;
    }

    /**
     * Gets the highest reserved subscript of a stem, or null when none is reserved.
     */
    public BigInteger getCeiling(String stem) {
        return ceilings.get(stem);
    }

    private NameChoice reserve(String hint) {
        String stem = Subscripts.stem(hint);
        BigInteger ceiling = ceilings.get(stem);
        BigInteger subscript = ceiling == null ? Subscripts.NONE : ceiling.add(BigInteger.ONE);
        // TODO: share the map between consecutive reservations instead of copying it
        Map<String, BigInteger> extended = new HashMap<>(ceilings);
        extended.put(stem, subscript);
        return new NameChoice(Name.of(Subscripts.withSubscript(stem, subscript)),
                new FastNameAvoidance(Map.copyOf(extended)));
    }

    @Override
    public String toString() {
        return "FastNameAvoidance" + ceilings;
    }
}
