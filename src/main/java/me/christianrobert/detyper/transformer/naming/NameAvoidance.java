package me.christianrobert.detyper.transformer.naming;

import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.transformer.context.NamingContext;

import java.util.Set;

/**
 * Strategy interface for manufacturing fresh identifiers during one detyping call.
 *
 * <p>Two implementations exist:</p>
 * <ul>
 *   <li><strong>Precise:</strong> {@link PreciseNameAvoidance} - exact set of taken
 *       identifiers, names computed by inspecting the binder's body</li>
 *   <li><strong>Fast:</strong> {@link FastNameAvoidance} - highest reserved subscript
 *       per stem, no body inspection</li>
 * </ul>
 *
 * <p>Values are immutable: every reservation returns the next state inside a
 * {@link NameChoice}. Within one call an identifier is never produced twice,
 * and never collides with the seed the avoidance was made from.</p>
 */
public interface NameAvoidance {

    /**
     * Reserves an identifier close to {@code hint} (anonymous hints use the non-dependent stem).
     *
     * @return always a concrete name
     */
    NameChoice nextNameAway(Name hint);

    /**
     * Chooses the display name of one binder.
     *
     * @param hint Name recorded in the core term
     * @param role Display position of the binder
     * @param letIn Whether the binder is a let (let binders always keep a name)
     * @param names Naming context outside the binder
     * @param body Body of the binder, where {@code Rel 1} is the bound variable
     * @return chosen name (possibly anonymous) and the next avoidance state
     */
    NameChoice computeName(Name hint, BinderRole role, boolean letIn, NamingContext names, Term body);

    /**
     * Checks whether {@code id} may no longer be produced.
     */
    boolean isReserved(String id);

    /**
     * Creates the avoidance state for a call.
     *
     * @param fast Whether to use the subscript-ceiling representation
     * @param seed Identifiers that must never be produced
     * @param oracle Displayed-name computer used by the precise mode
     */
    static NameAvoidance make(boolean fast, Set<String> seed, DisplayedNameComputer oracle) {
        if (fast) {
            return FastNameAvoidance.of(seed);
        }
        return PreciseNameAvoidance.of(seed, oracle);
    }
}
