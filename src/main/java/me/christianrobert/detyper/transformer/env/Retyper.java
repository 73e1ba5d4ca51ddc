package me.christianrobert.detyper.transformer.env;

import me.christianrobert.detyper.term.Projection;
import me.christianrobert.detyper.term.SortFamily;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.transformer.context.NamingContext;

/**
 * Typing oracle consulted while detyping.
 *
 * <p>Both operations may fail with {@link RetypingException}; callers treat
 * a failure as "no information" and never propagate it.</p>
 */
public interface Retyper {

    /**
     * Computes the sort family of the type of {@code type}'s inhabitants, i.e.
     * whether {@code type} is a proposition.
     *
     * @param context Local context the term lives in
     * @param type Type to classify
     * @throws RetypingException when the term cannot be typed
     */
    SortFamily sortFamilyOf(NamingContext context, Term type);

    /**
     * Expands a primitive projection into the application of its compatibility
     * constant to the record parameters and the principal argument.
     *
     * @param context Local context the term lives in
     * @param projection Projection to expand
     * @param principal Projected record value
     * @return Expanded term, e.g. {@code App(Const proj, [params.., principal])}
     * @throws RetypingException when the parameters cannot be recovered
     */
    Term expandProjection(NamingContext context, Projection projection, Term principal);
}
