package me.christianrobert.detyper.transformer.builder;

import me.christianrobert.detyper.surface.GLambda;
import me.christianrobert.detyper.surface.GLetIn;
import me.christianrobert.detyper.surface.GProd;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.BinderTerm;
import me.christianrobert.detyper.term.LetIn;
import me.christianrobert.detyper.term.SortFamily;
import me.christianrobert.detyper.term.TermKind;
import me.christianrobert.detyper.transformer.context.DetypingFlags;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.env.RetypingException;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;
import me.christianrobert.detyper.transformer.naming.NameChoice;

/**
 * Static helper for products, lambdas and lets.
 *
 * <p>The binder is named from its body, then:</p>
 * <ul>
 *   <li>the type (and let value) is translated outside the binder, never as goal</li>
 *   <li>the body is translated under the extended naming context</li>
 *   <li>a let keeps its type only when it is a proposition, or in raw mode</li>
 * </ul>
 */
public class VisitBinder {

    public static SurfaceTerm v(BinderTerm binder, DetypingFlags flags, NameAvoidance avoid, NamingContext names,
                                SurfaceTermBuilder b) {
        NameChoice choice = b.computeName(binder.getName(), false, false, flags, avoid, names, binder.getBody());
        SurfaceTerm body = b.build(binder.getBody(), flags, choice.getAvoidance(),
                names.push(choice.getName(), binder.getType()));
        SurfaceTerm type = b.build(binder.getType(), flags.notGoal(), avoid, names);
        if (binder.is(TermKind.PROD)) {
            return new GProd(choice.getName(), type, body);
        }
        return new GLambda(choice.getName(), type, body);
    }

    public static SurfaceTerm v(LetIn letIn, DetypingFlags flags, NameAvoidance avoid, NamingContext names,
                                SurfaceTermBuilder b) {
        NameChoice choice = b.computeName(letIn.getName(), true, false, flags, avoid, names, letIn.getBody());
        SurfaceTerm body = b.build(letIn.getBody(), flags, choice.getAvoidance(),
                names.pushDefinition(choice.getName(), letIn.getValue(), letIn.getType()));
        SurfaceTerm value = b.build(letIn.getValue(), flags.notGoal(), avoid, names);
        SurfaceTerm type = null;
        if (b.getOptions().isRaw() || sortFamily(letIn, names, b) == SortFamily.PROP) {
            type = b.build(letIn.getType(), flags.notGoal(), avoid, names);
        }
        return new GLetIn(choice.getName(), value, type, body);
    }

    private static SortFamily sortFamily(LetIn letIn, NamingContext names, SurfaceTermBuilder b) {
        try {
            return b.getContext().getRetyper().sortFamilyOf(names, letIn.getType());
        } catch (RetypingException e) {
            return SortFamily.TYPE;
        }
    }
}
