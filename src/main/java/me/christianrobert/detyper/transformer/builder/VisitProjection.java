package me.christianrobert.detyper.transformer.builder;

import me.christianrobert.detyper.surface.GApp;
import me.christianrobert.detyper.surface.GHole;
import me.christianrobert.detyper.surface.GRef;
import me.christianrobert.detyper.surface.GlobalReference;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.Proj;
import me.christianrobert.detyper.term.Projection;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.transformer.context.DetypingFlags;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.env.RetypingException;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Static helper for primitive projections.
 *
 * <h3>Default (and lax) display:</h3>
 * <pre>
 * Proj(p, c)  ->  p _ .. _ c      (one hole per record parameter)
 * </pre>
 *
 * <h3>With primitive projection parameters printed:</h3>
 * <p>The retyper rebuilds the parameters and the expansion is translated
 * instead. When it fails the default display is used.</p>
 */
public class VisitProjection {

    public static SurfaceTerm v(Proj proj, DetypingFlags flags, NameAvoidance avoid, NamingContext names,
                                SurfaceTermBuilder b) {
        if (!flags.isLax() && b.getOptions().isPrintPrimitiveProjectionParameters()) {
            Optional<Term> expanded = expand(proj, names, b);
            if (expanded.isPresent()) {
                return b.build(expanded.get(), flags, avoid, names);
            }
        }
        Projection projection = proj.getProjection();
        List<SurfaceTerm> args = new ArrayList<>();
        for (int i = 0; i < projection.getParameterCount(); i++) {
            args.add(GHole.INSTANCE);
        }
        args.add(b.build(proj.getTerm(), flags, avoid, names));
        return new GApp(new GRef(GlobalReference.ofConstant(projection.getConstant())), args);
    }

    private static Optional<Term> expand(Proj proj, NamingContext names, SurfaceTermBuilder b) {
        try {
            return Optional.of(b.getContext().getRetyper().expandProjection(names, proj.getProjection(), proj.getTerm()));
        } catch (RetypingException e) {
            return Optional.empty();
        }
    }
}
