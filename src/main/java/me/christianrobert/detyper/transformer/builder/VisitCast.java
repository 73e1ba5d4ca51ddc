package me.christianrobert.detyper.transformer.builder;

import me.christianrobert.detyper.surface.GCast;
import me.christianrobert.detyper.surface.SurfaceCastKind;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.Cast;
import me.christianrobert.detyper.term.CastKind;
import me.christianrobert.detyper.transformer.context.DetypingFlags;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;

/**
 * Static helper for type ascriptions.
 *
 * <p>Reverse casts only record universe bookkeeping and are dropped unless
 * raw printing is on. The other kinds keep the checker tag:</p>
 * <pre>
 * DEFAULT -> (t : T)        CONV
 * VM      -> (t <: T)       VM
 * NATIVE  -> (t <<: T)      NATIVE
 * </pre>
 */
public class VisitCast {

    public static SurfaceTerm v(Cast cast, DetypingFlags flags, NameAvoidance avoid, NamingContext names,
                                SurfaceTermBuilder b) {
        if (cast.getCastKind() == CastKind.REVERT && !b.getOptions().isRaw()) {
            return b.build(cast.getTerm(), flags, avoid, names);
        }
        SurfaceTerm term = b.build(cast.getTerm(), flags, avoid, names);
        SurfaceTerm type = b.build(cast.getType(), flags, avoid, names);
        return new GCast(term, surfaceKind(cast.getCastKind()), type);
    }

    private static SurfaceCastKind surfaceKind(CastKind kind) {
        switch (kind) {
            case VM:
                return SurfaceCastKind.VM;
            case NATIVE:
                return SurfaceCastKind.NATIVE;
            default:
                return SurfaceCastKind.CONV;
        }
    }
}
