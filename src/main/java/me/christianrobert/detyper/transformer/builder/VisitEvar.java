package me.christianrobert.detyper.transformer.builder;

import me.christianrobert.detyper.surface.EvarArgument;
import me.christianrobert.detyper.surface.GEvar;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.Evar;
import me.christianrobert.detyper.term.NamedDeclaration;
import me.christianrobert.detyper.term.Rel;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Var;
import me.christianrobert.detyper.transformer.context.DetypingFlags;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.env.EvarInfo;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static helper for existential variables.
 *
 * <p>Name: the evar's own identifier, else the store's suggested name, else
 * {@code X<id>}. An evar unknown to the store is shown as {@code ?X<id>} with
 * every argument named {@code __}.</p>
 *
 * <p>An instance argument is trivial when its hypothesis is a local
 * definition, or when it is exactly the variable of the same name. Trivial
 * arguments are hidden unless existential instances are printed, or the same
 * variable also appears as some non-trivial argument (then hiding it would
 * make the instance ambiguous).</p>
 */
public class VisitEvar {

    static final String UNKNOWN_ARGUMENT = "__";

    public static SurfaceTerm v(Evar evar, DetypingFlags flags, NameAvoidance avoid, NamingContext names,
                                SurfaceTermBuilder b) {
        Optional<EvarInfo> lookup = b.getContext().getEvarStore().lookup(evar.getId());
        if (lookup.isEmpty()) {
            List<EvarArgument> args = new ArrayList<>();
            for (Term arg : evar.getArguments()) {
                args.add(new EvarArgument(UNKNOWN_ARGUMENT, b.build(arg, flags, avoid, names)));
            }
            return new GEvar("X" + evar.getId(), args);
        }

        EvarInfo info = lookup.get();
        List<NamedDeclaration> decls = info.getInstanceContext();
        int count = Math.min(decls.size(), evar.getArguments().size());

        // Pass 1: variables used by non-trivial arguments
        Set<Integer> rels = new HashSet<>();
        Set<String> vars = new HashSet<>();
        for (int i = 0; i < count; i++) {
            Term arg = evar.getArguments().get(i);
            if (!isTrivial(decls.get(i), arg, names)) {
                if (arg instanceof Rel) {
                    rels.add(((Rel) arg).getIndex());
                } else if (arg instanceof Var) {
                    vars.add(((Var) arg).getId());
                }
            }
        }

        // Pass 2: drop trivial arguments nobody else mentions
        boolean printAll = b.getOptions().isPrintEvarArguments();
        List<EvarArgument> args = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            NamedDeclaration decl = decls.get(i);
            Term arg = evar.getArguments().get(i);
            boolean sharedVariable = (arg instanceof Rel && rels.contains(((Rel) arg).getIndex()))
                    || (arg instanceof Var && vars.contains(((Var) arg).getId()));
            if (!printAll && isTrivial(decl, arg, names) && !sharedVariable) {
                continue;
            }
            args.add(new EvarArgument(decl.getId(), b.build(arg, flags, avoid, names)));
        }
        return new GEvar(displayName(evar, info), args);
    }

    private static String displayName(Evar evar, EvarInfo info) {
        if (info.getIdentifier() != null) {
            return info.getIdentifier();
        }
        if (info.getSuggestedName() != null) {
            return info.getSuggestedName();
        }
        return "X" + evar.getId();
    }

    /**
     * Checks whether {@code arg} is just the hypothesis {@code decl} itself (or {@code decl} is a definition).
     */
    static boolean isTrivial(NamedDeclaration decl, Term arg, NamingContext names) {
        if (decl.isDefinition()) {
            return true;
        }
        int rel = names.indexOf(decl.getId());
        if (rel > 0) {
            return arg instanceof Rel && ((Rel) arg).getIndex() == rel;
        }
        return arg instanceof Var && ((Var) arg).getId().equals(decl.getId());
    }
}
