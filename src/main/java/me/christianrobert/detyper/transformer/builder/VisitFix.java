package me.christianrobert.detyper.transformer.builder;

import me.christianrobert.detyper.surface.GRec;
import me.christianrobert.detyper.surface.RecKind;
import me.christianrobert.detyper.surface.SurfaceBinder;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.CoFix;
import me.christianrobert.detyper.term.Fix;
import me.christianrobert.detyper.term.Lambda;
import me.christianrobert.detyper.term.LetIn;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Prod;
import me.christianrobert.detyper.term.RecBlock;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Terms;
import me.christianrobert.detyper.transformer.context.DetypingFlags;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;
import me.christianrobert.detyper.transformer.naming.NameChoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for fixpoints and cofixpoints.
 *
 * <p>Every function name is reserved first, so bodies can refer to all of
 * them. Each body is then walked together with its type, and the leading
 * arguments are named once for both:</p>
 * <pre>
 * type  forall (n : nat) (m : nat), nat
 * body  fun (k : nat) (_ : nat) => ...
 * shown fix f (n : nat) (m : nat) {struct n} : nat := ...
 * </pre>
 *
 * <h3>Sharing rules (while arguments remain to be shared):</h3>
 * <ul>
 *   <li>lambda/product pair: one name, the concrete one winning over anonymous</li>
 *   <li>let in the body: kept as a let argument, the type is lifted over it</li>
 *   <li>let in the type: substituted away</li>
 *   <li>product without lambda: the body is eta-expanded</li>
 * </ul>
 *
 * <p>A fixpoint shares arguments up to and including its decreasing one. A
 * cofixpoint has no decreasing argument and shares every lambda/product pair,
 * without eta-expansion.</p>
 */
public class VisitFix {

    private static final Logger log = LoggerFactory.getLogger(VisitFix.class);

    public static SurfaceTerm v(Fix fix, DetypingFlags flags, NameAvoidance avoid, NamingContext names,
                                SurfaceTermBuilder b) {
        return build(RecKind.FIX, fix.getRecIndices(), fix.getIndex(), fix.getBlock(), flags, avoid, names, b);
    }

    public static SurfaceTerm v(CoFix coFix, DetypingFlags flags, NameAvoidance avoid, NamingContext names,
                                SurfaceTermBuilder b) {
        return build(RecKind.COFIX, List.of(), coFix.getIndex(), coFix.getBlock(), flags, avoid, names, b);
    }

    private static SurfaceTerm build(RecKind kind, List<Integer> recIndices, int index, RecBlock block,
                                     DetypingFlags flags, NameAvoidance avoid, NamingContext names,
                                     SurfaceTermBuilder b) {
        // STEP 1: reserve the function names
        NameAvoidance blockAvoid = avoid;
        NamingContext blockNames = names;
        List<String> functionNames = new ArrayList<>();
        for (int i = 0; i < block.size(); i++) {
            NameChoice choice = blockAvoid.nextNameAway(block.getNames().get(i));
            blockAvoid = choice.getAvoidance();
            blockNames = blockNames.push(choice.getName(), Terms.lift(block.getTypes().get(i), i));
            functionNames.add(choice.getName().getId());
        }

        // STEP 2: share argument names between each body and its type
        int n = block.size();
        List<List<SurfaceBinder>> binders = new ArrayList<>();
        List<SurfaceTerm> types = new ArrayList<>();
        List<SurfaceTerm> bodies = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            SharingState state = new SharingState(blockAvoid, blockNames);
            int depth = kind == RecKind.FIX ? recIndices.get(i) + 1 : 0;
            shareNames(state, depth, kind == RecKind.COFIX, block.getBodies().get(i),
                    Terms.lift(block.getTypes().get(i), n), flags, b);
            binders.add(state.binders);
            types.add(state.type);
            bodies.add(state.body);
        }

        return new GRec(kind, recIndices, index, functionNames, binders, types, bodies);
    }

    private static void shareNames(SharingState state, int remaining, boolean shareAll, Term body, Term type,
                                   DetypingFlags flags, SurfaceTermBuilder b) {
        Term c = body;
        Term t = type;
        int n = remaining;
        while (true) {
            if (c instanceof Lambda && t instanceof Prod && (n > 0 || shareAll)) {
                Lambda lambda = (Lambda) c;
                Prod prod = (Prod) t;
                Name hint = lambda.getName().orElse(prod.getName());
                SurfaceTerm argType = b.build(lambda.getType(), flags, state.avoid, state.names);
                bind(state, hint, null, null, lambda.getType(), argType);
                c = lambda.getBody();
                t = prod.getBody();
                n = Math.max(n - 1, 0);
            } else if (c instanceof LetIn && n > 0) {
                LetIn letIn = (LetIn) c;
                SurfaceTerm argType = b.build(letIn.getType(), flags, state.avoid, state.names);
                SurfaceTerm argValue = b.build(letIn.getValue(), flags, state.avoid, state.names);
                bind(state, letIn.getName(), letIn.getValue(), argValue, letIn.getType(), argType);
                c = letIn.getBody();
                t = Terms.lift(t, 1);
            } else if (t instanceof LetIn && n > 0) {
                LetIn letIn = (LetIn) t;
                t = Terms.subst1(letIn.getValue(), letIn.getBody());
            } else if (t instanceof Prod && n > 0) {
                Prod prod = (Prod) t;
                SurfaceTerm argType = b.build(prod.getType(), flags, state.avoid, state.names);
                bind(state, prod.getName(), null, null, prod.getType(), argType);
                c = Terms.applist(Terms.lift(c, 1), List.of(Terms.mkRel(1)));
                t = prod.getBody();
                n--;
            } else {
                break;
            }
        }
        if (n > 0) {
            log.debug("Cannot factorize fix enough, {} argument(s) left unshared", n);
        }
        state.body = b.build(c, flags, state.avoid, state.names);
        state.type = b.build(t, flags, state.avoid, state.names);
    }

    private static void bind(SharingState state, Name hint, Term value, SurfaceTerm surfaceValue,
                             Term type, SurfaceTerm surfaceType) {
        NameChoice choice = state.avoid.nextNameAway(hint);
        state.avoid = choice.getAvoidance();
        state.names = value == null
                ? state.names.push(choice.getName(), type)
                : state.names.pushDefinition(choice.getName(), value, type);
        state.binders.add(new SurfaceBinder(choice.getName(), surfaceValue, surfaceType));
    }

    /**
     * Mutable accumulator for one function of the block.
     */
    private static class SharingState {
        private NameAvoidance avoid;
        private NamingContext names;
        private final List<SurfaceBinder> binders = new ArrayList<>();
        private SurfaceTerm body;
        private SurfaceTerm type;

        SharingState(NameAvoidance avoid, NamingContext names) {
            this.avoid = avoid;
            this.names = names;
        }
    }
}
