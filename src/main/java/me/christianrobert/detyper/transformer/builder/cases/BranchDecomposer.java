package me.christianrobert.detyper.transformer.builder.cases;

import me.christianrobert.detyper.surface.CasesClause;
import me.christianrobert.detyper.surface.PatCstr;
import me.christianrobert.detyper.surface.PatVar;
import me.christianrobert.detyper.surface.Pattern;
import me.christianrobert.detyper.term.Cast;
import me.christianrobert.detyper.term.ConstructorRef;
import me.christianrobert.detyper.term.Lambda;
import me.christianrobert.detyper.term.LetIn;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Sort;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Terms;
import me.christianrobert.detyper.transformer.builder.SurfaceTermBuilder;
import me.christianrobert.detyper.transformer.context.DetypingFlags;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.naming.BinderRole;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;
import me.christianrobert.detyper.transformer.naming.NameChoice;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Peels the argument binders off a case branch.
 *
 * <p>A branch for a constructor with argument tags {@code [false, true, false]}
 * is expected to look like {@code fun a => let b := v in fun c => rhs}. Slots
 * the compiled term does not bind (an eta-contracted branch) are repaired: a
 * missing lambda applies the branch to a fresh variable, a missing let gets an
 * anonymous slot.</p>
 */
public class BranchDecomposer {

    private final SurfaceTermBuilder builder;

    public BranchDecomposer(SurfaceTermBuilder builder) {
        this.builder = builder;
    }

    /**
     * Names the argument slots of a branch for case-tree reconstruction.
     *
     * <p>Lambda slots keep a name even when unused, so the tree can still
     * resolve them; wildcard promotion happens afterwards, once the final
     * right-hand side is known.</p>
     */
    public DecomposedBranch decompose(List<Boolean> tags, DetypingFlags flags, BranchState state) {
        List<Name> names = new ArrayList<>();
        NameAvoidance avoid = state.getAvoidance();
        NamingContext ctx = state.getNames();
        Term c = state.getBody();
        for (Boolean letSlot : tags) {
            Term stripped = Terms.stripOuterCast(c);
            Name hint;
            Term next;
            boolean keepName;
            Term value = null;
            Term type = null;
            if (stripped instanceof Lambda && !letSlot) {
                Lambda lambda = (Lambda) stripped;
                hint = lambda.getName();
                next = lambda.getBody();
                keepName = true;
                type = lambda.getType();
            } else if (stripped instanceof LetIn && letSlot) {
                LetIn letIn = (LetIn) stripped;
                hint = letIn.getName();
                next = letIn.getBody();
                keepName = false;
                value = letIn.getValue();
                type = letIn.getType();
            } else if (!letSlot) {
                hint = Name.of(BinderRole.DEPENDENT_STEM);
                next = Terms.applist(Terms.lift(c, 1), List.of(Terms.mkRel(1)));
                keepName = false;
            } else {
                hint = Name.ANONYMOUS;
                next = Terms.lift(c, 1);
                keepName = false;
            }
            NameChoice choice = builder.computeName(hint, keepName, true, flags, avoid, ctx, next);
            names.add(choice.getName());
            avoid = choice.getAvoidance();
            ctx = value != null ? ctx.pushDefinition(choice.getName(), value, type) : ctx.push(choice.getName(), type);
            c = next;
        }
        return new DecomposedBranch(names, new BranchState(avoid, ctx, c));
    }

    /**
     * Builds the single clause of one branch directly, without looking for nested cases.
     * A let slot is shown as a plain variable pattern; its value is kept only in the naming
     * context of the right-hand side.
     *
     * @param constructor Constructor the branch belongs to
     * @param tags Argument tags of the constructor ({@code true} = let slot)
     * @param branch Branch body
     * @return clause {@code | C p1 .. pn => rhs}
     */
    public CasesClause decomposeDirect(ConstructorRef constructor, List<Boolean> tags, Term branch,
                                       DetypingFlags flags, NameAvoidance avoid, NamingContext names) {
        PatternAccumulator acc = new PatternAccumulator(avoid, names);
        Term body = branch;
        int slot = 0;
        while (slot < tags.size()) {
            boolean letSlot = tags.get(slot);
            if (body instanceof Lambda && !letSlot) {
                Lambda lambda = (Lambda) body;
                addVariable(acc, lambda.getName(), lambda.getBody(), null, lambda.getType(), flags);
                body = lambda.getBody();
                slot++;
            } else if (body instanceof LetIn && letSlot) {
                LetIn letIn = (LetIn) body;
                addVariable(acc, letIn.getName(), letIn.getBody(), letIn.getValue(), letIn.getType(), flags);
                body = letIn.getBody();
                slot++;
            } else if (body instanceof Cast) {
                body = ((Cast) body).getTerm();
            } else if (letSlot) {
                acc.patterns.add(PatVar.WILDCARD);
                slot++;
            } else {
                Term expanded = Terms.applist(Terms.lift(body, 1), List.of(Terms.mkRel(1)));
                addVariable(acc, Name.ANONYMOUS, expanded, null, Sort.PROP, flags);
                body = expanded;
                slot++;
            }
        }
        List<Pattern> row = List.of(new PatCstr(constructor, acc.patterns, Name.ANONYMOUS));
        return CasesClause.single(new ArrayList<>(acc.ids), row,
                builder.build(body, flags, acc.avoid, acc.names));
    }

    private void addVariable(PatternAccumulator acc, Name hint, Term body, Term value, Term type,
                             DetypingFlags flags) {
        Name chosen;
        if (builder.getOptions().isForceWildcard() && Terms.noccurn(1, body)) {
            chosen = Name.ANONYMOUS;
        } else {
            NameChoice choice = builder.computeName(hint, false, true, flags, acc.avoid, acc.names, body);
            chosen = choice.getName();
            acc.avoid = choice.getAvoidance();
        }
        acc.patterns.add(new PatVar(chosen));
        acc.names = value != null ? acc.names.pushDefinition(chosen, value, type) : acc.names.push(chosen, type);
        if (chosen.isNamed()) {
            acc.ids.add(chosen.getId());
        }
    }

    /**
     * Checks that a branch binds exactly its tagged slots and does not use them.
     */
    public static boolean isNonDependent(Term branch, List<Boolean> tags) {
        Term rest = Terms.stripLambdaOrLetInN(branch, tags.size());
        return rest != null && Terms.noccurBetween(rest, 1, tags.size());
    }

    private static class PatternAccumulator {
        private NameAvoidance avoid;
        private NamingContext names;
        private final List<Pattern> patterns = new ArrayList<>();
        private final Set<String> ids = new TreeSet<>();

        PatternAccumulator(NameAvoidance avoid, NamingContext names) {
            this.avoid = avoid;
            this.names = names;
        }
    }
}
