package me.christianrobert.detyper.term;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * De Bruijn toolkit for core terms: lifting, substitution and occurrence checks.
 *
 * <p>All operations are pure; subterms without affected indices are shared
 * with the input.</p>
 */
public final class Terms {

    private Terms() {
    }

    /**
     * Maps a free de Bruijn index seen under {@code depth} extra binders to a replacement.
     */
    private interface RelMapper {
        Term map(int index, int depth);
    }

    /**
     * Predicate on a free de Bruijn index seen under {@code depth} extra binders.
     */
    private interface RelTest {
        boolean test(int index, int depth);
    }

    public static Rel mkRel(int index) {
        return new Rel(index);
    }

    /**
     * Builds {@code head args}, or returns {@code head} when there are no arguments.
     */
    public static Term applist(Term head, List<Term> args) {
        if (args.isEmpty()) {
            return head;
        }
        if (head instanceof App) {
            App app = (App) head;
            List<Term> all = new ArrayList<>(app.getArguments());
            all.addAll(args);
            return new App(app.getHead(), all);
        }
        return new App(head, args);
    }

    /**
     * Flattens nested applications in head position: {@code (f a) b} becomes {@code f a b}.
     */
    public static Term collapseApp(Term term) {
        if (!(term instanceof App)) {
            return term;
        }
        App app = (App) term;
        Term head = app.getHead();
        if (!(head instanceof App)) {
            return term;
        }
        Term collapsedHead = collapseApp(head);
        if (collapsedHead instanceof App) {
            App inner = (App) collapsedHead;
            List<Term> args = new ArrayList<>(inner.getArguments());
            args.addAll(app.getArguments());
            return new App(inner.getHead(), args);
        }
        return new App(collapsedHead, app.getArguments());
    }

    public static Term stripOuterCast(Term term) {
        Term current = term;
        while (current instanceof Cast) {
            current = ((Cast) current).getTerm();
        }
        return current;
    }

    /**
     * Shifts every free index by {@code n}.
     */
    public static Term lift(Term term, int n) {
        return liftFrom(term, 1, n);
    }

    /**
     * Shifts by {@code n} every free index greater than or equal to {@code from}.
     */
    public static Term liftFrom(Term term, int from, int n) {
        if (n == 0) {
            return term;
        }
        return mapRels(term, 0, (index, depth) ->
                index >= from + depth ? new Rel(index + n) : null);
    }

    /**
     * Substitutes {@code value} for {@code Rel 1} in {@code body} and lowers the other free indices.
     */
    public static Term subst1(Term value, Term body) {
        return mapRels(body, 0, (index, depth) -> {
            if (index == depth + 1) {
                return lift(value, depth);
            }
            if (index > depth + 1) {
                return new Rel(index - 1);
            }
            return null;
        });
    }

    /**
     * Checks whether some free index in {@code [from, from + count)} occurs in the term.
     */
    public static boolean occursBetween(Term term, int from, int count) {
        return anyRel(term, 0, (index, depth) -> index >= from + depth && index < from + count + depth);
    }

    /**
     * Checks that no free index in {@code [from, from + count)} occurs in the term.
     */
    public static boolean noccurBetween(Term term, int from, int count) {
        return !occursBetween(term, from, count);
    }

    /**
     * Checks that {@code Rel n} does not occur free in the term.
     */
    public static boolean noccurn(int n, Term term) {
        return noccurBetween(term, n, 1);
    }

    /**
     * Checks that the term has no free de Bruijn index at all.
     */
    public static boolean isClosed(Term term) {
        return !anyRel(term, 0, (index, depth) -> index > depth);
    }

    /**
     * Counts the leading lambda and let binders of a term (through casts).
     */
    public static int countLambdaOrLetIn(Term term) {
        int count = 0;
        Term current = stripOuterCast(term);
        while (current instanceof Lambda || current instanceof LetIn) {
            current = stripOuterCast(binderBody(current));
            count++;
        }
        return count;
    }

    /**
     * Strips every leading lambda and let binder and returns the remaining body.
     */
    public static Term stripLambdaOrLetIn(Term term) {
        Term current = stripOuterCast(term);
        while (current instanceof Lambda || current instanceof LetIn) {
            current = stripOuterCast(binderBody(current));
        }
        return current;
    }

    /**
     * Strips exactly {@code n} leading lambda or let binders.
     *
     * @return the remaining body, or null when the term has fewer than {@code n} such binders
     */
    public static Term stripLambdaOrLetInN(Term term, int n) {
        Term current = term;
        for (int i = 0; i < n; i++) {
            current = stripOuterCast(current);
            if (!(current instanceof Lambda) && !(current instanceof LetIn)) {
                return null;
            }
            current = binderBody(current);
        }
        return current;
    }

    /**
     * Visits the term and all its subterms, parents before children.
     */
    public static void forEachSubterm(Term term, Consumer<Term> visitor) {
        Deque<Term> pending = new ArrayDeque<>();
        pending.push(term);
        while (!pending.isEmpty()) {
            Term current = pending.pop();
            visitor.accept(current);
            for (Term child : children(current)) {
                pending.push(child);
            }
        }
    }

    private static List<Term> children(Term term) {
        switch (term.getKind()) {
            case EVAR:
                return ((Evar) term).getArguments();
            case CAST:
                return List.of(((Cast) term).getTerm(), ((Cast) term).getType());
            case PROD:
            case LAMBDA:
                return List.of(((BinderTerm) term).getType(), ((BinderTerm) term).getBody());
            case LET_IN: {
                LetIn letIn = (LetIn) term;
                return List.of(letIn.getValue(), letIn.getType(), letIn.getBody());
            }
            case APP: {
                List<Term> all = new ArrayList<>();
                all.add(((App) term).getHead());
                all.addAll(((App) term).getArguments());
                return all;
            }
            case CASE: {
                Case c = (Case) term;
                List<Term> all = new ArrayList<>();
                all.add(c.getMotive());
                all.add(c.getScrutinee());
                all.addAll(c.getBranches());
                return all;
            }
            case FIX:
                return blockChildren(((Fix) term).getBlock());
            case COFIX:
                return blockChildren(((CoFix) term).getBlock());
            case PROJ:
                return List.of(((Proj) term).getTerm());
            default:
                return List.of();
        }
    }

    private static List<Term> blockChildren(RecBlock block) {
        List<Term> all = new ArrayList<>(block.getTypes());
        all.addAll(block.getBodies());
        return all;
    }

    private static Term binderBody(Term binder) {
        if (binder instanceof BinderTerm) {
            return ((BinderTerm) binder).getBody();
        }
        return ((LetIn) binder).getBody();
    }

    private static Term mapRels(Term term, int depth, RelMapper mapper) {
        switch (term.getKind()) {
            case REL: {
                Term replacement = mapper.map(((Rel) term).getIndex(), depth);
                return replacement != null ? replacement : term;
            }
            case EVAR: {
                Evar evar = (Evar) term;
                List<Term> args = mapList(evar.getArguments(), depth, mapper);
                return args == evar.getArguments() ? term : new Evar(evar.getId(), args);
            }
            case CAST: {
                Cast cast = (Cast) term;
                Term c = mapRels(cast.getTerm(), depth, mapper);
                Term t = mapRels(cast.getType(), depth, mapper);
                return c == cast.getTerm() && t == cast.getType() ? term : new Cast(c, cast.getCastKind(), t);
            }
            case PROD: {
                Prod prod = (Prod) term;
                Term t = mapRels(prod.getType(), depth, mapper);
                Term b = mapRels(prod.getBody(), depth + 1, mapper);
                return t == prod.getType() && b == prod.getBody() ? term : new Prod(prod.getName(), t, b);
            }
            case LAMBDA: {
                Lambda lambda = (Lambda) term;
                Term t = mapRels(lambda.getType(), depth, mapper);
                Term b = mapRels(lambda.getBody(), depth + 1, mapper);
                return t == lambda.getType() && b == lambda.getBody() ? term : new Lambda(lambda.getName(), t, b);
            }
            case LET_IN: {
                LetIn letIn = (LetIn) term;
                Term v = mapRels(letIn.getValue(), depth, mapper);
                Term t = mapRels(letIn.getType(), depth, mapper);
                Term b = mapRels(letIn.getBody(), depth + 1, mapper);
                if (v == letIn.getValue() && t == letIn.getType() && b == letIn.getBody()) {
                    return term;
                }
                return new LetIn(letIn.getName(), v, t, b);
            }
            case APP: {
                App app = (App) term;
                Term h = mapRels(app.getHead(), depth, mapper);
                List<Term> args = mapList(app.getArguments(), depth, mapper);
                return h == app.getHead() && args == app.getArguments() ? term : new App(h, args);
            }
            case CASE: {
                Case c = (Case) term;
                Term motive = mapRels(c.getMotive(), depth, mapper);
                Term scrutinee = mapRels(c.getScrutinee(), depth, mapper);
                List<Term> branches = mapList(c.getBranches(), depth, mapper);
                if (motive == c.getMotive() && scrutinee == c.getScrutinee() && branches == c.getBranches()) {
                    return term;
                }
                return new Case(c.getInfo(), motive, scrutinee, branches);
            }
            case FIX: {
                Fix fix = (Fix) term;
                RecBlock block = mapBlock(fix.getBlock(), depth, mapper);
                return block == fix.getBlock() ? term : new Fix(fix.getRecIndices(), fix.getIndex(), block);
            }
            case COFIX: {
                CoFix coFix = (CoFix) term;
                RecBlock block = mapBlock(coFix.getBlock(), depth, mapper);
                return block == coFix.getBlock() ? term : new CoFix(coFix.getIndex(), block);
            }
            case PROJ: {
                Proj proj = (Proj) term;
                Term c = mapRels(proj.getTerm(), depth, mapper);
                return c == proj.getTerm() ? term : new Proj(proj.getProjection(), c);
            }
            default:
                return term;
        }
    }

    private static List<Term> mapList(List<Term> terms, int depth, RelMapper mapper) {
        List<Term> result = null;
        for (int i = 0; i < terms.size(); i++) {
            Term original = terms.get(i);
            Term mapped = mapRels(original, depth, mapper);
            if (mapped != original && result == null) {
                result = new ArrayList<>(terms.subList(0, i));
            }
            if (result != null) {
                result.add(mapped);
            }
        }
        return result == null ? terms : result;
    }

    private static RecBlock mapBlock(RecBlock block, int depth, RelMapper mapper) {
        List<Term> types = mapList(block.getTypes(), depth, mapper);
        List<Term> bodies = mapList(block.getBodies(), depth + block.size(), mapper);
        if (types == block.getTypes() && bodies == block.getBodies()) {
            return block;
        }
        return new RecBlock(block.getNames(), types, bodies);
    }

    private static boolean anyRel(Term term, int depth, RelTest test) {
        switch (term.getKind()) {
            case REL:
                return test.test(((Rel) term).getIndex(), depth);
            case EVAR:
                return anyRel(((Evar) term).getArguments(), depth, test);
            case CAST: {
                Cast cast = (Cast) term;
                return anyRel(cast.getTerm(), depth, test) || anyRel(cast.getType(), depth, test);
            }
            case PROD:
            case LAMBDA: {
                BinderTerm binder = (BinderTerm) term;
                return anyRel(binder.getType(), depth, test) || anyRel(binder.getBody(), depth + 1, test);
            }
            case LET_IN: {
                LetIn letIn = (LetIn) term;
                return anyRel(letIn.getValue(), depth, test)
                        || anyRel(letIn.getType(), depth, test)
                        || anyRel(letIn.getBody(), depth + 1, test);
            }
            case APP: {
                App app = (App) term;
                return anyRel(app.getHead(), depth, test) || anyRel(app.getArguments(), depth, test);
            }
            case CASE: {
                Case c = (Case) term;
                return anyRel(c.getMotive(), depth, test)
                        || anyRel(c.getScrutinee(), depth, test)
                        || anyRel(c.getBranches(), depth, test);
            }
            case FIX:
                return anyRel(((Fix) term).getBlock(), depth, test);
            case COFIX:
                return anyRel(((CoFix) term).getBlock(), depth, test);
            case PROJ:
                return anyRel(((Proj) term).getTerm(), depth, test);
            default:
                return false;
        }
    }

    private static boolean anyRel(List<Term> terms, int depth, RelTest test) {
        for (Term t : terms) {
            if (anyRel(t, depth, test)) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyRel(RecBlock block, int depth, RelTest test) {
        return anyRel(block.getTypes(), depth, test) || anyRel(block.getBodies(), depth + block.size(), test);
    }
}
