package me.christianrobert.detyper.surface;

import me.christianrobert.detyper.term.Name;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers over surface terms: application building and free variables.
 */
public final class SurfaceTerms {

    private SurfaceTerms() {
    }

    /**
     * Builds {@code head args}, flattening a head that is already an application.
     */
    public static SurfaceTerm mkApp(SurfaceTerm head, List<SurfaceTerm> args) {
        if (args.isEmpty()) {
            return head;
        }
        if (head instanceof GApp) {
            GApp app = (GApp) head;
            List<SurfaceTerm> all = new ArrayList<>(app.getArguments());
            all.addAll(args);
            return new GApp(app.getHead(), all);
        }
        return new GApp(head, args);
    }

    /**
     * Collects the identifiers occurring as free {@link GVar}s, in first-occurrence order.
     */
    public static Set<String> freeVariables(SurfaceTerm term) {
        Set<String> result = new LinkedHashSet<>();
        collect(term, new HashSet<>(), result);
        return result;
    }

    /**
     * Collects the identifiers bound by a pattern (aliases included).
     */
    public static Set<String> patternVariables(Pattern pattern) {
        Set<String> result = new LinkedHashSet<>();
        collectPattern(pattern, result);
        return result;
    }

    private static void collectPattern(Pattern pattern, Set<String> out) {
        if (pattern instanceof PatVar) {
            Name name = ((PatVar) pattern).getName();
            if (name.isNamed()) {
                out.add(name.getId());
            }
            return;
        }
        PatCstr cstr = (PatCstr) pattern;
        for (Pattern p : cstr.getArguments()) {
            collectPattern(p, out);
        }
        if (cstr.getAlias().isNamed()) {
            out.add(cstr.getAlias().getId());
        }
    }

    private static void collect(SurfaceTerm term, Set<String> bound, Set<String> out) {
        if (term == null) {
            return;
        }
        switch (term.getKind()) {
            case VAR: {
                String id = ((GVar) term).getId();
                if (!bound.contains(id)) {
                    out.add(id);
                }
                break;
            }
            case EVAR:
                for (EvarArgument arg : ((GEvar) term).getArguments()) {
                    collect(arg.getValue(), bound, out);
                }
                break;
            case APP: {
                GApp app = (GApp) term;
                collect(app.getHead(), bound, out);
                for (SurfaceTerm arg : app.getArguments()) {
                    collect(arg, bound, out);
                }
                break;
            }
            case PROD:
            case LAMBDA: {
                GBinderTerm binder = (GBinderTerm) term;
                collect(binder.getType(), bound, out);
                collect(binder.getBody(), extend(bound, binder.getName()), out);
                break;
            }
            case LET_IN: {
                GLetIn letIn = (GLetIn) term;
                collect(letIn.getValue(), bound, out);
                collect(letIn.getType(), bound, out);
                collect(letIn.getBody(), extend(bound, letIn.getName()), out);
                break;
            }
            case CASES: {
                GCases cases = (GCases) term;
                Set<String> returnBound = new HashSet<>(bound);
                for (CasesScrutinee scrutinee : cases.getScrutinees()) {
                    collect(scrutinee.getTerm(), bound, out);
                    addName(returnBound, scrutinee.getAlias());
                    for (Name n : scrutinee.getInNames()) {
                        addName(returnBound, n);
                    }
                }
                collect(cases.getReturnType(), returnBound, out);
                for (CasesClause clause : cases.getClauses()) {
                    Set<String> clauseBound = new HashSet<>(bound);
                    clauseBound.addAll(clause.getIds());
                    for (List<Pattern> row : clause.getRows()) {
                        for (Pattern pattern : row) {
                            clauseBound.addAll(patternVariables(pattern));
                        }
                    }
                    collect(clause.getRhs(), clauseBound, out);
                }
                break;
            }
            case LET_TUPLE: {
                GLetTuple let = (GLetTuple) term;
                collect(let.getScrutinee(), bound, out);
                collect(let.getReturnType(), extend(bound, let.getAlias()), out);
                Set<String> bodyBound = new HashSet<>(bound);
                for (Name n : let.getNames()) {
                    addName(bodyBound, n);
                }
                collect(let.getBody(), bodyBound, out);
                break;
            }
            case IF: {
                GIf gif = (GIf) term;
                collect(gif.getScrutinee(), bound, out);
                collect(gif.getReturnType(), extend(bound, gif.getAlias()), out);
                collect(gif.getThenBranch(), bound, out);
                collect(gif.getElseBranch(), bound, out);
                break;
            }
            case REC: {
                GRec rec = (GRec) term;
                Set<String> withFunctions = new HashSet<>(bound);
                withFunctions.addAll(rec.getNames());
                for (int i = 0; i < rec.getNames().size(); i++) {
                    Set<String> argsBound = new HashSet<>(bound);
                    Set<String> bodyBound = new HashSet<>(withFunctions);
                    for (SurfaceBinder binder : rec.getBinders().get(i)) {
                        collect(binder.getType(), argsBound, out);
                        collect(binder.getValue(), argsBound, out);
                        addName(argsBound, binder.getName());
                        addName(bodyBound, binder.getName());
                    }
                    collect(rec.getTypes().get(i), argsBound, out);
                    collect(rec.getBodies().get(i), bodyBound, out);
                }
                break;
            }
            case CAST: {
                GCast cast = (GCast) term;
                collect(cast.getTerm(), bound, out);
                collect(cast.getType(), bound, out);
                break;
            }
            default:
                break;
        }
    }

    private static Set<String> extend(Set<String> bound, Name name) {
        if (name.isAnonymous() || bound.contains(name.getId())) {
            return bound;
        }
        Set<String> extended = new HashSet<>(bound);
        extended.add(name.getId());
        return extended;
    }

    private static void addName(Set<String> set, Name name) {
        if (name.isNamed()) {
            set.add(name.getId());
        }
    }
}
