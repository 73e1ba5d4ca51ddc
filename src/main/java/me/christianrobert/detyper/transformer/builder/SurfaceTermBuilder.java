package me.christianrobert.detyper.transformer.builder;

import me.christianrobert.detyper.surface.GEvar;
import me.christianrobert.detyper.surface.GFloat;
import me.christianrobert.detyper.surface.GInt;
import me.christianrobert.detyper.surface.GRef;
import me.christianrobert.detyper.surface.GVar;
import me.christianrobert.detyper.surface.GlobalReference;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.surface.SurfaceTerms;
import me.christianrobert.detyper.term.App;
import me.christianrobert.detyper.term.BinderTerm;
import me.christianrobert.detyper.term.Case;
import me.christianrobert.detyper.term.Cast;
import me.christianrobert.detyper.term.CoFix;
import me.christianrobert.detyper.term.Const;
import me.christianrobert.detyper.term.Construct;
import me.christianrobert.detyper.term.Evar;
import me.christianrobert.detyper.term.Fix;
import me.christianrobert.detyper.term.FloatLit;
import me.christianrobert.detyper.term.GlobalTerm;
import me.christianrobert.detyper.term.Ind;
import me.christianrobert.detyper.term.IntLit;
import me.christianrobert.detyper.term.LetIn;
import me.christianrobert.detyper.term.Meta;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Proj;
import me.christianrobert.detyper.term.Rel;
import me.christianrobert.detyper.term.Sort;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Terms;
import me.christianrobert.detyper.term.Var;
import me.christianrobert.detyper.transformer.context.DetypingContext;
import me.christianrobert.detyper.transformer.context.DetypingFlags;
import me.christianrobert.detyper.transformer.context.DisplayOptions;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.naming.BinderRole;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;
import me.christianrobert.detyper.transformer.naming.NameChoice;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates core terms into named surface terms.
 *
 * <p>One {@code build} call handles one node; binders, projections, evars,
 * case expressions and fixpoints are delegated to the static {@code Visit*}
 * helpers, which call back into {@link #build} for their subterms. The naming
 * context and the avoidance state are passed down explicitly, never stored.</p>
 *
 * <p>Reference resolution never fails: an anonymous binder resolves to
 * {@code _ANONYMOUS_REL_n} and an index outside the context to
 * {@code _UNBOUND_REL_n}.</p>
 */
public class SurfaceTermBuilder {

    // no logging here, build runs once per subterm

    public static final String ANONYMOUS_REL_PREFIX = "_ANONYMOUS_REL_";
    public static final String UNBOUND_REL_PREFIX = "_UNBOUND_REL_";
    public static final String CONTEXT_HOLE = "CONTEXT-HOLE";

    private final DetypingContext context;

    public SurfaceTermBuilder(DetypingContext context) {
        this.context = context;
    }

    public DetypingContext getContext() {
        return context;
    }

    public DisplayOptions getOptions() {
        return context.getOptions();
    }

    /**
     * Translates a term living in {@code names}.
     *
     * @param term Core term
     * @param flags Goal/lax flags of this position
     * @param avoid Identifiers that may not be produced
     * @param names Names of the enclosing binders, innermost first
     * @return Surface term
     */
    public SurfaceTerm build(Term term, DetypingFlags flags, NameAvoidance avoid, NamingContext names) {
        switch (term.getKind()) {
            case REL:
                return visitRel((Rel) term, names);
            case VAR: {
                String id = ((Var) term).getId();
                if (context.getEnvironment().isSectionVariable(id)) {
                    return new GRef(GlobalReference.ofVariable(id));
                }
                return new GVar(id);
            }
            case META: {
                int number = ((Meta) term).getNumber();
                return new GEvar(number == Meta.SPECIAL ? CONTEXT_HOLE : "M" + number, List.of());
            }
            case EVAR:
                return VisitEvar.v((Evar) term, flags, avoid, names, this);
            case SORT:
                return VisitSort.v((Sort) term, getOptions());
            case CAST:
                return VisitCast.v((Cast) term, flags, avoid, names, this);
            case PROD:
            case LAMBDA:
                return VisitBinder.v((BinderTerm) term, flags, avoid, names, this);
            case LET_IN:
                return VisitBinder.v((LetIn) term, flags, avoid, names, this);
            case APP:
                return visitApp((App) Terms.collapseApp(term), flags, avoid, names);
            case CONST:
                return new GRef(GlobalReference.ofConstant(((Const) term).getName()), instance((GlobalTerm) term));
            case IND:
                return new GRef(GlobalReference.ofInductive(((Ind) term).getInductive()), instance((GlobalTerm) term));
            case CONSTRUCT:
                return new GRef(GlobalReference.ofConstructor(((Construct) term).getConstructor()),
                        instance((GlobalTerm) term));
            case CASE:
                return VisitCase.v((Case) term, flags, avoid, names, this);
            case FIX:
                return VisitFix.v((Fix) term, flags, avoid, names, this);
            case COFIX:
                return VisitFix.v((CoFix) term, flags, avoid, names, this);
            case INT:
                return new GInt(((IntLit) term).getValue());
            case FLOAT:
                return new GFloat(((FloatLit) term).getValue());
            case PROJ:
                return VisitProjection.v((Proj) term, flags, avoid, names, this);
            default:
                throw new IllegalStateException("Unknown term kind: " + term.getKind());
        }
    }

    /**
     * Names one binder, picking the role from the pattern flag and the goal flag.
     */
    public NameChoice computeName(Name hint, boolean letIn, boolean pattern, DetypingFlags flags,
                                  NameAvoidance avoid, NamingContext names, Term body) {
        BinderRole role = pattern ? BinderRole.PATTERN : flags.isGoal() ? BinderRole.GOAL : BinderRole.ELSEWHERE;
        return avoid.computeName(hint, role, letIn, names, body);
    }

    private SurfaceTerm visitRel(Rel rel, NamingContext names) {
        int n = rel.getIndex();
        Name name = names.lookup(n);
        if (name == null) {
            return new GVar(UNBOUND_REL_PREFIX + n);
        }
        if (name.isAnonymous()) {
            return new GVar(ANONYMOUS_REL_PREFIX + n);
        }
        return new GVar(name.getId());
    }

    private SurfaceTerm visitApp(App app, DetypingFlags flags, NameAvoidance avoid, NamingContext names) {
        SurfaceTerm head = build(app.getHead(), flags, avoid, names);
        List<SurfaceTerm> args = new ArrayList<>();
        for (Term arg : app.getArguments()) {
            args.add(build(arg, flags, avoid, names));
        }
        return SurfaceTerms.mkApp(head, args);
    }

    private List<String> instance(GlobalTerm term) {
        if (getOptions().isPrintUniverses() && !term.getInstance().isEmpty()) {
            return term.getInstance();
        }
        return null;
    }
}
