package me.christianrobert.detyper.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.detyper.config.service.ConfigService;
import me.christianrobert.detyper.surface.CasesClause;
import me.christianrobert.detyper.surface.DelayedSurfaceTerm;
import me.christianrobert.detyper.surface.SurfaceBinder;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.Cast;
import me.christianrobert.detyper.term.Lambda;
import me.christianrobert.detyper.term.LetIn;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Prod;
import me.christianrobert.detyper.term.RelDeclaration;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Terms;
import me.christianrobert.detyper.transformer.builder.SurfaceTermBuilder;
import me.christianrobert.detyper.transformer.builder.cases.ClauseFactorizer;
import me.christianrobert.detyper.transformer.context.DetypingContext;
import me.christianrobert.detyper.transformer.context.DetypingFlags;
import me.christianrobert.detyper.transformer.context.DisplayOptions;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.env.EvarStore;
import me.christianrobert.detyper.transformer.env.GlobalEnvironment;
import me.christianrobert.detyper.transformer.env.Retyper;
import me.christianrobert.detyper.transformer.naming.BinderRole;
import me.christianrobert.detyper.transformer.naming.DisplayedNameComputer;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;
import me.christianrobert.detyper.transformer.naming.NameChoice;
import me.christianrobert.detyper.transformer.naming.PreciseNameAvoidance;
import me.christianrobert.detyper.transformer.util.SurfaceTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for turning core terms into surface terms.
 *
 * <p>Architecture:
 * <pre>
 * Core Term → DetypingContext (options snapshot) → SurfaceTermBuilder → Surface Term
 *                  ↓                                       ↓
 *            ConfigService                          Static Visit* helpers
 * </pre>
 *
 * <p>Every call samples {@link ConfigService} once, builds a fresh
 * {@link DetypingContext} and a fresh name-avoidance state seeded with the
 * caller's identifiers and the names of the enclosing declarations. Nothing
 * is kept between calls.</p>
 *
 * <p>Translation never fails on well-formed input; unbound references and
 * unknown evars show up as placeholders in the result. Null arguments are
 * programmer errors and raise {@link IllegalArgumentException}.</p>
 */
@ApplicationScoped
public class DetypingService {

    private static final Logger log = LoggerFactory.getLogger(DetypingService.class);

    @Inject
    ConfigService configService;

    public DetypingService() {
    }

    /**
     * Creates a service outside a container.
     */
    public DetypingService(ConfigService configService) {
        this.configService = configService;
    }

    /**
     * Translates a closed term with default flags and no evars.
     */
    public SurfaceTerm detype(Term term, GlobalEnvironment environment) {
        return detype(term, List.of(), environment, null, null, false, Set.of(), false);
    }

    /**
     * Translates a core term into a surface term.
     *
     * @param term Core term
     * @param relContext Declarations the free de Bruijn indices of {@code term} refer to, outermost first
     * @param environment Global symbol table
     * @param evarStore Evar lookup, may be null
     * @param retyper Typing oracle, may be null
     * @param isGoal Whether the term is displayed as a goal
     * @param avoid Identifiers that must not be produced
     * @param lax Lax mode (no retyping of projections)
     * @return surface term whose binder names are fresh and distinct from {@code avoid}
     */
    public SurfaceTerm detype(Term term, List<RelDeclaration> relContext, GlobalEnvironment environment,
                              EvarStore evarStore, Retyper retyper, boolean isGoal, Set<String> avoid, boolean lax) {
        DisplayOptions options = snapshot();
        return detype(options, term, relContext, environment, evarStore, retyper, isGoal, avoid, lax);
    }

    /**
     * Same as {@link #detype(Term, List, GlobalEnvironment, EvarStore, Retyper, boolean, Set, boolean)},
     * computed on first {@code force()}. The settings are sampled now.
     */
    public DelayedSurfaceTerm detypeLater(Term term, List<RelDeclaration> relContext, GlobalEnvironment environment,
                                          EvarStore evarStore, Retyper retyper, boolean isGoal, Set<String> avoid,
                                          boolean lax) {
        requireArguments(term, relContext, environment, avoid);
        DisplayOptions options = snapshot();
        List<RelDeclaration> context = List.copyOf(relContext);
        Set<String> seed = Set.copyOf(avoid);
        return new DelayedSurfaceTerm(() ->
                detype(options, term, context, environment, evarStore, retyper, isGoal, seed, lax));
    }

    /**
     * Names and translates a telescope.
     *
     * @param where Term living under the whole telescope, used to decide which names are needed; when null,
     *              every declaration keeps its own name
     * @param telescope Declarations, outermost first
     * @param environment Global symbol table
     * @param retyper Typing oracle, may be null
     * @param avoid Identifiers that must not be produced
     * @param lax Lax mode
     * @return one surface binder per declaration, outermost first
     */
    public List<SurfaceBinder> detypeRelContext(Term where, List<RelDeclaration> telescope,
                                                GlobalEnvironment environment, Retyper retyper,
                                                Set<String> avoid, boolean lax) {
        if (telescope == null || environment == null || avoid == null) {
            throw new IllegalArgumentException("Telescope, environment and avoid set cannot be null");
        }
        DisplayOptions options = snapshot();
        DetypingContext context = new DetypingContext(options, environment, null, retyper);
        SurfaceTermBuilder builder = new SurfaceTermBuilder(context);
        DetypingFlags flags = DetypingFlags.of(false, lax);

        log.debug("Detyping telescope of {} declaration(s)", telescope.size());
        NameAvoidance avoidance = newAvoidance(options, environment, avoid);
        NamingContext names = NamingContext.empty();
        Term remaining = where != null ? wrap(where, telescope) : null;
        List<SurfaceBinder> binders = new ArrayList<>();
        for (RelDeclaration declaration : telescope) {
            Name name;
            if (remaining != null) {
                Term body = binderBody(remaining);
                NameChoice choice = builder.computeName(declaration.getName(), declaration.isDefinition(), false,
                        flags, avoidance, names, body);
                name = choice.getName();
                avoidance = choice.getAvoidance();
                remaining = body;
            } else {
                name = declaration.getName();
            }
            SurfaceTerm type = builder.build(declaration.getType(), flags, avoidance, names);
            SurfaceTerm value = declaration.isDefinition()
                    ? builder.build(declaration.getValue(), flags, avoidance, names)
                    : null;
            binders.add(new SurfaceBinder(name, value, type));
            names = declaration.isDefinition()
                    ? names.pushDefinition(name, declaration.getValue(), declaration.getType())
                    : names.push(name, declaration.getType());
        }
        return binders;
    }

    /**
     * Merges clauses with equal right-hand sides and picks a default clause, under the current settings.
     */
    public List<CasesClause> factorize(List<CasesClause> clauses) {
        if (clauses == null) {
            throw new IllegalArgumentException("Clauses cannot be null");
        }
        return new ClauseFactorizer().factorize(clauses, snapshot());
    }

    /**
     * Finds the position of the product or let binder that goal display shows as {@code id}.
     *
     * @param environment Global symbol table
     * @param environmentIds Identifiers of the named context, never produced
     * @param type Type to walk
     * @param id Displayed identifier to look for
     * @return 1-based binder position, or empty when no binder is displayed as {@code id}
     */
    public Optional<Integer> lookupNameAsDisplayed(GlobalEnvironment environment, Set<String> environmentIds,
                                                   Term type, String id) {
        if (environment == null || environmentIds == null || type == null || id == null) {
            throw new IllegalArgumentException("Environment, identifiers, type and id cannot be null");
        }
        NameAvoidance avoid = PreciseNameAvoidance.of(environmentIds,
                new DisplayedNameComputer(environment, snapshot().isForceWildcard()));
        NamingContext names = NamingContext.empty();
        Term c = type;
        int n = 1;
        while (true) {
            Term body;
            Name hint;
            if (c instanceof Prod) {
                hint = ((Prod) c).getName();
                body = ((Prod) c).getBody();
            } else if (c instanceof LetIn) {
                hint = ((LetIn) c).getName();
                body = ((LetIn) c).getBody();
            } else if (c instanceof Cast) {
                c = ((Cast) c).getTerm();
                continue;
            } else {
                return Optional.empty();
            }
            NameChoice choice = avoid.computeName(hint, BinderRole.GOAL, false, names, body);
            avoid = choice.getAvoidance();
            if (choice.getName().isNamed()) {
                if (choice.getName().getId().equals(id)) {
                    return Optional.of(n);
                }
                names = names.push(choice.getName());
                c = body;
            } else {
                c = Terms.liftFrom(body, 1, -1);
            }
            n++;
        }
    }

    /**
     * Finds the binder shown as the {@code n}-th arrow (anonymous binder) in goal display.
     *
     * @param environment Global symbol table
     * @param type Type to walk
     * @param n Arrow number; 0 asks for the position right after the last binder
     * @return binder position, or empty
     */
    public Optional<Integer> lookupIndexAsRenamed(GlobalEnvironment environment, Term type, int n) {
        if (environment == null || type == null) {
            throw new IllegalArgumentException("Environment and type cannot be null");
        }
        DisplayedNameComputer oracle = new DisplayedNameComputer(environment, snapshot().isForceWildcard());
        Term c = type;
        int remaining = n;
        int d = 1;
        while (true) {
            Term body;
            Name hint;
            if (c instanceof Prod) {
                hint = ((Prod) c).getName();
                body = ((Prod) c).getBody();
            } else if (c instanceof LetIn) {
                hint = ((LetIn) c).getName();
                body = ((LetIn) c).getBody();
            } else if (c instanceof Cast) {
                c = ((Cast) c).getTerm();
                continue;
            } else {
                return remaining == 0 ? Optional.of(d - 1) : Optional.empty();
            }
            NameChoice choice = PreciseNameAvoidance.of(Set.of(), oracle)
                    .computeName(hint, BinderRole.GOAL, false, NamingContext.empty(), body);
            if (choice.getName().isAnonymous()) {
                if (remaining == 0) {
                    return Optional.of(d - 1);
                }
                if (remaining == 1) {
                    return Optional.of(d);
                }
                remaining--;
            }
            d++;
            c = body;
        }
    }

    private SurfaceTerm detype(DisplayOptions options, Term term, List<RelDeclaration> relContext,
                               GlobalEnvironment environment, EvarStore evarStore, Retyper retyper,
                               boolean isGoal, Set<String> avoid, boolean lax) {
        requireArguments(term, relContext, environment, avoid);

        // STEP 1: Build the per-call context
        log.debug("Step 1: Creating detyping context ({} local declaration(s), goal={}, lax={})",
                relContext.size(), isGoal, lax);
        DetypingContext context = new DetypingContext(options, environment, evarStore, retyper);
        NamingContext names = NamingContext.empty();
        Set<String> seed = new HashSet<>(avoid);
        for (RelDeclaration declaration : relContext) {
            names = declaration.isDefinition()
                    ? names.pushDefinition(declaration.getName(), declaration.getValue(), declaration.getType())
                    : names.push(declaration.getName(), declaration.getType());
            if (declaration.getName().isNamed()) {
                seed.add(declaration.getName().getId());
            }
        }

        // STEP 2: Seed name avoidance
        log.debug("Step 2: Seeding {} name avoidance with {} identifier(s)",
                options.isFastNameGeneration() ? "fast" : "precise", seed.size());
        NameAvoidance avoidance = newAvoidance(options, environment, seed);

        // STEP 3: Translate
        log.debug("Step 3: Translating term");
        SurfaceTerm result = new SurfaceTermBuilder(context)
                .build(term, DetypingFlags.of(isGoal, lax), avoidance, names);

        if (log.isTraceEnabled()) {
            log.trace("Surface tree:\n{}", SurfaceTreeFormatter.format(result));
        }
        return result;
    }

    private DisplayOptions snapshot() {
        if (configService == null) {
            log.warn("No configuration service available, using default display options");
            return DisplayOptions.defaults();
        }
        return configService.snapshot();
    }

    private static NameAvoidance newAvoidance(DisplayOptions options, GlobalEnvironment environment,
                                              Set<String> seed) {
        return NameAvoidance.make(options.isFastNameGeneration(), seed,
                new DisplayedNameComputer(environment, options.isForceWildcard()));
    }

    private static Term wrap(Term where, List<RelDeclaration> telescope) {
        Term result = where;
        for (int i = telescope.size() - 1; i >= 0; i--) {
            RelDeclaration declaration = telescope.get(i);
            result = declaration.isDefinition()
                    ? new LetIn(declaration.getName(), declaration.getValue(), declaration.getType(), result)
                    : new Lambda(declaration.getName(), declaration.getType(), result);
        }
        return result;
    }

    private static Term binderBody(Term wrapped) {
        if (wrapped instanceof LetIn) {
            return ((LetIn) wrapped).getBody();
        }
        return ((Lambda) wrapped).getBody();
    }

    private static void requireArguments(Term term, List<RelDeclaration> relContext,
                                         GlobalEnvironment environment, Set<String> avoid) {
        if (term == null) {
            throw new IllegalArgumentException("Term cannot be null");
        }
        if (relContext == null) {
            throw new IllegalArgumentException("Local context cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("Global environment cannot be null");
        }
        if (avoid == null) {
            throw new IllegalArgumentException("Avoid set cannot be null");
        }
    }
}
