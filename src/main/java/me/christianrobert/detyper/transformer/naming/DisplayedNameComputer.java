package me.christianrobert.detyper.transformer.naming;

import me.christianrobert.detyper.term.Const;
import me.christianrobert.detyper.term.Construct;
import me.christianrobert.detyper.term.ConstructorRef;
import me.christianrobert.detyper.term.Ind;
import me.christianrobert.detyper.term.InductiveRef;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Terms;
import me.christianrobert.detyper.term.Var;
import me.christianrobert.detyper.transformer.env.GlobalEnvironment;
import me.christianrobert.detyper.transformer.env.InductiveDeclaration;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Occurrence-aware name oracle behind {@link PreciseNameAvoidance}.
 *
 * <p>A binder name must not hide what its body displays:</p>
 * <ul>
 *   <li>named variables occurring in the body (every role)</li>
 *   <li>short names of constants, inductives and constructors occurring in the body
 *       (elsewhere and pattern roles)</li>
 *   <li>all constructor names of the inductives the body mentions (pattern role,
 *       where a variable spelled like a constructor would be read as one)</li>
 * </ul>
 *
 * <p>Non-let binders whose variable does not occur in the body are displayed
 * anonymously (an arrow for products). For pattern binders this only happens
 * when wildcards are forced, otherwise a pattern keeps its recorded name.</p>
 */
public class DisplayedNameComputer {

    private final GlobalEnvironment environment;
    private final boolean forceWildcard;

    public DisplayedNameComputer(GlobalEnvironment environment, boolean forceWildcard) {
        this.environment = environment;
        this.forceWildcard = forceWildcard;
    }

    /**
     * Decides whether an unused non-let binder of the given role is shown anonymously.
     */
    public boolean anonymizesUnused(BinderRole role) {
        return role != BinderRole.PATTERN || forceWildcard;
    }

    /**
     * Picks the identifier for a binder, stepping through subscripts until it is neither taken nor visible.
     *
     * @param hint Recorded binder name
     * @param role Display position
     * @param body Binder body
     * @param taken Identifiers already reserved in this call
     */
    public String nextNameForDisplay(Name hint, BinderRole role, Term body, Predicate<String> taken) {
        Set<String> visible = visibleIdentifiers(body, role);
        String id = hint.isNamed() ? hint.getId() : role.defaultStem();
        while (taken.test(id) || visible.contains(id)) {
            id = Subscripts.increment(id);
        }
        return id;
    }

    /**
     * Collects the identifiers a binder of the given role must not be named after.
     */
    public Set<String> visibleIdentifiers(Term body, BinderRole role) {
        Set<String> visible = new HashSet<>();
        Terms.forEachSubterm(body, t -> {
            switch (t.getKind()) {
                case VAR:
                    visible.add(((Var) t).getId());
                    break;
                case CONST:
                    if (role != BinderRole.GOAL) {
                        visible.add(environment.constantShortName(((Const) t).getName()));
                    }
                    break;
                case IND:
                    if (role != BinderRole.GOAL) {
                        addInductive(((Ind) t).getInductive(), role, visible);
                    }
                    break;
                case CONSTRUCT:
                    if (role != BinderRole.GOAL) {
                        ConstructorRef constructor = ((Construct) t).getConstructor();
                        environment.constructorShortName(constructor).ifPresent(visible::add);
                        if (role == BinderRole.PATTERN) {
                            addInductive(constructor.getInductive(), role, visible);
                        }
                    }
                    break;
                default:
                    break;
            }
        });
        return visible;
    }

    private void addInductive(InductiveRef inductive, BinderRole role, Set<String> visible) {
        Optional<InductiveDeclaration> declaration = environment.lookupInductive(inductive);
        if (declaration.isEmpty()) {
            return;
        }
        visible.add(declaration.get().getName());
        if (role == BinderRole.PATTERN) {
            visible.addAll(declaration.get().getConstructorNames());
        }
    }
}
