package me.christianrobert.detyper.transformer.context;

import me.christianrobert.detyper.term.Projection;
import me.christianrobert.detyper.term.SortFamily;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.transformer.env.EvarStore;
import me.christianrobert.detyper.transformer.env.GlobalEnvironment;
import me.christianrobert.detyper.transformer.env.Retyper;
import me.christianrobert.detyper.transformer.env.RetypingException;

import java.util.Objects;

/**
 * Read-only context for one detyping call.
 *
 * <p>Holds what stays constant during a whole translation:</p>
 * <ul>
 *   <li>{@link #getOptions()} - printing flags sampled when the call started</li>
 *   <li>{@link #getEnvironment()} - global symbol table (short names, constructors, section variables)</li>
 *   <li>{@link #getEvarStore()} - existential variables visible to this call</li>
 *   <li>{@link #getRetyper()} - typing oracle for let types and projection expansion</li>
 * </ul>
 *
 * <p>What changes while descending into the term (binder names, avoided
 * identifiers, the goal flag) is passed explicitly as {@link NamingContext},
 * {@code NameAvoidance} and {@link DetypingFlags} values instead of living
 * here, so one context may be shared by any number of sibling calls.</p>
 *
 * <p>Instances are created fresh per call by {@code DetypingService} and are
 * never cached.</p>
 */
public class DetypingContext {

    private static final Retyper NO_RETYPER = new Retyper() {
        @Override
        public SortFamily sortFamilyOf(NamingContext context, Term type) {
            throw new RetypingException("No retyper available");
        }

        @Override
        public Term expandProjection(NamingContext context, Projection projection, Term principal) {
            throw new RetypingException("No retyper available");
        }
    };

    private final DisplayOptions options;
    private final GlobalEnvironment environment;
    private final EvarStore evarStore;
    private final Retyper retyper;

    /**
     * Creates a context.
     *
     * @param options Printing flags
     * @param environment Global symbol table
     * @param evarStore Evar lookup (null means no evars are known)
     * @param retyper Typing oracle (null means every retyping request fails)
     */
    public DetypingContext(DisplayOptions options, GlobalEnvironment environment,
                           EvarStore evarStore, Retyper retyper) {
        this.options = Objects.requireNonNull(options, "options");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.evarStore = evarStore != null ? evarStore : EvarStore.empty();
        this.retyper = retyper != null ? retyper : NO_RETYPER;
    }

    public DisplayOptions getOptions() {
        return options;
    }

    public GlobalEnvironment getEnvironment() {
        return environment;
    }

    public EvarStore getEvarStore() {
        return evarStore;
    }

    public Retyper getRetyper() {
        return retyper;
    }

    public boolean isRaw() {
        return options.isRaw();
    }
}
