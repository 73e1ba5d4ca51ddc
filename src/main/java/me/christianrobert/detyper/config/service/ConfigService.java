package me.christianrobert.detyper.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.detyper.term.InductiveRef;
import me.christianrobert.detyper.transformer.context.DetypingException;
import me.christianrobert.detyper.transformer.context.DisplayOptions;
import me.christianrobert.detyper.transformer.env.GlobalEnvironment;
import me.christianrobert.detyper.transformer.env.InductiveDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the printing flags and the if/let notation tables.
 *
 * <p>Each detyping call samples this service once through {@link #snapshot()};
 * changes made while a call runs are seen by the next call only.</p>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String PRINT_UNIVERSES = "printing.universes";
    public static final String FORCE_WILDCARD = "printing.wildcard";
    public static final String SYNTHESIZE_RETURN_TYPE = "printing.synth";
    public static final String REVERSE_MATCHING = "printing.matching";
    public static final String PRIMITIVE_PROJECTION_PARAMETERS = "printing.primitive-projection-parameters";
    public static final String FACTORIZE_MATCH_PATTERNS = "printing.factorizable-match-patterns";
    public static final String ALLOW_MATCH_DEFAULT_CLAUSE = "printing.allow-match-default-clause";
    public static final String FAST_NAME_GENERATION = "printing.fast-name-generation";
    public static final String EXISTENTIAL_INSTANCES = "printing.existential-instances";
    public static final String RAW = "printing.raw";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();
    private final Set<InductiveRef> ifStyleInductives = ConcurrentHashMap.newKeySet();
    private final Set<InductiveRef> letStyleInductives = ConcurrentHashMap.newKeySet();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(PRINT_UNIVERSES, false);
        configuration.put(FORCE_WILDCARD, true);
        configuration.put(SYNTHESIZE_RETURN_TYPE, true);
        configuration.put(REVERSE_MATCHING, true);
        configuration.put(PRIMITIVE_PROJECTION_PARAMETERS, false);
        configuration.put(FACTORIZE_MATCH_PATTERNS, true);
        configuration.put(ALLOW_MATCH_DEFAULT_CLAUSE, true);
        configuration.put(FAST_NAME_GENERATION, false);
        configuration.put(EXISTENTIAL_INSTANCES, false);
        configuration.put(RAW, false);

        log.info("Configuration service initialized with default values");
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = getConfigValue(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    public void setConfigValue(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("Config key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("Config value cannot be null for key " + key);
        }
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        ifStyleInductives.clear();
        letStyleInductives.clear();
        initializeDefaultConfiguration();
    }

    public boolean isPrintUniverses() {
        return flag(PRINT_UNIVERSES);
    }

    public boolean isForceWildcard() {
        return flag(FORCE_WILDCARD);
    }

    public boolean isSynthesizeReturnType() {
        return flag(SYNTHESIZE_RETURN_TYPE);
    }

    public boolean isReverseMatching() {
        return flag(REVERSE_MATCHING);
    }

    public boolean isPrintPrimitiveProjectionParameters() {
        return flag(PRIMITIVE_PROJECTION_PARAMETERS);
    }

    public boolean isFactorizeMatchPatterns() {
        return flag(FACTORIZE_MATCH_PATTERNS);
    }

    public boolean isAllowMatchDefaultClause() {
        return flag(ALLOW_MATCH_DEFAULT_CLAUSE);
    }

    public boolean isFastNameGeneration() {
        return flag(FAST_NAME_GENERATION);
    }

    public boolean isPrintEvarArguments() {
        return flag(EXISTENTIAL_INSTANCES);
    }

    public boolean isRaw() {
        return flag(RAW);
    }

    /**
     * Displays matches on {@code inductive} as {@code if .. then .. else}.
     *
     * @throws DetypingException when the inductive is unknown or does not have exactly two constructors
     */
    public void registerIfStyle(GlobalEnvironment environment, InductiveRef inductive) {
        requireConstructorCount(environment, inductive, 2, "if");
        if (ifStyleInductives.add(inductive)) {
            log.info("If notation enabled for {}", inductive);
        }
    }

    /**
     * Displays matches on {@code inductive} as {@code let (..) := .. in}.
     *
     * @throws DetypingException when the inductive is unknown or does not have exactly one constructor
     */
    public void registerLetStyle(GlobalEnvironment environment, InductiveRef inductive) {
        requireConstructorCount(environment, inductive, 1, "let");
        if (letStyleInductives.add(inductive)) {
            log.info("Let notation enabled for {}", inductive);
        }
    }

    public void unregisterIfStyle(InductiveRef inductive) {
        if (ifStyleInductives.remove(inductive)) {
            log.info("If notation disabled for {}", inductive);
        }
    }

    public void unregisterLetStyle(InductiveRef inductive) {
        if (letStyleInductives.remove(inductive)) {
            log.info("Let notation disabled for {}", inductive);
        }
    }

    /**
     * Freezes the current settings for one detyping call.
     */
    public DisplayOptions snapshot() {
        return DisplayOptions.builder()
                .printUniverses(isPrintUniverses())
                .forceWildcard(isForceWildcard())
                .synthesizeReturnType(isSynthesizeReturnType())
                .reverseMatching(isReverseMatching())
                .printPrimitiveProjectionParameters(isPrintPrimitiveProjectionParameters())
                .factorizeMatchPatterns(isFactorizeMatchPatterns())
                .allowMatchDefaultClause(isAllowMatchDefaultClause())
                .fastNameGeneration(isFastNameGeneration())
                .printEvarArguments(isPrintEvarArguments())
                .raw(isRaw())
                .ifStyleInductives(Set.copyOf(ifStyleInductives))
                .letStyleInductives(Set.copyOf(letStyleInductives))
                .build();
    }

    private boolean flag(String key) {
        return Boolean.TRUE.equals(getConfigValueAsBoolean(key));
    }

    private static void requireConstructorCount(GlobalEnvironment environment, InductiveRef inductive,
                                                int expected, String notation) {
        if (environment == null || inductive == null) {
            throw new IllegalArgumentException("Environment and inductive are required");
        }
        Optional<InductiveDeclaration> declaration = environment.lookupInductive(inductive);
        if (declaration.isEmpty()) {
            throw new DetypingException("Unknown inductive type", inductive.toString(),
                    "registering " + notation + " notation");
        }
        int count = declaration.get().getConstructorCount();
        if (count != expected) {
            throw new DetypingException("Expected an inductive type with " + expected
                    + " constructor(s), found " + count, declaration.get().getName(),
                    "registering " + notation + " notation");
        }
    }
}
