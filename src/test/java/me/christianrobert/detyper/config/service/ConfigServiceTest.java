package me.christianrobert.detyper.config.service;

import me.christianrobert.detyper.term.InductiveRef;
import me.christianrobert.detyper.transformer.context.DetypingException;
import me.christianrobert.detyper.transformer.context.DisplayOptions;
import me.christianrobert.detyper.transformer.env.GlobalIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.christianrobert.detyper.DetypingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigService defaults, typed access and notation registration.
 */
class ConfigServiceTest {

    private ConfigService configService;
    private GlobalIndex environment;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        environment = environment();
    }

    @Test
    void defaultsMatchDisplayDefaults() {
        assertFalse(configService.isPrintUniverses());
        assertTrue(configService.isForceWildcard());
        assertTrue(configService.isSynthesizeReturnType());
        assertTrue(configService.isReverseMatching());
        assertTrue(configService.isFactorizeMatchPatterns());
        assertTrue(configService.isAllowMatchDefaultClause());
        assertFalse(configService.isFastNameGeneration());
        assertFalse(configService.isRaw());
        assertEquals(DisplayOptions.defaults().toString(), configService.snapshot().toString());
    }

    @Test
    void stringValuesAreParsedAsBooleans() {
        // When
        configService.setConfigValue(ConfigService.SYNTHESIZE_RETURN_TYPE, "false");

        // Then
        assertFalse(configService.isSynthesizeReturnType());
        assertEquals(Boolean.FALSE, configService.getConfigValueAsBoolean(ConfigService.SYNTHESIZE_RETURN_TYPE));
        assertEquals("false", configService.getConfigValue(ConfigService.SYNTHESIZE_RETURN_TYPE));
        assertNull(configService.getConfigValueAsBoolean("printing.unknown"));
    }

    @Test
    void nullKeyOrValueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> configService.setConfigValue(null, true));
        assertThrows(IllegalArgumentException.class, () -> configService.setConfigValue(ConfigService.RAW, null));
    }

    @Test
    void snapshotIsDetachedFromLaterChanges() {
        // Given
        configService.setConfigValue(ConfigService.RAW, true);
        configService.registerIfStyle(environment, BOOL);

        // When
        DisplayOptions snapshot = configService.snapshot();
        configService.setConfigValue(ConfigService.RAW, false);
        configService.unregisterIfStyle(BOOL);

        // Then
        assertTrue(snapshot.isRaw());
        assertTrue(snapshot.isIfStyle(BOOL));
        assertFalse(configService.snapshot().isIfStyle(BOOL));
    }

    @Test
    void ifNotationNeedsTwoConstructors() {
        // When
        DetypingException e = assertThrows(DetypingException.class,
                () -> configService.registerIfStyle(environment, COLOR));

        // Then
        assertTrue(e.getMessage().contains("found 3"));
        assertFalse(configService.snapshot().isIfStyle(COLOR));
    }

    @Test
    void letNotationNeedsOneConstructor() {
        // When
        configService.registerLetStyle(environment, PAIR);

        // Then
        assertTrue(configService.snapshot().isLetStyle(PAIR));
        assertThrows(DetypingException.class, () -> configService.registerLetStyle(environment, LIST));

        // When
        configService.unregisterLetStyle(PAIR);

        // Then
        assertFalse(configService.snapshot().isLetStyle(PAIR));
    }

    @Test
    void unknownInductiveIsReported() {
        // Given
        InductiveRef unknown = InductiveRef.of("Top.missing");

        // When
        DetypingException e = assertThrows(DetypingException.class,
                () -> configService.registerIfStyle(environment, unknown));

        // Then
        assertTrue(e.getDetailedMessage().contains("Top.missing"));
    }

    @Test
    void resetRestoresDefaultsAndClearsNotations() {
        // Given
        configService.setConfigValue(ConfigService.FAST_NAME_GENERATION, true);
        configService.registerLetStyle(environment, PAIR);

        // When
        configService.resetToDefaults();

        // Then
        assertFalse(configService.isFastNameGeneration());
        assertFalse(configService.snapshot().isLetStyle(PAIR));
    }
}
