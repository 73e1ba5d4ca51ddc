package me.christianrobert.detyper.transformer.env;

import me.christianrobert.detyper.term.InductiveRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static me.christianrobert.detyper.DetypingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GlobalIndexBuilder and the short-name lookups of GlobalEnvironment.
 */
class GlobalIndexBuilderTest {

    @Test
    void buildsIndexFromDeclarations() {
        // When
        GlobalIndex index = new GlobalIndexBuilder()
                .inductives(List.of(
                        new InductiveDeclaration(NAT, "nat", List.of("O", "S"), 0),
                        new InductiveDeclaration(BOOL, "bool", List.of("true", "false"), 0)))
                .sectionVariable("A")
                .build();

        // Then
        assertEquals(2, index.getInductiveCount());
        assertEquals(1, index.getSectionVariableCount());
        assertTrue(index.isSectionVariable("A"));
        assertFalse(index.isSectionVariable("B"));
        assertEquals(2, index.lookupInductive(NAT).orElseThrow().getConstructorCount());
    }

    @Test
    void laterDeclarationReplacesEarlier() {
        // When
        GlobalIndex index = new GlobalIndexBuilder()
                .inductive(new InductiveDeclaration(COLOR, "color", List.of("red"), 0))
                .inductive(new InductiveDeclaration(COLOR, "color", List.of("red", "green", "blue"), 0))
                .build();

        // Then
        assertEquals(1, index.getInductiveCount());
        assertEquals(3, index.lookupInductive(COLOR).orElseThrow().getConstructorCount());
    }

    @Test
    void shortNamesComeFromDeclarations() {
        // Given
        GlobalIndex index = environment();

        // Then
        assertEquals("add", index.constantShortName("Coq.Init.Nat.add"));
        assertEquals("plain", index.constantShortName("plain"));
        assertEquals(Optional.of("nat"), index.inductiveShortName(NAT));
        assertEquals(Optional.of("S"), index.constructorShortName(NAT.constructor(2)));
        assertEquals(Optional.empty(), index.constructorShortName(NAT.constructor(3)));
        assertEquals(Optional.empty(), index.inductiveShortName(InductiveRef.of("Top.missing")));
    }

    @Test
    void invalidInputIsRejected() {
        GlobalIndexBuilder builder = new GlobalIndexBuilder();

        assertThrows(IllegalArgumentException.class, () -> builder.inductive(null));
        assertThrows(IllegalArgumentException.class, () -> builder.sectionVariable(""));
    }
}
