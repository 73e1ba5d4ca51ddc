package me.christianrobert.detyper.transformer.naming;

import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Var;
import me.christianrobert.detyper.transformer.context.NamingContext;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static me.christianrobert.detyper.DetypingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for precise naming: exact forbidden set plus inspection of the binder body.
 */
class PreciseNameAvoidanceTest {

    private final DisplayedNameComputer oracle = new DisplayedNameComputer(environment(), true);

    @Test
    void usedBinderSkipsTakenAndVisibleIdentifiers() {
        // Given: x is taken, x0 occurs as a variable in the body
        NameAvoidance avoid = PreciseNameAvoidance.of(Set.of("x"), oracle);

        // When
        NameChoice choice = avoid.computeName(Name.of("x"), BinderRole.ELSEWHERE, false,
                NamingContext.empty(), app(new Var("x0"), rel(1)));

        // Then
        assertEquals(Name.of("x1"), choice.getName());
        assertTrue(choice.getAvoidance().isReserved("x1"));
        assertFalse(avoid.isReserved("x1"));
    }

    @Test
    void unusedAnonymousBinderStaysAnonymous() {
        // Given
        NameAvoidance avoid = PreciseNameAvoidance.of(Set.of(), oracle);

        // When
        NameChoice choice = avoid.computeName(Name.ANONYMOUS, BinderRole.GOAL, false,
                NamingContext.empty(), ind(NAT));

        // Then
        assertEquals(Name.ANONYMOUS, choice.getName());
        assertSame(avoid, choice.getAvoidance());
    }

    @Test
    void unusedNamedBinderIsAnonymizedButReserved() {
        // Given
        NameAvoidance avoid = PreciseNameAvoidance.of(Set.of(), oracle);

        // When
        NameChoice choice = avoid.computeName(Name.of("h"), BinderRole.ELSEWHERE, false,
                NamingContext.empty(), ind(NAT));

        // Then
        assertEquals(Name.ANONYMOUS, choice.getName());
        assertTrue(choice.getAvoidance().isReserved("h"));
    }

    @Test
    void patternVariablesKeepNamesWithoutForcedWildcards() {
        // Given
        NameAvoidance avoid = PreciseNameAvoidance.of(Set.of(), new DisplayedNameComputer(environment(), false));

        // When
        NameChoice choice = avoid.computeName(Name.of("n"), BinderRole.PATTERN, false,
                NamingContext.empty(), ind(NAT));

        // Then
        assertEquals(Name.of("n"), choice.getName());
    }

    @Test
    void letBindersAreAlwaysNamed() {
        // Given
        NameAvoidance avoid = PreciseNameAvoidance.of(Set.of(), oracle);

        // When
        NameChoice choice = avoid.computeName(Name.ANONYMOUS, BinderRole.ELSEWHERE, true,
                NamingContext.empty(), ind(NAT));

        // Then
        assertEquals(Name.of("H"), choice.getName());
    }

    @Test
    void patternBindersAvoidConstructorNames() {
        // Given
        NameAvoidance avoid = PreciseNameAvoidance.of(Set.of(), oracle);

        // When: the body mentions S, so the constructor names of nat are visible
        NameChoice choice = avoid.computeName(Name.of("S"), BinderRole.PATTERN, false,
                NamingContext.empty(), app(cstr(NAT, 2), rel(1)));

        // Then
        assertEquals(Name.of("S0"), choice.getName());
    }

    @Test
    void freshAgainstSeedsSharingAStem() {
        // Given
        NameAvoidance avoid = PreciseNameAvoidance.of(Set.of("h", "h0", "h2", "h7"), oracle);

        // When
        NameChoice first = avoid.nextNameAway(Name.of("h"));
        NameChoice second = first.getAvoidance().nextNameAway(Name.of("h"));
        NameChoice third = second.getAvoidance().nextNameAway(Name.of("h6"));
        NameChoice fourth = third.getAvoidance().nextNameAway(Name.of("h6"));

        // Then: exact avoidance fills the gaps between seeded subscripts
        assertEquals(Name.of("h1"), first.getName());
        assertEquals(Name.of("h3"), second.getName());
        assertEquals(Name.of("h6"), third.getName());
        assertEquals(Name.of("h8"), fourth.getName());
    }

    @Test
    void missingOracleIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PreciseNameAvoidance.of(Set.of(), null));
    }
}
