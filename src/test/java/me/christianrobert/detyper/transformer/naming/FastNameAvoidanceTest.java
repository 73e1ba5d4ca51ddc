package me.christianrobert.detyper.transformer.naming;

import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.transformer.context.NamingContext;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static me.christianrobert.detyper.DetypingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FastNameAvoidanceTest {

    @Test
    void seedRaisesCeilingPerStem() {
        // Given
        FastNameAvoidance avoid = FastNameAvoidance.of(Set.of("x", "x3", "y"));

        // Then
        assertEquals(BigInteger.valueOf(3), avoid.getCeiling("x"));
        assertEquals(Subscripts.NONE, avoid.getCeiling("y"));
        assertNull(avoid.getCeiling("z"));
        assertTrue(avoid.isReserved("x1"));
        assertFalse(avoid.isReserved("x4"));
    }

    @Test
    void reservationsNeverRepeat() {
        // Given
        NameAvoidance avoid = FastNameAvoidance.of(Set.of("x3"));

        // When
        NameChoice first = avoid.nextNameAway(Name.of("x"));
        NameChoice second = first.getAvoidance().nextNameAway(Name.of("x1"));

        // Then
        assertEquals(Name.of("x4"), first.getName());
        assertEquals(Name.of("x5"), second.getName());
        assertFalse(avoid.isReserved("x4"));
    }

    @Test
    void longSubscriptsNeverCollideWithSeed() {
        // Given
        NameAvoidance avoid = FastNameAvoidance.of(Set.of("x12345678900"));

        // When
        NameChoice first = avoid.nextNameAway(Name.of("x1234567890"));
        NameChoice second = first.getAvoidance().nextNameAway(Name.of("x1234567890"));

        // Then
        assertEquals(Name.of("x12345678901"), first.getName());
        assertEquals(Name.of("x12345678902"), second.getName());
    }

    @Test
    void longSubscriptsNeverRepeatWithinOneCall() {
        // Given
        NameAvoidance avoid = FastNameAvoidance.of(Set.of());
        Set<String> produced = new HashSet<>();

        // When
        for (int i = 0; i < 4; i++) {
            NameChoice choice = avoid.nextNameAway(Name.of("y12345678900"));
            assertTrue(produced.add(choice.getName().getId()), "duplicate " + choice.getName());
            avoid = choice.getAvoidance();
            NameChoice again = avoid.nextNameAway(choice.getName());
            assertTrue(produced.add(again.getName().getId()), "duplicate " + again.getName());
            avoid = again.getAvoidance();
        }

        // Then
        assertEquals(8, produced.size());
    }

    @Test
    void freshAgainstSeedsSharingAStem() {
        // Given: seeds with the same stem and scattered subscripts
        Set<String> seed = Set.of("h", "h0", "h7", "h2", "k", "7");
        NameAvoidance avoid = FastNameAvoidance.of(seed);
        Set<String> produced = new HashSet<>();

        // When
        for (String hint : List.of("h", "h0", "h5", "h9", "k", "k", "7", "7")) {
            NameChoice choice = avoid.nextNameAway(Name.of(hint));
            produced.add(choice.getName().getId());
            avoid = choice.getAvoidance();
        }

        // Then
        assertEquals(8, produced.size());
        for (String id : seed) {
            assertFalse(produced.contains(id), id + " was produced");
        }
    }

    @Test
    void unusedBindersStillGetNames() {
        // Given
        NameAvoidance avoid = FastNameAvoidance.of(Set.of());

        // When
        NameChoice choice = avoid.computeName(Name.ANONYMOUS, BinderRole.ELSEWHERE, false,
                NamingContext.empty(), ind(NAT));
        NameChoice pattern = choice.getAvoidance().computeName(Name.ANONYMOUS, BinderRole.PATTERN, false,
                NamingContext.empty(), ind(NAT));

        // Then
        assertEquals(Name.of("H"), choice.getName());
        assertEquals(Name.of("x"), pattern.getName());
    }
}
