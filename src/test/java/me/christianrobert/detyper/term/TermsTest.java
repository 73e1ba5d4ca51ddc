package me.christianrobert.detyper.term;

import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.detyper.DetypingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for de Bruijn index manipulation.
 */
class TermsTest {

    @Test
    void liftSkipsBoundIndices() {
        // Given: fun _ => Rel1 Rel2
        Term term = lam("a", ind(NAT), app(rel(1), rel(2)));

        // When
        Term lifted = Terms.lift(term, 2);

        // Then
        assertEquals(lam("a", ind(NAT), app(rel(1), rel(4))), lifted);
    }

    @Test
    void substitutionLowersOuterIndices() {
        // When: (Rel1 Rel2)[Rel1 := c]
        Term result = Terms.subst1(new Const("Top.c"), app(rel(1), rel(2)));

        // Then
        assertEquals(app(new Const("Top.c"), rel(1)), result);
    }

    @Test
    void substitutionLiftsValueUnderBinders() {
        // When: (fun a => Rel2)[Rel1 := Rel5]
        Term result = Terms.subst1(rel(5), lam("a", ind(NAT), rel(2)));

        // Then
        assertEquals(lam("a", ind(NAT), rel(6)), result);
    }

    @Test
    void occurrenceChecksRespectDepth() {
        Term body = lam("a", rel(1), rel(2));

        assertFalse(Terms.noccurn(1, body));
        assertTrue(Terms.noccurn(2, body));
        assertTrue(Terms.isClosed(lam("a", ind(NAT), rel(1))));
        assertFalse(Terms.isClosed(body));
    }

    @Test
    void applicationsAreFlattened() {
        // Given
        Term nested = new App(app(new Var("f"), rel(1)), List.of(rel(2)));

        // Then
        assertEquals(app(new Var("f"), rel(1), rel(2)), Terms.collapseApp(nested));
        assertEquals(app(new Var("f"), rel(1), rel(2)), Terms.applist(app(new Var("f"), rel(1)), List.of(rel(2))));
        assertEquals(new Var("f"), Terms.applist(new Var("f"), List.of()));
    }

    @Test
    void leadingBindersAreCountedThroughCasts() {
        // Given
        Term term = lam("a", ind(NAT), new Cast(lam("b", ind(NAT), rel(2)), CastKind.VM, ind(NAT)));

        // Then
        assertEquals(2, Terms.countLambdaOrLetIn(term));
        assertEquals(rel(2), Terms.stripLambdaOrLetIn(term));
        assertNull(Terms.stripLambdaOrLetInN(term, 3));
    }
}
