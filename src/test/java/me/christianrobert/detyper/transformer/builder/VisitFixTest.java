package me.christianrobert.detyper.transformer.builder;

import me.christianrobert.detyper.surface.GRec;
import me.christianrobert.detyper.surface.RecKind;
import me.christianrobert.detyper.surface.SurfaceBinder;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.CoFix;
import me.christianrobert.detyper.term.Fix;
import me.christianrobert.detyper.term.LetIn;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.RecBlock;
import me.christianrobert.detyper.term.Sort;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Var;
import me.christianrobert.detyper.transformer.context.DisplayOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.detyper.DetypingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for argument sharing between fixpoint bodies and types.
 */
class VisitFixTest {

    private static Fix fix(Term type, Term body) {
        return new Fix(List.of(0), 0, new RecBlock(List.of(Name.of("f")), List.of(type), List.of(body)));
    }

    private static GRec expected(RecKind kind, List<Integer> recIndices, String name, String argument,
                                 SurfaceTerm type, SurfaceTerm body) {
        return new GRec(kind, recIndices, 0, List.of(name),
                List.of(List.of(SurfaceBinder.assumption(Name.of(argument), gInd(NAT)))),
                List.of(type), List.of(body));
    }

    @Test
    void lambdaAndProductShareOneName() {
        // Given: fix f (n : nat) : nat := f n
        Fix term = fix(prod("n", ind(NAT), ind(NAT)), lam("n", ind(NAT), app(rel(2), rel(1))));

        // When
        SurfaceTerm result = build(DisplayOptions.defaults(), term);

        // Then
        assertEquals(expected(RecKind.FIX, List.of(0), "f", "n", gInd(NAT), gApp(gVar("f"), gVar("n"))), result);
    }

    @Test
    void concreteNameWinsOverAnonymous() {
        // Given: the body binder is anonymous, the type names it m
        Fix term = fix(prod("m", ind(NAT), ind(NAT)), lam(null, ind(NAT), app(rel(2), rel(1))));

        // When
        SurfaceTerm result = build(DisplayOptions.defaults(), term);

        // Then
        assertEquals(expected(RecKind.FIX, List.of(0), "f", "m", gInd(NAT), gApp(gVar("f"), gVar("m"))), result);
    }

    @Test
    void etaContractedBodyIsExpanded() {
        // Given: fix f : nat -> nat := g, with the argument missing from the body
        Fix term = fix(prod("n", ind(NAT), ind(NAT)), new Var("g"));

        // When
        SurfaceTerm result = build(DisplayOptions.defaults(), term);

        // Then
        assertEquals(expected(RecKind.FIX, List.of(0), "f", "n", gInd(NAT), gApp(gVar("g"), gVar("n"))), result);
    }

    @Test
    void outOfRangeReferenceInBodyBecomesPlaceholder() {
        // Given: fix f (n : nat) : nat := f n #7, where only f and n are bound
        Fix term = fix(prod("n", ind(NAT), ind(NAT)), lam("n", ind(NAT), app(rel(2), rel(1), rel(7))));

        // When
        GRec result = (GRec) build(DisplayOptions.defaults(), term);

        // Then
        assertEquals(gApp(gVar("f"), gVar("n"), gVar("_UNBOUND_REL_7")), result.getBodies().get(0));
    }

    @Test
    void letInTypeIsSubstitutedAway() {
        // Given: fix f (n : nat) : (let T := nat in T) -> nat
        Term type = new LetIn(Name.of("T"), ind(NAT), Sort.SET,
                prod("n", rel(1), ind(NAT)));
        Fix term = fix(type, lam("n", ind(NAT), rel(1)));

        // When
        GRec result = (GRec) build(DisplayOptions.defaults(), term);

        // Then
        assertEquals(1, result.getBinders().get(0).size());
        assertEquals(Name.of("n"), result.getBinders().get(0).get(0).getName());
        assertEquals(gVar("n"), result.getBodies().get(0));
    }

    @Test
    void functionNamesAvoidEachOther() {
        // Given: two functions both called f
        RecBlock block = new RecBlock(List.of(Name.of("f"), Name.of("f")),
                List.of(prod("n", ind(NAT), ind(NAT)), prod("n", ind(NAT), ind(NAT))),
                List.of(lam("n", ind(NAT), app(rel(2), rel(1))), lam("n", ind(NAT), app(rel(3), rel(1)))));
        Fix term = new Fix(List.of(0, 0), 1, block);

        // When
        GRec result = (GRec) build(DisplayOptions.defaults(), term);

        // Then
        assertEquals(List.of("f", "f0"), result.getNames());
        assertEquals(gApp(gVar("f0"), gVar("n")), result.getBodies().get(0));
        assertEquals(gApp(gVar("f"), gVar("n")), result.getBodies().get(1));
    }

    @Test
    void cofixpointSharesItsWholePrefix() {
        // Given: cofix s (n : nat) : nat := s n
        RecBlock block = new RecBlock(List.of(Name.of("s")), List.of(prod("n", ind(NAT), ind(NAT))),
                List.of(lam("n", ind(NAT), app(rel(2), rel(1)))));
        CoFix term = new CoFix(0, block);

        // When
        SurfaceTerm result = build(DisplayOptions.defaults(), term);

        // Then
        assertEquals(expected(RecKind.COFIX, List.of(), "s", "n", gInd(NAT), gApp(gVar("s"), gVar("n"))), result);
    }
}
