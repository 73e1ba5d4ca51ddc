package me.christianrobert.detyper.transformer.builder;

import me.christianrobert.detyper.surface.CasesClause;
import me.christianrobert.detyper.surface.CasesScrutinee;
import me.christianrobert.detyper.surface.GCases;
import me.christianrobert.detyper.surface.GIf;
import me.christianrobert.detyper.surface.GLetTuple;
import me.christianrobert.detyper.surface.PatCstr;
import me.christianrobert.detyper.surface.PatVar;
import me.christianrobert.detyper.surface.Pattern;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.Case;
import me.christianrobert.detyper.term.CaseInfo;
import me.christianrobert.detyper.term.CaseStyle;
import me.christianrobert.detyper.term.InductiveRef;
import me.christianrobert.detyper.term.LetIn;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Var;
import me.christianrobert.detyper.transformer.context.DisplayOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static me.christianrobert.detyper.DetypingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for case translation: notation choice, return clauses, case-tree
 * reconstruction and clause factorization.
 */
class VisitCaseTest {

    private DisplayOptions options;

    @BeforeEach
    void setUp() {
        options = DisplayOptions.defaults();
    }

    private static Term constantMotive(InductiveRef inductive, Term result) {
        return lam(null, ind(inductive), result);
    }

    private static Term one() {
        return app(cstr(NAT, 2), cstr(NAT, 1));
    }

    private static SurfaceTerm gOne() {
        return gApp(gCstr(NAT, 2), gCstr(NAT, 1));
    }

    private static PatCstr pat(InductiveRef inductive, int number, Pattern... args) {
        return new PatCstr(inductive.constructor(number), List.of(args), Name.ANONYMOUS);
    }

    private static PatVar patVar(String id) {
        return new PatVar(Name.of(id));
    }

    // ========== Notation ==========

    @Test
    void ifNotationForRegisteredTwoConstructorType() {
        // Given: match b with true => O | false => S O end
        Case term = new Case(CaseInfo.regular(BOOL, 0, 0), constantMotive(BOOL, ind(NAT)), new Var("b"),
                List.of(cstr(NAT, 1), one()));
        DisplayOptions ifStyle = options.toBuilder().ifStyleInductives(Set.of(BOOL)).build();

        // When
        SurfaceTerm result = build(ifStyle, term);

        // Then
        assertEquals(new GIf(gVar("b"), Name.ANONYMOUS, null, gCstr(NAT, 1), gOne()), result);
    }

    @Test
    void ifNotationFallsBackWhenBranchUsesItsArgument() {
        // Given: match e with left x => x | right _ => O end, displayed with if notation
        CaseInfo info = CaseInfo.regular(EITHER, 1, 1);
        Case term = new Case(info, constantMotive(EITHER, ind(NAT)), new Var("e"),
                List.of(lam("x", ind(NAT), rel(1)), lam("y", ind(NAT), cstr(NAT, 1))));
        DisplayOptions ifStyle = options.toBuilder().ifStyleInductives(Set.of(EITHER)).build();

        // When
        SurfaceTerm result = build(ifStyle, term);

        // Then
        assertTrue(result instanceof GCases);
        GCases cases = (GCases) result;
        assertEquals(CaseStyle.REGULAR, cases.getStyle());
        assertEquals(2, cases.getClauses().size());
        assertEquals(List.of(List.of(pat(EITHER, 1, patVar("x")))), cases.getClauses().get(0).getRows());
        assertEquals(List.of(List.of(pat(EITHER, 2, PatVar.WILDCARD))), cases.getClauses().get(1).getRows());
    }

    @Test
    void rawModeNeverUsesSugar() {
        // Given
        Case term = new Case(CaseInfo.regular(BOOL, 0, 0), constantMotive(BOOL, ind(NAT)), new Var("b"),
                List.of(cstr(NAT, 1), one()));
        DisplayOptions raw = options.toBuilder().raw(true).ifStyleInductives(Set.of(BOOL)).build();

        // When
        SurfaceTerm result = build(raw, term);

        // Then
        assertTrue(result instanceof GCases);
        assertEquals(CaseStyle.REGULAR, ((GCases) result).getStyle());
        assertNotNull(((GCases) result).getReturnType());
    }

    @Test
    void letTupleForRegisteredSingleConstructorType() {
        // Given: match p with pair a b => f a b end
        CaseInfo info = CaseInfo.regular(PAIR, 2);
        Term branch = lam("a", ind(NAT), lam("b", ind(NAT), app(new Var("f"), rel(2), rel(1))));
        Case term = new Case(info, constantMotive(PAIR, ind(NAT)), new Var("p"), List.of(branch));
        DisplayOptions letStyle = options.toBuilder().letStyleInductives(Set.of(PAIR)).build();

        // When
        SurfaceTerm result = build(letStyle, term);

        // Then
        assertEquals(new GLetTuple(List.of(Name.of("a"), Name.of("b")), Name.ANONYMOUS, null, gVar("p"),
                gApp(gVar("f"), gVar("a"), gVar("b"))), result);
    }

    // ========== Return clause ==========

    @Test
    void dependentMotiveIsShownWithAlias() {
        // Given: match b as x return P x with true => t | false => u end
        Term motive = lam("x", ind(BOOL), app(new Var("P"), rel(1)));
        Case term = new Case(CaseInfo.regular(BOOL, 0, 0), motive, new Var("b"),
                List.of(new Var("t"), new Var("u")));

        // When
        SurfaceTerm result = build(options, term);

        // Then
        GCases cases = (GCases) result;
        assertEquals(gApp(gVar("P"), gVar("x")), cases.getReturnType());
        assertEquals(List.of(new CasesScrutinee(gVar("b"), Name.of("x"), null, List.of())),
                cases.getScrutinees());
    }

    @Test
    void returnClauseShownWhenSynthesisIsOff() {
        // Given
        Case term = new Case(CaseInfo.regular(BOOL, 0, 0), constantMotive(BOOL, ind(NAT)), new Var("b"),
                List.of(cstr(NAT, 1), one()));

        // When
        SurfaceTerm result = build(options.toBuilder().synthesizeReturnType(false).build(), term);

        // Then
        GCases cases = (GCases) result;
        assertEquals(gInd(NAT), cases.getReturnType());
        assertEquals(Name.ANONYMOUS, cases.getScrutinees().get(0).getAlias());
        assertFalse(cases.getScrutinees().get(0).hasInClause());
    }

    @Test
    void outOfRangeReferenceInMotiveBecomesPlaceholder() {
        // Given: a return clause mentioning a de Bruijn index past the motive's binder
        Case term = new Case(CaseInfo.regular(BOOL, 0, 0), lam("x", ind(BOOL), app(new Var("P"), rel(4))),
                new Var("b"), List.of(cstr(NAT, 1), one()));

        // When
        GCases cases = (GCases) build(options.toBuilder().synthesizeReturnType(false).build(), term);

        // Then
        assertEquals(gApp(gVar("P"), gVar("_UNBOUND_REL_4")), cases.getReturnType());
    }

    @Test
    void emptyMatchShowsReturnClause() {
        // Given: match v with end
        Case term = new Case(new CaseInfo(InductiveRef.of("Top.empty"), CaseStyle.REGULAR, List.of(), List.of()),
                lam(null, ind(InductiveRef.of("Top.empty")), ind(NAT)), new Var("v"), List.of());

        // When
        GCases cases = (GCases) build(options, term);

        // Then
        assertEquals(gInd(NAT), cases.getReturnType());
        assertTrue(cases.getClauses().isEmpty());
    }

    // ========== Clauses ==========

    @Test
    void binderNamesKeepTheirPositionsWithLetSlots() {
        // Given: a constructor with argument tags [false, true, false]
        InductiveRef triple = InductiveRef.of("Top.triple");
        CaseInfo info = new CaseInfo(triple, CaseStyle.REGULAR,
                List.of(List.of(false, true, false)), List.of());
        Term branch = lam("a", ind(NAT),
                new LetIn(Name.of("b"), cstr(NAT, 1), ind(NAT),
                        lam("c", ind(NAT), app(new Var("f"), rel(3), rel(2), rel(1)))));
        Case term = new Case(info, constantMotive(triple, ind(NAT)), new Var("t"), List.of(branch));

        // When
        GCases cases = (GCases) build(options, term);

        // Then
        CasesClause clause = cases.getClauses().get(0);
        assertEquals(List.of("a", "b", "c"), clause.getIds());
        assertEquals(List.of(List.of(pat(triple, 1, patVar("a"), patVar("b"), patVar("c")))), clause.getRows());
        assertEquals(gApp(gVar("f"), gVar("a"), gVar("b"), gVar("c")), clause.getRhs());
    }

    @Test
    void letSlotIsPlainVariableWithoutReverseMatching() {
        // Given: a constructor with argument tags [false, true, false], whose let slot b := O
        InductiveRef triple = InductiveRef.of("Top.triple");
        CaseInfo info = new CaseInfo(triple, CaseStyle.REGULAR,
                List.of(List.of(false, true, false)), List.of());
        Term branch = lam("a", ind(NAT),
                new LetIn(Name.of("b"), cstr(NAT, 1), ind(NAT),
                        lam("c", ind(NAT), app(new Var("f"), rel(3), rel(2), rel(1)))));
        Case term = new Case(info, constantMotive(triple, ind(NAT)), new Var("t"), List.of(branch));

        // When
        GCases cases = (GCases) build(options.toBuilder().reverseMatching(false).build(), term);

        // Then: the value O appears nowhere, b is an ordinary pattern variable
        CasesClause clause = cases.getClauses().get(0);
        assertEquals(List.of(List.of(pat(triple, 1, patVar("a"), patVar("b"), patVar("c")))), clause.getRows());
        assertEquals(gApp(gVar("f"), gVar("a"), gVar("b"), gVar("c")), clause.getRhs());
    }

    @Test
    void nestedCaseIsRebuiltIntoDeepPatterns() {
        // Given: match l with nil => O | cons x tl => match tl with nil => S O | cons y r => y end end
        CaseInfo info = CaseInfo.regular(LIST, 0, 2);
        Term listOfNat = app(ind(LIST), ind(NAT));
        Term inner = new Case(info, lam(null, listOfNat, ind(NAT)), rel(1),
                List.of(one(), lam("y", ind(NAT), lam("r", listOfNat, rel(2)))));
        Term outer = new Case(info, lam(null, listOfNat, ind(NAT)), new Var("l"),
                List.of(cstr(NAT, 1), lam("x", ind(NAT), lam("tl", listOfNat, inner))));

        // When
        GCases cases = (GCases) build(options, outer);

        // Then
        List<CasesClause> clauses = cases.getClauses();
        assertEquals(3, clauses.size());
        assertEquals(List.of(List.of(pat(LIST, 1))), clauses.get(0).getRows());
        assertEquals(List.of(List.of(pat(LIST, 2, PatVar.WILDCARD, pat(LIST, 1)))), clauses.get(1).getRows());
        assertEquals(gOne(), clauses.get(1).getRhs());
        assertEquals(List.of(List.of(pat(LIST, 2, PatVar.WILDCARD, pat(LIST, 2, patVar("y"), PatVar.WILDCARD)))),
                clauses.get(2).getRows());
        assertEquals(List.of("y"), clauses.get(2).getIds());
        assertEquals(gVar("y"), clauses.get(2).getRhs());
    }

    @Test
    void outOfRangeReferenceInRebuiltBranchBecomesPlaceholder() {
        // Given: the deepest right-hand side refers past its four binders x, tl, y, r
        CaseInfo info = CaseInfo.regular(LIST, 0, 2);
        Term listOfNat = app(ind(LIST), ind(NAT));
        Term inner = new Case(info, lam(null, listOfNat, ind(NAT)), rel(1),
                List.of(one(), lam("y", ind(NAT), lam("r", listOfNat, app(rel(2), rel(9))))));
        Term outer = new Case(info, lam(null, listOfNat, ind(NAT)), new Var("l"),
                List.of(cstr(NAT, 1), lam("x", ind(NAT), lam("tl", listOfNat, inner))));

        // When
        GCases cases = (GCases) build(options, outer);

        // Then
        assertEquals(3, cases.getClauses().size());
        assertEquals(gApp(gVar("y"), gVar("_UNBOUND_REL_9")), cases.getClauses().get(2).getRhs());
    }

    @Test
    void outOfRangeReferenceInPlainBranchBecomesPlaceholder() {
        // Given: match n with O => #3 | S m => m end, at top level
        Case term = new Case(CaseInfo.regular(NAT, 0, 1), constantMotive(NAT, ind(NAT)), new Var("n"),
                List.of(rel(3), lam("m", ind(NAT), rel(1))));

        // When
        GCases cases = (GCases) build(options, term);

        // Then
        assertEquals(gVar("_UNBOUND_REL_3"), cases.getClauses().get(0).getRhs());
        assertEquals(gVar("m"), cases.getClauses().get(1).getRhs());
    }

    @Test
    void nestedCaseStaysNestedWithoutReverseMatching() {
        // Given
        CaseInfo info = CaseInfo.regular(LIST, 0, 2);
        Term listOfNat = app(ind(LIST), ind(NAT));
        Term inner = new Case(info, lam(null, listOfNat, ind(NAT)), rel(1),
                List.of(one(), lam("y", ind(NAT), lam("r", listOfNat, rel(2)))));
        Term outer = new Case(info, lam(null, listOfNat, ind(NAT)), new Var("l"),
                List.of(cstr(NAT, 1), lam("x", ind(NAT), lam("tl", listOfNat, inner))));

        // When
        GCases cases = (GCases) build(options.toBuilder().reverseMatching(false).build(), outer);

        // Then
        assertEquals(2, cases.getClauses().size());
        assertEquals(List.of(List.of(pat(LIST, 2, PatVar.WILDCARD, patVar("tl")))),
                cases.getClauses().get(1).getRows());
        assertTrue(cases.getClauses().get(1).getRhs() instanceof GCases);
    }

    @Test
    void equalBranchesArePromotedToDefaultClause() {
        // Given: match c with red => O | green => S O | blue => S O end
        Case term = new Case(CaseInfo.regular(COLOR, 0, 0, 0), constantMotive(COLOR, ind(NAT)), new Var("c"),
                List.of(cstr(NAT, 1), one(), one()));

        // When
        GCases cases = (GCases) build(options, term);

        // Then
        assertEquals(2, cases.getClauses().size());
        assertEquals(List.of(List.of(pat(COLOR, 1))), cases.getClauses().get(0).getRows());
        assertEquals(List.of(List.<Pattern>of(PatVar.WILDCARD)), cases.getClauses().get(1).getRows());
        assertEquals(gOne(), cases.getClauses().get(1).getRhs());
    }

    @Test
    void singleMergedClauseKeepsOneConstructorVisible() {
        // Given: every branch is O
        Case term = new Case(CaseInfo.regular(COLOR, 0, 0, 0), constantMotive(COLOR, ind(NAT)), new Var("c"),
                List.of(cstr(NAT, 1), cstr(NAT, 1), cstr(NAT, 1)));

        // When
        GCases cases = (GCases) build(options, term);

        // Then
        assertEquals(1, cases.getClauses().size());
        assertEquals(List.of(List.<Pattern>of(pat(COLOR, 1)), List.<Pattern>of(PatVar.WILDCARD)),
                cases.getClauses().get(0).getRows());
    }

    @Test
    void factorizationCanBeDisabled() {
        // Given
        Case term = new Case(CaseInfo.regular(COLOR, 0, 0, 0), constantMotive(COLOR, ind(NAT)), new Var("c"),
                List.of(cstr(NAT, 1), one(), one()));

        // When
        GCases cases = (GCases) build(options.toBuilder().factorizeMatchPatterns(false).build(), term);

        // Then
        assertEquals(3, cases.getClauses().size());
    }

    @Test
    void etaContractedBranchIsExpanded() {
        // Given: match e with left => f | right y => O end, where the left branch is just f
        CaseInfo info = CaseInfo.regular(EITHER, 1, 1);
        Case term = new Case(info, constantMotive(EITHER, ind(NAT)), new Var("e"),
                List.of(new Var("f"), lam("y", ind(NAT), cstr(NAT, 1))));

        // When
        GCases cases = (GCases) build(options, term);

        // Then
        CasesClause first = cases.getClauses().get(0);
        assertEquals(List.of(List.of(pat(EITHER, 1, patVar("x")))), first.getRows());
        assertEquals(gApp(gVar("f"), gVar("x")), first.getRhs());
    }

    @Test
    void computableMotiveDetection() {
        assertTrue(VisitCase.isComputable(lam(null, ind(BOOL), ind(NAT)), 0));
        assertFalse(VisitCase.isComputable(lam("x", ind(BOOL), app(new Var("P"), rel(1))), 0));
        assertFalse(VisitCase.isComputable(ind(NAT), 0));
    }
}
