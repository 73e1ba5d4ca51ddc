package me.christianrobert.detyper.transformer.service;

import me.christianrobert.detyper.config.service.ConfigService;
import me.christianrobert.detyper.surface.CasesClause;
import me.christianrobert.detyper.surface.DelayedSurfaceTerm;
import me.christianrobert.detyper.surface.GLambda;
import me.christianrobert.detyper.surface.GRef;
import me.christianrobert.detyper.surface.GSort;
import me.christianrobert.detyper.surface.GlobalReference;
import me.christianrobert.detyper.surface.PatVar;
import me.christianrobert.detyper.surface.Pattern;
import me.christianrobert.detyper.surface.SurfaceBinder;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.Const;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.RelDeclaration;
import me.christianrobert.detyper.term.Sort;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Var;
import me.christianrobert.detyper.transformer.builder.SurfaceTermBuilder;
import me.christianrobert.detyper.transformer.env.GlobalIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static me.christianrobert.detyper.DetypingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DetypingService covering local contexts, delayed translation,
 * telescopes and the goal lookups.
 */
class DetypingServiceTest {

    private ConfigService configService;
    private DetypingService service;
    private GlobalIndex environment;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        service = new DetypingService(configService);
        environment = environment();
    }

    @Test
    void binderIsRenamedAwayFromLocalContext() {
        // Given: x : nat |- fun x => add x x(outer)
        List<RelDeclaration> context = List.of(RelDeclaration.assumption(Name.of("x"), ind(NAT)));
        Term term = lam("x", ind(NAT), app(new Const("Top.add"), rel(1), rel(2)));

        // When
        SurfaceTerm result = service.detype(term, context, environment, null, null, false, Set.of(), false);

        // Then
        SurfaceTerm expected = new GLambda(Name.of("x0"), gInd(NAT),
                gApp(new GRef(GlobalReference.ofConstant("Top.add")), gVar("x0"), gVar("x")));
        assertEquals(expected, result);
    }

    @Test
    void unboundIndexBecomesPlaceholder() {
        // Given
        List<RelDeclaration> context = List.of(
                RelDeclaration.assumption(Name.of("a"), ind(NAT)),
                RelDeclaration.assumption(Name.of("b"), ind(NAT)));

        // When
        SurfaceTerm result = service.detype(rel(3), context, environment, null, null, false, Set.of(), false);

        // Then
        assertEquals(gVar(SurfaceTermBuilder.UNBOUND_REL_PREFIX + "3"), result);
    }

    @Test
    void avoidSetIsHonoured() {
        // When
        SurfaceTerm result = service.detype(lam("y", ind(NAT), rel(1)), List.of(), environment,
                null, null, false, Set.of("y"), false);

        // Then
        assertEquals(new GLambda(Name.of("y0"), gInd(NAT), gVar("y0")), result);
    }

    @Test
    void delayedTermIsComputedOnceOnDemand() {
        // Given
        DelayedSurfaceTerm delayed = service.detypeLater(lam("n", ind(NAT), rel(1)), List.of(), environment,
                null, null, false, Set.of(), false);

        // Then
        assertFalse(delayed.isForced());
        SurfaceTerm first = delayed.force();
        assertTrue(delayed.isForced());
        assertSame(first, delayed.force());
        assertEquals(new GLambda(Name.of("n"), gInd(NAT), gVar("n")), first);
    }

    @Test
    void delayedTermUsesSettingsFromCreationTime() {
        // Given: fast naming is switched on only after the delayed term exists
        DelayedSurfaceTerm delayed = service.detypeLater(lam(null, ind(NAT), ind(NAT)), List.of(), environment,
                null, null, false, Set.of(), false);
        configService.setConfigValue(ConfigService.FAST_NAME_GENERATION, true);

        // When
        SurfaceTerm result = delayed.force();

        // Then: precise naming keeps the unused binder anonymous
        assertEquals(new GLambda(Name.ANONYMOUS, gInd(NAT), gInd(NAT)), result);
    }

    @Test
    void telescopeNamesFollowUsage() {
        // Given: [A : Set, a : A] under a body mentioning a
        List<RelDeclaration> telescope = List.of(
                RelDeclaration.assumption(Name.of("A"), Sort.SET),
                RelDeclaration.assumption(Name.of("a"), rel(1)));

        // When
        List<SurfaceBinder> binders = service.detypeRelContext(rel(1), telescope, environment, null,
                Set.of(), false);

        // Then
        assertEquals(List.of(
                SurfaceBinder.assumption(Name.of("A"), GSort.SET),
                SurfaceBinder.assumption(Name.of("a"), gVar("A"))), binders);
    }

    @Test
    void telescopeDropsNamesTheBodyDoesNotNeed() {
        // Given
        List<RelDeclaration> telescope = List.of(
                RelDeclaration.assumption(Name.of("A"), Sort.SET),
                RelDeclaration.assumption(Name.of("a"), rel(1)));

        // When
        List<SurfaceBinder> binders = service.detypeRelContext(ind(NAT), telescope, environment, null,
                Set.of(), false);

        // Then
        assertEquals(Name.of("A"), binders.get(0).getName());
        assertEquals(Name.ANONYMOUS, binders.get(1).getName());
        assertEquals(gVar("A"), binders.get(1).getType());
    }

    @Test
    void telescopeWithoutBodyKeepsDeclaredNames() {
        // Given
        List<RelDeclaration> telescope = List.of(
                RelDeclaration.assumption(Name.of("x"), ind(NAT)),
                RelDeclaration.assumption(Name.ANONYMOUS, ind(NAT)));

        // When
        List<SurfaceBinder> binders = service.detypeRelContext(null, telescope, environment, null,
                Set.of("x"), false);

        // Then
        assertEquals(Name.of("x"), binders.get(0).getName());
        assertEquals(Name.ANONYMOUS, binders.get(1).getName());
        assertEquals(gInd(NAT), binders.get(1).getType());
    }

    @Test
    void factorizeFollowsCurrentSettings() {
        // Given
        List<CasesClause> clauses = List.of(
                CasesClause.single(List.of(), List.<Pattern>of(new PatVar(Name.of("a"))), gVar("r")),
                CasesClause.single(List.of(), List.<Pattern>of(new PatVar(Name.of("b"))), gVar("r")));
        configService.setConfigValue(ConfigService.ALLOW_MATCH_DEFAULT_CLAUSE, false);

        // When
        List<CasesClause> result = service.factorize(clauses);

        // Then
        assertEquals(1, result.size());
        assertEquals(2, result.get(0).getRows().size());
    }

    @Test
    void nameAsDisplayedFindsProductPosition() {
        // Given: forall n : nat, P n -> forall m : nat, Q m n
        Term type = goalType();

        // Then
        assertEquals(Optional.of(1), service.lookupNameAsDisplayed(environment, Set.of(), type, "n"));
        assertEquals(Optional.of(3), service.lookupNameAsDisplayed(environment, Set.of(), type, "m"));
        assertEquals(Optional.empty(), service.lookupNameAsDisplayed(environment, Set.of(), type, "z"));
    }

    @Test
    void nameAsDisplayedSeesRenamedBinder() {
        // When: n is already taken by the named context
        Optional<Integer> position = service.lookupNameAsDisplayed(environment, Set.of("n"), goalType(), "n0");

        // Then
        assertEquals(Optional.of(1), position);
    }

    @Test
    void indexAsRenamedCountsArrows() {
        // Given
        Term type = goalType();

        // Then
        assertEquals(Optional.of(2), service.lookupIndexAsRenamed(environment, type, 1));
        assertEquals(Optional.of(1), service.lookupIndexAsRenamed(environment, type, 0));
        assertEquals(Optional.empty(), service.lookupIndexAsRenamed(environment, type, 2));
    }

    @Test
    void nullArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.detype(null, environment));
        assertThrows(IllegalArgumentException.class, () -> service.detype(ind(NAT), null));
        assertThrows(IllegalArgumentException.class, () ->
                service.detype(ind(NAT), List.of(), environment, null, null, false, null, false));
        assertThrows(IllegalArgumentException.class, () -> service.factorize(null));
    }

    @Test
    void worksWithoutConfigurationService() {
        // Given
        DetypingService standalone = new DetypingService();

        // When
        SurfaceTerm result = standalone.detype(lam("n", ind(NAT), rel(1)), environment);

        // Then
        assertEquals(new GLambda(Name.of("n"), gInd(NAT), gVar("n")), result);
    }

    private static Term goalType() {
        return prod("n", ind(NAT),
                prod(null, app(new Var("P"), rel(1)),
                        prod("m", ind(NAT), app(new Var("Q"), rel(1), rel(3)))));
    }
}
