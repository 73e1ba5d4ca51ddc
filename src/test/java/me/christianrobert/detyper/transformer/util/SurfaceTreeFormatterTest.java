package me.christianrobert.detyper.transformer.util;

import me.christianrobert.detyper.surface.GLambda;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.Name;
import org.junit.jupiter.api.Test;

import static me.christianrobert.detyper.DetypingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SurfaceTreeFormatterTest {

    @Test
    void nullTree() {
        assertEquals("(null tree)", SurfaceTreeFormatter.format(null));
    }

    @Test
    void binderPrintsTypeThenBody() {
        // Given
        SurfaceTerm term = new GLambda(Name.of("n"), gInd(NAT), gApp(gVar("f"), gVar("n")));

        // When
        String text = SurfaceTreeFormatter.format(term);

        // Then
        assertEquals("LAMBDA n\n"
                + "  type: Coq.Init.Datatypes.nat\n"
                + "  APP\n"
                + "    f\n"
                + "    n\n", text);
    }

    @Test
    void longLeavesAreTruncated() {
        // Given
        String id = "x".repeat(80);

        // When
        String text = SurfaceTreeFormatter.format(gVar(id));

        // Then
        assertEquals("x".repeat(50) + "...\n", text);
    }
}
