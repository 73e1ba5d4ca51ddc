package me.christianrobert.detyper.surface;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DelayedSurfaceTermTest {

    @Test
    void supplierRunsOnlyOnce() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        DelayedSurfaceTerm delayed = new DelayedSurfaceTerm(() -> {
            calls.incrementAndGet();
            return new GVar("x");
        });

        // When
        SurfaceTerm first = delayed.force();
        SurfaceTerm second = delayed.force();

        // Then
        assertSame(first, second);
        assertEquals(1, calls.get());
    }

    @Test
    void readyTermIsAlreadyForced() {
        DelayedSurfaceTerm delayed = DelayedSurfaceTerm.ready(new GVar("y"));

        assertTrue(delayed.isForced());
        assertEquals("Delayed[y]", delayed.toString());
    }

    @Test
    void pendingTermPrintsPlaceholder() {
        assertEquals("Delayed[<pending>]", new DelayedSurfaceTerm(() -> new GVar("z")).toString());
    }
}
