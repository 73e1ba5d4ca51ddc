package me.christianrobert.detyper.transformer.context;

import me.christianrobert.detyper.term.Name;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.detyper.DetypingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class NamingContextTest {

    @Test
    void indicesCountFromInnermost() {
        // Given: a, _, c with c innermost
        NamingContext names = NamingContext.of(List.of(Name.of("a"), Name.ANONYMOUS, Name.of("c")));

        // Then
        assertEquals(Name.of("c"), names.lookup(1));
        assertEquals(Name.ANONYMOUS, names.lookup(2));
        assertEquals(Name.of("a"), names.lookup(3));
        assertNull(names.lookup(4));
        assertNull(names.lookup(0));
        assertEquals(3, names.indexOf("a"));
        assertEquals(2, names.indexOf(Name.ANONYMOUS));
        assertEquals(-1, names.indexOf("b"));
        assertEquals(List.of("c", "a"), names.identifiers());
    }

    @Test
    void definitionsKeepValueAndType() {
        // When
        NamingContext names = NamingContext.empty()
                .push(Name.of("n"), ind(NAT))
                .pushDefinition(Name.of("m"), rel(1), ind(NAT));

        // Then
        assertEquals(rel(1), names.lookupValue(1));
        assertNull(names.lookupValue(2));
        assertEquals(ind(NAT), names.lookupType(2));
        assertEquals(2, names.size());
        assertTrue(NamingContext.empty().isEmpty());
    }
}
