package com.company.consolidation.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsolidatedAlertIdsTest {

    @Test
    void shouldIgnoreMemberOrder() {
        assertEquals(ConsolidatedAlertIds.forMembers(List.of("a", "b", "c")),
                ConsolidatedAlertIds.forMembers(List.of("c", "a", "b")));
    }

    @Test
    void shouldDifferForDifferentMembers() {
        assertNotEquals(ConsolidatedAlertIds.forMembers(List.of("a", "b")),
                ConsolidatedAlertIds.forMembers(List.of("a", "c")));
    }

    @Test
    void shouldUsePrefixAndFixedLength() {
        String id = ConsolidatedAlertIds.forMembers(List.of("1", "2"));
        assertTrue(id.startsWith(ConsolidatedAlertIds.PREFIX));
        assertEquals(ConsolidatedAlertIds.PREFIX.length() + 16, id.length());
    }

    @Test
    void shouldRejectEmptyMembers() {
        assertThrows(IllegalArgumentException.class, () -> ConsolidatedAlertIds.forMembers(List.of()));
    }
}
