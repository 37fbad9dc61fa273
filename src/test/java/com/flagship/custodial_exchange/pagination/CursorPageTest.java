package com.flagship.custodial_exchange.pagination;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CursorPageTest {

    private final List<Long> sevenOrders = List.of(0L, 1L, 2L, 3L, 4L, 5L, 6L);

    @Test
    @DisplayName("Cursor 5, size 10 over 7 entries returns the last 2 and cursor 7")
    void testClampedTail() {
        CursorPage<Long> page = CursorPage.fetchPage(sevenOrders, 5, 10);

        assertEquals(List.of(5L, 6L), page.getItems());
        assertEquals(7, page.getNewCursor());
    }

    @Test
    @DisplayName("Cursor at or past the end yields an empty page with the cursor unchanged")
    void testExhausted() {
        CursorPage<Long> atEnd = CursorPage.fetchPage(sevenOrders, 7, 10);
        assertTrue(atEnd.getItems().isEmpty());
        assertEquals(7, atEnd.getNewCursor());

        CursorPage<Long> pastEnd = CursorPage.fetchPage(sevenOrders, 12, 3);
        assertTrue(pastEnd.getItems().isEmpty());
        assertEquals(12, pastEnd.getNewCursor());
    }

    @Test
    @DisplayName("Walking with the returned cursor visits every entry once, in insertion order")
    void testWalk() {
        long cursor = 0;
        List<Long> seen = new java.util.ArrayList<>();
        CursorPage<Long> page;
        do {
            page = CursorPage.fetchPage(sevenOrders, cursor, 3);
            seen.addAll(page.getItems());
            cursor = page.getNewCursor();
        } while (!page.getItems().isEmpty());

        assertEquals(sevenOrders, seen);
    }

    @Test
    @DisplayName("Page size 0 returns nothing and does not move the cursor")
    void testZeroSize() {
        CursorPage<Long> page = CursorPage.fetchPage(sevenOrders, 2, 0);
        assertTrue(page.getItems().isEmpty());
        assertEquals(2, page.getNewCursor());
    }

    @Test
    @DisplayName("Negative cursor or size is rejected")
    void testNegative() {
        assertThrows(IllegalArgumentException.class, () -> CursorPage.fetchPage(sevenOrders, -1, 3));
        assertThrows(IllegalArgumentException.class, () -> CursorPage.fetchPage(sevenOrders, 0, -3));
    }
}
