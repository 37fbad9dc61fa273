package com.flagship.custodial_exchange.pagination;

import lombok.Value;

import java.util.List;
import java.util.function.BiFunction;

/**
 * One page of an append-only index plus the cursor to continue from.
 *
 * Page length is {@code min(howMany, total - cursor)}; a cursor at or past the
 * end yields an empty page whose {@code newCursor} equals the cursor.
 */
@Value
public class CursorPage<T> {
    List<T> items;
    long newCursor;

    /**
     * Slices an in-memory index.
     */
    public static <T> CursorPage<T> fetchPage(List<T> source, long cursor, int howMany) {
        return fetchPage(source.size(), cursor, howMany,
            (start, length) -> source.subList(start.intValue(), start.intValue() + length));
    }

    /**
     * Slices an index of {@code total} entries through {@code loader}, which
     * receives the start position and the clamped length.
     */
    public static <T> CursorPage<T> fetchPage(long total, long cursor, int howMany,
                                              BiFunction<Long, Integer, List<T>> loader) {
        if (cursor < 0) {
            throw new IllegalArgumentException("Cursor must not be negative: " + cursor);
        }
        if (howMany < 0) {
            throw new IllegalArgumentException("Page size must not be negative: " + howMany);
        }
        if (cursor >= total) {
            return new CursorPage<>(List.of(), cursor);
        }

        int length = (int) Math.min(howMany, total - cursor);
        if (length == 0) {
            return new CursorPage<>(List.of(), cursor);
        }
        List<T> items = List.copyOf(loader.apply(cursor, length));
        return new CursorPage<>(items, cursor + length);
    }
}
