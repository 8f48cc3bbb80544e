package com.treasurylens.domain;

import java.util.List;

/**
 * Cursor page from the indexer. endCursor is null on the last page.
 */
public record Page<T>(List<T> items, boolean hasNextPage, String endCursor) {

    public Page {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static <T> Page<T> empty() {
        return new Page<>(List.of(), false, null);
    }
}
