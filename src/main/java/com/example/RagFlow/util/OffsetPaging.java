package com.example.RagFlow.util;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.function.Function;

/**
 * skip/limit windows over Spring Data repositories.
 * Pageable only addresses whole pages, so the query is asked for the first skip + limit rows
 * and the head is dropped here.
 */
public final class OffsetPaging {

    public static final int DEFAULT_LIMIT = 100;

    private OffsetPaging() {
    }

    public static <T> List<T> slice(int skip, int limit, Sort sort, Function<Pageable, List<T>> query) {
        int size = limit <= 0 ? DEFAULT_LIMIT : limit;
        int offset = Math.max(0, skip);
        int window = (int) Math.min(Integer.MAX_VALUE, (long) offset + size);
        List<T> rows = query.apply(PageRequest.of(0, window, sort));
        if (offset >= rows.size()) {
            return List.of();
        }
        return rows.subList(offset, Math.min(rows.size(), offset + size));
    }
}
