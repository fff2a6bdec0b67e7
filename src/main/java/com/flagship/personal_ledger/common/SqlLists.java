package com.flagship.personal_ledger.common;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers for binding collections and Postgres integer arrays through JdbcTemplate.
 */
public final class SqlLists {

    private SqlLists() {
        // Utility class
    }

    /**
     * Placeholder list for an IN clause, e.g. {@code ?, ?, ?}.
     */
    public static String placeholders(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("IN clause needs at least one value");
        }
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    /**
     * Leading arguments followed by the collection values, in binding order.
     */
    public static Object[] args(Collection<?> values, Object... leading) {
        List<Object> args = new ArrayList<>(leading.length + values.size());
        Collections.addAll(args, leading);
        args.addAll(values);
        return args.toArray();
    }

    /**
     * Postgres array literal bound with a {@code ?::integer[]} cast, or null for an absent set.
     */
    public static String intArrayLiteral(Collection<Integer> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.stream().map(String::valueOf).collect(Collectors.joining(",", "{", "}"));
    }
}
