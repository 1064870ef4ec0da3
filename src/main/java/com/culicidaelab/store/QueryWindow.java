package com.culicidaelab.store;

import lombok.Value;

/**
 * Limit/offset window applied by the store after predicate evaluation.
 * A limit of zero or less means unbounded.
 */
@Value
public class QueryWindow {

    private static final QueryWindow UNBOUNDED = new QueryWindow(0, 0);

    int limit;
    int offset;

    public static QueryWindow of(int limit, int offset) {
        return new QueryWindow(limit, Math.max(0, offset));
    }

    public static QueryWindow limit(int limit) {
        return new QueryWindow(limit, 0);
    }

    public static QueryWindow unbounded() {
        return UNBOUNDED;
    }

    public boolean isBounded() {
        return limit > 0;
    }
}
