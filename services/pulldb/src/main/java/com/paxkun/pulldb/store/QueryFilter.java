package com.paxkun.pulldb.store;

import java.util.Objects;

/**
 * A single property condition. {@code EQ} against an array property matches when any element is equal.
 */
public record QueryFilter(String field, Operator operator, Object value) {

    public enum Operator {
        EQ,
        GT
    }

    public QueryFilter {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    public static QueryFilter eq(String field, Object value) {
        return new QueryFilter(field, Operator.EQ, value);
    }

    public static QueryFilter gt(String field, Object value) {
        return new QueryFilter(field, Operator.GT, value);
    }
}
