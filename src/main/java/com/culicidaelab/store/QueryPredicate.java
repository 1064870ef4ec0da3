package com.culicidaelab.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Predicate pushed down into a {@link TableHandle} query.
 * Supports the comparison operators every store backend can evaluate natively,
 * combined with AND/OR.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryPredicate {

    public enum Operator {
        EQUALS,                // ==
        NOT_EQUALS,            // !=
        IN,                    // in (list)
        NOT_IN,                // not in (list)
        CONTAINS_IGNORE_CASE,  // case-insensitive substring
        ARRAY_CONTAINS,        // list field holds value
        EXISTS                 // field present and not null
    }

    public enum LogicalOperator {
        AND,
        OR
    }

    private String field;
    private Operator operator;
    private Object value;
    private List<Object> values;

    private List<QueryPredicate> conditions;
    private LogicalOperator logicalOperator;

    public boolean isComposite() {
        return conditions != null && !conditions.isEmpty();
    }

    /**
     * Check if a row matches this predicate
     */
    public boolean matches(Row row) {
        if (row == null) {
            return false;
        }
        if (isComposite()) {
            if (logicalOperator == LogicalOperator.OR) {
                return conditions.stream().anyMatch(condition -> condition.matches(row));
            }
            return conditions.stream().allMatch(condition -> condition.matches(row));
        }
        return evaluateSimpleCondition(row);
    }

    private boolean evaluateSimpleCondition(Row row) {
        Object actualValue = row.get(field);

        switch (operator) {
            case EXISTS:
                return actualValue != null;

            case EQUALS:
                return valuesEqual(actualValue, value);

            case NOT_EQUALS:
                return !valuesEqual(actualValue, value);

            case IN:
                return values != null && values.stream().anyMatch(v -> valuesEqual(actualValue, v));

            case NOT_IN:
                return values == null || values.stream().noneMatch(v -> valuesEqual(actualValue, v));

            case CONTAINS_IGNORE_CASE:
                return actualValue != null && value != null
                        && actualValue.toString().toLowerCase(Locale.ROOT)
                                .contains(value.toString().toLowerCase(Locale.ROOT));

            case ARRAY_CONTAINS:
                return actualValue instanceof Collection
                        && ((Collection<?>) actualValue).stream().anyMatch(item -> valuesEqual(item, value));

            default:
                return false;
        }
    }

    private static boolean valuesEqual(Object a, Object b) {
        if (a == null && b == null) return true;
        if (a == null || b == null) return false;

        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue()) == 0;
        }

        return a.toString().equals(b.toString());
    }

    // Factory helpers

    public static QueryPredicate eq(String field, Object value) {
        return QueryPredicate.builder()
                .field(field)
                .operator(Operator.EQUALS)
                .value(value)
                .build();
    }

    public static QueryPredicate notEq(String field, Object value) {
        return QueryPredicate.builder()
                .field(field)
                .operator(Operator.NOT_EQUALS)
                .value(value)
                .build();
    }

    public static QueryPredicate in(String field, Collection<?> values) {
        return QueryPredicate.builder()
                .field(field)
                .operator(Operator.IN)
                .values(List.copyOf(values))
                .build();
    }

    public static QueryPredicate notIn(String field, Collection<?> values) {
        return QueryPredicate.builder()
                .field(field)
                .operator(Operator.NOT_IN)
                .values(List.copyOf(values))
                .build();
    }

    public static QueryPredicate containsIgnoreCase(String field, String fragment) {
        return QueryPredicate.builder()
                .field(field)
                .operator(Operator.CONTAINS_IGNORE_CASE)
                .value(fragment)
                .build();
    }

    public static QueryPredicate arrayContains(String field, Object value) {
        return QueryPredicate.builder()
                .field(field)
                .operator(Operator.ARRAY_CONTAINS)
                .value(value)
                .build();
    }

    public static QueryPredicate exists(String field) {
        return QueryPredicate.builder()
                .field(field)
                .operator(Operator.EXISTS)
                .build();
    }

    public static QueryPredicate and(List<QueryPredicate> conditions) {
        return QueryPredicate.builder()
                .conditions(List.copyOf(conditions))
                .logicalOperator(LogicalOperator.AND)
                .build();
    }

    public static QueryPredicate or(List<QueryPredicate> conditions) {
        return QueryPredicate.builder()
                .conditions(List.copyOf(conditions))
                .logicalOperator(LogicalOperator.OR)
                .build();
    }

    /**
     * AND of the given conditions, collapsing to the single condition or null
     */
    public static QueryPredicate allOf(List<QueryPredicate> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return null;
        }
        if (conditions.size() == 1) {
            return conditions.get(0);
        }
        return and(conditions);
    }
}
