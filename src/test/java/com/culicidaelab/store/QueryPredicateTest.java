package com.culicidaelab.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for in-memory predicate evaluation
 */
public class QueryPredicateTest {

    private Row row;

    @BeforeEach
    public void setUp() {
        row = Row.of(Map.of(
                "id", "aedes_aegypti",
                "scientific_name", "Aedes aegypti",
                "count", 3,
                "vector_status", "High",
                "vectors", List.of("dengue", "zika")));
    }

    @Test
    public void testEquals() {
        assertTrue(QueryPredicate.eq("id", "aedes_aegypti").matches(row));
        assertFalse(QueryPredicate.eq("id", "culex_pipiens").matches(row));
        assertFalse(QueryPredicate.eq("missing", "x").matches(row));
    }

    @Test
    public void testNumbersCompareByValue() {
        assertTrue(QueryPredicate.eq("count", 3.0).matches(row));
        assertTrue(QueryPredicate.notEq("count", 4L).matches(row));
    }

    @Test
    public void testInAndNotIn() {
        assertTrue(QueryPredicate.in("vector_status", List.of("High", "Medium")).matches(row));
        assertFalse(QueryPredicate.in("vector_status", List.of("None")).matches(row));
        assertTrue(QueryPredicate.notIn("vector_status", List.of("None", "Unknown")).matches(row));
        assertTrue(QueryPredicate.notIn("missing", List.of("None")).matches(row));
    }

    @Test
    public void testContainsIgnoreCase() {
        assertTrue(QueryPredicate.containsIgnoreCase("scientific_name", "AEGYPTI").matches(row));
        assertFalse(QueryPredicate.containsIgnoreCase("scientific_name", "culex").matches(row));
        assertFalse(QueryPredicate.containsIgnoreCase("missing", "a").matches(row));
    }

    @Test
    public void testArrayContains() {
        assertTrue(QueryPredicate.arrayContains("vectors", "zika").matches(row));
        assertFalse(QueryPredicate.arrayContains("vectors", "malaria").matches(row));
        assertFalse(QueryPredicate.arrayContains("id", "aedes_aegypti").matches(row));
    }

    @Test
    public void testExists() {
        assertTrue(QueryPredicate.exists("vector_status").matches(row));
        assertFalse(QueryPredicate.exists("missing").matches(row));
    }

    @Test
    public void testCompositeConditions() {
        QueryPredicate both = QueryPredicate.and(List.of(
                QueryPredicate.eq("id", "aedes_aegypti"),
                QueryPredicate.eq("vector_status", "Low")));
        assertFalse(both.matches(row));

        QueryPredicate either = QueryPredicate.or(List.of(
                QueryPredicate.eq("id", "culex_pipiens"),
                QueryPredicate.eq("vector_status", "High")));
        assertTrue(either.matches(row));
    }

    @Test
    public void testAllOfCollapses() {
        assertNull(QueryPredicate.allOf(List.of()));

        QueryPredicate single = QueryPredicate.eq("id", "x");
        assertSame(single, QueryPredicate.allOf(List.of(single)));

        QueryPredicate combined = QueryPredicate.allOf(List.of(single, QueryPredicate.exists("id")));
        assertTrue(combined.isComposite());
        assertEquals(QueryPredicate.LogicalOperator.AND, combined.getLogicalOperator());
    }
}
