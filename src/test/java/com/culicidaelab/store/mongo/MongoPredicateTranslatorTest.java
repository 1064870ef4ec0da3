package com.culicidaelab.store.mongo;

import com.culicidaelab.store.QueryPredicate;
import com.mongodb.MongoClientSettings;
import org.bson.BsonDocument;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MongoPredicateTranslatorTest {

    @Test
    public void testNullPredicateMatchesAll() {
        assertEquals(new BsonDocument(), render(MongoPredicateTranslator.toFilter(null)));
    }

    @Test
    public void testEquality() {
        BsonDocument filter = render(MongoPredicateTranslator.toFilter(
                QueryPredicate.eq("species_scientific_name", "Aedes aegypti")));

        assertEquals(BsonDocument.parse("{\"species_scientific_name\": \"Aedes aegypti\"}"), filter);
    }

    @Test
    public void testInAndNotIn() {
        assertEquals(BsonDocument.parse("{\"id\": {\"$in\": [\"a\", \"b\"]}}"),
                render(MongoPredicateTranslator.toFilter(QueryPredicate.in("id", List.of("a", "b")))));
        assertEquals(BsonDocument.parse("{\"vector_status\": {\"$nin\": [\"None\", \"Unknown\"]}}"),
                render(MongoPredicateTranslator.toFilter(
                        QueryPredicate.notIn("vector_status", List.of("None", "Unknown")))));
    }

    @Test
    public void testOrOfConditions() {
        QueryPredicate predicate = QueryPredicate.or(List.of(
                QueryPredicate.eq("observer_id", "u1"),
                QueryPredicate.eq("user_id", "u1")));

        assertEquals(BsonDocument.parse("{\"$or\": [{\"observer_id\": \"u1\"}, {\"user_id\": \"u1\"}]}"),
                render(MongoPredicateTranslator.toFilter(predicate)));
    }

    @Test
    public void testContainsIsQuotedCaseInsensitiveRegex() {
        BsonDocument filter = render(MongoPredicateTranslator.toFilter(
                QueryPredicate.containsIgnoreCase("common_name_en", "a.b")));

        assertTrue(filter.get("common_name_en").isRegularExpression());
        assertEquals("i", filter.get("common_name_en").asRegularExpression().getOptions());
        assertEquals("\\Qa.b\\E", filter.get("common_name_en").asRegularExpression().getPattern());
    }

    @Test
    public void testExistsExcludesNull() {
        String json = render(MongoPredicateTranslator.toFilter(QueryPredicate.exists("vector_status"))).toJson();

        assertTrue(json.contains("$exists"));
        assertTrue(json.contains("$ne"));
    }

    private static BsonDocument render(Bson filter) {
        return filter.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
    }
}
