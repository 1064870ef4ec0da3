package com.culicidaelab.store.mongo;

import com.culicidaelab.store.QueryPredicate;
import com.mongodb.client.model.Filters;
import org.bson.conversions.Bson;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Translates {@link QueryPredicate} trees into MongoDB query filters
 */
final class MongoPredicateTranslator {

    private MongoPredicateTranslator() {
    }

    static Bson toFilter(QueryPredicate predicate) {
        if (predicate == null) {
            return Filters.empty();
        }

        if (predicate.isComposite()) {
            List<Bson> filters = predicate.getConditions().stream()
                    .map(MongoPredicateTranslator::toFilter)
                    .collect(Collectors.toList());
            return predicate.getLogicalOperator() == QueryPredicate.LogicalOperator.OR
                    ? Filters.or(filters)
                    : Filters.and(filters);
        }

        String field = predicate.getField();
        switch (predicate.getOperator()) {
            case EQUALS:
                return Filters.eq(field, predicate.getValue());
            case NOT_EQUALS:
                return Filters.ne(field, predicate.getValue());
            case IN:
                return Filters.in(field, predicate.getValues());
            case NOT_IN:
                return Filters.nin(field, predicate.getValues());
            case CONTAINS_IGNORE_CASE:
                return Filters.regex(field, Pattern.quote(String.valueOf(predicate.getValue())), "i");
            case ARRAY_CONTAINS:
                // equality against an array field matches any element
                return Filters.eq(field, predicate.getValue());
            case EXISTS:
                return Filters.and(Filters.exists(field), Filters.ne(field, null));
            default:
                throw new IllegalArgumentException("Unsupported operator: " + predicate.getOperator());
        }
    }
}
