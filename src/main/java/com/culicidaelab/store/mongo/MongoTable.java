package com.culicidaelab.store.mongo;

import com.culicidaelab.store.QueryPredicate;
import com.culicidaelab.store.QueryWindow;
import com.culicidaelab.store.Row;
import com.culicidaelab.store.StoreException;
import com.culicidaelab.store.StoreTimeoutException;
import com.culicidaelab.store.TableHandle;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * MongoDB collection exposed as a {@link TableHandle}.
 * Stable order is ascending {@code _id}, which follows insertion order for generated ids.
 */
public class MongoTable implements TableHandle {

    private static final String MONGO_ID = "_id";

    private final String name;
    private final MongoCollection<Document> collection;
    private final long queryTimeoutMs;

    MongoTable(String name, MongoCollection<Document> collection, long queryTimeoutMs) {
        this.name = name;
        this.collection = collection;
        this.queryTimeoutMs = queryTimeoutMs;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<Row> query(QueryPredicate predicate, QueryWindow window) {
        Bson filter = MongoPredicateTranslator.toFilter(predicate);
        try {
            FindIterable<Document> find = collection.find(filter)
                    .sort(Sorts.ascending(MONGO_ID))
                    .skip(window.getOffset())
                    .maxTime(queryTimeoutMs, TimeUnit.MILLISECONDS);
            if (window.isBounded()) {
                find = find.limit(window.getLimit());
            }

            List<Row> rows = new ArrayList<>();
            for (Document document : find) {
                rows.add(toRow(document));
            }
            return rows;
        } catch (MongoException e) {
            throw translate("query", e);
        }
    }

    @Override
    public long count(QueryPredicate predicate) {
        Bson filter = MongoPredicateTranslator.toFilter(predicate);
        try {
            return collection.countDocuments(filter,
                    new CountOptions().maxTime(queryTimeoutMs, TimeUnit.MILLISECONDS));
        } catch (MongoException e) {
            throw translate("count", e);
        }
    }

    @Override
    public void insert(Row row) {
        try {
            collection.insertOne(new Document(row.asMap()));
        } catch (MongoException e) {
            throw translate("insert", e);
        }
    }

    static Row toRow(Document document) {
        Row row = new Row();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (!MONGO_ID.equals(entry.getKey())) {
                row.put(entry.getKey(), entry.getValue());
            }
        }
        return row;
    }

    private StoreException translate(String operation, MongoException e) {
        String message = String.format("MongoDB %s on '%s' failed: %s", operation, name, e.getMessage());
        if (e instanceof MongoExecutionTimeoutException
                || e instanceof MongoTimeoutException
                || e instanceof MongoSocketReadTimeoutException) {
            return new StoreTimeoutException(message, e);
        }
        return new StoreException(message, e);
    }
}
