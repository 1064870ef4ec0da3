package com.culicidaelab.store.mongo;

import com.culicidaelab.store.DocumentStore;
import com.culicidaelab.store.StoreException;
import com.culicidaelab.store.TableHandle;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Document store backed by MongoDB, one collection per table
 */
public class MongoDocumentStore implements DocumentStore, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentStore.class);

    private final MongoClient mongoClient;
    private final MongoDatabase database;
    private final long queryTimeoutMs;

    public MongoDocumentStore(MongoClient mongoClient, String databaseName, long queryTimeoutMs) {
        this.mongoClient = mongoClient;
        this.database = mongoClient.getDatabase(databaseName);
        this.queryTimeoutMs = queryTimeoutMs;
    }

    /**
     * Connect to the given MongoDB connection string
     */
    public static MongoDocumentStore connect(String connectionString, String databaseName, long queryTimeoutMs) {
        logger.info("Connecting MongoDB document store to database '{}'", databaseName);
        try {
            return new MongoDocumentStore(MongoClients.create(connectionString), databaseName, queryTimeoutMs);
        } catch (MongoException | IllegalArgumentException e) {
            throw new StoreException("Failed to connect to MongoDB: " + e.getMessage(), e);
        }
    }

    @Override
    public TableHandle openTable(String name) {
        return new MongoTable(name, database.getCollection(name), queryTimeoutMs);
    }

    @Override
    public void close() {
        mongoClient.close();
        logger.info("Closed MongoDB document store");
    }
}
