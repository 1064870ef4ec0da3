package com.culicidaelab.store.mongo;

import com.culicidaelab.store.Row;
import com.culicidaelab.store.StoreException;
import com.culicidaelab.store.StoreTimeoutException;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.CountOptions;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class MongoTableTest {

    private MongoCollection<Document> collection;
    private MongoTable table;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        collection = mock(MongoCollection.class);
        table = new MongoTable("observations", collection, 5000);
    }

    @Test
    public void testInsertWritesRowFields() {
        table.insert(new Row().put("id", "obs-1").put("count", 2));

        ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
        verify(collection).insertOne(captor.capture());
        assertEquals("obs-1", captor.getValue().getString("id"));
        assertEquals(2, captor.getValue().getInteger("count"));
    }

    @Test
    public void testDocumentIdIsNotExposed() {
        Row row = MongoTable.toRow(new Document("_id", new ObjectId()).append("id", "obs-1"));

        assertFalse(row.has("_id"));
        assertEquals("obs-1", row.getString("id"));
    }

    @Test
    public void testTimeoutTranslation() {
        when(collection.countDocuments(any(Bson.class), any(CountOptions.class)))
                .thenThrow(new MongoExecutionTimeoutException(50, "operation exceeded time limit"));

        assertThrows(StoreTimeoutException.class, () -> table.count(null));
    }

    @Test
    public void testWriteFailureTranslation() {
        doThrow(new MongoException("not primary")).when(collection).insertOne(any(Document.class));

        StoreException e = assertThrows(StoreException.class, () -> table.insert(new Row().put("id", "x")));
        assertFalse(e instanceof StoreTimeoutException);
        assertTrue(e.getMessage().contains("observations"));
    }
}
