package com.culicidaelab.exception;

import com.culicidaelab.localization.CacheDomain;
import com.culicidaelab.localization.LocalizationNotLoadedException;
import com.culicidaelab.model.result.ApiResponse;
import com.culicidaelab.store.StoreException;
import com.culicidaelab.store.StoreTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    public void testStatusMapping() {
        assertEquals(HttpStatus.BAD_REQUEST, handler.handleInvalidParameter(
                new InvalidQueryParameterException("bbox", "bad")).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, handler.handleNotFound(
                new ResourceNotFoundException("Species", "x")).getStatusCode());
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, handler.handleWriteFailure(
                new StorageWriteFailedException("failed", new StoreException("disk"))).getStatusCode());
        assertEquals(HttpStatus.GATEWAY_TIMEOUT, handler.handleTimeout(
                new StoreTimeoutException("slow", null)).getStatusCode());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, handler.handleStore(
                new StoreException("down")).getStatusCode());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, handler.handleNotLoaded(
                new LocalizationNotLoadedException(CacheDomain.REGION)).getStatusCode());
    }

    @Test
    public void testErrorBody() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleInvalidParameter(
                new InvalidQueryParameterException("bbox", "must have four values"));

        assertFalse(response.getBody().getOk());
        assertEquals("bbox: must have four values", response.getBody().getError());
        assertNull(response.getBody().getData());
    }

    @Test
    public void testUnexpectedExceptionHidesDetails() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleOther(new IllegalStateException("secret"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Internal server error", response.getBody().getError());
    }
}
