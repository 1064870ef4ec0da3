package com.culicidaelab.exception;

import com.culicidaelab.localization.LocalizationNotLoadedException;
import com.culicidaelab.model.result.ApiResponse;
import com.culicidaelab.store.StoreException;
import com.culicidaelab.store.StoreTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps exceptions to status codes with an {@link ApiResponse} error body
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidQueryParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidParameter(InvalidQueryParameterException ex) {
        log.debug("Invalid parameter: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        log.debug("Validation failed: {}", message);
        return respond(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiResponse<Void>> handleUnreadableRequest(Exception ex) {
        log.debug("Unreadable request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request: " + ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(StorageWriteFailedException.class)
    public ResponseEntity<ApiResponse<Void>> handleWriteFailure(StorageWriteFailedException ex) {
        log.error("Storage write failed: {}", ex.getMessage(), ex.getCause());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(StoreTimeoutException.class)
    public ResponseEntity<ApiResponse<Void>> handleTimeout(StoreTimeoutException ex) {
        log.warn("Store call timed out: {}", ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage());
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ApiResponse<Void>> handleStore(StoreException ex) {
        log.error("Store error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(LocalizationNotLoadedException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotLoaded(LocalizationNotLoadedException ex) {
        log.error("Localization cache misconfigured: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleOther(Exception ex) {
        if (ex instanceof ErrorResponse) {
            // Spring MVC exceptions carry their own status (404 route, 405 method, ...)
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            return ResponseEntity.status(status).body(ApiResponse.error(ex.getMessage()));
        }
        log.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(message));
    }
}
