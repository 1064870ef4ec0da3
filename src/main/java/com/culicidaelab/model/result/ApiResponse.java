package com.culicidaelab.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Envelope for admin responses and all error bodies
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private Boolean ok;
    private T data;
    private String error;
    private String elapsed;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .ok(true)
                .data(data)
                .build();
    }

    /**
     * Successful response with elapsed time in milliseconds
     */
    public static <T> ApiResponse<T> success(T data, long elapsedMs) {
        return ApiResponse.<T>builder()
                .ok(true)
                .data(data)
                .elapsed(String.format(Locale.ROOT, "%.3fs", elapsedMs / 1000.0))
                .build();
    }

    public static <T> ApiResponse<T> error(String error) {
        return ApiResponse.<T>builder()
                .ok(false)
                .error(error)
                .build();
    }
}
