package com.di.insightnova.exception;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured error body returned by every API endpoint.
 */
@Data
public class ErrorResponse {
    private String timestamp;
    private int status;
    private String error;
    private String message;
    private String errorCategory;
    private String errorCategoryName;
    private String errorCategoryDescription;
    private String path;
    private String requestId;
    private Map<String, Object> details = new LinkedHashMap<>();

    public void addDetail(String key, Object value) {
        this.details.put(key, value);
    }
}
