package com.di.trialguard.exception;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of every error returned by the REST API.
 */
@Data
public class ErrorResponse {
    private String timestamp;
    private int status;
    private String error;
    private String message;
    private String errorCategory;
    private String errorCategoryName;
    private String path;
    private Map<String, Object> details = new LinkedHashMap<>();

    public void addDetail(String key, Object value) {
        this.details.put(key, value);
    }
}
