package com.cred.freestyle.registration.api.dto;

import com.cred.freestyle.registration.exception.ErrorKind;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Standardized error body for all API errors.
 * {@code details.kind} carries the stable {@link ErrorKind} clients branch on.
 *
 * @author Registration Team
 */
public class ErrorResponse {

    private Instant timestamp;
    private Integer status;
    private String error;
    private String message;
    private String path;
    private Map<String, Object> details;

    public ErrorResponse() {
        this.timestamp = Instant.now();
        this.details = new LinkedHashMap<>();
    }

    public ErrorResponse(Integer status, String error, String message, String path) {
        this();
        this.status = status;
        this.error = error;
        this.message = message;
        this.path = path;
    }

    /**
     * Add an error detail.
     *
     * @param key Detail key
     * @param value Detail value
     * @return This ErrorResponse for method chaining
     */
    public ErrorResponse addDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }

    public ErrorResponse withKind(ErrorKind kind) {
        return addDetail("kind", kind.name());
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Integer getStatus() {
        return status;
    }

    public void setStatus(Integer status) {
        this.status = status;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public void setDetails(Map<String, Object> details) {
        this.details = details;
    }
}
