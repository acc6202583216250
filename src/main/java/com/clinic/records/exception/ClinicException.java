package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Root of every business and tenancy failure surfaced to callers.
 * Each subclass fixes the HTTP status and a stable code clients can switch on.
 */
public abstract class ClinicException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected ClinicException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected ClinicException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    /** Extra structured fields for the error body. */
    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
