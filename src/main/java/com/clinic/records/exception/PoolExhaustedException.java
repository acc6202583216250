package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

/**
 * No pooled connection became available within the checkout timeout.
 * Callers may retry with backoff.
 */
public class PoolExhaustedException extends ClinicException {

    public PoolExhaustedException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "POOL_EXHAUSTED", message, cause);
    }
}
