package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

/**
 * The tenant id could not be bound to a connection. Fatal for the request, never retried.
 */
public class InvalidTenantContextException extends ClinicException {

    public InvalidTenantContextException(String message) {
        super(HttpStatus.BAD_REQUEST, "INVALID_TENANT_CONTEXT", message);
    }

    public InvalidTenantContextException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, "INVALID_TENANT_CONTEXT", message, cause);
    }
}
