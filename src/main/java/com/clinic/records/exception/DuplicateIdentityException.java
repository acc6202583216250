package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

public class DuplicateIdentityException extends ClinicException {

    public DuplicateIdentityException(String message) {
        super(HttpStatus.CONFLICT, "DUPLICATE_IDENTITY", message);
    }
}
