package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ClinicException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "NOT_FOUND", message);
    }

    public static NotFoundException of(String what, Object key) {
        return new NotFoundException(what + " not found: " + key);
    }
}
