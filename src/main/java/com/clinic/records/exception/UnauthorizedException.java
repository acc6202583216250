package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends ClinicException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", message);
    }
}
