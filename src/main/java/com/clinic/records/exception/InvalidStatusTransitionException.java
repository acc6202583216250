package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

public class InvalidStatusTransitionException extends ClinicException {

    public InvalidStatusTransitionException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_STATUS_TRANSITION", message);
    }
}
