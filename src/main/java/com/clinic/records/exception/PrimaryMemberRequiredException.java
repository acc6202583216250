package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

public class PrimaryMemberRequiredException extends ClinicException {

    public PrimaryMemberRequiredException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "PRIMARY_MEMBER_REQUIRED", message);
    }
}
