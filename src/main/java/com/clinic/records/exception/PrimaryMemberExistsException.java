package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

public class PrimaryMemberExistsException extends ClinicException {

    public PrimaryMemberExistsException(String message) {
        super(HttpStatus.CONFLICT, "PRIMARY_MEMBER_EXISTS", message);
    }
}
