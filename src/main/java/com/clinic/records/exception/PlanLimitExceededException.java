package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

public class PlanLimitExceededException extends ClinicException {

    public PlanLimitExceededException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "PLAN_LIMIT_EXCEEDED", message);
    }
}
