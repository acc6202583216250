package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class FamilyLimitExceededException extends ClinicException {

    private final int maxMembers;

    public FamilyLimitExceededException(String mobileNumber, int maxMembers) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "FAMILY_LIMIT_EXCEEDED",
                "Maximum " + maxMembers + " family members allowed for mobile number " + mobileNumber);
        this.maxMembers = maxMembers;
    }

    public int getMaxMembers() {
        return maxMembers;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("maxMembers", maxMembers);
    }
}
