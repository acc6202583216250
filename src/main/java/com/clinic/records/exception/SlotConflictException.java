package com.clinic.records.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;
import java.util.UUID;

/**
 * Raised when a requested slot overlaps an active appointment of the same doctor.
 * Carries the colliding appointment so clients can offer alternatives.
 */
public class SlotConflictException extends ClinicException {

    private final UUID conflictingAppointmentId;

    public SlotConflictException(UUID conflictingAppointmentId) {
        super(HttpStatus.CONFLICT, "SLOT_CONFLICT",
                "Appointment time conflicts with existing appointment " + conflictingAppointmentId);
        this.conflictingAppointmentId = conflictingAppointmentId;
    }

    public UUID getConflictingAppointmentId() {
        return conflictingAppointmentId;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("conflictingAppointmentId", conflictingAppointmentId.toString());
    }
}
