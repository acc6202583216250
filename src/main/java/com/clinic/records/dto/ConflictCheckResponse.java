package com.clinic.records.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictCheckResponse {
    private boolean conflict;
    private UUID conflictingAppointmentId;
}
