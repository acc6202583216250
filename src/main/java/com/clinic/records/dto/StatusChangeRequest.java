package com.clinic.records.dto;

import com.clinic.records.entity.AppointmentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StatusChangeRequest {
    @NotNull
    private AppointmentStatus status;
    private String notes;
}
