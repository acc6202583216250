package com.clinic.records.dto;

import com.clinic.records.entity.PrescriptionStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PrescriptionStatusRequest {
    @NotNull
    private PrescriptionStatus status;
    private String notes;
}
