package com.clinic.records.dto;

import com.clinic.records.entity.SubscriptionPlan;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ChangePlanRequest {
    @NotNull
    private SubscriptionPlan plan;
    @Min(1)
    private Integer maxDoctors;
    @Min(1)
    private Integer maxPatients;
    @Min(1)
    private Integer maxStorageMb;
    @Min(1)
    private Integer maxClinics;
}
