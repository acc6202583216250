package com.clinic.records.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantUsageResponse {
    private long doctors;
    private int maxDoctors;
    private long patients;
    private int maxPatients;
    private boolean canAddDoctor;
    private boolean canAddPatient;
}
