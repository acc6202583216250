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
public class ClinicRegistrationResponse {
    private TenantResponse tenant;
    private UUID userId;
    private UUID doctorId;
    private UUID officeId;
    private TokenResponse token;
}
