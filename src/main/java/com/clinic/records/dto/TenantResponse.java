package com.clinic.records.dto;

import com.clinic.records.entity.Tenant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantResponse {
    private UUID id;
    private String tenantName;
    private String tenantCode;
    private String subscriptionPlan;
    private Instant trialEndsAt;
    private int maxClinics;
    private int maxDoctors;
    private int maxPatients;
    private int maxStorageMb;
    private boolean active;

    public static TenantResponse from(Tenant t) {
        return TenantResponse.builder()
                .id(t.getId())
                .tenantName(t.getTenantName())
                .tenantCode(t.getTenantCode())
                .subscriptionPlan(t.getSubscriptionPlan().name().toLowerCase(Locale.ROOT))
                .trialEndsAt(t.getTrialEndsAt())
                .maxClinics(t.getMaxClinics())
                .maxDoctors(t.getMaxDoctors())
                .maxPatients(t.getMaxPatients())
                .maxStorageMb(t.getMaxStorageMb())
                .active(t.isActive())
                .build();
    }
}
