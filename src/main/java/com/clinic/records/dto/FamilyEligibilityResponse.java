package com.clinic.records.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FamilyEligibilityResponse {
    private String mobileNumber;
    private long currentMembers;
    private int maxMembers;
    private boolean hasPrimaryMember;
    private boolean canRegister;
    private List<String> reasons;
}
