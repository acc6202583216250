package com.clinic.records.dto;

import com.clinic.records.entity.Doctor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DoctorResponse {
    private UUID id;
    private String name;
    private String licenseNumber;
    private String specialization;
    private boolean active;

    public static DoctorResponse from(Doctor d) {
        return new DoctorResponse(d.getId(), d.getName(), d.getLicenseNumber(), d.getSpecialization(), d.isActive());
    }
}
