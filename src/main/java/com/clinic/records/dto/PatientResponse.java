package com.clinic.records.dto;

import com.clinic.records.entity.Patient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientResponse {
    private UUID id;
    private String mobileNumber;
    private String firstName;
    private String lastName;
    private LocalDate dateOfBirth;
    private String gender;
    private String relationship;
    private String primaryContactMobile;
    private String email;
    private boolean active;

    public static PatientResponse from(Patient p) {
        return PatientResponse.builder()
                .id(p.getId())
                .mobileNumber(p.getMobileNumber())
                .firstName(p.getFirstName())
                .lastName(p.getLastName())
                .dateOfBirth(p.getDateOfBirth())
                .gender(p.getGender() == null ? null : p.getGender().name().toLowerCase(Locale.ROOT))
                .relationship(p.getRelationship().name().toLowerCase(Locale.ROOT))
                .primaryContactMobile(p.getPrimaryContactMobile())
                .email(p.getEmail())
                .active(p.isActive())
                .build();
    }
}
