package com.clinic.records.dto;

import com.clinic.records.entity.Gender;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

/**
 * Non-key attributes only. Null fields are left unchanged.
 */
@Data
public class UpdatePatientRequest {
    @Size(max = 100)
    private String lastName;
    @Past
    private LocalDate dateOfBirth;
    private Gender gender;
    @Email
    private String email;
    private String address;
    private String notes;
}
