package com.clinic.records.dto;

import com.clinic.records.entity.Gender;
import com.clinic.records.entity.Relationship;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterPatientRequest {
    @NotBlank(message = "Mobile number is required")
    @Size(max = 20)
    private String mobileNumber;

    @NotBlank(message = "First name is required")
    @Size(max = 100)
    private String firstName;

    @Size(max = 100)
    private String lastName;

    @Past
    private LocalDate dateOfBirth;

    private Gender gender;

    /** Defaults to {@code SELF}. */
    private Relationship relationship;

    private String primaryContactMobile;

    @Email
    private String email;

    private String address;

    private String notes;
}
