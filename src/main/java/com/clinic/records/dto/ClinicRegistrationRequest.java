package com.clinic.records.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ClinicRegistrationRequest {
    @NotBlank(message = "Clinic name is required")
    @Size(max = 200)
    private String clinicName;

    @NotBlank(message = "Clinic phone is required")
    @Size(max = 20)
    private String clinicPhone;

    @Size(max = 500)
    private String clinicAddress;

    @NotBlank(message = "Owner email is required")
    @Email
    private String ownerEmail;

    @NotBlank(message = "Password is required")
    @Size(min = 8, message = "Password must be at least 8 characters")
    private String password;

    private String ownerFirstName;

    private String ownerLastName;

    /** {@code admin} or {@code admin_doctor}. */
    @NotBlank
    @Pattern(regexp = "admin|admin_doctor", message = "Role must be 'admin' or 'admin_doctor'")
    private String role;

    /** Required for {@code admin_doctor}. */
    private String licenseNumber;

    private String specialization;
}
