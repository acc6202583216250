package com.clinic.records.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDoctorRequest {
    @NotBlank(message = "Name is required")
    @Size(max = 100)
    private String name;

    @NotBlank(message = "License number is required")
    @Size(max = 100)
    private String licenseNumber;

    private String specialization;

    private UUID userId;

    /** Optional first office, created as the primary one. */
    @Valid
    private CreateOfficeRequest office;
}
