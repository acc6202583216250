package com.clinic.records.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePrescriptionRequest {
    @NotBlank(message = "Patient mobile number is required")
    private String patientMobile;

    @NotBlank(message = "Patient first name is required")
    private String patientFirstName;

    @NotNull(message = "Doctor is required")
    private UUID doctorId;

    private UUID appointmentId;

    /** Defaults to today. */
    private LocalDate visitDate;

    @Size(max = 1000)
    private String chiefComplaint;

    @NotBlank(message = "Diagnosis is required")
    @Size(min = 3, max = 1000, message = "Diagnosis must be between 3 and 1000 characters")
    private String diagnosis;

    @Size(max = 1000)
    private String symptoms;

    @Size(max = 4000)
    private String clinicalNotes;

    @Size(max = 2000)
    private String doctorInstructions;

    /** Saves as a draft instead of issuing right away. */
    private boolean draft;

    @NotEmpty(message = "At least one medicine is required")
    @Valid
    private List<Item> items;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        @NotNull(message = "Medicine is required")
        private UUID medicineId;

        @NotBlank(message = "Dosage is required")
        @Size(max = 100)
        private String dosage;

        @NotBlank(message = "Frequency is required")
        @Size(max = 100)
        private String frequency;

        @NotBlank(message = "Duration is required")
        @Size(max = 100)
        private String duration;

        @Size(max = 500)
        private String instructions;

        @Min(1)
        @Max(1000)
        private Integer quantity;

        /** Defaults to the catalogue price. */
        @DecimalMin("0.00")
        private BigDecimal unitPrice;

        private Boolean genericSubstitutionAllowed;
    }
}
