package com.clinic.records.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookAppointmentRequest {
    @NotNull(message = "Doctor is required")
    private UUID doctorId;

    private UUID officeId;

    @NotNull(message = "Date is required")
    private LocalDate date;

    @NotNull(message = "Start time is required")
    private LocalTime startTime;

    /** Defaults to the configured appointment length. */
    @Min(5)
    @Max(480)
    private Integer durationMinutes;

    @NotBlank(message = "Patient mobile number is required")
    private String patientMobile;

    @NotBlank(message = "Patient first name is required")
    private String patientFirstName;

    @Size(max = 500)
    private String reason;
}
