package com.clinic.records.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RescheduleRequest {
    @NotNull
    private LocalDate newDate;
    @NotNull
    private LocalTime newTime;
    /** Keeps the original length when absent. */
    @Min(5)
    @Max(480)
    private Integer durationMinutes;
    private String reason;
}
