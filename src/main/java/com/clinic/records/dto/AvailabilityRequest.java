package com.clinic.records.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Replaces a doctor's whole weekly schedule.
 */
@Data
public class AvailabilityRequest {

    @Valid
    @NotNull
    private List<Range> ranges = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Range {
        /** 1 = Monday, 7 = Sunday. */
        @Min(1)
        @Max(7)
        private int dayOfWeek;
        @NotNull
        private LocalTime start;
        @NotNull
        private LocalTime end;
    }
}
