package com.clinic.records.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalTime;
import java.util.UUID;

/**
 * One availability range of a doctor's weekly schedule.
 */
@Entity
@Table(name = "doctor_working_hours",
        indexes = @Index(name = "idx_working_hours_doctor_day", columnList = "doctor_id, day_of_week"))
@EntityListeners(TenantStampListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DoctorWorkingHours implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "doctor_id", nullable = false)
    private UUID doctorId;

    /**
     * Day of week: 1 = Monday, 7 = Sunday (java.time.DayOfWeek)
     */
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;
}
