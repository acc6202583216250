package com.clinic.records.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Carries the patient's composite key alongside its surrogate id; both are written at booking time and
 * never diverge.
 */
@Entity
@Table(name = "appointments",
        indexes = {
                @Index(name = "idx_appointments_doctor_date", columnList = "tenant_id, doctor_id, appointment_date"),
                @Index(name = "idx_appointments_patient", columnList = "tenant_id, patient_mobile_number, patient_first_name")
        })
@EntityListeners(TenantStampListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "appointment_number", nullable = false, unique = true, length = 40)
    private String appointmentNumber;

    @Column(name = "patient_mobile_number", nullable = false, length = 20)
    private String patientMobileNumber;

    @Column(name = "patient_first_name", nullable = false, length = 100)
    private String patientFirstName;

    @Column(name = "patient_id", nullable = false)
    private UUID patientId;

    @Column(name = "doctor_id", nullable = false)
    private UUID doctorId;

    @Column(name = "office_id")
    private UUID officeId;

    @Column(name = "appointment_date", nullable = false)
    private LocalDate appointmentDate;

    @Column(name = "appointment_time", nullable = false)
    private LocalTime appointmentTime;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AppointmentStatus status = AppointmentStatus.SCHEDULED;

    @Column(name = "reason_for_visit", length = 500)
    private String reasonForVisit;

    @Column(length = 2000)
    private String notes;

    /** Set on the successor created by a reschedule. */
    @Column(name = "rescheduled_from_id")
    private UUID rescheduledFromId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public int startMinute() {
        return appointmentTime.getHour() * 60 + appointmentTime.getMinute();
    }

    public int endMinute() {
        return startMinute() + durationMinutes;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
