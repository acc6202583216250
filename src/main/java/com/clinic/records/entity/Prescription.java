package com.clinic.records.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A doctor's prescription for one visit. Like {@link Appointment} it keeps the patient's composite key next
 * to the surrogate id. Items are loaded with the prescription since they are always shown together.
 */
@Entity
@Table(name = "prescriptions",
        indexes = {
                @Index(name = "idx_prescriptions_patient", columnList = "tenant_id, patient_mobile_number, patient_first_name"),
                @Index(name = "idx_prescriptions_doctor_date", columnList = "tenant_id, doctor_id, visit_date")
        })
@EntityListeners(TenantStampListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Prescription implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "prescription_number", nullable = false, unique = true, length = 40)
    private String prescriptionNumber;

    @Column(name = "patient_mobile_number", nullable = false, length = 20)
    private String patientMobileNumber;

    @Column(name = "patient_first_name", nullable = false, length = 100)
    private String patientFirstName;

    @Column(name = "patient_id", nullable = false)
    private UUID patientId;

    @Column(name = "doctor_id", nullable = false)
    private UUID doctorId;

    @Column(name = "appointment_id")
    private UUID appointmentId;

    @Column(name = "visit_date", nullable = false)
    private LocalDate visitDate;

    @Column(name = "chief_complaint", length = 1000)
    private String chiefComplaint;

    @Column(nullable = false, length = 1000)
    private String diagnosis;

    @Column(length = 1000)
    private String symptoms;

    @Column(name = "clinical_notes", length = 4000)
    private String clinicalNotes;

    @Column(name = "doctor_instructions", length = 2000)
    private String doctorInstructions;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PrescriptionStatus status = PrescriptionStatus.ACTIVE;

    @Column(name = "is_printed", nullable = false)
    private boolean printed;

    @Column(name = "printed_at")
    private Instant printedAt;

    @Column(name = "template_used", length = 200)
    private String templateUsed;

    @OneToMany(mappedBy = "prescription", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("sequenceOrder ASC")
    @Builder.Default
    private List<PrescriptionItem> items = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public void addItem(PrescriptionItem item) {
        item.setPrescription(this);
        items.add(item);
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
