package com.clinic.records.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One medicine line. The medicine name is copied at prescribing time so later catalogue edits do not
 * change what the patient was given.
 */
@Entity
@Table(name = "prescription_items",
        indexes = @Index(name = "idx_prescription_items_prescription", columnList = "prescription_id"),
        uniqueConstraints = @UniqueConstraint(name = "uk_prescription_items_medicine",
                columnNames = {"prescription_id", "medicine_id"}))
@EntityListeners(TenantStampListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrescriptionItem implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "prescription_id", nullable = false)
    private Prescription prescription;

    @Column(name = "medicine_id", nullable = false)
    private UUID medicineId;

    @Column(name = "medicine_name", nullable = false, length = 200)
    private String medicineName;

    @Column(nullable = false, length = 100)
    private String dosage;

    @Column(nullable = false, length = 100)
    private String frequency;

    @Column(nullable = false, length = 100)
    private String duration;

    @Column(length = 500)
    private String instructions;

    @Column(nullable = false)
    @Builder.Default
    private int quantity = 1;

    @Column(name = "unit_price", precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "total_amount", precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "generic_substitution_allowed", nullable = false)
    @Builder.Default
    private boolean genericSubstitutionAllowed = true;

    @Column(name = "sequence_order", nullable = false)
    private int sequenceOrder;
}
