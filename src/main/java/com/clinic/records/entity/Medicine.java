package com.clinic.records.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Catalogue entry. A null {@code tenantId} marks a global entry every tenant can read; otherwise the
 * entry is private to its tenant.
 */
@Entity
@Table(name = "medicines", indexes = @Index(name = "idx_medicines_name", columnList = "name"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Medicine {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", updatable = false)
    private UUID tenantId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "generic_name", length = 200)
    private String genericName;

    @Column(length = 200)
    private String manufacturer;

    @Column(length = 100)
    private String strength;

    @Column(name = "drug_category", length = 100)
    private String drugCategory;

    @Column(precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "requires_prescription", nullable = false)
    @Builder.Default
    private boolean requiresPrescription = true;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    public boolean isGlobal() {
        return tenantId == null;
    }
}
