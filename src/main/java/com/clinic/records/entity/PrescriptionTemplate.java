package com.clinic.records.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Print layout for prescriptions. Scope widens as {@code officeId}, then {@code doctorId}, are left null.
 */
@Entity
@Table(name = "prescription_templates",
        indexes = @Index(name = "idx_templates_scope", columnList = "tenant_id, doctor_id, office_id"))
@EntityListeners(TenantStampListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrescriptionTemplate implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "doctor_id")
    private UUID doctorId;

    @Column(name = "office_id")
    private UUID officeId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 500)
    private String description;

    @Column(name = "paper_size", nullable = false, length = 20)
    @Builder.Default
    private String paperSize = "a4";

    @Column(nullable = false, length = 20)
    @Builder.Default
    private String orientation = "portrait";

    @Column(name = "margin_top", precision = 5, scale = 2)
    private BigDecimal marginTop;

    @Column(name = "margin_bottom", precision = 5, scale = 2)
    private BigDecimal marginBottom;

    @Column(name = "margin_left", precision = 5, scale = 2)
    private BigDecimal marginLeft;

    @Column(name = "margin_right", precision = 5, scale = 2)
    private BigDecimal marginRight;

    /** Layout sections as JSON, interpreted by the renderer. */
    @Column(name = "layout_config", length = 8000)
    private String layoutConfig;

    @Column(name = "signature_text", length = 500)
    private String signatureText;

    @Column(name = "preset_type", length = 50)
    private String presetType;

    @Column(name = "is_default", nullable = false)
    private boolean defaultTemplate;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

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
