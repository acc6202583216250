package com.clinic.records.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A patient, identified externally by {@code (mobileNumber, firstName)} and internally by {@code id}.
 * <p>
 * {@code activeKey} and {@code primaryMarker} are TRUE or NULL so that plain unique constraints only bite on
 * active rows: one active row per composite key, one active {@code SELF} per mobile number.
 */
@Entity
@Table(name = "patients",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_patients_identity",
                        columnNames = {"tenant_id", "mobile_number", "first_name", "active_key"}),
                @UniqueConstraint(name = "uk_patients_family_primary",
                        columnNames = {"tenant_id", "mobile_number", "primary_marker"})
        },
        indexes = @Index(name = "idx_patients_family", columnList = "tenant_id, mobile_number, relationship"))
@EntityListeners(TenantStampListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Patient implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "mobile_number", nullable = false, updatable = false, length = 20)
    private String mobileNumber;

    @Column(name = "first_name", nullable = false, updatable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private Gender gender;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Relationship relationship;

    @Column(name = "primary_contact_mobile", length = 20)
    private String primaryContactMobile;

    private String email;

    @Column(length = 500)
    private String address;

    @Column(length = 2000)
    private String notes;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "active_key")
    private Boolean activeKey;

    @Column(name = "primary_marker")
    private Boolean primaryMarker;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isPrimaryMember() {
        return relationship == Relationship.SELF;
    }

    public void deactivate() {
        active = false;
        syncMarkers();
    }

    public void reactivate() {
        active = true;
        syncMarkers();
    }

    private void syncMarkers() {
        activeKey = active ? Boolean.TRUE : null;
        primaryMarker = active && isPrimaryMember() ? Boolean.TRUE : null;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        syncMarkers();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        syncMarkers();
    }
}
