package com.clinic.records.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * A location a doctor practises at. The id is stable and referenced by appointments and templates.
 */
@Entity
@Table(name = "doctor_offices", indexes = @Index(name = "idx_doctor_offices_doctor", columnList = "doctor_id"))
@EntityListeners(TenantStampListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DoctorOffice implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "doctor_id", nullable = false, updatable = false)
    private UUID doctorId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 500)
    private String address;

    @Column(length = 20)
    private String phone;

    @Column(name = "is_primary", nullable = false)
    private boolean primary;
}
