package com.clinic.records.repository;

import com.clinic.records.entity.Patient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PatientRepository extends JpaRepository<Patient, UUID> {

    Optional<Patient> findByTenantIdAndMobileNumberAndFirstNameAndActiveTrue(
            UUID tenantId, String mobileNumber, String firstName);

    Optional<Patient> findFirstByTenantIdAndMobileNumberAndFirstNameAndActiveFalseOrderByUpdatedAtDesc(
            UUID tenantId, String mobileNumber, String firstName);

    Optional<Patient> findByIdAndTenantId(UUID id, UUID tenantId);

    List<Patient> findByTenantIdAndMobileNumberAndActiveTrue(UUID tenantId, String mobileNumber);

    long countByTenantIdAndActiveTrue(UUID tenantId);

    /**
     * Locks the family's primary member. Every non-primary registration for the mobile number takes this
     * lock first, so family-size checks for one family run one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Patient p WHERE p.tenantId = :tenantId AND p.mobileNumber = :mobile"
            + " AND p.relationship = com.clinic.records.entity.Relationship.SELF AND p.active = true")
    Optional<Patient> findActivePrimaryForUpdate(@Param("tenantId") UUID tenantId, @Param("mobile") String mobile);
}
