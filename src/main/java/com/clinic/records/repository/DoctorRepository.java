package com.clinic.records.repository;

import com.clinic.records.entity.Doctor;
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
public interface DoctorRepository extends JpaRepository<Doctor, UUID> {

    Optional<Doctor> findByIdAndTenantId(UUID id, UUID tenantId);

    List<Doctor> findByTenantIdAndActiveTrueOrderByName(UUID tenantId);

    long countByTenantIdAndActiveTrue(UUID tenantId);

    boolean existsByLicenseNumber(String licenseNumber);

    /** Serialises bookings for one doctor. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Doctor d WHERE d.id = :id AND d.tenantId = :tenantId")
    Optional<Doctor> findByIdForUpdate(@Param("id") UUID id, @Param("tenantId") UUID tenantId);
}
