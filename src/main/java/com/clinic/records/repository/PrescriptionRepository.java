package com.clinic.records.repository;

import com.clinic.records.entity.Prescription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PrescriptionRepository extends JpaRepository<Prescription, UUID> {

    Optional<Prescription> findByIdAndTenantId(UUID id, UUID tenantId);

    Optional<Prescription> findByTenantIdAndPrescriptionNumber(UUID tenantId, String prescriptionNumber);

    List<Prescription> findByTenantIdAndPatientMobileNumberAndPatientFirstNameOrderByVisitDateDescCreatedAtDesc(
            UUID tenantId, String mobileNumber, String firstName);

    List<Prescription> findByTenantIdAndDoctorIdAndVisitDateBetweenOrderByVisitDateDescCreatedAtDesc(
            UUID tenantId, UUID doctorId, LocalDate from, LocalDate to);

    boolean existsByPrescriptionNumber(String prescriptionNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Prescription p WHERE p.id = :id AND p.tenantId = :tenantId")
    Optional<Prescription> findByIdForUpdate(@Param("id") UUID id, @Param("tenantId") UUID tenantId);
}
