package com.clinic.records.repository;

import com.clinic.records.entity.PrescriptionTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PrescriptionTemplateRepository extends JpaRepository<PrescriptionTemplate, UUID> {

    Optional<PrescriptionTemplate> findByIdAndTenantId(UUID id, UUID tenantId);

    // doctor + office
    Optional<PrescriptionTemplate> findFirstByTenantIdAndDoctorIdAndOfficeIdAndActiveTrueOrderByDefaultTemplateDescCreatedAtAsc(
            UUID tenantId, UUID doctorId, UUID officeId);

    // doctor, no office
    Optional<PrescriptionTemplate> findFirstByTenantIdAndDoctorIdAndOfficeIdIsNullAndDefaultTemplateTrueAndActiveTrue(
            UUID tenantId, UUID doctorId);

    Optional<PrescriptionTemplate> findFirstByTenantIdAndDoctorIdAndOfficeIdIsNullAndActiveTrueOrderByCreatedAtAsc(
            UUID tenantId, UUID doctorId);

    // tenant-wide
    Optional<PrescriptionTemplate> findFirstByTenantIdAndDoctorIdIsNullAndOfficeIdIsNullAndDefaultTemplateTrueAndActiveTrue(
            UUID tenantId);

    Optional<PrescriptionTemplate> findFirstByTenantIdAndDoctorIdIsNullAndOfficeIdIsNullAndActiveTrueOrderByCreatedAtAsc(
            UUID tenantId);

    // default flag moves, issued as SQL so no stale entity snapshot can undo them; callers hold the scope lock
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PrescriptionTemplate t SET t.defaultTemplate = false, t.updatedAt = :now"
            + " WHERE t.tenantId = :tenantId AND t.doctorId IS NULL AND t.officeId IS NULL AND t.defaultTemplate = true")
    int clearTenantDefaults(@Param("tenantId") UUID tenantId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PrescriptionTemplate t SET t.defaultTemplate = false, t.updatedAt = :now"
            + " WHERE t.tenantId = :tenantId AND t.doctorId = :doctorId AND t.officeId IS NULL"
            + " AND t.defaultTemplate = true")
    int clearDoctorDefaults(@Param("tenantId") UUID tenantId, @Param("doctorId") UUID doctorId,
                            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PrescriptionTemplate t SET t.defaultTemplate = false, t.updatedAt = :now"
            + " WHERE t.tenantId = :tenantId AND t.doctorId = :doctorId AND t.officeId = :officeId"
            + " AND t.defaultTemplate = true")
    int clearOfficeDefaults(@Param("tenantId") UUID tenantId, @Param("doctorId") UUID doctorId,
                            @Param("officeId") UUID officeId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PrescriptionTemplate t SET t.defaultTemplate = true, t.updatedAt = :now"
            + " WHERE t.id = :id AND t.tenantId = :tenantId")
    int markDefault(@Param("tenantId") UUID tenantId, @Param("id") UUID id, @Param("now") Instant now);

    List<PrescriptionTemplate> findByTenantIdAndActiveTrueOrderByCreatedAtAsc(UUID tenantId);

    List<PrescriptionTemplate> findByTenantIdAndDoctorIdAndActiveTrueOrderByCreatedAtAsc(UUID tenantId, UUID doctorId);
}
