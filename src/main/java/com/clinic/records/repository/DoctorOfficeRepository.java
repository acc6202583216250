package com.clinic.records.repository;

import com.clinic.records.entity.DoctorOffice;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DoctorOfficeRepository extends JpaRepository<DoctorOffice, UUID> {

    Optional<DoctorOffice> findByIdAndTenantIdAndDoctorId(UUID id, UUID tenantId, UUID doctorId);

    List<DoctorOffice> findByTenantIdAndDoctorIdOrderByName(UUID tenantId, UUID doctorId);

    long countByTenantIdAndDoctorId(UUID tenantId, UUID doctorId);
}
