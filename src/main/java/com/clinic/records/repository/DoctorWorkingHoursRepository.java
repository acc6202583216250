package com.clinic.records.repository;

import com.clinic.records.entity.DoctorWorkingHours;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface DoctorWorkingHoursRepository extends JpaRepository<DoctorWorkingHours, UUID> {

    List<DoctorWorkingHours> findByTenantIdAndDoctorIdOrderByDayOfWeekAscStartTimeAsc(UUID tenantId, UUID doctorId);

    void deleteByTenantIdAndDoctorId(UUID tenantId, UUID doctorId);
}
