package com.clinic.records.repository;

import com.clinic.records.entity.Appointment;
import com.clinic.records.entity.AppointmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, UUID> {

    Optional<Appointment> findByIdAndTenantId(UUID id, UUID tenantId);

    List<Appointment> findByTenantIdAndDoctorIdAndAppointmentDateAndStatusInOrderByAppointmentTimeAsc(
            UUID tenantId, UUID doctorId, LocalDate date, Collection<AppointmentStatus> statuses);

    List<Appointment> findByTenantIdAndDoctorIdAndAppointmentDateOrderByAppointmentTimeAsc(
            UUID tenantId, UUID doctorId, LocalDate date);

    List<Appointment> findByTenantIdAndPatientMobileNumberAndPatientFirstNameOrderByAppointmentDateDescAppointmentTimeDesc(
            UUID tenantId, String mobileNumber, String firstName);

    boolean existsByAppointmentNumber(String appointmentNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id AND a.tenantId = :tenantId")
    Optional<Appointment> findByIdForUpdate(@Param("id") UUID id, @Param("tenantId") UUID tenantId);
}
