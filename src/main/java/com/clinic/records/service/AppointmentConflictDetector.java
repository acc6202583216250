package com.clinic.records.service;

import com.clinic.records.entity.Appointment;
import com.clinic.records.entity.AppointmentStatus;
import com.clinic.records.repository.AppointmentRepository;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a proposed booking overlaps a doctor's existing ones on the same day.
 * <p>
 * Intervals are half-open, {@code [start, start + duration)}: a booking ending at 09:30 and one starting at
 * 09:30 do not overlap. Only {@link AppointmentStatus#BLOCKING} appointments count. Callers that must
 * serialise concurrent bookings run this inside a transaction holding the doctor's row lock.
 */
@Component
public class AppointmentConflictDetector {

    private final AppointmentRepository appointmentRepository;

    public AppointmentConflictDetector(AppointmentRepository appointmentRepository) {
        this.appointmentRepository = appointmentRepository;
    }

    public boolean hasConflict(UUID tenantId, UUID doctorId, LocalDate date, LocalTime startTime,
                               int durationMinutes, UUID excludeId) {
        return findConflict(tenantId, doctorId, date, startTime, durationMinutes, excludeId).isPresent();
    }

    /** First blocking appointment the proposed slot collides with, in start-time order. */
    public Optional<Appointment> findConflict(UUID tenantId, UUID doctorId, LocalDate date, LocalTime startTime,
                                              int durationMinutes, UUID excludeId) {
        List<Appointment> existing = appointmentRepository
                .findByTenantIdAndDoctorIdAndAppointmentDateAndStatusInOrderByAppointmentTimeAsc(
                        tenantId, doctorId, date, AppointmentStatus.BLOCKING);
        return firstOverlap(existing, minuteOfDay(startTime), durationMinutes, excludeId);
    }

    static Optional<Appointment> firstOverlap(Collection<Appointment> existing, int newStart,
                                              int durationMinutes, UUID excludeId) {
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("Duration must be positive: " + durationMinutes);
        }
        int newEnd = newStart + durationMinutes;
        for (Appointment a : existing) {
            if (excludeId != null && excludeId.equals(a.getId())) {
                continue;
            }
            if (!a.getStatus().isBlocking()) {
                continue;
            }
            if (overlaps(newStart, newEnd, a.startMinute(), a.endMinute())) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }

    static boolean overlaps(int newStart, int newEnd, int existingStart, int existingEnd) {
        return newStart < existingEnd && newEnd > existingStart;
    }

    static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}
