package com.clinic.records.service;

import com.clinic.records.entity.Appointment;
import com.clinic.records.entity.AppointmentStatus;
import com.clinic.records.repository.AppointmentRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AppointmentConflictDetectorTest {

    private static final UUID TENANT = UUID.randomUUID();
    private static final UUID DOCTOR = UUID.randomUUID();
    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);

    @Mock
    private AppointmentRepository appointmentRepository;

    @InjectMocks
    private AppointmentConflictDetector detector;

    private static Appointment at(String time, int duration, AppointmentStatus status) {
        return Appointment.builder()
                .id(UUID.randomUUID())
                .tenantId(TENANT)
                .doctorId(DOCTOR)
                .appointmentDate(DAY)
                .appointmentTime(LocalTime.parse(time))
                .durationMinutes(duration)
                .status(status)
                .build();
    }

    @Test
    void touchingIntervalsDoNotOverlap() {
        Appointment nineOClock = at("09:00", 30, AppointmentStatus.SCHEDULED);

        assertTrue(AppointmentConflictDetector.firstOverlap(List.of(nineOClock), 9 * 60 + 30, 30, null).isEmpty());
        assertTrue(AppointmentConflictDetector.firstOverlap(List.of(nineOClock), 8 * 60 + 30, 30, null).isEmpty());
    }

    @Test
    void partialAndContainedIntervalsOverlap() {
        Appointment nineOClock = at("09:00", 30, AppointmentStatus.CONFIRMED);

        assertEquals(Optional.of(nineOClock),
                AppointmentConflictDetector.firstOverlap(List.of(nineOClock), 9 * 60 + 15, 30, null));
        assertEquals(Optional.of(nineOClock),
                AppointmentConflictDetector.firstOverlap(List.of(nineOClock), 8 * 60 + 45, 120, null));
        assertEquals(Optional.of(nineOClock),
                AppointmentConflictDetector.firstOverlap(List.of(nineOClock), 9 * 60 + 10, 5, null));
    }

    @Test
    void nonBlockingStatusesAreIgnored() {
        List<Appointment> existing = List.of(
                at("09:00", 30, AppointmentStatus.CANCELLED),
                at("09:00", 30, AppointmentStatus.COMPLETED),
                at("09:00", 30, AppointmentStatus.NO_SHOW),
                at("09:00", 30, AppointmentStatus.RESCHEDULED));

        assertTrue(AppointmentConflictDetector.firstOverlap(existing, 9 * 60, 30, null).isEmpty());
    }

    @Test
    void excludedAppointmentDoesNotConflictWithItself() {
        Appointment original = at("10:00", 30, AppointmentStatus.SCHEDULED);

        assertTrue(AppointmentConflictDetector.firstOverlap(List.of(original), 10 * 60 + 15, 30, original.getId())
                .isEmpty());
    }

    @Test
    void nonPositiveDurationIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> AppointmentConflictDetector.firstOverlap(List.of(), 600, 0, null));
        assertThrows(IllegalArgumentException.class,
                () -> AppointmentConflictDetector.firstOverlap(List.of(), 600, -15, null));
    }

    @Test
    void findConflictQueriesOnlyBlockingAppointmentsOfThatDoctorAndDay() {
        Appointment first = at("09:00", 30, AppointmentStatus.SCHEDULED);
        Appointment second = at("09:30", 30, AppointmentStatus.IN_PROGRESS);
        when(appointmentRepository.findByTenantIdAndDoctorIdAndAppointmentDateAndStatusInOrderByAppointmentTimeAsc(
                eq(TENANT), eq(DOCTOR), eq(DAY), eq(AppointmentStatus.BLOCKING)))
                .thenReturn(List.of(first, second));

        Optional<Appointment> conflict = detector.findConflict(TENANT, DOCTOR, DAY, LocalTime.of(9, 40), 10, null);

        assertEquals(Optional.of(second), conflict);
        assertTrue(detector.hasConflict(TENANT, DOCTOR, DAY, LocalTime.of(9, 0), 60, null));
        assertFalse(detector.hasConflict(TENANT, DOCTOR, DAY, LocalTime.of(10, 0), 60, null));
    }
}
