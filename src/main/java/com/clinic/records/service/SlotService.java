package com.clinic.records.service;

import com.clinic.records.config.ClinicProperties;
import com.clinic.records.dto.SlotResponse;
import com.clinic.records.entity.Appointment;
import com.clinic.records.entity.AppointmentStatus;
import com.clinic.records.entity.DoctorWorkingHours;
import com.clinic.records.exception.NotFoundException;
import com.clinic.records.repository.AppointmentRepository;
import com.clinic.records.repository.DoctorRepository;
import com.clinic.records.repository.DoctorWorkingHoursRepository;
import com.clinic.records.tenant.ConnectionScopeBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Free slots of a doctor on one day, derived from the weekly schedule minus blocking appointments.
 */
@Service
public class SlotService {

    private static final Logger log = LoggerFactory.getLogger(SlotService.class);
    // Used when a doctor has no schedule at all: Mon-Sat 9-13 and 14-18
    private static final LocalTime BLOCK1_START = LocalTime.of(9, 0);
    private static final LocalTime BLOCK1_END = LocalTime.of(13, 0);
    private static final LocalTime BLOCK2_START = LocalTime.of(14, 0);
    private static final LocalTime BLOCK2_END = LocalTime.of(18, 0);

    private final DoctorRepository doctorRepository;
    private final DoctorWorkingHoursRepository workingHoursRepository;
    private final AppointmentRepository appointmentRepository;
    private final ConnectionScopeBinder binder;
    private final int slotMinutes;

    public SlotService(DoctorRepository doctorRepository,
                       DoctorWorkingHoursRepository workingHoursRepository,
                       AppointmentRepository appointmentRepository,
                       ConnectionScopeBinder binder,
                       ClinicProperties properties) {
        this.doctorRepository = doctorRepository;
        this.workingHoursRepository = workingHoursRepository;
        this.appointmentRepository = appointmentRepository;
        this.binder = binder;
        this.slotMinutes = properties.getAppointments().getSlotMinutes();
    }

    public List<SlotResponse> availableSlots(UUID tenantId, UUID doctorId, LocalDate date) {
        return binder.inTenantReadOnly(tenantId, status -> {
            doctorRepository.findByIdAndTenantId(doctorId, tenantId)
                    .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
            List<Appointment> booked = appointmentRepository
                    .findByTenantIdAndDoctorIdAndAppointmentDateAndStatusInOrderByAppointmentTimeAsc(
                            tenantId, doctorId, date, AppointmentStatus.BLOCKING);

            List<SlotResponse> slots = new ArrayList<>();
            for (LocalTime[] block : getBlocksForDay(tenantId, doctorId, date)) {
                int blockEnd = AppointmentConflictDetector.minuteOfDay(block[1]);
                for (int minute = AppointmentConflictDetector.minuteOfDay(block[0]);
                     minute + slotMinutes <= blockEnd;
                     minute += slotMinutes) {
                    if (AppointmentConflictDetector.firstOverlap(booked, minute, slotMinutes, null).isEmpty()) {
                        slots.add(new SlotResponse(toTime(minute), toTime(minute + slotMinutes)));
                    }
                }
            }
            log.debug("Doctor {} has {} free slots on {}", doctorId, slots.size(), date);
            return slots;
        });
    }

    private static LocalTime toTime(int minuteOfDay) {
        return LocalTime.of(minuteOfDay / 60, minuteOfDay % 60);
    }

    private List<LocalTime[]> getBlocksForDay(UUID tenantId, UUID doctorId, LocalDate date) {
        int dayOfWeek = date.getDayOfWeek().getValue(); // 1=Mon, 7=Sun
        List<DoctorWorkingHours> wh = workingHoursRepository
                .findByTenantIdAndDoctorIdOrderByDayOfWeekAscStartTimeAsc(tenantId, doctorId);
        if (!wh.isEmpty()) {
            return wh.stream()
                    .filter(w -> w.getDayOfWeek() == dayOfWeek)
                    .map(w -> new LocalTime[]{w.getStartTime(), w.getEndTime()})
                    .toList();
        }
        if (dayOfWeek >= 1 && dayOfWeek <= 6) {
            return List.of(
                    new LocalTime[]{BLOCK1_START, BLOCK1_END},
                    new LocalTime[]{BLOCK2_START, BLOCK2_END}
            );
        }
        return List.of();
    }
}
