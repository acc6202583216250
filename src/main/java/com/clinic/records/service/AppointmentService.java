package com.clinic.records.service;

import com.clinic.records.config.ClinicProperties;
import com.clinic.records.dto.BookAppointmentRequest;
import com.clinic.records.dto.ConflictCheckResponse;
import com.clinic.records.dto.RescheduleRequest;
import com.clinic.records.entity.Appointment;
import com.clinic.records.entity.AppointmentStatus;
import com.clinic.records.entity.Doctor;
import com.clinic.records.entity.Patient;
import com.clinic.records.exception.DuplicateIdentityException;
import com.clinic.records.exception.InvalidStatusTransitionException;
import com.clinic.records.exception.NotFoundException;
import com.clinic.records.exception.SlotConflictException;
import com.clinic.records.exception.StorageErrorTranslator;
import com.clinic.records.repository.AppointmentRepository;
import com.clinic.records.repository.DoctorOfficeRepository;
import com.clinic.records.repository.DoctorRepository;
import com.clinic.records.repository.PatientRepository;
import com.clinic.records.tenant.ConnectionScopeBinder;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Booking, rescheduling and status changes. Every write that can create an overlap takes the doctor's row
 * lock before consulting {@link AppointmentConflictDetector}, so two bookings for one doctor never both pass.
 */
@Service
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);
    private static final DateTimeFormatter NUMBER_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final AppointmentRepository appointmentRepository;
    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;
    private final DoctorOfficeRepository officeRepository;
    private final AppointmentConflictDetector conflictDetector;
    private final ConnectionScopeBinder binder;
    private final StorageErrorTranslator errorTranslator;
    private final int defaultDurationMinutes;

    public AppointmentService(AppointmentRepository appointmentRepository,
                              PatientRepository patientRepository,
                              DoctorRepository doctorRepository,
                              DoctorOfficeRepository officeRepository,
                              AppointmentConflictDetector conflictDetector,
                              ConnectionScopeBinder binder,
                              StorageErrorTranslator errorTranslator,
                              ClinicProperties properties) {
        this.appointmentRepository = appointmentRepository;
        this.patientRepository = patientRepository;
        this.doctorRepository = doctorRepository;
        this.officeRepository = officeRepository;
        this.conflictDetector = conflictDetector;
        this.binder = binder;
        this.errorTranslator = errorTranslator;
        this.defaultDurationMinutes = properties.getAppointments().getDefaultDurationMinutes();
    }

    public Appointment book(UUID tenantId, BookAppointmentRequest request) {
        String mobile = PatientIdentityRegistry.normalizeMobile(request.getPatientMobile());
        String firstName = PatientIdentityRegistry.normalizeName(request.getPatientFirstName());
        int duration = request.getDurationMinutes() == null ? defaultDurationMinutes : request.getDurationMinutes();

        Appointment booked = binder.inTenantTransaction(tenantId, status -> {
            Patient patient = patientRepository
                    .findByTenantIdAndMobileNumberAndFirstNameAndActiveTrue(tenantId, mobile, firstName)
                    .orElseThrow(() -> NotFoundException.of("Patient", mobile + "/" + firstName));
            Doctor doctor = lockActiveDoctor(tenantId, request.getDoctorId());
            if (request.getOfficeId() != null) {
                officeRepository.findByIdAndTenantIdAndDoctorId(request.getOfficeId(), tenantId, doctor.getId())
                        .orElseThrow(() -> NotFoundException.of("Office", request.getOfficeId()));
            }
            conflictDetector.findConflict(tenantId, doctor.getId(), request.getDate(), request.getStartTime(),
                            duration, null)
                    .ifPresent(conflict -> {
                        throw new SlotConflictException(conflict.getId());
                    });

            Appointment appointment = Appointment.builder()
                    .tenantId(tenantId)
                    .appointmentNumber(nextAppointmentNumber(request.getDate()))
                    .patientId(patient.getId())
                    .patientMobileNumber(patient.getMobileNumber())
                    .patientFirstName(patient.getFirstName())
                    .doctorId(doctor.getId())
                    .officeId(request.getOfficeId())
                    .appointmentDate(request.getDate())
                    .appointmentTime(truncate(request.getStartTime()))
                    .durationMinutes(duration)
                    .status(AppointmentStatus.SCHEDULED)
                    .reasonForVisit(StringUtils.trimToNull(request.getReason()))
                    .build();
            return saveChecked("book appointment", appointment);
        });
        log.info("Booked appointment {} for doctor {} on {} {}", booked.getAppointmentNumber(),
                booked.getDoctorId(), booked.getAppointmentDate(), booked.getAppointmentTime());
        return booked;
    }

    /**
     * Moves an appointment to a new slot. The original becomes {@code RESCHEDULED} and a successor is
     * booked at the new slot, pointing back to it.
     */
    public Appointment reschedule(UUID tenantId, UUID appointmentId, RescheduleRequest request) {
        Appointment successor = binder.inTenantTransaction(tenantId, status -> {
            Appointment original = appointmentRepository.findByIdForUpdate(appointmentId, tenantId)
                    .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
            requireTransition(original, AppointmentStatus.RESCHEDULED);
            int duration = request.getDurationMinutes() == null
                    ? original.getDurationMinutes() : request.getDurationMinutes();

            lockActiveDoctor(tenantId, original.getDoctorId());
            conflictDetector.findConflict(tenantId, original.getDoctorId(), request.getNewDate(),
                            request.getNewTime(), duration, original.getId())
                    .ifPresent(conflict -> {
                        throw new SlotConflictException(conflict.getId());
                    });

            original.setStatus(AppointmentStatus.RESCHEDULED);
            original.setNotes(appendNote(original.getNotes(), "Rescheduled to " + request.getNewDate() + " "
                    + truncate(request.getNewTime()) + reasonSuffix(request.getReason())));
            appointmentRepository.save(original);

            Appointment next = Appointment.builder()
                    .tenantId(tenantId)
                    .appointmentNumber(nextAppointmentNumber(request.getNewDate()))
                    .patientId(original.getPatientId())
                    .patientMobileNumber(original.getPatientMobileNumber())
                    .patientFirstName(original.getPatientFirstName())
                    .doctorId(original.getDoctorId())
                    .officeId(original.getOfficeId())
                    .appointmentDate(request.getNewDate())
                    .appointmentTime(truncate(request.getNewTime()))
                    .durationMinutes(duration)
                    .status(AppointmentStatus.SCHEDULED)
                    .reasonForVisit(original.getReasonForVisit())
                    .rescheduledFromId(original.getId())
                    .build();
            return saveChecked("reschedule appointment", next);
        });
        log.info("Rescheduled appointment {} to {} ({} {})", appointmentId, successor.getId(),
                successor.getAppointmentDate(), successor.getAppointmentTime());
        return successor;
    }

    public Appointment changeStatus(UUID tenantId, UUID appointmentId, AppointmentStatus target, String notes) {
        if (target == AppointmentStatus.RESCHEDULED) {
            throw new InvalidStatusTransitionException("Use reschedule to move an appointment to a new slot");
        }
        Appointment updated = binder.inTenantTransaction(tenantId, status -> {
            Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId, tenantId)
                    .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
            requireTransition(appointment, target);
            appointment.setStatus(target);
            if (StringUtils.isNotBlank(notes)) {
                appointment.setNotes(appendNote(appointment.getNotes(), notes.trim()));
            }
            return appointmentRepository.save(appointment);
        });
        log.info("Appointment {} is now {}", appointmentId, target);
        return updated;
    }

    public Appointment cancel(UUID tenantId, UUID appointmentId, String reason) {
        return changeStatus(tenantId, appointmentId, AppointmentStatus.CANCELLED,
                StringUtils.isBlank(reason) ? null : "Cancelled: " + reason.trim());
    }

    public ConflictCheckResponse checkConflict(UUID tenantId, UUID doctorId, LocalDate date, LocalTime startTime,
                                               Integer durationMinutes, UUID excludeId) {
        int duration = durationMinutes == null ? defaultDurationMinutes : durationMinutes;
        return binder.inTenantReadOnly(tenantId, status ->
                conflictDetector.findConflict(tenantId, doctorId, date, startTime, duration, excludeId)
                        .map(c -> new ConflictCheckResponse(true, c.getId()))
                        .orElseGet(() -> new ConflictCheckResponse(false, null)));
    }

    public Appointment findById(UUID tenantId, UUID appointmentId) {
        return binder.inTenantReadOnly(tenantId, status ->
                appointmentRepository.findByIdAndTenantId(appointmentId, tenantId)
                        .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId)));
    }

    public List<Appointment> findByPatient(UUID tenantId, String mobileNumber, String firstName) {
        String mobile = PatientIdentityRegistry.normalizeMobile(mobileNumber);
        String name = PatientIdentityRegistry.normalizeName(firstName);
        return binder.inTenantReadOnly(tenantId, status -> appointmentRepository
                .findByTenantIdAndPatientMobileNumberAndPatientFirstNameOrderByAppointmentDateDescAppointmentTimeDesc(
                        tenantId, mobile, name));
    }

    public List<Appointment> doctorDay(UUID tenantId, UUID doctorId, LocalDate date) {
        return binder.inTenantReadOnly(tenantId, status -> appointmentRepository
                .findByTenantIdAndDoctorIdAndAppointmentDateOrderByAppointmentTimeAsc(tenantId, doctorId, date));
    }

    private Doctor lockActiveDoctor(UUID tenantId, UUID doctorId) {
        return doctorRepository.findByIdForUpdate(doctorId, tenantId)
                .filter(Doctor::isActive)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
    }

    private void requireTransition(Appointment appointment, AppointmentStatus target) {
        if (!appointment.getStatus().canTransitionTo(target)) {
            throw new InvalidStatusTransitionException("Cannot change appointment "
                    + appointment.getAppointmentNumber() + " from " + appointment.getStatus() + " to " + target);
        }
    }

    private Appointment saveChecked(String operation, Appointment appointment) {
        try {
            return appointmentRepository.saveAndFlush(appointment);
        } catch (DataIntegrityViolationException e) {
            throw errorTranslator.translateWrite(operation, e,
                    () -> new DuplicateIdentityException("Appointment number collision, please retry"));
        }
    }

    private String nextAppointmentNumber(LocalDate date) {
        String number;
        do {
            number = "APT-" + date.format(NUMBER_DATE) + "-"
                    + RandomStringUtils.randomAlphanumeric(8).toUpperCase(Locale.ROOT);
        } while (appointmentRepository.existsByAppointmentNumber(number));
        return number;
    }

    private static LocalTime truncate(LocalTime time) {
        return time.withSecond(0).withNano(0);
    }

    private static String appendNote(String existing, String note) {
        return StringUtils.isBlank(existing) ? note : existing + "\n" + note;
    }

    private static String reasonSuffix(String reason) {
        return StringUtils.isBlank(reason) ? "" : ": " + reason.trim();
    }
}
