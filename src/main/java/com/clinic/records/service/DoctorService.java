package com.clinic.records.service;

import com.clinic.records.dto.AvailabilityRequest;
import com.clinic.records.dto.CreateDoctorRequest;
import com.clinic.records.dto.CreateOfficeRequest;
import com.clinic.records.entity.Doctor;
import com.clinic.records.entity.DoctorOffice;
import com.clinic.records.entity.DoctorWorkingHours;
import com.clinic.records.exception.DuplicateIdentityException;
import com.clinic.records.exception.NotFoundException;
import com.clinic.records.exception.StorageErrorTranslator;
import com.clinic.records.repository.DoctorOfficeRepository;
import com.clinic.records.repository.DoctorRepository;
import com.clinic.records.repository.DoctorWorkingHoursRepository;
import com.clinic.records.tenant.ConnectionScopeBinder;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Service
public class DoctorService {

    private static final Logger log = LoggerFactory.getLogger(DoctorService.class);

    private final DoctorRepository doctorRepository;
    private final DoctorOfficeRepository officeRepository;
    private final DoctorWorkingHoursRepository workingHoursRepository;
    private final TenantLimitService limitService;
    private final ConnectionScopeBinder binder;
    private final StorageErrorTranslator errorTranslator;

    public DoctorService(DoctorRepository doctorRepository,
                         DoctorOfficeRepository officeRepository,
                         DoctorWorkingHoursRepository workingHoursRepository,
                         TenantLimitService limitService,
                         ConnectionScopeBinder binder,
                         StorageErrorTranslator errorTranslator) {
        this.doctorRepository = doctorRepository;
        this.officeRepository = officeRepository;
        this.workingHoursRepository = workingHoursRepository;
        this.limitService = limitService;
        this.binder = binder;
        this.errorTranslator = errorTranslator;
    }

    public Doctor createDoctor(UUID tenantId, CreateDoctorRequest request) {
        String license = StringUtils.trimToEmpty(request.getLicenseNumber());
        if (license.isEmpty()) {
            throw new IllegalArgumentException("License number is required");
        }
        Doctor doctor = binder.inTenantTransaction(tenantId, status -> {
            limitService.ensureCanAddDoctor(tenantId);
            // other tenants' doctors are invisible here; the unique constraint covers them
            if (doctorRepository.existsByLicenseNumber(license)) {
                throw new DuplicateIdentityException("License number " + license + " is already registered");
            }
            Doctor saved;
            try {
                saved = doctorRepository.saveAndFlush(Doctor.builder()
                        .tenantId(tenantId)
                        .userId(request.getUserId())
                        .name(request.getName().trim())
                        .licenseNumber(license)
                        .specialization(StringUtils.defaultIfBlank(request.getSpecialization(), "General Practice"))
                        .active(true)
                        .build());
            } catch (DataIntegrityViolationException e) {
                throw errorTranslator.translateWrite("create doctor", e,
                        () -> new DuplicateIdentityException("License number " + license + " is already registered"));
            }
            if (request.getOffice() != null) {
                newOffice(tenantId, saved.getId(), request.getOffice(), true);
            }
            return saved;
        });
        log.info("Created doctor {} in tenant {}", doctor.getId(), tenantId);
        return doctor;
    }

    public DoctorOffice addOffice(UUID tenantId, UUID doctorId, CreateOfficeRequest request) {
        return binder.inTenantTransaction(tenantId, status -> {
            requireDoctor(tenantId, doctorId);
            boolean first = officeRepository.countByTenantIdAndDoctorId(tenantId, doctorId) == 0;
            return newOffice(tenantId, doctorId, request, first);
        });
    }

    public List<DoctorOffice> offices(UUID tenantId, UUID doctorId) {
        return binder.inTenantReadOnly(tenantId, status -> {
            requireDoctor(tenantId, doctorId);
            return officeRepository.findByTenantIdAndDoctorIdOrderByName(tenantId, doctorId);
        });
    }

    /**
     * Replaces the doctor's weekly schedule. Ranges are half-open and may not overlap within a day.
     */
    public List<DoctorWorkingHours> setWeeklyAvailability(UUID tenantId, UUID doctorId, AvailabilityRequest request) {
        List<AvailabilityRequest.Range> ranges = new ArrayList<>(request.getRanges());
        validate(ranges);
        List<DoctorWorkingHours> saved = binder.inTenantTransaction(tenantId, status -> {
            requireDoctor(tenantId, doctorId);
            workingHoursRepository.deleteByTenantIdAndDoctorId(tenantId, doctorId);
            workingHoursRepository.flush();
            List<DoctorWorkingHours> rows = new ArrayList<>();
            for (AvailabilityRequest.Range r : ranges) {
                rows.add(workingHoursRepository.save(DoctorWorkingHours.builder()
                        .tenantId(tenantId)
                        .doctorId(doctorId)
                        .dayOfWeek(r.getDayOfWeek())
                        .startTime(r.getStart())
                        .endTime(r.getEnd())
                        .build()));
            }
            return rows;
        });
        log.info("Set {} availability ranges for doctor {}", saved.size(), doctorId);
        return saved;
    }

    public List<DoctorWorkingHours> weeklyAvailability(UUID tenantId, UUID doctorId) {
        return binder.inTenantReadOnly(tenantId, status ->
                workingHoursRepository.findByTenantIdAndDoctorIdOrderByDayOfWeekAscStartTimeAsc(tenantId, doctorId));
    }

    public List<Doctor> findActive(UUID tenantId) {
        return binder.inTenantReadOnly(tenantId, status -> doctorRepository.findByTenantIdAndActiveTrueOrderByName(tenantId));
    }

    public Doctor getDoctor(UUID tenantId, UUID doctorId) {
        return binder.inTenantReadOnly(tenantId, status -> requireDoctor(tenantId, doctorId));
    }

    private Doctor requireDoctor(UUID tenantId, UUID doctorId) {
        return doctorRepository.findByIdAndTenantId(doctorId, tenantId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
    }

    private DoctorOffice newOffice(UUID tenantId, UUID doctorId, CreateOfficeRequest request, boolean primary) {
        return officeRepository.save(DoctorOffice.builder()
                .tenantId(tenantId)
                .doctorId(doctorId)
                .name(request.getName().trim())
                .address(request.getAddress())
                .phone(request.getPhone())
                .primary(primary)
                .build());
    }

    private static void validate(List<AvailabilityRequest.Range> ranges) {
        ranges.sort(Comparator.comparingInt(AvailabilityRequest.Range::getDayOfWeek)
                .thenComparing(AvailabilityRequest.Range::getStart));
        AvailabilityRequest.Range previous = null;
        for (AvailabilityRequest.Range r : ranges) {
            if (r.getDayOfWeek() < 1 || r.getDayOfWeek() > 7) {
                throw new IllegalArgumentException("Day of week must be 1..7: " + r.getDayOfWeek());
            }
            if (!r.getStart().isBefore(r.getEnd())) {
                throw new IllegalArgumentException("Range start must be before end: " + r.getStart() + "-" + r.getEnd());
            }
            if (previous != null && previous.getDayOfWeek() == r.getDayOfWeek()
                    && r.getStart().isBefore(previous.getEnd())) {
                throw new IllegalArgumentException("Overlapping availability on day " + r.getDayOfWeek());
            }
            previous = r;
        }
    }
}
