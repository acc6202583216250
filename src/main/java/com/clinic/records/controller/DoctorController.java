package com.clinic.records.controller;

import com.clinic.records.auth.AccessGuard;
import com.clinic.records.auth.IdentityClaims;
import com.clinic.records.dto.AvailabilityRequest;
import com.clinic.records.dto.CreateDoctorRequest;
import com.clinic.records.dto.CreateOfficeRequest;
import com.clinic.records.dto.DoctorResponse;
import com.clinic.records.dto.OfficeResponse;
import com.clinic.records.dto.SlotResponse;
import com.clinic.records.entity.DoctorWorkingHours;
import com.clinic.records.service.DoctorService;
import com.clinic.records.service.SlotService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static com.clinic.records.auth.Permission.BASIC_PATIENT_INFO;
import static com.clinic.records.auth.Permission.MANAGE_DOCTORS;
import static com.clinic.records.auth.Permission.SCHEDULE_APPOINTMENTS;

@RestController
@RequestMapping("/api/v1/doctors")
public class DoctorController {

    private final DoctorService doctorService;
    private final SlotService slotService;
    private final AccessGuard accessGuard;

    public DoctorController(DoctorService doctorService, SlotService slotService, AccessGuard accessGuard) {
        this.doctorService = doctorService;
        this.slotService = slotService;
        this.accessGuard = accessGuard;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DoctorResponse create(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                 @Valid @RequestBody CreateDoctorRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, MANAGE_DOCTORS);
        return DoctorResponse.from(doctorService.createDoctor(tenantId, request));
    }

    @GetMapping
    public List<DoctorResponse> list(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims) {
        UUID tenantId = accessGuard.requireTenant(claims);
        return doctorService.findActive(tenantId).stream().map(DoctorResponse::from).toList();
    }

    @GetMapping("/{doctorId}")
    public DoctorResponse get(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                              @PathVariable UUID doctorId) {
        UUID tenantId = accessGuard.requireTenant(claims);
        return DoctorResponse.from(doctorService.getDoctor(tenantId, doctorId));
    }

    @PostMapping("/{doctorId}/offices")
    @ResponseStatus(HttpStatus.CREATED)
    public OfficeResponse addOffice(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                    @PathVariable UUID doctorId,
                                    @Valid @RequestBody CreateOfficeRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, MANAGE_DOCTORS);
        return OfficeResponse.from(doctorService.addOffice(tenantId, doctorId, request));
    }

    @GetMapping("/{doctorId}/offices")
    public List<OfficeResponse> offices(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                        @PathVariable UUID doctorId) {
        UUID tenantId = accessGuard.requireTenant(claims);
        return doctorService.offices(tenantId, doctorId).stream().map(OfficeResponse::from).toList();
    }

    @PutMapping("/{doctorId}/availability")
    public List<AvailabilityRequest.Range> setAvailability(
            @RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
            @PathVariable UUID doctorId,
            @Valid @RequestBody AvailabilityRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, MANAGE_DOCTORS);
        return toRanges(doctorService.setWeeklyAvailability(tenantId, doctorId, request));
    }

    @GetMapping("/{doctorId}/availability")
    public List<AvailabilityRequest.Range> availability(
            @RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
            @PathVariable UUID doctorId) {
        UUID tenantId = accessGuard.requireTenant(claims);
        return toRanges(doctorService.weeklyAvailability(tenantId, doctorId));
    }

    @GetMapping("/{doctorId}/slots")
    public List<SlotResponse> slots(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                    @PathVariable UUID doctorId,
                                    @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        UUID tenantId = accessGuard.requireAny(claims, SCHEDULE_APPOINTMENTS, BASIC_PATIENT_INFO, MANAGE_DOCTORS);
        return slotService.availableSlots(tenantId, doctorId, date);
    }

    private static List<AvailabilityRequest.Range> toRanges(List<DoctorWorkingHours> rows) {
        return rows.stream()
                .map(h -> new AvailabilityRequest.Range(h.getDayOfWeek(), h.getStartTime(), h.getEndTime()))
                .toList();
    }
}
