package com.clinic.records.controller;

import com.clinic.records.auth.AccessGuard;
import com.clinic.records.auth.IdentityClaims;
import com.clinic.records.dto.AppointmentResponse;
import com.clinic.records.dto.BookAppointmentRequest;
import com.clinic.records.dto.ConflictCheckResponse;
import com.clinic.records.dto.RescheduleRequest;
import com.clinic.records.dto.StatusChangeRequest;
import com.clinic.records.service.AppointmentService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import static com.clinic.records.auth.Permission.SCHEDULE_APPOINTMENTS;
import static com.clinic.records.auth.Permission.VIEW_APPOINTMENTS;

@RestController
@RequestMapping("/api/v1/appointments")
public class AppointmentController {

    private final AppointmentService appointmentService;
    private final AccessGuard accessGuard;

    public AppointmentController(AppointmentService appointmentService, AccessGuard accessGuard) {
        this.appointmentService = appointmentService;
        this.accessGuard = accessGuard;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AppointmentResponse book(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                    @Valid @RequestBody BookAppointmentRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, SCHEDULE_APPOINTMENTS);
        return AppointmentResponse.from(appointmentService.book(tenantId, request));
    }

    @GetMapping("/{appointmentId}")
    public AppointmentResponse get(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                   @PathVariable UUID appointmentId) {
        UUID tenantId = accessGuard.requireAny(claims, SCHEDULE_APPOINTMENTS, VIEW_APPOINTMENTS);
        return AppointmentResponse.from(appointmentService.findById(tenantId, appointmentId));
    }

    @PostMapping("/{appointmentId}/reschedule")
    @ResponseStatus(HttpStatus.CREATED)
    public AppointmentResponse reschedule(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                          @PathVariable UUID appointmentId,
                                          @Valid @RequestBody RescheduleRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, SCHEDULE_APPOINTMENTS);
        return AppointmentResponse.from(appointmentService.reschedule(tenantId, appointmentId, request));
    }

    @PostMapping("/{appointmentId}/status")
    public AppointmentResponse changeStatus(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                            @PathVariable UUID appointmentId,
                                            @Valid @RequestBody StatusChangeRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, SCHEDULE_APPOINTMENTS);
        return AppointmentResponse.from(
                appointmentService.changeStatus(tenantId, appointmentId, request.getStatus(), request.getNotes()));
    }

    @PostMapping("/{appointmentId}/cancel")
    public AppointmentResponse cancel(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                      @PathVariable UUID appointmentId,
                                      @RequestParam(required = false) String reason) {
        UUID tenantId = accessGuard.requireAny(claims, SCHEDULE_APPOINTMENTS);
        return AppointmentResponse.from(appointmentService.cancel(tenantId, appointmentId, reason));
    }

    @GetMapping("/conflicts")
    public ConflictCheckResponse conflicts(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                           @RequestParam UUID doctorId,
                                           @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                           @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime startTime,
                                           @RequestParam(required = false) Integer durationMinutes,
                                           @RequestParam(required = false) UUID excludeId) {
        UUID tenantId = accessGuard.requireAny(claims, SCHEDULE_APPOINTMENTS);
        return appointmentService.checkConflict(tenantId, doctorId, date, startTime, durationMinutes, excludeId);
    }

    @GetMapping("/doctor/{doctorId}")
    public List<AppointmentResponse> doctorDay(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                               @PathVariable UUID doctorId,
                                               @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        UUID tenantId = accessGuard.requireAny(claims, SCHEDULE_APPOINTMENTS);
        return appointmentService.doctorDay(tenantId, doctorId, date).stream()
                .map(AppointmentResponse::from).toList();
    }
}
