package com.clinic.records.controller;

import com.clinic.records.auth.AccessGuard;
import com.clinic.records.auth.IdentityClaims;
import com.clinic.records.dto.CreatePrescriptionRequest;
import com.clinic.records.dto.PrescriptionResponse;
import com.clinic.records.dto.PrescriptionStatusRequest;
import com.clinic.records.service.PrescriptionService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static com.clinic.records.auth.Permission.CREATE_PRESCRIPTIONS;
import static com.clinic.records.auth.Permission.VIEW_ALL_PRESCRIPTIONS;
import static com.clinic.records.auth.Permission.VIEW_PRESCRIPTIONS;

@RestController
@RequestMapping("/api/v1/prescriptions")
public class PrescriptionController {

    private final PrescriptionService prescriptionService;
    private final AccessGuard accessGuard;

    public PrescriptionController(PrescriptionService prescriptionService, AccessGuard accessGuard) {
        this.prescriptionService = prescriptionService;
        this.accessGuard = accessGuard;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public PrescriptionResponse create(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                       @Valid @RequestBody CreatePrescriptionRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS);
        return PrescriptionResponse.from(prescriptionService.create(tenantId, request));
    }

    @GetMapping("/{prescriptionId}")
    public PrescriptionResponse get(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                    @PathVariable UUID prescriptionId) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS, VIEW_PRESCRIPTIONS, VIEW_ALL_PRESCRIPTIONS);
        return PrescriptionResponse.from(prescriptionService.findById(tenantId, prescriptionId));
    }

    @GetMapping("/number/{prescriptionNumber}")
    public PrescriptionResponse byNumber(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                         @PathVariable String prescriptionNumber) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS, VIEW_PRESCRIPTIONS, VIEW_ALL_PRESCRIPTIONS);
        return PrescriptionResponse.from(prescriptionService.findByNumber(tenantId, prescriptionNumber));
    }

    @GetMapping("/patient")
    public List<PrescriptionResponse> forPatient(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                                 @RequestParam String mobile,
                                                 @RequestParam String firstName) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS, VIEW_PRESCRIPTIONS, VIEW_ALL_PRESCRIPTIONS);
        return prescriptionService.findByPatient(tenantId, mobile, firstName).stream()
                .map(PrescriptionResponse::from).toList();
    }

    @GetMapping("/doctor/{doctorId}")
    public List<PrescriptionResponse> forDoctor(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                                @PathVariable UUID doctorId,
                                                @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                                @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS, VIEW_PRESCRIPTIONS, VIEW_ALL_PRESCRIPTIONS);
        return prescriptionService.findByDoctor(tenantId, doctorId, from, to).stream()
                .map(PrescriptionResponse::from).toList();
    }

    @PostMapping("/{prescriptionId}/status")
    public PrescriptionResponse changeStatus(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                             @PathVariable UUID prescriptionId,
                                             @Valid @RequestBody PrescriptionStatusRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS);
        return PrescriptionResponse.from(prescriptionService.changeStatus(tenantId, prescriptionId,
                request.getStatus(), request.getNotes()));
    }

    @PostMapping("/{prescriptionId}/print")
    public PrescriptionResponse print(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                      @PathVariable UUID prescriptionId,
                                      @RequestParam(required = false) UUID officeId) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS, VIEW_PRESCRIPTIONS);
        return PrescriptionResponse.from(prescriptionService.markPrinted(tenantId, prescriptionId, officeId));
    }
}
