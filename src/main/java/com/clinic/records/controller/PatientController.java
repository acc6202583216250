package com.clinic.records.controller;

import com.clinic.records.auth.AccessGuard;
import com.clinic.records.auth.IdentityClaims;
import com.clinic.records.dto.AppointmentResponse;
import com.clinic.records.dto.FamilyEligibilityResponse;
import com.clinic.records.dto.PatientResponse;
import com.clinic.records.dto.RegisterPatientRequest;
import com.clinic.records.dto.UpdatePatientRequest;
import com.clinic.records.service.AppointmentService;
import com.clinic.records.service.PatientIdentityRegistry;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

import static com.clinic.records.auth.Permission.BASIC_PATIENT_INFO;
import static com.clinic.records.auth.Permission.MANAGE_PATIENTS;
import static com.clinic.records.auth.Permission.REGISTER_PATIENTS;
import static com.clinic.records.auth.Permission.SCHEDULE_APPOINTMENTS;

/**
 * Patients are addressed by mobile number and first name; the surrogate id route exists for joins from
 * other records.
 */
@RestController
@RequestMapping("/api/v1/patients")
public class PatientController {

    private final PatientIdentityRegistry registry;
    private final AppointmentService appointmentService;
    private final AccessGuard accessGuard;

    public PatientController(PatientIdentityRegistry registry,
                             AppointmentService appointmentService,
                             AccessGuard accessGuard) {
        this.registry = registry;
        this.appointmentService = appointmentService;
        this.accessGuard = accessGuard;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public PatientResponse register(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                    @Valid @RequestBody RegisterPatientRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, REGISTER_PATIENTS, MANAGE_PATIENTS);
        return PatientResponse.from(registry.register(tenantId, request));
    }

    @GetMapping("/{mobile}/{firstName}")
    public PatientResponse lookup(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                  @PathVariable String mobile, @PathVariable String firstName) {
        UUID tenantId = accessGuard.requireAny(claims, REGISTER_PATIENTS, MANAGE_PATIENTS, BASIC_PATIENT_INFO);
        return PatientResponse.from(registry.lookup(tenantId, mobile, firstName));
    }

    @GetMapping("/by-id/{patientId}")
    public PatientResponse byId(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                @PathVariable UUID patientId) {
        UUID tenantId = accessGuard.requireAny(claims, REGISTER_PATIENTS, MANAGE_PATIENTS, BASIC_PATIENT_INFO);
        return PatientResponse.from(registry.findById(tenantId, patientId));
    }

    @PutMapping("/{mobile}/{firstName}")
    public PatientResponse update(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                  @PathVariable String mobile, @PathVariable String firstName,
                                  @Valid @RequestBody UpdatePatientRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, REGISTER_PATIENTS, MANAGE_PATIENTS);
        return PatientResponse.from(registry.update(tenantId, mobile, firstName, request));
    }

    @GetMapping("/families/{mobile}")
    public List<PatientResponse> family(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                        @PathVariable String mobile) {
        UUID tenantId = accessGuard.requireAny(claims, REGISTER_PATIENTS, MANAGE_PATIENTS, BASIC_PATIENT_INFO);
        return registry.listFamily(tenantId, mobile).stream().map(PatientResponse::from).toList();
    }

    @GetMapping("/families/{mobile}/eligibility")
    public FamilyEligibilityResponse eligibility(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                                 @PathVariable String mobile) {
        UUID tenantId = accessGuard.requireAny(claims, REGISTER_PATIENTS, MANAGE_PATIENTS);
        return registry.familyEligibility(tenantId, mobile);
    }

    @PostMapping("/{mobile}/{firstName}/deactivate")
    public PatientResponse deactivate(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                      @PathVariable String mobile, @PathVariable String firstName) {
        UUID tenantId = accessGuard.requireAny(claims, MANAGE_PATIENTS);
        return PatientResponse.from(registry.deactivate(tenantId, mobile, firstName));
    }

    @PostMapping("/{mobile}/{firstName}/reactivate")
    public PatientResponse reactivate(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                      @PathVariable String mobile, @PathVariable String firstName) {
        UUID tenantId = accessGuard.requireAny(claims, MANAGE_PATIENTS);
        return PatientResponse.from(registry.reactivate(tenantId, mobile, firstName));
    }

    @GetMapping("/{mobile}/{firstName}/appointments")
    public List<AppointmentResponse> appointments(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                                  @PathVariable String mobile, @PathVariable String firstName) {
        UUID tenantId = accessGuard.requireAny(claims, SCHEDULE_APPOINTMENTS, MANAGE_PATIENTS);
        return appointmentService.findByPatient(tenantId, mobile, firstName).stream()
                .map(AppointmentResponse::from).toList();
    }
}
