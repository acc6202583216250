package com.clinic.records.controller;

import com.clinic.records.auth.AccessGuard;
import com.clinic.records.auth.IdentityClaims;
import com.clinic.records.dto.CreateTemplateRequest;
import com.clinic.records.dto.TemplateResponse;
import com.clinic.records.service.PrescriptionTemplateService;
import com.clinic.records.service.TemplateResolutionChain;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

import static com.clinic.records.auth.Permission.CREATE_PRESCRIPTIONS;
import static com.clinic.records.auth.Permission.SYSTEM_CONFIG;
import static com.clinic.records.auth.Permission.VIEW_ALL_PRESCRIPTIONS;
import static com.clinic.records.auth.Permission.VIEW_PRESCRIPTIONS;

@RestController
@RequestMapping("/api/v1/prescription-templates")
public class PrescriptionTemplateController {

    private final PrescriptionTemplateService templateService;
    private final TemplateResolutionChain resolutionChain;
    private final AccessGuard accessGuard;

    public PrescriptionTemplateController(PrescriptionTemplateService templateService,
                                          TemplateResolutionChain resolutionChain,
                                          AccessGuard accessGuard) {
        this.templateService = templateService;
        this.resolutionChain = resolutionChain;
        this.accessGuard = accessGuard;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TemplateResponse create(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                   @Valid @RequestBody CreateTemplateRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS, SYSTEM_CONFIG);
        return TemplateResponse.from(templateService.create(tenantId, request));
    }

    @GetMapping
    public List<TemplateResponse> list(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                       @RequestParam(required = false) UUID doctorId) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS, SYSTEM_CONFIG, VIEW_ALL_PRESCRIPTIONS);
        return templateService.list(tenantId, doctorId).stream().map(TemplateResponse::from).toList();
    }

    @PostMapping("/{templateId}/default")
    public TemplateResponse makeDefault(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                        @PathVariable UUID templateId) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS, SYSTEM_CONFIG);
        return TemplateResponse.from(templateService.setDefault(tenantId, templateId));
    }

    @PostMapping("/{templateId}/deactivate")
    public TemplateResponse deactivate(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                       @PathVariable UUID templateId) {
        UUID tenantId = accessGuard.requireAny(claims, CREATE_PRESCRIPTIONS, SYSTEM_CONFIG);
        return TemplateResponse.from(templateService.deactivate(tenantId, templateId));
    }

    /**
     * The template a prescription for this doctor and office would print with. 204 means the built-in layout.
     */
    @GetMapping("/effective")
    public ResponseEntity<TemplateResponse> effective(
            @RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
            @RequestParam(required = false) UUID doctorId,
            @RequestParam(required = false) UUID officeId) {
        UUID tenantId = accessGuard.requireAny(claims,
                CREATE_PRESCRIPTIONS, SYSTEM_CONFIG, VIEW_ALL_PRESCRIPTIONS, VIEW_PRESCRIPTIONS);
        return resolutionChain.resolve(tenantId, doctorId, officeId)
                .map(resolved -> {
                    TemplateResponse body = TemplateResponse.from(resolved.template());
                    body.setResolvedBy(resolved.step().name());
                    return ResponseEntity.ok(body);
                })
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
