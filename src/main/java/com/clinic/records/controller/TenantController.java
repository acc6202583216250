package com.clinic.records.controller;

import com.clinic.records.auth.AccessGuard;
import com.clinic.records.auth.IdentityClaims;
import com.clinic.records.auth.Permission;
import com.clinic.records.auth.Role;
import com.clinic.records.dto.ChangePlanRequest;
import com.clinic.records.dto.ClinicRegistrationRequest;
import com.clinic.records.dto.ClinicRegistrationResponse;
import com.clinic.records.dto.TenantResponse;
import com.clinic.records.dto.TenantUsageResponse;
import com.clinic.records.exception.ForbiddenException;
import com.clinic.records.service.TenantService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/tenants")
public class TenantController {

    private final TenantService tenantService;
    private final AccessGuard accessGuard;

    public TenantController(TenantService tenantService, AccessGuard accessGuard) {
        this.tenantService = tenantService;
        this.accessGuard = accessGuard;
    }

    /** Public: the caller has no tenant yet. */
    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public ClinicRegistrationResponse register(@Valid @RequestBody ClinicRegistrationRequest request) {
        return tenantService.registerClinic(request);
    }

    @GetMapping("/current")
    public TenantResponse current(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims) {
        return TenantResponse.from(tenantService.getTenant(accessGuard.requireTenant(claims)));
    }

    @GetMapping("/current/usage")
    public TenantUsageResponse usage(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims) {
        return tenantService.usage(accessGuard.requireAny(claims, Permission.SYSTEM_CONFIG, Permission.MANAGE_USERS));
    }

    @PostMapping("/{tenantId}/plan")
    public TenantResponse changePlan(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                     @PathVariable UUID tenantId,
                                     @Valid @RequestBody ChangePlanRequest request) {
        requireSuperAdmin(claims);
        return TenantResponse.from(tenantService.changePlan(tenantId, request));
    }

    @PostMapping("/{tenantId}/deactivate")
    public TenantResponse deactivate(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                     @PathVariable UUID tenantId) {
        requireSuperAdmin(claims);
        return TenantResponse.from(tenantService.deactivate(tenantId));
    }

    private void requireSuperAdmin(IdentityClaims claims) {
        accessGuard.requireAuthenticated(claims);
        if (claims.role() != Role.SUPER_ADMIN) {
            throw new ForbiddenException("Platform administrators only");
        }
    }
}
