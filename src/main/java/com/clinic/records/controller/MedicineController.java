package com.clinic.records.controller;

import com.clinic.records.auth.AccessGuard;
import com.clinic.records.auth.IdentityClaims;
import com.clinic.records.dto.CreateMedicineRequest;
import com.clinic.records.dto.MedicineResponse;
import com.clinic.records.service.MedicineCatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

import static com.clinic.records.auth.Permission.CREATE_PRESCRIPTIONS;
import static com.clinic.records.auth.Permission.MANAGE_MEDICINES;

@RestController
@RequestMapping("/api/v1/medicines")
public class MedicineController {

    private final MedicineCatalogService catalogService;
    private final AccessGuard accessGuard;

    public MedicineController(MedicineCatalogService catalogService, AccessGuard accessGuard) {
        this.catalogService = catalogService;
        this.accessGuard = accessGuard;
    }

    @GetMapping
    public List<MedicineResponse> search(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                         @RequestParam(name = "q", required = false) String query) {
        UUID tenantId = accessGuard.requireTenant(claims);
        return catalogService.search(tenantId, query).stream().map(MedicineResponse::from).toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MedicineResponse add(@RequestAttribute(IdentityClaims.REQUEST_ATTRIBUTE) IdentityClaims claims,
                                @Valid @RequestBody CreateMedicineRequest request) {
        UUID tenantId = accessGuard.requireAny(claims, MANAGE_MEDICINES, CREATE_PRESCRIPTIONS);
        return MedicineResponse.from(catalogService.addTenantMedicine(tenantId, request));
    }
}
