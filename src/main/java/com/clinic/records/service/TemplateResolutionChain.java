package com.clinic.records.service;

import com.clinic.records.entity.PrescriptionTemplate;
import com.clinic.records.repository.PrescriptionTemplateRepository;
import com.clinic.records.tenant.ConnectionScopeBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Picks the prescription template that applies to a doctor at an office, falling back from the most specific
 * scope to the tenant-wide one. Each step is its own lookup so the step that matched can be logged and
 * reported.
 */
@Component
public class TemplateResolutionChain {

    private static final Logger log = LoggerFactory.getLogger(TemplateResolutionChain.class);

    public enum Step {
        DOCTOR_OFFICE,
        DOCTOR_DEFAULT,
        DOCTOR_ANY,
        TENANT_DEFAULT,
        TENANT_ANY
    }

    public record ResolvedTemplate(PrescriptionTemplate template, Step step) {
    }

    private final PrescriptionTemplateRepository templateRepository;
    private final ConnectionScopeBinder binder;

    public TemplateResolutionChain(PrescriptionTemplateRepository templateRepository, ConnectionScopeBinder binder) {
        this.templateRepository = templateRepository;
        this.binder = binder;
    }

    /**
     * @return empty when the tenant has no active template at all; callers then use the built-in layout
     */
    public Optional<ResolvedTemplate> resolve(UUID tenantId, UUID doctorId, UUID officeId) {
        Optional<ResolvedTemplate> resolved = binder.inTenantReadOnly(tenantId,
                status -> lookup(tenantId, doctorId, officeId));
        if (resolved.isPresent()) {
            log.debug("Template {} resolved by {} for doctor={} office={}",
                    resolved.get().template().getId(), resolved.get().step(), doctorId, officeId);
        } else {
            log.debug("No template for doctor={} office={}, using built-in layout", doctorId, officeId);
        }
        return resolved;
    }

    private Optional<ResolvedTemplate> lookup(UUID tenantId, UUID doctorId, UUID officeId) {
        Optional<PrescriptionTemplate> found;
        if (doctorId != null && officeId != null) {
            found = templateRepository
                    .findFirstByTenantIdAndDoctorIdAndOfficeIdAndActiveTrueOrderByDefaultTemplateDescCreatedAtAsc(
                            tenantId, doctorId, officeId);
            if (found.isPresent()) {
                return found.map(t -> new ResolvedTemplate(t, Step.DOCTOR_OFFICE));
            }
        }
        if (doctorId != null) {
            found = templateRepository
                    .findFirstByTenantIdAndDoctorIdAndOfficeIdIsNullAndDefaultTemplateTrueAndActiveTrue(tenantId, doctorId);
            if (found.isPresent()) {
                return found.map(t -> new ResolvedTemplate(t, Step.DOCTOR_DEFAULT));
            }
            found = templateRepository
                    .findFirstByTenantIdAndDoctorIdAndOfficeIdIsNullAndActiveTrueOrderByCreatedAtAsc(tenantId, doctorId);
            if (found.isPresent()) {
                return found.map(t -> new ResolvedTemplate(t, Step.DOCTOR_ANY));
            }
        }
        found = templateRepository
                .findFirstByTenantIdAndDoctorIdIsNullAndOfficeIdIsNullAndDefaultTemplateTrueAndActiveTrue(tenantId);
        if (found.isPresent()) {
            return found.map(t -> new ResolvedTemplate(t, Step.TENANT_DEFAULT));
        }
        return templateRepository
                .findFirstByTenantIdAndDoctorIdIsNullAndOfficeIdIsNullAndActiveTrueOrderByCreatedAtAsc(tenantId)
                .map(t -> new ResolvedTemplate(t, Step.TENANT_ANY));
    }
}
