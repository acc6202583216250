package com.clinic.records.service;

import com.clinic.records.dto.CreateTemplateRequest;
import com.clinic.records.entity.PrescriptionTemplate;
import com.clinic.records.exception.NotFoundException;
import com.clinic.records.repository.DoctorOfficeRepository;
import com.clinic.records.repository.DoctorRepository;
import com.clinic.records.repository.PrescriptionTemplateRepository;
import com.clinic.records.repository.TenantRepository;
import com.clinic.records.tenant.ConnectionScopeBinder;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class PrescriptionTemplateService {

    private static final Logger log = LoggerFactory.getLogger(PrescriptionTemplateService.class);

    private final PrescriptionTemplateRepository templateRepository;
    private final DoctorRepository doctorRepository;
    private final DoctorOfficeRepository officeRepository;
    private final TenantRepository tenantRepository;
    private final ConnectionScopeBinder binder;

    public PrescriptionTemplateService(PrescriptionTemplateRepository templateRepository,
                                       DoctorRepository doctorRepository,
                                       DoctorOfficeRepository officeRepository,
                                       TenantRepository tenantRepository,
                                       ConnectionScopeBinder binder) {
        this.templateRepository = templateRepository;
        this.doctorRepository = doctorRepository;
        this.officeRepository = officeRepository;
        this.tenantRepository = tenantRepository;
        this.binder = binder;
    }

    public PrescriptionTemplate create(UUID tenantId, CreateTemplateRequest request) {
        if (request.getOfficeId() != null && request.getDoctorId() == null) {
            throw new IllegalArgumentException("An office template must also name its doctor");
        }
        PrescriptionTemplate created = binder.inTenantTransaction(tenantId, status -> {
            if (request.getDoctorId() != null) {
                doctorRepository.findByIdAndTenantId(request.getDoctorId(), tenantId)
                        .orElseThrow(() -> NotFoundException.of("Doctor", request.getDoctorId()));
            }
            if (request.getOfficeId() != null) {
                officeRepository.findByIdAndTenantIdAndDoctorId(request.getOfficeId(), tenantId, request.getDoctorId())
                        .orElseThrow(() -> NotFoundException.of("Office", request.getOfficeId()));
            }
            if (request.isMakeDefault()) {
                lockScope(tenantId, request.getDoctorId());
                clearDefaults(tenantId, request.getDoctorId(), request.getOfficeId());
            }
            PrescriptionTemplate template = PrescriptionTemplate.builder()
                    .tenantId(tenantId)
                    .doctorId(request.getDoctorId())
                    .officeId(request.getOfficeId())
                    .name(request.getName().trim())
                    .description(request.getDescription())
                    .paperSize(StringUtils.defaultIfBlank(request.getPaperSize(), "a4"))
                    .orientation(StringUtils.defaultIfBlank(request.getOrientation(), "portrait"))
                    .marginTop(request.getMarginTop())
                    .marginBottom(request.getMarginBottom())
                    .marginLeft(request.getMarginLeft())
                    .marginRight(request.getMarginRight())
                    .layoutConfig(request.getLayoutConfig())
                    .signatureText(request.getSignatureText())
                    .presetType(request.getPresetType())
                    .defaultTemplate(request.isMakeDefault())
                    .active(true)
                    .build();
            return templateRepository.save(template);
        });
        log.info("Created prescription template {} (doctor={}, office={}, default={})",
                created.getId(), created.getDoctorId(), created.getOfficeId(), created.isDefaultTemplate());
        return created;
    }

    /** Marks the template as its scope's default; the previous default of the same scope loses the flag. */
    public PrescriptionTemplate setDefault(UUID tenantId, UUID templateId) {
        return binder.inTenantTransaction(tenantId, status -> {
            PrescriptionTemplate template = activeTemplate(tenantId, templateId);
            lockScope(tenantId, template.getDoctorId());
            clearDefaults(tenantId, template.getDoctorId(), template.getOfficeId());
            // re-read under the lock: the template may have been deactivated meanwhile
            activeTemplate(tenantId, templateId);
            templateRepository.markDefault(tenantId, templateId, Instant.now());
            log.info("Template {} is now the default for doctor={} office={}",
                    templateId, template.getDoctorId(), template.getOfficeId());
            return activeTemplate(tenantId, templateId);
        });
    }

    public PrescriptionTemplate deactivate(UUID tenantId, UUID templateId) {
        return binder.inTenantTransaction(tenantId, status -> {
            PrescriptionTemplate template = activeTemplate(tenantId, templateId);
            template.setActive(false);
            template.setDefaultTemplate(false);
            return templateRepository.save(template);
        });
    }

    public List<PrescriptionTemplate> list(UUID tenantId, UUID doctorId) {
        return binder.inTenantReadOnly(tenantId, status -> doctorId == null
                ? templateRepository.findByTenantIdAndActiveTrueOrderByCreatedAtAsc(tenantId)
                : templateRepository.findByTenantIdAndDoctorIdAndActiveTrueOrderByCreatedAtAsc(tenantId, doctorId));
    }

    private PrescriptionTemplate activeTemplate(UUID tenantId, UUID templateId) {
        return templateRepository.findByIdAndTenantId(templateId, tenantId)
                .filter(PrescriptionTemplate::isActive)
                .orElseThrow(() -> NotFoundException.of("Prescription template", templateId));
    }

    /**
     * Locks the row owning a template scope: the doctor for doctor and office templates, the tenant for
     * clinic-wide ones. Default changes within one scope then run one at a time.
     */
    private void lockScope(UUID tenantId, UUID doctorId) {
        if (doctorId == null) {
            tenantRepository.findByIdForUpdate(tenantId)
                    .orElseThrow(() -> NotFoundException.of("Tenant", tenantId));
        } else {
            doctorRepository.findByIdForUpdate(doctorId, tenantId)
                    .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        }
    }

    private void clearDefaults(UUID tenantId, UUID doctorId, UUID officeId) {
        Instant now = Instant.now();
        int cleared;
        if (doctorId == null) {
            cleared = templateRepository.clearTenantDefaults(tenantId, now);
        } else if (officeId == null) {
            cleared = templateRepository.clearDoctorDefaults(tenantId, doctorId, now);
        } else {
            cleared = templateRepository.clearOfficeDefaults(tenantId, doctorId, officeId, now);
        }
        log.debug("Cleared {} previous default(s) for doctor={} office={}", cleared, doctorId, officeId);
    }
}
