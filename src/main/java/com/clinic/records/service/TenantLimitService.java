package com.clinic.records.service;

import com.clinic.records.dto.TenantUsageResponse;
import com.clinic.records.entity.Tenant;
import com.clinic.records.exception.ForbiddenException;
import com.clinic.records.exception.NotFoundException;
import com.clinic.records.exception.PlanLimitExceededException;
import com.clinic.records.repository.DoctorRepository;
import com.clinic.records.repository.PatientRepository;
import com.clinic.records.repository.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Subscription resource limits. Expects to run inside the caller's tenant transaction.
 */
@Service
public class TenantLimitService {

    private static final Logger log = LoggerFactory.getLogger(TenantLimitService.class);

    private final TenantRepository tenantRepository;
    private final DoctorRepository doctorRepository;
    private final PatientRepository patientRepository;

    public TenantLimitService(TenantRepository tenantRepository,
                              DoctorRepository doctorRepository,
                              PatientRepository patientRepository) {
        this.tenantRepository = tenantRepository;
        this.doctorRepository = doctorRepository;
        this.patientRepository = patientRepository;
    }

    public Tenant activeTenant(UUID tenantId) {
        Tenant tenant = tenantRepository.findById(tenantId)
                .orElseThrow(() -> NotFoundException.of("Tenant", tenantId));
        if (!tenant.isActive()) {
            throw new ForbiddenException("Tenant " + tenant.getTenantCode() + " is deactivated");
        }
        return tenant;
    }

    public void ensureCanAddDoctor(UUID tenantId) {
        Tenant tenant = activeTenant(tenantId);
        long doctors = doctorRepository.countByTenantIdAndActiveTrue(tenantId);
        if (doctors >= tenant.getMaxDoctors()) {
            log.warn("Tenant {} reached doctor limit {}", tenantId, tenant.getMaxDoctors());
            throw new PlanLimitExceededException("Doctor limit of " + tenant.getMaxDoctors()
                    + " reached for plan " + tenant.getSubscriptionPlan());
        }
    }

    public void ensureCanAddPatient(UUID tenantId) {
        Tenant tenant = activeTenant(tenantId);
        long patients = patientRepository.countByTenantIdAndActiveTrue(tenantId);
        if (patients >= tenant.getMaxPatients()) {
            log.warn("Tenant {} reached patient limit {}", tenantId, tenant.getMaxPatients());
            throw new PlanLimitExceededException("Patient limit of " + tenant.getMaxPatients()
                    + " reached for plan " + tenant.getSubscriptionPlan());
        }
    }

    public TenantUsageResponse usage(UUID tenantId) {
        Tenant tenant = activeTenant(tenantId);
        long doctors = doctorRepository.countByTenantIdAndActiveTrue(tenantId);
        long patients = patientRepository.countByTenantIdAndActiveTrue(tenantId);
        return TenantUsageResponse.builder()
                .doctors(doctors)
                .maxDoctors(tenant.getMaxDoctors())
                .patients(patients)
                .maxPatients(tenant.getMaxPatients())
                .canAddDoctor(doctors < tenant.getMaxDoctors())
                .canAddPatient(patients < tenant.getMaxPatients())
                .build();
    }
}
