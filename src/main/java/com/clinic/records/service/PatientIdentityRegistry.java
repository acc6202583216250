package com.clinic.records.service;

import com.clinic.records.config.ClinicProperties;
import com.clinic.records.dto.FamilyEligibilityResponse;
import com.clinic.records.dto.RegisterPatientRequest;
import com.clinic.records.dto.UpdatePatientRequest;
import com.clinic.records.entity.Patient;
import com.clinic.records.entity.Relationship;
import com.clinic.records.exception.ClinicException;
import com.clinic.records.exception.DuplicateIdentityException;
import com.clinic.records.exception.FamilyLimitExceededException;
import com.clinic.records.exception.NotFoundException;
import com.clinic.records.exception.PrimaryMemberExistsException;
import com.clinic.records.exception.PrimaryMemberRequiredException;
import com.clinic.records.exception.StorageErrorTranslator;
import com.clinic.records.repository.PatientRepository;
import com.clinic.records.tenant.ConnectionScopeBinder;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Patients keyed by {@code (mobileNumber, firstName)} within a tenant, grouped into families by mobile number.
 * <p>
 * Rules for active rows: the composite key is unique; a family needs an active {@code SELF} member before any
 * other relationship is accepted; a family never exceeds {@code clinic.patients.max-family-members}.
 * The checks here give precise errors. The unique constraints on {@code patients} and the lock on the family's
 * primary row are what hold the rules under concurrent registrations.
 */
@Service
public class PatientIdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(PatientIdentityRegistry.class);

    static final String FAMILY_PRIMARY_CONSTRAINT = "uk_patients_family_primary";

    private static final Comparator<Patient> FAMILY_ORDER = Comparator
            .comparing((Patient p) -> p.isPrimaryMember() ? 0 : 1)
            .thenComparing(Patient::getFirstName, String.CASE_INSENSITIVE_ORDER);

    private final PatientRepository patientRepository;
    private final TenantLimitService limitService;
    private final ConnectionScopeBinder binder;
    private final StorageErrorTranslator errorTranslator;
    private final int maxFamilyMembers;

    public PatientIdentityRegistry(PatientRepository patientRepository,
                                   TenantLimitService limitService,
                                   ConnectionScopeBinder binder,
                                   StorageErrorTranslator errorTranslator,
                                   ClinicProperties properties) {
        this.patientRepository = patientRepository;
        this.limitService = limitService;
        this.binder = binder;
        this.errorTranslator = errorTranslator;
        this.maxFamilyMembers = properties.getPatients().getMaxFamilyMembers();
    }

    public Patient register(UUID tenantId, RegisterPatientRequest request) {
        String mobile = normalizeMobile(request.getMobileNumber());
        String firstName = normalizeName(request.getFirstName());
        Relationship relationship = request.getRelationship() == null ? Relationship.SELF : request.getRelationship();

        Patient saved = binder.inTenantTransaction(tenantId, status -> {
            limitService.ensureCanAddPatient(tenantId);
            checkFamilyRules(tenantId, mobile, firstName, relationship);

            Patient patient = Patient.builder()
                    .tenantId(tenantId)
                    .mobileNumber(mobile)
                    .firstName(firstName)
                    .lastName(StringUtils.trimToNull(request.getLastName()))
                    .dateOfBirth(request.getDateOfBirth())
                    .gender(request.getGender())
                    .relationship(relationship)
                    .primaryContactMobile(relationship == Relationship.SELF
                            ? null : StringUtils.defaultIfBlank(request.getPrimaryContactMobile(), mobile))
                    .email(StringUtils.lowerCase(StringUtils.trimToNull(request.getEmail())))
                    .address(request.getAddress())
                    .notes(request.getNotes())
                    .active(true)
                    .build();
            return saveChecked("register patient", patient, mobile, firstName);
        });
        log.info("Registered patient {} ({}) in tenant {}", saved.getId(), relationship, tenantId);
        return saved;
    }

    public Patient lookup(UUID tenantId, String mobileNumber, String firstName) {
        String mobile = normalizeMobile(mobileNumber);
        String name = normalizeName(firstName);
        return binder.inTenantReadOnly(tenantId, status ->
                patientRepository.findByTenantIdAndMobileNumberAndFirstNameAndActiveTrue(tenantId, mobile, name)
                        .orElseThrow(() -> NotFoundException.of("Patient", mobile + "/" + name)));
    }

    public Patient findById(UUID tenantId, UUID patientId) {
        return binder.inTenantReadOnly(tenantId, status ->
                patientRepository.findByIdAndTenantId(patientId, tenantId)
                        .orElseThrow(() -> NotFoundException.of("Patient", patientId)));
    }

    /** Active members sharing the mobile number, the primary member first, then by first name. */
    public List<Patient> listFamily(UUID tenantId, String mobileNumber) {
        String mobile = normalizeMobile(mobileNumber);
        return binder.inTenantReadOnly(tenantId, status -> {
            List<Patient> family = new ArrayList<>(
                    patientRepository.findByTenantIdAndMobileNumberAndActiveTrue(tenantId, mobile));
            family.sort(FAMILY_ORDER);
            return family;
        });
    }

    public FamilyEligibilityResponse familyEligibility(UUID tenantId, String mobileNumber) {
        String mobile = normalizeMobile(mobileNumber);
        return binder.inTenantReadOnly(tenantId, status -> {
            List<Patient> family = patientRepository.findByTenantIdAndMobileNumberAndActiveTrue(tenantId, mobile);
            boolean hasPrimary = family.stream().anyMatch(Patient::isPrimaryMember);
            List<String> reasons = new ArrayList<>();
            if (family.size() >= maxFamilyMembers) {
                reasons.add("Family already has " + family.size() + " of " + maxFamilyMembers + " members");
            }
            if (!family.isEmpty() && !hasPrimary) {
                reasons.add("Family has no active primary member; only relationship 'self' can be registered");
            }
            return FamilyEligibilityResponse.builder()
                    .mobileNumber(mobile)
                    .currentMembers(family.size())
                    .maxMembers(maxFamilyMembers)
                    .hasPrimaryMember(hasPrimary)
                    .canRegister(family.size() < maxFamilyMembers)
                    .reasons(reasons)
                    .build();
        });
    }

    public Patient update(UUID tenantId, String mobileNumber, String firstName, UpdatePatientRequest request) {
        String mobile = normalizeMobile(mobileNumber);
        String name = normalizeName(firstName);
        return binder.inTenantTransaction(tenantId, status -> {
            Patient patient = patientRepository
                    .findByTenantIdAndMobileNumberAndFirstNameAndActiveTrue(tenantId, mobile, name)
                    .orElseThrow(() -> NotFoundException.of("Patient", mobile + "/" + name));
            if (request.getLastName() != null) {
                patient.setLastName(StringUtils.trimToNull(request.getLastName()));
            }
            if (request.getDateOfBirth() != null) {
                patient.setDateOfBirth(request.getDateOfBirth());
            }
            if (request.getGender() != null) {
                patient.setGender(request.getGender());
            }
            if (request.getEmail() != null) {
                patient.setEmail(StringUtils.lowerCase(StringUtils.trimToNull(request.getEmail())));
            }
            if (request.getAddress() != null) {
                patient.setAddress(request.getAddress());
            }
            if (request.getNotes() != null) {
                patient.setNotes(request.getNotes());
            }
            return patientRepository.save(patient);
        });
    }

    /** Frees the composite key and the family slot; the row and its id stay for history. */
    public Patient deactivate(UUID tenantId, String mobileNumber, String firstName) {
        String mobile = normalizeMobile(mobileNumber);
        String name = normalizeName(firstName);
        Patient patient = binder.inTenantTransaction(tenantId, status -> {
            Patient p = patientRepository
                    .findByTenantIdAndMobileNumberAndFirstNameAndActiveTrue(tenantId, mobile, name)
                    .orElseThrow(() -> NotFoundException.of("Patient", mobile + "/" + name));
            p.deactivate();
            return patientRepository.saveAndFlush(p);
        });
        log.info("Deactivated patient {} in tenant {}", patient.getId(), tenantId);
        return patient;
    }

    /**
     * Reactivates the most recently deactivated row for the key, subject to the same rules as a registration.
     */
    public Patient reactivate(UUID tenantId, String mobileNumber, String firstName) {
        String mobile = normalizeMobile(mobileNumber);
        String name = normalizeName(firstName);
        Patient patient = binder.inTenantTransaction(tenantId, status -> {
            Patient p = patientRepository
                    .findFirstByTenantIdAndMobileNumberAndFirstNameAndActiveFalseOrderByUpdatedAtDesc(
                            tenantId, mobile, name)
                    .orElseThrow(() -> NotFoundException.of("Inactive patient", mobile + "/" + name));
            limitService.ensureCanAddPatient(tenantId);
            checkFamilyRules(tenantId, mobile, name, p.getRelationship());
            p.reactivate();
            return saveChecked("reactivate patient", p, mobile, name);
        });
        log.info("Reactivated patient {} in tenant {}", patient.getId(), tenantId);
        return patient;
    }

    private void checkFamilyRules(UUID tenantId, String mobile, String firstName, Relationship relationship) {
        if (patientRepository.findByTenantIdAndMobileNumberAndFirstNameAndActiveTrue(tenantId, mobile, firstName)
                .isPresent()) {
            throw new DuplicateIdentityException("Patient " + firstName + " is already registered for " + mobile);
        }
        if (relationship != Relationship.SELF) {
            // taken before counting so concurrent registrations into this family queue up here
            patientRepository.findActivePrimaryForUpdate(tenantId, mobile)
                    .orElseThrow(() -> new PrimaryMemberRequiredException(
                            "Register the primary member (relationship 'self') for " + mobile + " first"));
        }
        List<Patient> family = patientRepository.findByTenantIdAndMobileNumberAndActiveTrue(tenantId, mobile);
        if (relationship == Relationship.SELF && family.stream().anyMatch(Patient::isPrimaryMember)) {
            throw new PrimaryMemberExistsException("Mobile number " + mobile + " already has a primary member");
        }
        if (family.size() >= maxFamilyMembers) {
            throw new FamilyLimitExceededException(mobile, maxFamilyMembers);
        }
    }

    private Patient saveChecked(String operation, Patient patient, String mobile, String firstName) {
        try {
            return patientRepository.saveAndFlush(patient);
        } catch (DataIntegrityViolationException e) {
            throw errorTranslator.translateWrite(operation, e, () -> duplicateFor(e, mobile, firstName));
        }
    }

    private ClinicException duplicateFor(Throwable e, String mobile, String firstName) {
        if (StringUtils.containsIgnoreCase(ExceptionUtils.getStackTrace(e), FAMILY_PRIMARY_CONSTRAINT)) {
            return new PrimaryMemberExistsException("Mobile number " + mobile + " already has a primary member");
        }
        return new DuplicateIdentityException("Patient " + firstName + " is already registered for " + mobile);
    }

    static String normalizeMobile(String mobile) {
        String cleaned = StringUtils.defaultString(mobile).replaceAll("[^\\d+]", "");
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("Mobile number is required");
        }
        return cleaned;
    }

    static String normalizeName(String name) {
        String cleaned = StringUtils.normalizeSpace(name);
        if (StringUtils.isEmpty(cleaned)) {
            throw new IllegalArgumentException("First name is required");
        }
        return cleaned;
    }
}
