package com.clinic.records.service;

import com.clinic.records.auth.AccessTokenService;
import com.clinic.records.auth.Permission;
import com.clinic.records.auth.Role;
import com.clinic.records.config.ClinicProperties;
import com.clinic.records.dto.ChangePlanRequest;
import com.clinic.records.dto.ClinicRegistrationRequest;
import com.clinic.records.dto.ClinicRegistrationResponse;
import com.clinic.records.dto.CreateDoctorRequest;
import com.clinic.records.dto.CreateOfficeRequest;
import com.clinic.records.dto.TenantResponse;
import com.clinic.records.dto.TokenResponse;
import com.clinic.records.dto.TenantUsageResponse;
import com.clinic.records.entity.Doctor;
import com.clinic.records.entity.DoctorOffice;
import com.clinic.records.entity.SubscriptionPlan;
import com.clinic.records.entity.Tenant;
import com.clinic.records.entity.User;
import com.clinic.records.exception.DuplicateIdentityException;
import com.clinic.records.exception.NotFoundException;
import com.clinic.records.exception.StorageErrorTranslator;
import com.clinic.records.repository.DoctorOfficeRepository;
import com.clinic.records.repository.TenantRepository;
import com.clinic.records.repository.UserRepository;
import com.clinic.records.tenant.ConnectionScopeBinder;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Clinic onboarding and subscription management.
 */
@Service
public class TenantService {

    private static final Logger log = LoggerFactory.getLogger(TenantService.class);
    private static final Duration TRIAL_PERIOD = Duration.ofDays(30);
    private static final int CODE_PREFIX_LENGTH = 20;

    private final TenantRepository tenantRepository;
    private final UserRepository userRepository;
    private final DoctorOfficeRepository officeRepository;
    private final DoctorService doctorService;
    private final TenantLimitService limitService;
    private final AccessTokenService tokenService;
    private final PasswordEncoder passwordEncoder;
    private final ConnectionScopeBinder binder;
    private final StorageErrorTranslator errorTranslator;
    private final ClinicProperties.TrialPlan trialPlan;

    public TenantService(TenantRepository tenantRepository,
                         UserRepository userRepository,
                         DoctorOfficeRepository officeRepository,
                         DoctorService doctorService,
                         TenantLimitService limitService,
                         AccessTokenService tokenService,
                         PasswordEncoder passwordEncoder,
                         ConnectionScopeBinder binder,
                         StorageErrorTranslator errorTranslator,
                         ClinicProperties properties) {
        this.tenantRepository = tenantRepository;
        this.userRepository = userRepository;
        this.officeRepository = officeRepository;
        this.doctorService = doctorService;
        this.limitService = limitService;
        this.tokenService = tokenService;
        this.passwordEncoder = passwordEncoder;
        this.binder = binder;
        this.errorTranslator = errorTranslator;
        this.trialPlan = properties.getTrialPlan();
    }

    /**
     * Creates tenant, owner and (for {@code admin_doctor}) the owner's doctor profile in one transaction.
     * The new tenant is bound to the transaction's connection before the owner rows are written, so the
     * row-isolation write check accepts them.
     */
    public ClinicRegistrationResponse registerClinic(ClinicRegistrationRequest request) {
        boolean adminDoctor = "admin_doctor".equals(request.getRole());
        if (!adminDoctor && !"admin".equals(request.getRole())) {
            throw new IllegalArgumentException("Role must be 'admin' or 'admin_doctor'");
        }
        if (adminDoctor && StringUtils.isBlank(request.getLicenseNumber())) {
            throw new IllegalArgumentException("License number required for admin_doctor role");
        }
        String email = request.getOwnerEmail().trim().toLowerCase(Locale.ROOT);
        String phone = request.getClinicPhone().trim();

        ClinicRegistrationResponse response = binder.inUnboundTransaction(status -> {
            if (userRepository.existsByEmailIgnoreCase(email)) {
                throw new DuplicateIdentityException("Email already registered");
            }
            if (tenantRepository.existsByPhone(phone)) {
                throw new DuplicateIdentityException("Clinic phone number already registered");
            }

            Tenant tenant;
            try {
                tenant = tenantRepository.saveAndFlush(Tenant.builder()
                        .tenantName(request.getClinicName().trim())
                        .tenantCode(nextTenantCode(request.getClinicName()))
                        .subscriptionPlan(SubscriptionPlan.TRIAL)
                        .trialEndsAt(Instant.now().plus(TRIAL_PERIOD))
                        .maxClinics(trialPlan.getMaxClinics())
                        .maxDoctors(trialPlan.getMaxDoctors())
                        .maxPatients(trialPlan.getMaxPatients())
                        .maxStorageMb(trialPlan.getMaxStorageMb())
                        .phone(phone)
                        .address(request.getClinicAddress())
                        .active(true)
                        .build());
            } catch (DataIntegrityViolationException e) {
                throw errorTranslator.translateWrite("register clinic", e,
                        () -> new DuplicateIdentityException("Clinic is already registered, please retry"));
            }

            binder.bindCurrentTransaction(tenant.getId());

            Role role = adminDoctor ? Role.DOCTOR : Role.ADMIN;
            User owner;
            try {
                owner = userRepository.saveAndFlush(User.builder()
                        .tenantId(tenant.getId())
                        .email(email)
                        .passwordHash(passwordEncoder.encode(request.getPassword()))
                        .role(role)
                        .firstName(StringUtils.trimToNull(request.getOwnerFirstName()))
                        .lastName(StringUtils.trimToNull(request.getOwnerLastName()))
                        .active(true)
                        .build());
            } catch (DataIntegrityViolationException e) {
                throw errorTranslator.translateWrite("register clinic owner", e,
                        () -> new DuplicateIdentityException("Email already registered"));
            }

            UUID doctorId = null;
            UUID officeId = null;
            if (adminDoctor) {
                Doctor doctor = doctorService.createDoctor(tenant.getId(), CreateDoctorRequest.builder()
                        .userId(owner.getId())
                        .name(StringUtils.defaultIfBlank(owner.getFullName(), email))
                        .licenseNumber(request.getLicenseNumber())
                        .specialization(request.getSpecialization())
                        .office(CreateOfficeRequest.builder()
                                .name(request.getClinicName().trim())
                                .address(request.getClinicAddress())
                                .phone(phone)
                                .build())
                        .build());
                doctorId = doctor.getId();
                officeId = officeRepository.findByTenantIdAndDoctorIdOrderByName(tenant.getId(), doctorId)
                        .stream().findFirst().map(DoctorOffice::getId).orElse(null);
            }

            return ClinicRegistrationResponse.builder()
                    .tenant(TenantResponse.from(tenant))
                    .userId(owner.getId())
                    .doctorId(doctorId)
                    .officeId(officeId)
                    .token(token(owner))
                    .build();
        });
        log.info("Registered clinic {} ({}) with owner {}", response.getTenant().getTenantCode(),
                response.getTenant().getId(), response.getUserId());
        return response;
    }

    public TokenResponse token(User user) {
        return TokenResponse.builder()
                .accessToken(tokenService.issue(user.getId(), user.getRole(), user.getTenantId()))
                .expiresIn(tokenService.ttl().toSeconds())
                .userId(user.getId())
                .tenantId(user.getTenantId())
                .role(user.getRole().tag())
                .permissions(user.getRole().permissions().stream().map(Permission::tag).toList())
                .build();
    }

    public Tenant getTenant(UUID tenantId) {
        return binder.inUnboundTransaction(status -> tenantRepository.findById(tenantId)
                .orElseThrow(() -> NotFoundException.of("Tenant", tenantId)));
    }

    public TenantUsageResponse usage(UUID tenantId) {
        return binder.inTenantReadOnly(tenantId, status -> limitService.usage(tenantId));
    }

    public Tenant changePlan(UUID tenantId, ChangePlanRequest request) {
        Tenant tenant = binder.inUnboundTransaction(status -> {
            Tenant t = tenantRepository.findById(tenantId)
                    .orElseThrow(() -> NotFoundException.of("Tenant", tenantId));
            t.setSubscriptionPlan(request.getPlan());
            if (request.getPlan() != SubscriptionPlan.TRIAL) {
                t.setTrialEndsAt(null);
            }
            if (request.getMaxDoctors() != null) {
                t.setMaxDoctors(request.getMaxDoctors());
            }
            if (request.getMaxPatients() != null) {
                t.setMaxPatients(request.getMaxPatients());
            }
            if (request.getMaxStorageMb() != null) {
                t.setMaxStorageMb(request.getMaxStorageMb());
            }
            if (request.getMaxClinics() != null) {
                t.setMaxClinics(request.getMaxClinics());
            }
            return tenantRepository.save(t);
        });
        log.info("Tenant {} moved to plan {}", tenantId, tenant.getSubscriptionPlan());
        return tenant;
    }

    /** Soft delete: rows stay, logins for the tenant are refused. */
    public Tenant deactivate(UUID tenantId) {
        Tenant tenant = binder.inUnboundTransaction(status -> {
            Tenant t = tenantRepository.findById(tenantId)
                    .orElseThrow(() -> NotFoundException.of("Tenant", tenantId));
            t.setActive(false);
            return tenantRepository.save(t);
        });
        log.warn("Tenant {} deactivated", tenantId);
        return tenant;
    }

    /** {@code Sunrise Dental} becomes {@code SUNRISE_DENTAL_001}, then {@code _002} and so on. */
    String nextTenantCode(String tenantName) {
        String base = StringUtils.left(
                StringUtils.strip(tenantName.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_"), "_"),
                CODE_PREFIX_LENGTH);
        if (base.isEmpty()) {
            base = "CLINIC";
        }
        List<String> existing = tenantRepository.findCodesStartingWith(base + "_");
        int max = 0;
        for (String code : existing) {
            String suffix = StringUtils.substringAfterLast(code, "_");
            if (StringUtils.isNumeric(suffix) && code.length() == base.length() + 1 + suffix.length()) {
                max = Math.max(max, Integer.parseInt(suffix));
            }
        }
        return base + "_" + StringUtils.leftPad(String.valueOf(max + 1), 3, '0');
    }
}
