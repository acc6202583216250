package com.clinic.records.service;

import com.clinic.records.ClinicFixtures;
import com.clinic.records.auth.AccessTokenService;
import com.clinic.records.auth.AuthService;
import com.clinic.records.auth.IdentityClaims;
import com.clinic.records.auth.Role;
import com.clinic.records.dto.ChangePlanRequest;
import com.clinic.records.dto.ClinicRegistrationRequest;
import com.clinic.records.dto.ClinicRegistrationResponse;
import com.clinic.records.dto.CreateDoctorRequest;
import com.clinic.records.dto.LoginRequest;
import com.clinic.records.dto.TokenResponse;
import com.clinic.records.entity.Relationship;
import com.clinic.records.entity.SubscriptionPlan;
import com.clinic.records.exception.DuplicateIdentityException;
import com.clinic.records.exception.ForbiddenException;
import com.clinic.records.exception.PlanLimitExceededException;
import com.clinic.records.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class TenantServiceTest {

    @Autowired
    private TenantService tenantService;

    @Autowired
    private AuthService authService;

    @Autowired
    private AccessTokenService tokenService;

    @Autowired
    private DoctorService doctorService;

    @Autowired
    private PatientIdentityRegistry registry;

    private static LoginRequest login(String email, String password) {
        LoginRequest request = new LoginRequest();
        request.setEmail(email);
        request.setPassword(password);
        return request;
    }

    @Test
    void adminDoctorRegistrationCreatesDoctorWithPrimaryOffice() {
        ClinicRegistrationResponse response = tenantService.registerClinic(ClinicFixtures.clinic("admin_doctor"));

        assertNotNull(response.getDoctorId());
        assertNotNull(response.getOfficeId());
        assertEquals("trial", response.getTenant().getSubscriptionPlan());
        assertNotNull(response.getTenant().getTrialEndsAt());

        IdentityClaims claims = tokenService.verify(response.getToken().getAccessToken());
        assertEquals(Role.DOCTOR, claims.role());
        assertEquals(response.getTenant().getId(), claims.tenantId());
        assertEquals(response.getUserId(), claims.userId());
        assertEquals(1, doctorService.offices(claims.tenantId(), response.getDoctorId()).size());
    }

    @Test
    void tenantCodesAreNumberedPerName() {
        String name = "Lotus Care " + UUID.randomUUID().toString().substring(0, 8);
        ClinicRegistrationRequest first = ClinicFixtures.clinic("admin");
        first.setClinicName(name);
        ClinicRegistrationRequest second = ClinicFixtures.clinic("admin");
        second.setClinicName(name);

        String firstCode = tenantService.registerClinic(first).getTenant().getTenantCode();
        String secondCode = tenantService.registerClinic(second).getTenant().getTenantCode();

        assertTrue(firstCode.startsWith("LOTUS_CARE_"), firstCode);
        assertTrue(firstCode.endsWith("_001"), firstCode);
        assertEquals(firstCode.substring(0, firstCode.length() - 3) + "002", secondCode);
    }

    @Test
    void duplicateEmailOrPhoneIsRejected() {
        ClinicRegistrationRequest original = ClinicFixtures.clinic("admin");
        tenantService.registerClinic(original);

        ClinicRegistrationRequest sameEmail = ClinicFixtures.clinic("admin");
        sameEmail.setOwnerEmail(original.getOwnerEmail().toUpperCase());
        ClinicRegistrationRequest samePhone = ClinicFixtures.clinic("admin");
        samePhone.setClinicPhone(original.getClinicPhone());

        assertThrows(DuplicateIdentityException.class, () -> tenantService.registerClinic(sameEmail));
        assertThrows(DuplicateIdentityException.class, () -> tenantService.registerClinic(samePhone));
    }

    @Test
    void adminDoctorNeedsLicense() {
        ClinicRegistrationRequest request = ClinicFixtures.clinic("admin_doctor");
        request.setLicenseNumber(" ");

        assertThrows(IllegalArgumentException.class, () -> tenantService.registerClinic(request));
    }

    @Test
    void loginChecksPasswordAndTenantState() {
        ClinicRegistrationRequest request = ClinicFixtures.clinic("admin");
        ClinicRegistrationResponse clinic = tenantService.registerClinic(request);

        TokenResponse token = authService.login(login(request.getOwnerEmail(), request.getPassword()));
        assertEquals(clinic.getTenant().getId(), token.getTenantId());
        assertEquals("admin", token.getRole());

        assertThrows(UnauthorizedException.class,
                () -> authService.login(login(request.getOwnerEmail(), "wrong-password")));
        assertThrows(UnauthorizedException.class,
                () -> authService.login(login("nobody@nowhere.test", request.getPassword())));

        tenantService.deactivate(clinic.getTenant().getId());
        assertThrows(ForbiddenException.class,
                () -> authService.login(login(request.getOwnerEmail(), request.getPassword())));
        assertThrows(ForbiddenException.class, () -> registry.register(clinic.getTenant().getId(),
                ClinicFixtures.patient(ClinicFixtures.uniqueMobile(), "Ravi", Relationship.SELF)));
    }

    @Test
    void planLimitsGateNewDoctorsAndPatients() {
        UUID tenantId = tenantService.registerClinic(ClinicFixtures.clinic("admin_doctor")).getTenant().getId();
        ChangePlanRequest limits = new ChangePlanRequest();
        limits.setPlan(SubscriptionPlan.BASIC);
        limits.setMaxDoctors(1);
        limits.setMaxPatients(1);
        tenantService.changePlan(tenantId, limits);

        assertThrows(PlanLimitExceededException.class, () -> doctorService.createDoctor(tenantId,
                CreateDoctorRequest.builder().name("Dr Second").licenseNumber("LIC-" + UUID.randomUUID()).build()));

        String mobile = ClinicFixtures.uniqueMobile();
        registry.register(tenantId, ClinicFixtures.patient(mobile, "Ravi", Relationship.SELF));
        assertThrows(PlanLimitExceededException.class, () -> registry.register(tenantId,
                ClinicFixtures.patient(mobile, "Priya", Relationship.SPOUSE)));

        assertEquals(SubscriptionPlan.BASIC, tenantService.getTenant(tenantId).getSubscriptionPlan());
        assertNull(tenantService.getTenant(tenantId).getTrialEndsAt());
        assertFalse(tenantService.usage(tenantId).isCanAddPatient());
    }

    @Test
    void licenseNumbersAreUniqueAcrossTenants() {
        ClinicRegistrationRequest first = ClinicFixtures.clinic("admin_doctor");
        tenantService.registerClinic(first);
        UUID otherTenant = tenantService.registerClinic(ClinicFixtures.clinic("admin")).getTenant().getId();

        assertThrows(DuplicateIdentityException.class, () -> doctorService.createDoctor(otherTenant,
                CreateDoctorRequest.builder().name("Dr Copy").licenseNumber(first.getLicenseNumber()).build()));
    }
}
