package com.clinic.records.service;

import com.clinic.records.ClinicFixtures;
import com.clinic.records.dto.FamilyEligibilityResponse;
import com.clinic.records.entity.Patient;
import com.clinic.records.entity.Relationship;
import com.clinic.records.exception.DuplicateIdentityException;
import com.clinic.records.exception.FamilyLimitExceededException;
import com.clinic.records.exception.NotFoundException;
import com.clinic.records.exception.PrimaryMemberExistsException;
import com.clinic.records.exception.PrimaryMemberRequiredException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class PatientIdentityRegistryTest {

    @Autowired
    private PatientIdentityRegistry registry;

    @Autowired
    private TenantService tenantService;

    private UUID tenantId;
    private String mobile;

    @BeforeEach
    void setUp() {
        tenantId = tenantService.registerClinic(ClinicFixtures.clinic("admin")).getTenant().getId();
        mobile = ClinicFixtures.uniqueMobile();
    }

    private Patient register(String firstName, Relationship relationship) {
        return registry.register(tenantId, ClinicFixtures.patient(mobile, firstName, relationship));
    }

    @Test
    void registersFamilyAroundPrimaryMember() {
        register("Ravi", Relationship.SELF);
        register("priya", Relationship.SPOUSE);
        register("Arjun", Relationship.CHILD);

        List<Patient> family = registry.listFamily(tenantId, mobile);

        assertThat(family).extracting(Patient::getFirstName).containsExactly("Ravi", "Arjun", "priya");
        assertThat(family.get(0).isPrimaryMember()).isTrue();
        assertThat(family.get(1).getPrimaryContactMobile()).isEqualTo(mobile);
    }

    @Test
    void relativeNeedsPrimaryMemberFirst() {
        assertThatThrownBy(() -> register("Priya", Relationship.SPOUSE))
                .isInstanceOf(PrimaryMemberRequiredException.class);

        register("Ravi", Relationship.SELF);
        Patient spouse = register("Priya", Relationship.SPOUSE);

        assertThat(spouse.isActive()).isTrue();
        assertThat(registry.listFamily(tenantId, mobile))
                .extracting(Patient::getFirstName)
                .containsExactly("Ravi", "Priya");
    }

    @Test
    void duplicateIsReportedBeforeMissingPrimaryMember() {
        register("Ravi", Relationship.SELF);
        register("Priya", Relationship.SPOUSE);
        registry.deactivate(tenantId, mobile, "Ravi");

        assertThatThrownBy(() -> register("Priya", Relationship.SPOUSE))
                .isInstanceOf(DuplicateIdentityException.class);
        assertThatThrownBy(() -> register("Kiran", Relationship.CHILD))
                .isInstanceOf(PrimaryMemberRequiredException.class);
    }

    @Test
    void secondPrimaryMemberIsRejected() {
        register("Ravi", Relationship.SELF);

        assertThatThrownBy(() -> register("Kiran", Relationship.SELF))
                .isInstanceOf(PrimaryMemberExistsException.class);
    }

    @Test
    void duplicateKeyIsRejectedAfterNormalisation() {
        register("Ravi", Relationship.SELF);
        String spacedMobile = mobile.substring(0, 5) + " " + mobile.substring(5);

        assertThatThrownBy(() -> registry.register(tenantId,
                ClinicFixtures.patient(spacedMobile, "  Ravi ", Relationship.OTHER)))
                .isInstanceOf(DuplicateIdentityException.class);
        assertThat(registry.lookup(tenantId, spacedMobile, "Ravi").getMobileNumber()).isEqualTo(mobile);
    }

    @Test
    void familyIsCappedAtTenMembers() {
        register("Member0", Relationship.SELF);
        for (int i = 1; i < 10; i++) {
            register("Member" + i, Relationship.CHILD);
        }

        assertThatThrownBy(() -> register("Member10", Relationship.CHILD))
                .isInstanceOf(FamilyLimitExceededException.class);
        FamilyEligibilityResponse eligibility = registry.familyEligibility(tenantId, mobile);
        assertThat(eligibility.isCanRegister()).isFalse();
        assertThat(eligibility.getCurrentMembers()).isEqualTo(10);
    }

    @Test
    void concurrentRegistrationsNeverExceedFamilyLimit() throws Exception {
        register("Member0", Relationship.SELF);
        for (int i = 1; i < 9; i++) {
            register("Member" + i, Relationship.CHILD);
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Patient>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                String name = "Late" + i;
                Callable<Patient> task = () -> {
                    start.await();
                    return register(name, Relationship.CHILD);
                };
                results.add(executor.submit(task));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<Patient> result : results) {
                try {
                    result.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(FamilyLimitExceededException.class);
                }
            }
            assertThat(succeeded).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(registry.listFamily(tenantId, mobile)).hasSize(10);
    }

    @Test
    void deactivationFreesKeyAndReactivationRechecksIt() {
        register("Ravi", Relationship.SELF);
        Patient original = register("Priya", Relationship.SPOUSE);

        Patient inactive = registry.deactivate(tenantId, mobile, "Priya");
        assertThat(inactive.isActive()).isFalse();
        assertThatThrownBy(() -> registry.lookup(tenantId, mobile, "Priya")).isInstanceOf(NotFoundException.class);

        Patient replacement = register("Priya", Relationship.SPOUSE);
        assertThat(replacement.getId()).isNotEqualTo(original.getId());
        assertThatThrownBy(() -> registry.reactivate(tenantId, mobile, "Priya"))
                .isInstanceOf(DuplicateIdentityException.class);

        registry.deactivate(tenantId, mobile, "Priya");
        Patient reactivated = registry.reactivate(tenantId, mobile, "Priya");
        assertThat(reactivated.isActive()).isTrue();
        assertThat(registry.findById(tenantId, reactivated.getId()).getFirstName()).isEqualTo("Priya");
    }

    @Test
    void sameKeyLivesIndependentlyInEachTenant() {
        UUID otherTenant = tenantService.registerClinic(ClinicFixtures.clinic("admin")).getTenant().getId();
        Patient mine = register("Ravi", Relationship.SELF);
        Patient theirs = registry.register(otherTenant, ClinicFixtures.patient(mobile, "Ravi", Relationship.SELF));

        assertThat(theirs.getId()).isNotEqualTo(mine.getId());
        assertThat(theirs.getTenantId()).isEqualTo(otherTenant);
        assertThatThrownBy(() -> registry.findById(otherTenant, mine.getId())).isInstanceOf(NotFoundException.class);
        assertThat(registry.listFamily(otherTenant, mobile)).extracting(Patient::getId).containsExactly(theirs.getId());
    }

    @Test
    void blankKeyPartsAreRejected() {
        assertThatThrownBy(() -> registry.register(tenantId, ClinicFixtures.patient("  ", "Ravi", Relationship.SELF)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.lookup(tenantId, mobile, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
