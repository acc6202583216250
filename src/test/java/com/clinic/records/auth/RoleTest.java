package com.clinic.records.auth;

import com.clinic.records.exception.ForbiddenException;
import com.clinic.records.exception.InvalidTenantContextException;
import com.clinic.records.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RoleTest {

    private final AccessGuard guard = new AccessGuard();

    @Test
    void superAdminHoldsEveryPermission() {
        assertEquals(EnumSet.allOf(Permission.class), Role.SUPER_ADMIN.permissions());
    }

    @Test
    void adminManagesClinicButNotPatients() {
        assertTrue(Role.ADMIN.has(Permission.MANAGE_DOCTORS));
        assertFalse(Role.ADMIN.has(Permission.MANAGE_PATIENTS));
        assertFalse(Role.ADMIN.has(Permission.SCHEDULE_APPOINTMENTS));
    }

    @Test
    void tagsRoundTripThroughTokenForm() {
        assertEquals("receptionist", Role.RECEPTIONIST.tag());
        assertEquals(Role.ADMIN, Role.fromTag(" Admin "));
        assertEquals(Permission.VIEW_OWN_RECORDS, Permission.fromTag("view_own_records"));
        assertThrows(IllegalArgumentException.class, () -> Role.fromTag("janitor"));
    }

    @Test
    void guardRejectsAnonymousCaller() {
        assertThrows(UnauthorizedException.class, () -> guard.requireAny(IdentityClaims.ANONYMOUS, Permission.MANAGE_PATIENTS));
        assertThrows(UnauthorizedException.class, () -> guard.requireTenant(null));
    }

    @Test
    void guardRejectsMissingPermission() {
        IdentityClaims patient = new IdentityClaims(UUID.randomUUID(), Role.PATIENT, UUID.randomUUID());

        assertThrows(ForbiddenException.class, () -> guard.requireAny(patient, Permission.REGISTER_PATIENTS));
    }

    @Test
    void guardReturnsBoundTenant() {
        UUID tenant = UUID.randomUUID();
        IdentityClaims nurse = new IdentityClaims(UUID.randomUUID(), Role.NURSE, tenant);

        assertEquals(tenant, guard.requireAny(nurse, Permission.MANAGE_PATIENTS, Permission.REGISTER_PATIENTS));
    }

    @Test
    void tenantlessTokenCannotReachTenantData() {
        IdentityClaims platform = new IdentityClaims(UUID.randomUUID(), Role.SUPER_ADMIN, null);

        assertThrows(InvalidTenantContextException.class, () -> guard.requireAny(platform, Permission.MANAGE_PATIENTS));
    }
}
