package com.clinic.records.entity;

import com.clinic.records.exception.ForbiddenException;
import com.clinic.records.exception.InvalidTenantContextException;
import com.clinic.records.tenant.TenantContextHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(OutputCaptureExtension.class)
class TenantStampListenerTest {

    private static final UUID BOUND = UUID.fromString("0b5e7c1a-3f2d-4e6b-8a9c-1d2e3f4a5b6c");

    private final TenantStampListener listener = new TenantStampListener();

    @AfterEach
    void clearContext() {
        TenantContextHolder.clear();
    }

    @Test
    void newRowTakesBoundTenant() {
        TenantContextHolder.set(BOUND);
        Doctor doctor = Doctor.builder().name("Dr Rao").build();

        listener.stamp(doctor);

        assertEquals(BOUND, doctor.getTenantId());
    }

    @Test
    void rowForAnotherTenantIsRefusedAndLogged(CapturedOutput output) {
        TenantContextHolder.set(BOUND);
        UUID other = UUID.randomUUID();
        Doctor doctor = Doctor.builder().tenantId(other).name("Dr Rao").build();

        assertThrows(ForbiddenException.class, () -> listener.stamp(doctor));
        assertTrue(output.getOut().contains("Cross-tenant write refused"));
        assertTrue(output.getOut().contains(other.toString()));
    }

    @Test
    void tenantOwnedRowNeedsBoundTenant() {
        assertThrows(InvalidTenantContextException.class,
                () -> listener.stamp(Doctor.builder().name("Dr Rao").build()));
    }

    @Test
    void sharedRowsAreLeftAlone() {
        Medicine medicine = Medicine.builder().name("Zinc").build();

        listener.stamp(medicine);

        assertNull(medicine.getTenantId());
    }
}
