package com.clinic.records.entity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class PrescriptionStatusTest {

    @Test
    void draftIsIssuedOrDropped() {
        assertTrue(PrescriptionStatus.DRAFT.canTransitionTo(PrescriptionStatus.ACTIVE));
        assertTrue(PrescriptionStatus.DRAFT.canTransitionTo(PrescriptionStatus.CANCELLED));
        assertFalse(PrescriptionStatus.DRAFT.canTransitionTo(PrescriptionStatus.DISPENSED));
    }

    @Test
    void dispensedCanOnlyComplete() {
        assertTrue(PrescriptionStatus.DISPENSED.canTransitionTo(PrescriptionStatus.COMPLETED));
        assertFalse(PrescriptionStatus.DISPENSED.canTransitionTo(PrescriptionStatus.CANCELLED));
        assertFalse(PrescriptionStatus.DISPENSED.canTransitionTo(PrescriptionStatus.ACTIVE));
    }

    @Test
    void expiredCanBeRenewed() {
        assertTrue(PrescriptionStatus.EXPIRED.canTransitionTo(PrescriptionStatus.ACTIVE));
        assertFalse(PrescriptionStatus.EXPIRED.isTerminal());
    }

    @ParameterizedTest
    @EnumSource(value = PrescriptionStatus.class, names = {"COMPLETED", "CANCELLED"})
    void closedStatusesAllowNoTransition(PrescriptionStatus closed) {
        for (PrescriptionStatus next : PrescriptionStatus.values()) {
            assertFalse(closed.canTransitionTo(next), closed + " -> " + next);
        }
        assertTrue(closed.isTerminal());
    }

    @Test
    void draftsAndCancelledAreNotPrinted() {
        assertFalse(PrescriptionStatus.DRAFT.isPrintable());
        assertFalse(PrescriptionStatus.CANCELLED.isPrintable());
        assertTrue(PrescriptionStatus.ACTIVE.isPrintable());
        assertTrue(PrescriptionStatus.DISPENSED.isPrintable());
    }
}
