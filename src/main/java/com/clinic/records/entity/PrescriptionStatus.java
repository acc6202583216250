package com.clinic.records.entity;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum PrescriptionStatus {
    DRAFT,
    ACTIVE,
    DISPENSED,
    COMPLETED,
    CANCELLED,
    EXPIRED;

    private static final Map<PrescriptionStatus, Set<PrescriptionStatus>> TRANSITIONS =
            new EnumMap<>(PrescriptionStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(ACTIVE, CANCELLED));
        TRANSITIONS.put(ACTIVE, EnumSet.of(DISPENSED, COMPLETED, CANCELLED, EXPIRED));
        TRANSITIONS.put(DISPENSED, EnumSet.of(COMPLETED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(PrescriptionStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(PrescriptionStatus.class));
        // renewal
        TRANSITIONS.put(EXPIRED, EnumSet.of(ACTIVE));
    }

    public boolean canTransitionTo(PrescriptionStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /** Drafts and cancelled prescriptions are never handed to a patient. */
    public boolean isPrintable() {
        return this != DRAFT && this != CANCELLED;
    }
}
