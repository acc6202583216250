package com.clinic.records.entity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum AppointmentStatus {
    SCHEDULED,
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_SHOW,
    RESCHEDULED;

    /** Statuses that occupy the doctor's time. */
    public static final Set<AppointmentStatus> BLOCKING = Collections.unmodifiableSet(
            EnumSet.of(SCHEDULED, CONFIRMED, IN_PROGRESS));

    private static final Map<AppointmentStatus, Set<AppointmentStatus>> TRANSITIONS =
            new EnumMap<>(AppointmentStatus.class);

    static {
        TRANSITIONS.put(SCHEDULED, EnumSet.of(CONFIRMED, IN_PROGRESS, CANCELLED, NO_SHOW, RESCHEDULED));
        TRANSITIONS.put(CONFIRMED, EnumSet.of(IN_PROGRESS, CANCELLED, NO_SHOW, RESCHEDULED));
        TRANSITIONS.put(IN_PROGRESS, EnumSet.of(COMPLETED, CANCELLED, NO_SHOW));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(AppointmentStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(AppointmentStatus.class));
        TRANSITIONS.put(NO_SHOW, EnumSet.noneOf(AppointmentStatus.class));
        // superseded by its successor appointment
        TRANSITIONS.put(RESCHEDULED, EnumSet.noneOf(AppointmentStatus.class));
    }

    public boolean canTransitionTo(AppointmentStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == NO_SHOW;
    }

    public boolean isBlocking() {
        return BLOCKING.contains(this);
    }
}
