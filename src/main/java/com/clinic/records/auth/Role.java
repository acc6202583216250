package com.clinic.records.auth;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static com.clinic.records.auth.Permission.*;

public enum Role {
    SUPER_ADMIN(EnumSet.allOf(Permission.class)),
    ADMIN(EnumSet.of(MANAGE_USERS, MANAGE_DOCTORS, MANAGE_MEDICINES, VIEW_ALL_PRESCRIPTIONS, SYSTEM_CONFIG)),
    DOCTOR(EnumSet.of(MANAGE_PATIENTS, CREATE_PRESCRIPTIONS, VIEW_OWN_PRESCRIPTIONS, SCHEDULE_APPOINTMENTS,
            MANAGE_SHORT_KEYS)),
    NURSE(EnumSet.of(REGISTER_PATIENTS, SCHEDULE_APPOINTMENTS, VIEW_PRESCRIPTIONS)),
    RECEPTIONIST(EnumSet.of(REGISTER_PATIENTS, SCHEDULE_APPOINTMENTS, BASIC_PATIENT_INFO)),
    PATIENT(EnumSet.of(VIEW_OWN_RECORDS, VIEW_OWN_PRESCRIPTIONS, VIEW_APPOINTMENTS));

    private final Set<Permission> permissions;

    Role(EnumSet<Permission> permissions) {
        this.permissions = Collections.unmodifiableSet(permissions);
    }

    public Set<Permission> permissions() {
        return permissions;
    }

    public boolean has(Permission permission) {
        return permissions.contains(permission);
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Role fromTag(String tag) {
        return valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }
}
