package com.clinic.records.auth;

import java.util.Locale;

public enum Permission {
    MANAGE_USERS,
    MANAGE_DOCTORS,
    MANAGE_MEDICINES,
    VIEW_ALL_PRESCRIPTIONS,
    SYSTEM_CONFIG,
    MANAGE_PATIENTS,
    CREATE_PRESCRIPTIONS,
    VIEW_OWN_PRESCRIPTIONS,
    SCHEDULE_APPOINTMENTS,
    MANAGE_SHORT_KEYS,
    REGISTER_PATIENTS,
    VIEW_PRESCRIPTIONS,
    BASIC_PATIENT_INFO,
    VIEW_OWN_RECORDS,
    VIEW_APPOINTMENTS;

    /** Token form, e.g. {@code schedule_appointments}. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Permission fromTag(String tag) {
        return valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }
}
