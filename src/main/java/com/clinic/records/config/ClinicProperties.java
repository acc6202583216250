package com.clinic.records.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "clinic")
public class ClinicProperties {

    private Security security = new Security();
    private Patients patients = new Patients();
    private Appointments appointments = new Appointments();
    private Tenancy tenancy = new Tenancy();
    private TrialPlan trialPlan = new TrialPlan();

    @Getter
    @Setter
    public static class Security {
        /** HMAC key for access tokens, at least 32 bytes. */
        private String jwtSecret;
        private Duration accessTokenTtl = Duration.ofMinutes(30);
        private String issuer = "clinic-records";
    }

    @Getter
    @Setter
    public static class Patients {
        private int maxFamilyMembers = 10;
    }

    @Getter
    @Setter
    public static class Appointments {
        private int defaultDurationMinutes = 30;
        private int slotMinutes = 30;
    }

    @Getter
    @Setter
    public static class Tenancy {
        private String sessionVariable = "app.current_tenant_id";
        private Dialect dialect = Dialect.POSTGRES;
        private boolean installPolicies = true;
    }

    public enum Dialect {
        POSTGRES, H2
    }

    @Getter
    @Setter
    public static class TrialPlan {
        private int maxDoctors = 5;
        private int maxPatients = 1000;
        private int maxStorageMb = 1000;
        private int maxClinics = 1;
    }
}
