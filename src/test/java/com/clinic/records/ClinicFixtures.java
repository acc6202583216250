package com.clinic.records;

import com.clinic.records.dto.ClinicRegistrationRequest;
import com.clinic.records.dto.RegisterPatientRequest;
import com.clinic.records.entity.Relationship;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Request builders producing values unique across one JVM, since integration tests share an in-memory database.
 */
public final class ClinicFixtures {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private ClinicFixtures() {
    }

    public static String uniqueMobile() {
        return "+9198" + String.format("%08d", SEQUENCE.incrementAndGet() * 7 + ThreadLocalRandom.current().nextInt(7));
    }

    public static ClinicRegistrationRequest clinic(String role) {
        int n = SEQUENCE.incrementAndGet();
        ClinicRegistrationRequest request = new ClinicRegistrationRequest();
        request.setClinicName("Sunrise Clinic " + n);
        request.setClinicPhone(uniqueMobile());
        request.setClinicAddress("12 MG Road");
        request.setOwnerEmail("owner" + n + "-" + System.nanoTime() + "@sunrise.test");
        request.setPassword("s3cret-pass");
        request.setOwnerFirstName("Asha");
        request.setOwnerLastName("Rao");
        request.setRole(role);
        if ("admin_doctor".equals(role)) {
            request.setLicenseNumber("LIC-" + n + "-" + System.nanoTime());
            request.setSpecialization("General Medicine");
        }
        return request;
    }

    public static RegisterPatientRequest patient(String mobile, String firstName, Relationship relationship) {
        return RegisterPatientRequest.builder()
                .mobileNumber(mobile)
                .firstName(firstName)
                .lastName("Sharma")
                .relationship(relationship)
                .build();
    }
}
