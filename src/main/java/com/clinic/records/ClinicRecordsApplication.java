package com.clinic.records;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.clinic.records")
@EnableJpaRepositories(basePackages = "com.clinic.records.repository")
@EntityScan(basePackages = "com.clinic.records.entity")
public class ClinicRecordsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinicRecordsApplication.class, args);
    }
}
