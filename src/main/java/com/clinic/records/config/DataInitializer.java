package com.clinic.records.config;

import com.clinic.records.entity.Medicine;
import com.clinic.records.service.MedicineCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Idempotent seeder for the global medicine catalogue. Safe to re-run.
 */
@Component
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final MedicineCatalogService medicineCatalogService;

    public DataInitializer(MedicineCatalogService medicineCatalogService) {
        this.medicineCatalogService = medicineCatalogService;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void seed() {
        int inserted = medicineCatalogService.seedGlobalCatalog(List.of(
                medicine("Paracetamol", "Acetaminophen", "500 mg", "Analgesic", "2.50", false),
                medicine("Amoxicillin", "Amoxicillin", "500 mg", "Antibiotic", "8.00", true),
                medicine("Ibuprofen", "Ibuprofen", "400 mg", "NSAID", "3.20", false),
                medicine("Cetirizine", "Cetirizine hydrochloride", "10 mg", "Antihistamine", "1.80", false),
                medicine("Metformin", "Metformin hydrochloride", "500 mg", "Antidiabetic", "4.10", true),
                medicine("Amlodipine", "Amlodipine besylate", "5 mg", "Antihypertensive", "5.60", true),
                medicine("Omeprazole", "Omeprazole", "20 mg", "Proton pump inhibitor", "6.40", true)
        ));
        if (inserted > 0) {
            log.info("Seeded {} global medicines", inserted);
        }
    }

    private static Medicine medicine(String name, String generic, String strength, String category,
                                     String price, boolean prescription) {
        return Medicine.builder()
                .name(name)
                .genericName(generic)
                .strength(strength)
                .drugCategory(category)
                .price(new BigDecimal(price))
                .requiresPrescription(prescription)
                .active(true)
                .build();
    }
}
