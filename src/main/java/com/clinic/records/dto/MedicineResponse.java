package com.clinic.records.dto;

import com.clinic.records.entity.Medicine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MedicineResponse {
    private UUID id;
    private String name;
    private String genericName;
    private String strength;
    private String drugCategory;
    private BigDecimal price;
    private boolean requiresPrescription;
    private boolean global;

    public static MedicineResponse from(Medicine m) {
        return MedicineResponse.builder()
                .id(m.getId())
                .name(m.getName())
                .genericName(m.getGenericName())
                .strength(m.getStrength())
                .drugCategory(m.getDrugCategory())
                .price(m.getPrice())
                .requiresPrescription(m.isRequiresPrescription())
                .global(m.isGlobal())
                .build();
    }
}
