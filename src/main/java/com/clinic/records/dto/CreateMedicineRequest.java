package com.clinic.records.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class CreateMedicineRequest {
    @NotBlank(message = "Name is required")
    @Size(max = 200)
    private String name;
    private String genericName;
    private String manufacturer;
    private String strength;
    private String drugCategory;
    @DecimalMin("0")
    private BigDecimal price;
    private boolean requiresPrescription = true;
}
