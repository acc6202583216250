package com.clinic.records.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
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
public class CreateTemplateRequest {
    /** Null for a tenant-wide template. */
    private UUID doctorId;

    /** Requires {@code doctorId}. */
    private UUID officeId;

    @NotBlank(message = "Template name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 500)
    private String description;

    @Pattern(regexp = "a4|a5|letter")
    private String paperSize;

    @Pattern(regexp = "portrait|landscape")
    private String orientation;

    @DecimalMin("0") @DecimalMax("100")
    private BigDecimal marginTop;
    @DecimalMin("0") @DecimalMax("100")
    private BigDecimal marginBottom;
    @DecimalMin("0") @DecimalMax("100")
    private BigDecimal marginLeft;
    @DecimalMin("0") @DecimalMax("100")
    private BigDecimal marginRight;

    private String layoutConfig;

    private String signatureText;

    private String presetType;

    private boolean makeDefault;
}
