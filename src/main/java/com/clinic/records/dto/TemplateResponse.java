package com.clinic.records.dto;

import com.clinic.records.entity.PrescriptionTemplate;
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
public class TemplateResponse {
    private UUID id;
    private UUID doctorId;
    private UUID officeId;
    private String name;
    private String description;
    private String paperSize;
    private String orientation;
    private BigDecimal marginTop;
    private BigDecimal marginBottom;
    private BigDecimal marginLeft;
    private BigDecimal marginRight;
    private String layoutConfig;
    private String signatureText;
    private String presetType;
    private boolean defaultTemplate;
    /** Which fallback step produced this template, when resolved. */
    private String resolvedBy;

    public static TemplateResponse from(PrescriptionTemplate t) {
        return TemplateResponse.builder()
                .id(t.getId())
                .doctorId(t.getDoctorId())
                .officeId(t.getOfficeId())
                .name(t.getName())
                .description(t.getDescription())
                .paperSize(t.getPaperSize())
                .orientation(t.getOrientation())
                .marginTop(t.getMarginTop())
                .marginBottom(t.getMarginBottom())
                .marginLeft(t.getMarginLeft())
                .marginRight(t.getMarginRight())
                .layoutConfig(t.getLayoutConfig())
                .signatureText(t.getSignatureText())
                .presetType(t.getPresetType())
                .defaultTemplate(t.isDefaultTemplate())
                .build();
    }
}
