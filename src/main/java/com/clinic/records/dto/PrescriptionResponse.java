package com.clinic.records.dto;

import com.clinic.records.entity.Prescription;
import com.clinic.records.entity.PrescriptionItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionResponse {
    private UUID id;
    private String prescriptionNumber;
    private UUID patientId;
    private String patientMobile;
    private String patientFirstName;
    private UUID doctorId;
    private UUID appointmentId;
    private LocalDate visitDate;
    private String chiefComplaint;
    private String diagnosis;
    private String symptoms;
    private String clinicalNotes;
    private String doctorInstructions;
    private String status;
    private boolean printed;
    private Instant printedAt;
    private String templateUsed;
    private BigDecimal totalAmount;
    private List<ItemResponse> items;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemResponse {
        private UUID medicineId;
        private String medicineName;
        private String dosage;
        private String frequency;
        private String duration;
        private String instructions;
        private int quantity;
        private BigDecimal unitPrice;
        private BigDecimal totalAmount;
        private boolean genericSubstitutionAllowed;
        private int sequenceOrder;

        static ItemResponse from(PrescriptionItem i) {
            return ItemResponse.builder()
                    .medicineId(i.getMedicineId())
                    .medicineName(i.getMedicineName())
                    .dosage(i.getDosage())
                    .frequency(i.getFrequency())
                    .duration(i.getDuration())
                    .instructions(i.getInstructions())
                    .quantity(i.getQuantity())
                    .unitPrice(i.getUnitPrice())
                    .totalAmount(i.getTotalAmount())
                    .genericSubstitutionAllowed(i.isGenericSubstitutionAllowed())
                    .sequenceOrder(i.getSequenceOrder())
                    .build();
        }
    }

    public static PrescriptionResponse from(Prescription p) {
        return PrescriptionResponse.builder()
                .id(p.getId())
                .prescriptionNumber(p.getPrescriptionNumber())
                .patientId(p.getPatientId())
                .patientMobile(p.getPatientMobileNumber())
                .patientFirstName(p.getPatientFirstName())
                .doctorId(p.getDoctorId())
                .appointmentId(p.getAppointmentId())
                .visitDate(p.getVisitDate())
                .chiefComplaint(p.getChiefComplaint())
                .diagnosis(p.getDiagnosis())
                .symptoms(p.getSymptoms())
                .clinicalNotes(p.getClinicalNotes())
                .doctorInstructions(p.getDoctorInstructions())
                .status(p.getStatus().name().toLowerCase(Locale.ROOT))
                .printed(p.isPrinted())
                .printedAt(p.getPrintedAt())
                .templateUsed(p.getTemplateUsed())
                .totalAmount(p.getItems().stream()
                        .map(PrescriptionItem::getTotalAmount)
                        .filter(Objects::nonNull)
                        .reduce(BigDecimal.ZERO, BigDecimal::add))
                .items(p.getItems().stream().map(ItemResponse::from).toList())
                .build();
    }
}
