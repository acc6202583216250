package com.clinic.records.dto;

import com.clinic.records.entity.Appointment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Locale;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentResponse {
    private UUID id;
    private String appointmentNumber;
    private UUID patientId;
    private String patientMobile;
    private String patientFirstName;
    private UUID doctorId;
    private UUID officeId;
    private LocalDate date;
    private LocalTime startTime;
    private int durationMinutes;
    private String status;
    private String reason;
    private UUID rescheduledFromId;

    public static AppointmentResponse from(Appointment a) {
        return AppointmentResponse.builder()
                .id(a.getId())
                .appointmentNumber(a.getAppointmentNumber())
                .patientId(a.getPatientId())
                .patientMobile(a.getPatientMobileNumber())
                .patientFirstName(a.getPatientFirstName())
                .doctorId(a.getDoctorId())
                .officeId(a.getOfficeId())
                .date(a.getAppointmentDate())
                .startTime(a.getAppointmentTime())
                .durationMinutes(a.getDurationMinutes())
                .status(a.getStatus().name().toLowerCase(Locale.ROOT))
                .reason(a.getReasonForVisit())
                .rescheduledFromId(a.getRescheduledFromId())
                .build();
    }
}
