package com.clinic.records.dto;

import com.clinic.records.entity.DoctorOffice;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OfficeResponse {
    private UUID id;
    private UUID doctorId;
    private String name;
    private String address;
    private String phone;
    private boolean primary;

    public static OfficeResponse from(DoctorOffice o) {
        return new OfficeResponse(o.getId(), o.getDoctorId(), o.getName(), o.getAddress(), o.getPhone(), o.isPrimary());
    }
}
