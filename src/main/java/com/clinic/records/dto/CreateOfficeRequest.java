package com.clinic.records.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOfficeRequest {
    @NotBlank(message = "Office name is required")
    @Size(max = 200)
    private String name;
    @Size(max = 500)
    private String address;
    @Size(max = 20)
    private String phone;
}
