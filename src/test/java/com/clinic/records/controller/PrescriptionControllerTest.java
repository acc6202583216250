package com.clinic.records.controller;

import com.clinic.records.ClinicFixtures;
import com.clinic.records.dto.ClinicRegistrationResponse;
import com.clinic.records.service.TenantService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PrescriptionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TenantService tenantService;

    private String bearer;
    private String doctorId;
    private String mobile;
    private String medicineId;

    @BeforeEach
    void setUp() throws Exception {
        ClinicRegistrationResponse clinic = tenantService.registerClinic(ClinicFixtures.clinic("admin_doctor"));
        bearer = "Bearer " + clinic.getToken().getAccessToken();
        doctorId = clinic.getDoctorId().toString();
        mobile = ClinicFixtures.uniqueMobile();

        mockMvc.perform(post("/api/v1/patients")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mobileNumber\":\"" + mobile + "\",\"firstName\":\"Ravi\",\"relationship\":\"SELF\"}"))
                .andExpect(status().isCreated());

        String medicine = mockMvc.perform(post("/api/v1/medicines")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Amoxicillin 250\",\"price\":8.00}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        medicineId = objectMapper.readTree(medicine).get("id").asText();
    }

    private String prescription(String items) {
        return "{\"patientMobile\":\"" + mobile + "\",\"patientFirstName\":\"Ravi\",\"doctorId\":\"" + doctorId + "\","
                + "\"diagnosis\":\"Throat infection\",\"items\":" + items + "}";
    }

    private String amoxicillin() {
        return "[{\"medicineId\":\"" + medicineId + "\",\"dosage\":\"1 capsule\",\"frequency\":\"Thrice daily\","
                + "\"duration\":\"7 days\",\"quantity\":21}]";
    }

    @Test
    void issuedPrescriptionIsFoundByNumberAndPrinted() throws Exception {
        String body = mockMvc.perform(post("/api/v1/prescriptions")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(prescription(amoxicillin())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.items[0].medicineName").value("Amoxicillin 250"))
                .andExpect(jsonPath("$.totalAmount").value(168.0))
                .andReturn().getResponse().getContentAsString();
        JsonNode issued = objectMapper.readTree(body);

        mockMvc.perform(get("/api/v1/prescriptions/number/" + issued.get("prescriptionNumber").asText())
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(issued.get("id").asText()));

        mockMvc.perform(post("/api/v1/prescriptions/" + issued.get("id").asText() + "/print")
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.printed").value(true))
                .andExpect(jsonPath("$.templateUsed").value("default"));
    }

    @Test
    void emptyItemListFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/prescriptions")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(prescription("[]")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.items").exists());
    }

    @Test
    void illegalStatusChangeIsUnprocessable() throws Exception {
        String body = mockMvc.perform(post("/api/v1/prescriptions")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(prescription(amoxicillin())))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String id = objectMapper.readTree(body).get("id").asText();

        mockMvc.perform(post("/api/v1/prescriptions/" + id + "/status")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"DRAFT\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_STATUS_TRANSITION"));
    }

    @Test
    void adminWithoutPrescribingRightsCannotIssue() throws Exception {
        ClinicRegistrationResponse adminClinic = tenantService.registerClinic(ClinicFixtures.clinic("admin"));

        mockMvc.perform(post("/api/v1/prescriptions")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminClinic.getToken().getAccessToken())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(prescription(amoxicillin())))
                .andExpect(status().isForbidden());
    }
}
