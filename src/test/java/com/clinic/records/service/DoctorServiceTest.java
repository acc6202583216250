package com.clinic.records.service;

import com.clinic.records.ClinicFixtures;
import com.clinic.records.dto.AvailabilityRequest;
import com.clinic.records.dto.BookAppointmentRequest;
import com.clinic.records.dto.ClinicRegistrationResponse;
import com.clinic.records.dto.CreateMedicineRequest;
import com.clinic.records.dto.SlotResponse;
import com.clinic.records.entity.Medicine;
import com.clinic.records.entity.Relationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class DoctorServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2030, 1, 7);
    private static final LocalDate SUNDAY = LocalDate.of(2030, 1, 6);

    @Autowired
    private DoctorService doctorService;

    @Autowired
    private SlotService slotService;

    @Autowired
    private AppointmentService appointmentService;

    @Autowired
    private PatientIdentityRegistry registry;

    @Autowired
    private MedicineCatalogService medicineCatalogService;

    @Autowired
    private TenantService tenantService;

    private UUID tenantId;
    private UUID doctorId;

    @BeforeEach
    void setUp() {
        ClinicRegistrationResponse clinic = tenantService.registerClinic(ClinicFixtures.clinic("admin_doctor"));
        tenantId = clinic.getTenant().getId();
        doctorId = clinic.getDoctorId();
    }

    private static AvailabilityRequest ranges(AvailabilityRequest.Range... ranges) {
        AvailabilityRequest request = new AvailabilityRequest();
        request.setRanges(List.of(ranges));
        return request;
    }

    @Test
    void defaultWeekAppliesWithoutSchedule() {
        String mobile = ClinicFixtures.uniqueMobile();
        registry.register(tenantId, ClinicFixtures.patient(mobile, "Ravi", Relationship.SELF));
        appointmentService.book(tenantId, BookAppointmentRequest.builder()
                .doctorId(doctorId)
                .date(MONDAY)
                .startTime(LocalTime.of(9, 0))
                .durationMinutes(30)
                .patientMobile(mobile)
                .patientFirstName("Ravi")
                .build());

        List<SlotResponse> slots = slotService.availableSlots(tenantId, doctorId, MONDAY);

        assertThat(slots).hasSize(15);
        assertThat(slots.get(0).getStartTime()).isEqualTo(LocalTime.of(9, 30));
        assertThat(slots).extracting(SlotResponse::getStartTime).doesNotContain(LocalTime.of(13, 0));
        assertThat(slotService.availableSlots(tenantId, doctorId, SUNDAY)).isEmpty();
    }

    @Test
    void weeklyScheduleReplacesDefaults() {
        doctorService.setWeeklyAvailability(tenantId, doctorId, ranges(
                new AvailabilityRequest.Range(1, LocalTime.of(10, 0), LocalTime.of(11, 0)),
                new AvailabilityRequest.Range(7, LocalTime.of(8, 0), LocalTime.of(8, 30))));

        assertThat(slotService.availableSlots(tenantId, doctorId, MONDAY))
                .extracting(SlotResponse::getStartTime)
                .containsExactly(LocalTime.of(10, 0), LocalTime.of(10, 30));
        assertThat(slotService.availableSlots(tenantId, doctorId, SUNDAY)).hasSize(1);

        doctorService.setWeeklyAvailability(tenantId, doctorId, ranges(
                new AvailabilityRequest.Range(1, LocalTime.of(15, 0), LocalTime.of(15, 30))));
        assertThat(doctorService.weeklyAvailability(tenantId, doctorId)).hasSize(1);
    }

    @Test
    void invalidScheduleIsRejected() {
        assertThatThrownBy(() -> doctorService.setWeeklyAvailability(tenantId, doctorId, ranges(
                new AvailabilityRequest.Range(2, LocalTime.of(9, 0), LocalTime.of(12, 0)),
                new AvailabilityRequest.Range(2, LocalTime.of(11, 0), LocalTime.of(13, 0)))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> doctorService.setWeeklyAvailability(tenantId, doctorId, ranges(
                new AvailabilityRequest.Range(3, LocalTime.of(12, 0), LocalTime.of(12, 0)))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> doctorService.setWeeklyAvailability(tenantId, doctorId, ranges(
                new AvailabilityRequest.Range(8, LocalTime.of(9, 0), LocalTime.of(10, 0)))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void medicineSearchCombinesGlobalAndOwnCatalogue() {
        CreateMedicineRequest request = new CreateMedicineRequest();
        request.setName("Paracetamol Syrup House Blend");
        Medicine own = medicineCatalogService.addTenantMedicine(tenantId, request);
        UUID otherTenant = tenantService.registerClinic(ClinicFixtures.clinic("admin")).getTenant().getId();

        List<Medicine> mine = medicineCatalogService.search(tenantId, "paracetamol");
        List<Medicine> theirs = medicineCatalogService.search(otherTenant, "paracetamol");

        assertThat(mine).extracting(Medicine::getId).contains(own.getId());
        assertThat(mine).anyMatch(Medicine::isGlobal);
        assertThat(theirs).extracting(Medicine::getId).doesNotContain(own.getId());
        assertThat(theirs).isNotEmpty().allMatch(Medicine::isGlobal);
    }
}
