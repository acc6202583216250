package com.clinic.records.service;

import com.clinic.records.dto.CreatePrescriptionRequest;
import com.clinic.records.entity.Appointment;
import com.clinic.records.entity.Doctor;
import com.clinic.records.entity.Medicine;
import com.clinic.records.entity.Patient;
import com.clinic.records.entity.Prescription;
import com.clinic.records.entity.PrescriptionItem;
import com.clinic.records.entity.PrescriptionStatus;
import com.clinic.records.exception.DuplicateIdentityException;
import com.clinic.records.exception.InvalidStatusTransitionException;
import com.clinic.records.exception.NotFoundException;
import com.clinic.records.exception.StorageErrorTranslator;
import com.clinic.records.repository.AppointmentRepository;
import com.clinic.records.repository.DoctorRepository;
import com.clinic.records.repository.MedicineRepository;
import com.clinic.records.repository.PatientRepository;
import com.clinic.records.repository.PrescriptionRepository;
import com.clinic.records.tenant.ConnectionScopeBinder;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Issues prescriptions and moves them through their lifecycle. A prescription is written against an active
 * patient and doctor of the bound tenant; its medicines come from the catalogue entries that tenant can see.
 */
@Service
public class PrescriptionService {

    private static final Logger log = LoggerFactory.getLogger(PrescriptionService.class);
    private static final DateTimeFormatter NUMBER_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    static final String BUILT_IN_TEMPLATE = "default";

    private final PrescriptionRepository prescriptionRepository;
    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;
    private final AppointmentRepository appointmentRepository;
    private final MedicineRepository medicineRepository;
    private final TemplateResolutionChain templateChain;
    private final ConnectionScopeBinder binder;
    private final StorageErrorTranslator errorTranslator;

    public PrescriptionService(PrescriptionRepository prescriptionRepository,
                               PatientRepository patientRepository,
                               DoctorRepository doctorRepository,
                               AppointmentRepository appointmentRepository,
                               MedicineRepository medicineRepository,
                               TemplateResolutionChain templateChain,
                               ConnectionScopeBinder binder,
                               StorageErrorTranslator errorTranslator) {
        this.prescriptionRepository = prescriptionRepository;
        this.patientRepository = patientRepository;
        this.doctorRepository = doctorRepository;
        this.appointmentRepository = appointmentRepository;
        this.medicineRepository = medicineRepository;
        this.templateChain = templateChain;
        this.binder = binder;
        this.errorTranslator = errorTranslator;
    }

    public Prescription create(UUID tenantId, CreatePrescriptionRequest request) {
        String mobile = PatientIdentityRegistry.normalizeMobile(request.getPatientMobile());
        String firstName = PatientIdentityRegistry.normalizeName(request.getPatientFirstName());
        LocalDate visitDate = request.getVisitDate() == null ? LocalDate.now() : request.getVisitDate();
        if (visitDate.isAfter(LocalDate.now())) {
            throw new IllegalArgumentException("Visit date cannot be in the future");
        }
        Set<UUID> medicineIds = new HashSet<>();
        for (CreatePrescriptionRequest.Item item : request.getItems()) {
            if (!medicineIds.add(item.getMedicineId())) {
                throw new IllegalArgumentException("Medicine " + item.getMedicineId() + " is listed more than once");
            }
        }

        Prescription created = binder.inTenantTransaction(tenantId, status -> {
            Patient patient = patientRepository
                    .findByTenantIdAndMobileNumberAndFirstNameAndActiveTrue(tenantId, mobile, firstName)
                    .orElseThrow(() -> NotFoundException.of("Patient", mobile + "/" + firstName));
            Doctor doctor = doctorRepository.findByIdAndTenantId(request.getDoctorId(), tenantId)
                    .filter(Doctor::isActive)
                    .orElseThrow(() -> NotFoundException.of("Doctor", request.getDoctorId()));
            if (request.getAppointmentId() != null) {
                Appointment appointment = appointmentRepository
                        .findByIdAndTenantId(request.getAppointmentId(), tenantId)
                        .orElseThrow(() -> NotFoundException.of("Appointment", request.getAppointmentId()));
                if (!appointment.getPatientId().equals(patient.getId())
                        || !appointment.getDoctorId().equals(doctor.getId())) {
                    throw new IllegalArgumentException("Appointment " + appointment.getAppointmentNumber()
                            + " belongs to a different patient or doctor");
                }
            }

            Prescription prescription = Prescription.builder()
                    .tenantId(tenantId)
                    .prescriptionNumber(nextPrescriptionNumber(visitDate))
                    .patientId(patient.getId())
                    .patientMobileNumber(patient.getMobileNumber())
                    .patientFirstName(patient.getFirstName())
                    .doctorId(doctor.getId())
                    .appointmentId(request.getAppointmentId())
                    .visitDate(visitDate)
                    .chiefComplaint(StringUtils.trimToNull(request.getChiefComplaint()))
                    .diagnosis(request.getDiagnosis().trim())
                    .symptoms(StringUtils.trimToNull(request.getSymptoms()))
                    .clinicalNotes(StringUtils.trimToNull(request.getClinicalNotes()))
                    .doctorInstructions(StringUtils.trimToNull(request.getDoctorInstructions()))
                    .status(request.isDraft() ? PrescriptionStatus.DRAFT : PrescriptionStatus.ACTIVE)
                    .build();
            int sequence = 1;
            for (CreatePrescriptionRequest.Item item : request.getItems()) {
                prescription.addItem(toItem(tenantId, item, sequence++));
            }
            return saveChecked("create prescription", prescription);
        });
        log.info("Issued prescription {} ({} item(s)) by doctor {} as {}", created.getPrescriptionNumber(),
                created.getItems().size(), created.getDoctorId(), created.getStatus());
        return created;
    }

    public Prescription changeStatus(UUID tenantId, UUID prescriptionId, PrescriptionStatus target, String notes) {
        Prescription updated = binder.inTenantTransaction(tenantId, status -> {
            Prescription prescription = lockPrescription(tenantId, prescriptionId);
            if (!prescription.getStatus().canTransitionTo(target)) {
                throw new InvalidStatusTransitionException("Cannot change prescription "
                        + prescription.getPrescriptionNumber() + " from " + prescription.getStatus() + " to " + target);
            }
            prescription.setStatus(target);
            if (StringUtils.isNotBlank(notes)) {
                prescription.setClinicalNotes(appendNote(prescription.getClinicalNotes(), notes.trim()));
            }
            return prescriptionRepository.save(prescription);
        });
        log.info("Prescription {} is now {}", prescriptionId, target);
        return updated;
    }

    /**
     * Records a print using the template the resolution chain picks for the prescribing doctor at the given
     * office, or the built-in layout when the clinic has none. Reprints move {@code printedAt} forward.
     */
    public Prescription markPrinted(UUID tenantId, UUID prescriptionId, UUID officeId) {
        Prescription printed = binder.inTenantTransaction(tenantId, status -> {
            Prescription prescription = lockPrescription(tenantId, prescriptionId);
            if (!prescription.getStatus().isPrintable()) {
                throw new InvalidStatusTransitionException("Prescription " + prescription.getPrescriptionNumber()
                        + " cannot be printed while " + prescription.getStatus());
            }
            String templateName = templateChain.resolve(tenantId, prescription.getDoctorId(), officeId)
                    .map(resolved -> resolved.template().getName())
                    .orElse(BUILT_IN_TEMPLATE);
            prescription.setPrinted(true);
            prescription.setPrintedAt(Instant.now());
            prescription.setTemplateUsed(templateName);
            return prescriptionRepository.save(prescription);
        });
        log.info("Prescription {} printed with template '{}'", printed.getPrescriptionNumber(),
                printed.getTemplateUsed());
        return printed;
    }

    public Prescription findById(UUID tenantId, UUID prescriptionId) {
        return binder.inTenantReadOnly(tenantId, status ->
                prescriptionRepository.findByIdAndTenantId(prescriptionId, tenantId)
                        .orElseThrow(() -> NotFoundException.of("Prescription", prescriptionId)));
    }

    public Prescription findByNumber(UUID tenantId, String prescriptionNumber) {
        String number = StringUtils.trimToEmpty(prescriptionNumber).toUpperCase(Locale.ROOT);
        return binder.inTenantReadOnly(tenantId, status ->
                prescriptionRepository.findByTenantIdAndPrescriptionNumber(tenantId, number)
                        .orElseThrow(() -> NotFoundException.of("Prescription", number)));
    }

    public List<Prescription> findByPatient(UUID tenantId, String mobileNumber, String firstName) {
        String mobile = PatientIdentityRegistry.normalizeMobile(mobileNumber);
        String name = PatientIdentityRegistry.normalizeName(firstName);
        return binder.inTenantReadOnly(tenantId, status -> prescriptionRepository
                .findByTenantIdAndPatientMobileNumberAndPatientFirstNameOrderByVisitDateDescCreatedAtDesc(
                        tenantId, mobile, name));
    }

    /** Both bounds are inclusive; an open start reaches back to the first visit, an open end stops today. */
    public List<Prescription> findByDoctor(UUID tenantId, UUID doctorId, LocalDate from, LocalDate to) {
        LocalDate start = from == null ? LocalDate.EPOCH : from;
        LocalDate end = to == null ? LocalDate.now() : to;
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start date " + start + " is after end date " + end);
        }
        return binder.inTenantReadOnly(tenantId, status -> prescriptionRepository
                .findByTenantIdAndDoctorIdAndVisitDateBetweenOrderByVisitDateDescCreatedAtDesc(
                        tenantId, doctorId, start, end));
    }

    private PrescriptionItem toItem(UUID tenantId, CreatePrescriptionRequest.Item item, int sequence) {
        Medicine medicine = medicineRepository.findVisible(item.getMedicineId(), tenantId)
                .orElseThrow(() -> NotFoundException.of("Medicine", item.getMedicineId()));
        int quantity = item.getQuantity() == null ? 1 : item.getQuantity();
        BigDecimal unitPrice = item.getUnitPrice() != null ? item.getUnitPrice() : medicine.getPrice();
        return PrescriptionItem.builder()
                .tenantId(tenantId)
                .medicineId(medicine.getId())
                .medicineName(medicine.getName())
                .dosage(item.getDosage().trim())
                .frequency(item.getFrequency().trim())
                .duration(item.getDuration().trim())
                .instructions(StringUtils.trimToNull(item.getInstructions()))
                .quantity(quantity)
                .unitPrice(unitPrice)
                .totalAmount(unitPrice == null ? null : unitPrice.multiply(BigDecimal.valueOf(quantity)))
                .genericSubstitutionAllowed(item.getGenericSubstitutionAllowed() == null
                        || item.getGenericSubstitutionAllowed())
                .sequenceOrder(sequence)
                .build();
    }

    private Prescription lockPrescription(UUID tenantId, UUID prescriptionId) {
        return prescriptionRepository.findByIdForUpdate(prescriptionId, tenantId)
                .orElseThrow(() -> NotFoundException.of("Prescription", prescriptionId));
    }

    private Prescription saveChecked(String operation, Prescription prescription) {
        try {
            return prescriptionRepository.saveAndFlush(prescription);
        } catch (DataIntegrityViolationException e) {
            throw errorTranslator.translateWrite(operation, e,
                    () -> new DuplicateIdentityException("Prescription number collision, please retry"));
        }
    }

    private String nextPrescriptionNumber(LocalDate visitDate) {
        String number;
        do {
            number = "RX-" + visitDate.format(NUMBER_DATE) + "-"
                    + RandomStringUtils.randomAlphanumeric(8).toUpperCase(Locale.ROOT);
        } while (prescriptionRepository.existsByPrescriptionNumber(number));
        return number;
    }

    private static String appendNote(String existing, String note) {
        return StringUtils.isBlank(existing) ? note : existing + "\n" + note;
    }
}
