package com.clinic.records.service;

import com.clinic.records.dto.CreateMedicineRequest;
import com.clinic.records.entity.Medicine;
import com.clinic.records.repository.MedicineRepository;
import com.clinic.records.tenant.ConnectionScopeBinder;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Shared medicine catalogue: global entries (null tenant) visible to every clinic plus each clinic's own.
 */
@Service
public class MedicineCatalogService {

    private static final Logger log = LoggerFactory.getLogger(MedicineCatalogService.class);

    private final MedicineRepository medicineRepository;
    private final ConnectionScopeBinder binder;

    public MedicineCatalogService(MedicineRepository medicineRepository, ConnectionScopeBinder binder) {
        this.medicineRepository = medicineRepository;
        this.binder = binder;
    }

    public List<Medicine> search(UUID tenantId, String text) {
        String pattern = "%" + StringUtils.defaultString(StringUtils.trimToNull(text)).toLowerCase(Locale.ROOT)
                .replace("%", "").replace("_", "") + "%";
        return binder.inTenantReadOnly(tenantId, status -> medicineRepository.search(tenantId, pattern));
    }

    public Medicine addTenantMedicine(UUID tenantId, CreateMedicineRequest request) {
        Medicine saved = binder.inTenantTransaction(tenantId, status -> medicineRepository.save(Medicine.builder()
                .tenantId(tenantId)
                .name(request.getName().trim())
                .genericName(StringUtils.trimToNull(request.getGenericName()))
                .manufacturer(StringUtils.trimToNull(request.getManufacturer()))
                .strength(StringUtils.trimToNull(request.getStrength()))
                .drugCategory(StringUtils.trimToNull(request.getDrugCategory()))
                .price(request.getPrice())
                .requiresPrescription(request.isRequiresPrescription())
                .active(true)
                .build()));
        log.info("Added medicine {} to tenant {} catalogue", saved.getId(), tenantId);
        return saved;
    }

    /** Inserts the global entries unless a global catalogue already exists. */
    public int seedGlobalCatalog(List<Medicine> entries) {
        return binder.inUnboundTransaction(status -> {
            if (medicineRepository.countByTenantIdIsNull() > 0) {
                return 0;
            }
            entries.forEach(m -> m.setTenantId(null));
            return medicineRepository.saveAll(entries).size();
        });
    }
}
