package com.clinic.records.repository;

import com.clinic.records.entity.Medicine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MedicineRepository extends JpaRepository<Medicine, UUID> {

    /** Global entries plus the tenant's own. */
    @Query("SELECT m FROM Medicine m WHERE (m.tenantId IS NULL OR m.tenantId = :tenantId) AND m.active = true"
            + " AND (LOWER(m.name) LIKE :pattern OR LOWER(m.genericName) LIKE :pattern) ORDER BY m.name")
    List<Medicine> search(@Param("tenantId") UUID tenantId, @Param("pattern") String pattern);

    /** An active entry the tenant may prescribe: global or its own. */
    @Query("SELECT m FROM Medicine m WHERE m.id = :id AND (m.tenantId IS NULL OR m.tenantId = :tenantId)"
            + " AND m.active = true")
    Optional<Medicine> findVisible(@Param("id") UUID id, @Param("tenantId") UUID tenantId);

    long countByTenantIdIsNull();
}
