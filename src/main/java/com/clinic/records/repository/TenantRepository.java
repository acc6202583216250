package com.clinic.records.repository;

import com.clinic.records.entity.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TenantRepository extends JpaRepository<Tenant, UUID> {

    Optional<Tenant> findByTenantCode(String tenantCode);

    boolean existsByPhone(String phone);

    /** Serialises changes to tenant-wide settings such as the clinic's default template. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Tenant t WHERE t.id = :id")
    Optional<Tenant> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT t.tenantCode FROM Tenant t WHERE t.tenantCode LIKE CONCAT(:prefix, '%')")
    List<String> findCodesStartingWith(@Param("prefix") String prefix);
}
