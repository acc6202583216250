package com.clinic.records.entity;

import com.clinic.records.exception.ForbiddenException;
import com.clinic.records.exception.InvalidTenantContextException;
import com.clinic.records.tenant.TenantContextHolder;
import jakarta.persistence.PrePersist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Stamps new tenant-owned rows with the bound tenant and refuses rows addressed to any other tenant.
 */
public class TenantStampListener {

    private static final Logger log = LoggerFactory.getLogger(TenantStampListener.class);

    @PrePersist
    public void stamp(Object entity) {
        if (!(entity instanceof TenantOwned owned)) {
            return;
        }
        UUID bound = TenantContextHolder.currentTenant()
                .orElseThrow(() -> new InvalidTenantContextException(
                        "No tenant bound while creating " + entity.getClass().getSimpleName()));
        if (owned.getTenantId() == null) {
            owned.setTenantId(bound);
        } else if (!owned.getTenantId().equals(bound)) {
            log.error("Cross-tenant write refused: {} addressed to tenant {} while bound to {}",
                    entity.getClass().getSimpleName(), owned.getTenantId(), bound);
            throw new ForbiddenException(entity.getClass().getSimpleName() + " addressed to tenant "
                    + owned.getTenantId() + " while bound to " + bound);
        }
    }
}
