package com.clinic.records.entity;

import java.util.UUID;

/**
 * Row partitioned by tenant and covered by row isolation.
 */
public interface TenantOwned {

    UUID getTenantId();

    void setTenantId(UUID tenantId);
}
