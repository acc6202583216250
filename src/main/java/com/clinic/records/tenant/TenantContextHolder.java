package com.clinic.records.tenant;

import java.util.Optional;
import java.util.UUID;

/**
 * Thread-bound tenant of the unit of work currently executing on this thread.
 * Read by {@link TenantBindingDataSource} when the pool hands out a connection.
 */
public final class TenantContextHolder {

    private static final ThreadLocal<UUID> CURRENT = new ThreadLocal<>();

    private TenantContextHolder() {
    }

    public static Optional<UUID> currentTenant() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static void set(UUID tenantId) {
        if (tenantId == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(tenantId);
        }
    }

    public static void clear() {
        CURRENT.remove();
    }
}
