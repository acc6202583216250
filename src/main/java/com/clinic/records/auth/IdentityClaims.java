package com.clinic.records.auth;

import java.util.Optional;
import java.util.UUID;

/**
 * Verified identity of the caller. All fields are null for an anonymous request.
 */
public record IdentityClaims(UUID userId, Role role, UUID tenantId) {

    public static final IdentityClaims ANONYMOUS = new IdentityClaims(null, null, null);

    /** Request attribute the claims are stored under. */
    public static final String REQUEST_ATTRIBUTE = "clinic.identityClaims";

    public boolean isAuthenticated() {
        return userId != null && role != null;
    }

    public Optional<UUID> tenant() {
        return Optional.ofNullable(tenantId);
    }

    public boolean has(Permission permission) {
        return role != null && role.has(permission);
    }
}
