package com.clinic.records.auth;

import com.clinic.records.exception.ForbiddenException;
import com.clinic.records.exception.InvalidTenantContextException;
import com.clinic.records.exception.UnauthorizedException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.UUID;

/**
 * Endpoint-level authorization. Row isolation scopes the data; this decides whether the caller may act at all.
 */
@Component
public class AccessGuard {

    public IdentityClaims requireAuthenticated(IdentityClaims claims) {
        if (claims == null || !claims.isAuthenticated()) {
            throw new UnauthorizedException("Authentication required");
        }
        return claims;
    }

    /** Caller must hold at least one of {@code permissions}. Returns the tenant the request is bound to. */
    public UUID requireAny(IdentityClaims claims, Permission... permissions) {
        requireAuthenticated(claims);
        if (Arrays.stream(permissions).noneMatch(claims::has)) {
            throw new ForbiddenException("Role " + claims.role().tag() + " may not perform this action");
        }
        return requireTenant(claims);
    }

    public UUID requireTenant(IdentityClaims claims) {
        requireAuthenticated(claims);
        return claims.tenant()
                .orElseThrow(() -> new InvalidTenantContextException("Token carries no tenant"));
    }
}
