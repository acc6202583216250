package com.clinic.records.auth;

import io.jsonwebtoken.JwtException;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Turns the bearer token of a request into {@link IdentityClaims}. Never fails the request: a missing,
 * expired, malformed or forged token yields {@link IdentityClaims#ANONYMOUS}, which binds no tenant.
 */
@Component
public class TenantContextResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantContextResolver.class);
    private static final String BEARER = "Bearer ";

    private final AccessTokenService tokenService;

    public TenantContextResolver(AccessTokenService tokenService) {
        this.tokenService = tokenService;
    }

    public IdentityClaims resolve(HttpServletRequest request) {
        return resolve(request.getHeader(HttpHeaders.AUTHORIZATION));
    }

    public IdentityClaims resolve(String authorizationHeader) {
        if (StringUtils.isBlank(authorizationHeader)
                || !StringUtils.startsWithIgnoreCase(authorizationHeader, BEARER)) {
            return IdentityClaims.ANONYMOUS;
        }
        String token = authorizationHeader.substring(BEARER.length()).trim();
        if (token.isEmpty()) {
            return IdentityClaims.ANONYMOUS;
        }
        try {
            return tokenService.verify(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected access token: {}", e.getMessage());
            return IdentityClaims.ANONYMOUS;
        }
    }
}
