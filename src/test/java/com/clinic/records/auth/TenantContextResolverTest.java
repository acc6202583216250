package com.clinic.records.auth;

import com.clinic.records.config.ClinicProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TenantContextResolverTest {

    private static final String SECRET = "resolver-test-secret-with-at-least-32-bytes";
    private static final Instant NOW = Instant.parse("2026-03-10T10:00:00Z");

    private AccessTokenService tokenService;
    private TenantContextResolver resolver;

    @BeforeEach
    void setUp() {
        ClinicProperties.Security security = new ClinicProperties.Security();
        security.setJwtSecret(SECRET);
        security.setAccessTokenTtl(Duration.ofMinutes(30));
        tokenService = new AccessTokenService(security, Clock.fixed(NOW, ZoneOffset.UTC));
        resolver = new TenantContextResolver(tokenService);
    }

    @Test
    void validTokenYieldsItsClaims() {
        UUID user = UUID.randomUUID();
        UUID tenant = UUID.randomUUID();
        String token = tokenService.issue(user, Role.RECEPTIONIST, tenant);

        IdentityClaims claims = resolver.resolve("Bearer " + token);

        assertEquals(user, claims.userId());
        assertEquals(Role.RECEPTIONIST, claims.role());
        assertEquals(tenant, claims.tenantId());
        assertTrue(claims.has(Permission.REGISTER_PATIENTS));
        assertFalse(claims.has(Permission.MANAGE_PATIENTS));
    }

    @Test
    void platformTokenHasNoTenant() {
        IdentityClaims claims = resolver.resolve("Bearer " + tokenService.issue(UUID.randomUUID(), Role.SUPER_ADMIN, null));

        assertTrue(claims.isAuthenticated());
        assertTrue(claims.tenant().isEmpty());
    }

    @Test
    void missingOrMalformedHeaderIsAnonymous() {
        assertSame(IdentityClaims.ANONYMOUS, resolver.resolve((String) null));
        assertSame(IdentityClaims.ANONYMOUS, resolver.resolve(""));
        assertSame(IdentityClaims.ANONYMOUS, resolver.resolve("Basic dXNlcjpwdw=="));
        assertSame(IdentityClaims.ANONYMOUS, resolver.resolve("Bearer "));
        assertSame(IdentityClaims.ANONYMOUS, resolver.resolve("Bearer not.a.jwt"));
    }

    @Test
    void expiredTokenIsAnonymous() {
        ClinicProperties.Security security = new ClinicProperties.Security();
        security.setJwtSecret(SECRET);
        AccessTokenService earlier = new AccessTokenService(security,
                Clock.fixed(NOW.minus(Duration.ofHours(2)), ZoneOffset.UTC));
        String stale = earlier.issue(UUID.randomUUID(), Role.DOCTOR, UUID.randomUUID());

        assertSame(IdentityClaims.ANONYMOUS, resolver.resolve("Bearer " + stale));
    }

    @Test
    void tokenSignedWithAnotherKeyIsAnonymous() {
        String forged = Jwts.builder()
                .issuer("clinic-records")
                .claim("user_id", UUID.randomUUID().toString())
                .claim("role", "super_admin")
                .claim("type", "access")
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(Keys.hmacShaKeyFor("another-secret-that-is-also-32-bytes-long".getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertSame(IdentityClaims.ANONYMOUS, resolver.resolve("Bearer " + forged));
    }

    @Test
    void tokenWithMalformedTenantClaimIsAnonymous() {
        String token = Jwts.builder()
                .issuer("clinic-records")
                .claim("user_id", UUID.randomUUID().toString())
                .claim("role", "doctor")
                .claim("tenant_id", "clinic-42")
                .claim("type", "access")
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertSame(IdentityClaims.ANONYMOUS, resolver.resolve("Bearer " + token));
    }

    @Test
    void readsAuthorizationHeaderOfRequest() {
        UUID tenant = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "bearer " + tokenService.issue(UUID.randomUUID(), Role.NURSE, tenant));

        assertEquals(tenant, resolver.resolve(request).tenantId());
    }

    @Test
    void shortSecretIsRejectedAtStartup() {
        ClinicProperties.Security security = new ClinicProperties.Security();
        security.setJwtSecret("too-short");

        assertThrows(IllegalStateException.class, () -> new AccessTokenService(security, Clock.systemUTC()));
    }
}
