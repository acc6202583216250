package com.clinic.records.auth;

import com.clinic.records.config.ClinicProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HS256 access tokens.
 */
@Service
public class AccessTokenService {

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TENANT_ID = "tenant_id";
    static final String CLAIM_PERMISSIONS = "permissions";
    static final String CLAIM_TYPE = "type";
    static final String ACCESS = "access";

    private final SecretKey key;
    private final String issuer;
    private final Duration ttl;
    private final Clock clock;
    private final JwtParser parser;

    @Autowired
    public AccessTokenService(ClinicProperties properties) {
        this(properties.getSecurity(), Clock.systemUTC());
    }

    public AccessTokenService(ClinicProperties.Security security, Clock clock) {
        String secret = security.getJwtSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalStateException("clinic.security.jwt-secret must be at least 32 bytes");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = security.getIssuer();
        this.ttl = security.getAccessTokenTtl();
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(issuer)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public String issue(UUID userId, Role role, UUID tenantId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .issuer(issuer)
                .subject(userId.toString())
                .claim(CLAIM_USER_ID, userId.toString())
                .claim(CLAIM_ROLE, role.tag())
                .claim(CLAIM_TENANT_ID, tenantId == null ? null : tenantId.toString())
                .claim(CLAIM_PERMISSIONS, role.permissions().stream().map(Permission::tag).toList())
                .claim(CLAIM_TYPE, ACCESS)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key)
                .compact();
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Verify signature, issuer and expiry, then map the payload to claims.
     *
     * @throws JwtException             if the token is not acceptable
     * @throws IllegalArgumentException if a claim has an unexpected format
     */
    public IdentityClaims verify(String token) {
        Claims claims = parser.parseSignedClaims(token).getPayload();
        if (!ACCESS.equals(claims.get(CLAIM_TYPE, String.class))) {
            throw new JwtException("Not an access token");
        }
        String userId = claims.get(CLAIM_USER_ID, String.class);
        String role = claims.get(CLAIM_ROLE, String.class);
        String tenantId = claims.get(CLAIM_TENANT_ID, String.class);
        if (userId == null || role == null) {
            throw new JwtException("Token is missing user_id or role");
        }
        return new IdentityClaims(
                UUID.fromString(userId),
                Role.fromTag(role),
                tenantId == null ? null : UUID.fromString(tenantId));
    }
}
