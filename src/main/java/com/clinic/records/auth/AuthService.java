package com.clinic.records.auth;

import com.clinic.records.dto.LoginRequest;
import com.clinic.records.dto.TokenResponse;
import com.clinic.records.entity.Tenant;
import com.clinic.records.entity.User;
import com.clinic.records.exception.ForbiddenException;
import com.clinic.records.exception.UnauthorizedException;
import com.clinic.records.repository.TenantRepository;
import com.clinic.records.repository.UserRepository;
import com.clinic.records.service.TenantService;
import com.clinic.records.tenant.ConnectionScopeBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;

/**
 * Credential login. Runs before any tenant is known, on an unbound connection; {@code users} and
 * {@code tenants} are outside row isolation for exactly this reason.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final String BAD_CREDENTIALS = "Invalid email or password";

    private final UserRepository userRepository;
    private final TenantRepository tenantRepository;
    private final PasswordEncoder passwordEncoder;
    private final TenantService tenantService;
    private final ConnectionScopeBinder binder;

    public AuthService(UserRepository userRepository,
                       TenantRepository tenantRepository,
                       PasswordEncoder passwordEncoder,
                       TenantService tenantService,
                       ConnectionScopeBinder binder) {
        this.userRepository = userRepository;
        this.tenantRepository = tenantRepository;
        this.passwordEncoder = passwordEncoder;
        this.tenantService = tenantService;
        this.binder = binder;
    }

    public TokenResponse login(LoginRequest request) {
        String email = request.getEmail().trim().toLowerCase(Locale.ROOT);
        User user = binder.inUnboundTransaction(status -> {
            User u = userRepository.findByEmailIgnoreCase(email)
                    .filter(candidate -> passwordEncoder.matches(request.getPassword(), candidate.getPasswordHash()))
                    .orElseThrow(() -> new UnauthorizedException(BAD_CREDENTIALS));
            if (!u.isActive()) {
                throw new UnauthorizedException("Account is disabled");
            }
            if (u.getTenantId() != null) {
                Tenant tenant = tenantRepository.findById(u.getTenantId())
                        .orElseThrow(() -> new UnauthorizedException(BAD_CREDENTIALS));
                if (!tenant.isActive()) {
                    throw new ForbiddenException("Clinic account is deactivated");
                }
            }
            u.setLastLoginAt(Instant.now());
            return userRepository.save(u);
        });
        log.info("User {} logged in (tenant {})", user.getId(), user.getTenantId());
        return tenantService.token(user);
    }
}
