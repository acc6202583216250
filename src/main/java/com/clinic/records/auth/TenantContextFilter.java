package com.clinic.records.auth;

import com.clinic.records.tenant.TenantContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Resolves the caller's identity once per request and exposes it to controllers, to the connection pool
 * (through {@link TenantContextHolder}) and to log lines (through MDC). Everything is cleared on the way out.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class TenantContextFilter extends OncePerRequestFilter {

    static final String MDC_TENANT = "tenantId";
    static final String MDC_USER = "userId";

    private final TenantContextResolver resolver;

    public TenantContextFilter(TenantContextResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        IdentityClaims claims = resolver.resolve(request);
        request.setAttribute(IdentityClaims.REQUEST_ATTRIBUTE, claims);
        try {
            TenantContextHolder.set(claims.tenantId());
            if (claims.tenantId() != null) {
                MDC.put(MDC_TENANT, claims.tenantId().toString());
            }
            if (claims.userId() != null) {
                MDC.put(MDC_USER, claims.userId().toString());
            }
            chain.doFilter(request, response);
        } finally {
            TenantContextHolder.clear();
            MDC.remove(MDC_TENANT);
            MDC.remove(MDC_USER);
        }
    }
}
