package com.clinic.records.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maps raw storage-engine failures onto the business taxonomy so engine errors never leak to callers.
 */
@Component
public class StorageErrorTranslator {

    private static final Logger log = LoggerFactory.getLogger(StorageErrorTranslator.class);

    /** PostgreSQL: insufficient_privilege, raised when a row fails a policy WITH CHECK. */
    static final String ROW_POLICY_VIOLATION = "42501";
    static final String UNIQUE_VIOLATION = "23505";

    /**
     * Translate a failure raised while writing. Unique-key violations become the supplied business error,
     * row-policy violations become {@link ForbiddenException}; anything else is returned unchanged.
     */
    public RuntimeException translateWrite(String operation, RuntimeException ex,
                                           Supplier<? extends ClinicException> onDuplicate) {
        if (ex instanceof ClinicException) {
            return ex;
        }
        Optional<String> state = sqlState(ex);
        if (state.filter(ROW_POLICY_VIOLATION::equals).isPresent()) {
            return crossTenantWrite(operation, ex);
        }
        if (onDuplicate != null
                && (state.filter(UNIQUE_VIOLATION::equals).isPresent() || ex instanceof DataIntegrityViolationException)) {
            ClinicException translated = onDuplicate.get();
            log.warn("{} rejected by unique constraint: {}", operation, translated.getMessage());
            return translated;
        }
        return ex;
    }

    public RuntimeException translate(String operation, RuntimeException ex) {
        return translateWrite(operation, ex, null);
    }

    private ForbiddenException crossTenantWrite(String operation, Throwable ex) {
        log.error("SECURITY: {} rejected by row-isolation write check, possible cross-tenant write", operation, ex);
        return new ForbiddenException("Write rejected: row does not belong to the bound tenant", ex);
    }

    static Optional<String> sqlState(Throwable ex) {
        Throwable current = ex;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SQLException sql) {
                SQLException next = sql;
                while (next != null) {
                    if (next.getSQLState() != null) {
                        return Optional.of(next.getSQLState());
                    }
                    next = next.getNextException();
                }
            }
            current = current.getCause();
        }
        return Optional.empty();
    }
}
