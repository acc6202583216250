package com.clinic.records.tenant;

import com.clinic.records.exception.ClinicException;
import com.clinic.records.exception.InvalidTenantContextException;
import com.clinic.records.exception.StorageErrorTranslator;
import jakarta.persistence.EntityManager;
import org.hibernate.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs units of work against a connection bound to one tenant.
 * <p>
 * Binding happens when the connection leaves the pool and is undone when it goes back, on success and on
 * failure alike. Transactional scopes set {@link TenantContextHolder} for their duration so the JPA layer
 * borrows through {@link TenantBindingDataSource} with the right tenant.
 */
@Component
public class ConnectionScopeBinder {

    private static final Logger log = LoggerFactory.getLogger(ConnectionScopeBinder.class);

    private final TenantBindingDataSource dataSource;
    private final TenantSessionVariable sessionVariable;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final EntityManager entityManager;
    private final StorageErrorTranslator errorTranslator;

    public ConnectionScopeBinder(TenantBindingDataSource dataSource,
                                 TenantSessionVariable sessionVariable,
                                 PlatformTransactionManager transactionManager,
                                 EntityManager entityManager,
                                 StorageErrorTranslator errorTranslator) {
        this.dataSource = dataSource;
        this.sessionVariable = sessionVariable;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
        this.entityManager = entityManager;
        this.errorTranslator = errorTranslator;
    }

    /**
     * Borrow a connection bound to {@code tenantId}, run {@code work}, release. The connection is unbound
     * before it returns to the pool whether {@code work} completes or throws.
     */
    public <T> T withTenantConnection(String tenantId, ConnectionCallback<T> work) {
        Connection connection = checkout(() -> dataSource.checkout(tenantId));
        return runAndRelease(connection, work);
    }

    public <T> T withTenantConnection(UUID tenantId, ConnectionCallback<T> work) {
        Connection connection = checkout(() -> dataSource.checkout(tenantId));
        return runAndRelease(connection, work);
    }

    /** Connection with no tenant bound; tenant-owned tables read as empty through it. */
    public <T> T withUnboundConnection(ConnectionCallback<T> work) {
        Connection connection = checkout(dataSource::checkoutUnbound);
        return runAndRelease(connection, work);
    }

    /** Read-write transaction whose connection is bound to {@code tenantId}. */
    public <T> T inTenantTransaction(UUID tenantId, TransactionCallback<T> action) {
        if (tenantId == null) {
            throw new InvalidTenantContextException("Tenant id is required");
        }
        return inScope(tenantId, transactionTemplate, action);
    }

    public <T> T inTenantReadOnly(UUID tenantId, TransactionCallback<T> action) {
        if (tenantId == null) {
            throw new InvalidTenantContextException("Tenant id is required");
        }
        return inScope(tenantId, readOnlyTemplate, action);
    }

    /**
     * Transaction on an unbound connection, for tables outside row isolation (tenants, users) and for
     * flows such as clinic registration that only learn their tenant mid-way.
     */
    public <T> T inUnboundTransaction(TransactionCallback<T> action) {
        return inScope(null, transactionTemplate, action);
    }

    /**
     * Bind the connection of the running transaction to a tenant created inside it. The caller's scope
     * restores the previous holder value when it ends; the pool release clears the connection.
     */
    public void bindCurrentTransaction(UUID tenantId) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("No transaction to bind tenant " + tenantId + " to");
        }
        entityManager.unwrap(Session.class).doWork(connection -> sessionVariable.bind(connection, tenantId));
        TenantContextHolder.set(tenantId);
        log.debug("Bound running transaction to tenant {}", tenantId);
    }

    private <T> T inScope(UUID tenantId, TransactionTemplate template, TransactionCallback<T> action) {
        Optional<UUID> previous = TenantContextHolder.currentTenant();
        if (TransactionSynchronizationManager.isActualTransactionActive()
                && !Objects.equals(previous.orElse(null), tenantId)) {
            throw new IllegalStateException("Cannot switch tenant from " + previous.orElse(null)
                    + " to " + tenantId + " inside a running transaction");
        }
        TenantContextHolder.set(tenantId);
        try {
            return template.execute(action);
        } catch (TransactionException e) {
            throw tenancyFailure(e);
        } catch (RuntimeException e) {
            throw errorTranslator.translate("tenant unit of work", e);
        } finally {
            TenantContextHolder.set(previous.orElse(null));
        }
    }

    private <T> T runAndRelease(Connection connection, ConnectionCallback<T> work) {
        try {
            return work.doInConnection(connection);
        } catch (SQLException e) {
            throw errorTranslator.translate("tenant connection work",
                    new UncategorizedSQLException("tenant connection work", null, e));
        } catch (RuntimeException e) {
            throw errorTranslator.translate("tenant connection work", e);
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Error releasing tenant connection", e);
            }
        }
    }

    private Connection checkout(ConnectionSource source) {
        try {
            return source.get();
        } catch (SQLException e) {
            throw new UncategorizedSQLException("connection checkout", null, e);
        }
    }

    /** Surfaces binding and pool failures raised while the transaction manager opened its connection. */
    private RuntimeException tenancyFailure(TransactionException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof ClinicException clinic) {
                return clinic;
            }
            cause = cause.getCause();
        }
        return e;
    }

    @FunctionalInterface
    private interface ConnectionSource {
        Connection get() throws SQLException;
    }
}
