package com.clinic.records.tenant;

import com.clinic.records.exception.InvalidTenantContextException;
import com.clinic.records.exception.PoolExhaustedException;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.datasource.ConnectionProxy;
import org.springframework.jdbc.datasource.DelegatingDataSource;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLTransientConnectionException;
import java.util.UUID;

/**
 * Pool front that binds the session tenant on checkout and unbinds it on release.
 * <p>
 * Every connection handed out carries either the tenant of {@link TenantContextHolder} or no tenant at all,
 * never a binding left behind by a previous borrower. A connection whose binding cannot be cleared is evicted
 * from the pool instead of being returned.
 */
public class TenantBindingDataSource extends DelegatingDataSource {

    private static final Logger log = LoggerFactory.getLogger(TenantBindingDataSource.class);

    private final HikariDataSource pool;
    private final TenantSessionVariable sessionVariable;

    public TenantBindingDataSource(HikariDataSource pool, TenantSessionVariable sessionVariable) {
        super(pool);
        this.pool = pool;
        this.sessionVariable = sessionVariable;
    }

    @Override
    public Connection getConnection() throws SQLException {
        UUID tenantId = TenantContextHolder.currentTenant().orElse(null);
        return tenantId == null ? checkoutUnbound() : checkout(tenantId);
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        throw new SQLFeatureNotSupportedException("Per-call credentials bypass tenant binding");
    }

    /**
     * Borrow a connection bound to {@code rawTenantId}.
     *
     * @throws InvalidTenantContextException when the value is not a tenant id or cannot be bound
     * @throws PoolExhaustedException        when no connection frees up within the pool timeout
     */
    public Connection checkout(String rawTenantId) throws SQLException {
        UUID tenantId;
        try {
            tenantId = UUID.fromString(rawTenantId == null ? "" : rawTenantId.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidTenantContextException("Tenant id is not a valid UUID: " + rawTenantId, e);
        }
        return checkout(tenantId);
    }

    public Connection checkout(UUID tenantId) throws SQLException {
        if (tenantId == null) {
            throw new InvalidTenantContextException("Tenant id is required");
        }
        Connection physical = borrow();
        try {
            sessionVariable.bind(physical, tenantId);
        } catch (SQLException | RuntimeException e) {
            release(physical);
            throw new InvalidTenantContextException("Could not bind tenant " + tenantId + " to connection", e);
        }
        return wrap(physical, tenantId);
    }

    /** Borrow a connection with no tenant bound. Tenant-owned tables read as empty through it. */
    public Connection checkoutUnbound() throws SQLException {
        Connection physical = borrow();
        try {
            sessionVariable.clear(physical);
        } catch (SQLException | RuntimeException e) {
            log.error("Could not clear tenant binding on checkout, evicting connection", e);
            pool.evictConnection(physical);
            throw new SQLException("Connection could not be reset for unbound use", e);
        }
        return wrap(physical, null);
    }

    private Connection borrow() throws SQLException {
        try {
            return pool.getConnection();
        } catch (SQLTransientConnectionException e) {
            log.warn("Connection pool exhausted (active={}, waiting={})", activeConnections(), waitingThreads());
            throw new PoolExhaustedException(
                    "No database connection available within " + pool.getConnectionTimeout() + " ms", e);
        }
    }

    /**
     * Clears the binding and returns the connection to the pool. Runs on every release path. An open
     * transaction is rolled back and autocommit restored first, so the reset commits on its own and the
     * pool's rollback-on-return cannot undo it.
     */
    void release(Connection physical) {
        try {
            if (!physical.getAutoCommit()) {
                physical.rollback();
                physical.setAutoCommit(true);
            }
            sessionVariable.clear(physical);
        } catch (SQLException | RuntimeException e) {
            log.error("Failed to clear tenant binding, evicting connection from pool", e);
            pool.evictConnection(physical);
            return;
        }
        try {
            physical.close();
        } catch (SQLException e) {
            log.warn("Error returning connection to pool", e);
        }
    }

    private int activeConnections() {
        return pool.getHikariPoolMXBean() == null ? -1 : pool.getHikariPoolMXBean().getActiveConnections();
    }

    private int waitingThreads() {
        return pool.getHikariPoolMXBean() == null ? -1 : pool.getHikariPoolMXBean().getThreadsAwaitingConnection();
    }

    /** Same proxy shape as Spring's transaction-aware data sources, so {@code DataSourceUtils} can unwrap it. */
    private ConnectionProxy wrap(Connection physical, UUID tenantId) {
        return (ConnectionProxy) Proxy.newProxyInstance(
                ConnectionProxy.class.getClassLoader(),
                new Class<?>[]{ConnectionProxy.class},
                new BoundConnectionHandler(physical, tenantId));
    }

    private final class BoundConnectionHandler implements InvocationHandler {

        private final Connection physical;
        private final UUID tenantId;
        private boolean released;

        private BoundConnectionHandler(Connection physical, UUID tenantId) {
            this.physical = physical;
            this.tenantId = tenantId;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            switch (method.getName()) {
                case "close":
                    if (!released) {
                        released = true;
                        release(physical);
                    }
                    return null;
                case "isClosed":
                    return released || physical.isClosed();
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "getTargetConnection":
                    return physical;
                case "toString":
                    return "TenantBoundConnection[tenant=" + tenantId + ", " + physical + "]";
                case "unwrap":
                    if (((Class<?>) args[0]).isInstance(proxy)) {
                        return proxy;
                    }
                    break;
                case "isWrapperFor":
                    if (((Class<?>) args[0]).isInstance(proxy)) {
                        return true;
                    }
                    break;
                default:
                    break;
            }
            if (released) {
                throw new SQLException("Connection has already been released to the pool");
            }
            try {
                return method.invoke(physical, args);
            } catch (InvocationTargetException e) {
                throw e.getTargetException();
            }
        }
    }
}
