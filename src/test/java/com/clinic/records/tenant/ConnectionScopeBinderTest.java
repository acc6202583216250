package com.clinic.records.tenant;

import com.clinic.records.exception.InvalidTenantContextException;
import com.clinic.records.exception.PoolExhaustedException;
import com.clinic.records.exception.StorageErrorTranslator;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * Runs against a real two-connection pool so that every test reuses the same physical sessions.
 */
class ConnectionScopeBinderTest {

    private HikariDataSource pool;
    private TenantBindingDataSource dataSource;
    private TenantSessionVariable sessionVariable;
    private ConnectionScopeBinder binder;

    @BeforeEach
    void setUp() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:binder-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        config.setUsername("sa");
        config.setMaximumPoolSize(2);
        config.setConnectionTimeout(2000);
        pool = new HikariDataSource(config);
        sessionVariable = new H2TenantSessionVariable("app.current_tenant_id");
        dataSource = new TenantBindingDataSource(pool, sessionVariable);
        binder = new ConnectionScopeBinder(dataSource, sessionVariable,
                new DataSourceTransactionManager(dataSource), mock(EntityManager.class), new StorageErrorTranslator());
    }

    @AfterEach
    void tearDown() {
        TenantContextHolder.clear();
        pool.close();
    }

    private Optional<UUID> boundTenant(Connection connection) throws SQLException {
        return sessionVariable.read(connection);
    }

    /** Tenant left on each pooled session, read straight from the pool so nothing resets it first. */
    private List<Optional<UUID>> pooledBindings() throws SQLException {
        List<Connection> held = new ArrayList<>();
        List<Optional<UUID>> bindings = new ArrayList<>();
        try {
            for (int i = 0; i < pool.getMaximumPoolSize(); i++) {
                Connection connection = pool.getConnection();
                held.add(connection);
                bindings.add(boundTenant(connection));
            }
        } finally {
            for (Connection connection : held) {
                connection.close();
            }
        }
        return bindings;
    }

    @Test
    void workSeesItsOwnTenant() {
        UUID tenant = UUID.randomUUID();

        Optional<UUID> seen = binder.withTenantConnection(tenant, this::boundTenant);

        assertThat(seen).contains(tenant);
    }

    @Test
    void bindingIsClearedAfterSuccessAndFailure() throws SQLException {
        UUID tenant = UUID.randomUUID();
        binder.withTenantConnection(tenant, c -> null);
        assertThatThrownBy(() -> binder.withTenantConnection(tenant.toString(), c -> {
            throw new IllegalStateException("work failed");
        })).isInstanceOf(IllegalStateException.class);

        // both pooled sessions must carry nothing over
        assertThat(pooledBindings()).containsOnly(Optional.empty());
    }

    @Test
    void invalidTenantIdIsRejected() {
        assertThatThrownBy(() -> binder.withTenantConnection("tenant-7", c -> null))
                .isInstanceOf(InvalidTenantContextException.class);
        assertThatThrownBy(() -> binder.inTenantTransaction(null, s -> null))
                .isInstanceOf(InvalidTenantContextException.class);
    }

    @Test
    void concurrentWorkNeverObservesAnotherTenant() throws Exception {
        List<UUID> tenants = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger mismatches = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                UUID tenant = tenants.get(i % tenants.size());
                boolean fail = i % 5 == 0;
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        binder.withTenantConnection(tenant, c -> {
                            if (!boundTenant(c).equals(Optional.of(tenant))) {
                                mismatches.incrementAndGet();
                            }
                            if (fail) {
                                throw new IllegalStateException("simulated failure");
                            }
                            return null;
                        });
                    } catch (IllegalStateException expected) {
                        // simulated
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(mismatches).hasValue(0);
        assertThat(pooledBindings()).containsOnly(Optional.empty());
    }

    @Test
    void transactionBorrowsConnectionOfItsTenant() {
        UUID tenant = UUID.randomUUID();
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);

        String seen = binder.inTenantTransaction(tenant,
                status -> jdbc.queryForObject("SELECT @app_current_tenant_id", String.class));

        assertThat(seen).isEqualTo(tenant.toString());
        assertThat(TenantContextHolder.currentTenant()).isEmpty();
        String unbound = binder.inUnboundTransaction(
                status -> jdbc.queryForObject("SELECT @app_current_tenant_id", String.class));
        assertThat(unbound).isNull();
    }

    @Test
    void tenantCannotChangeInsideRunningTransaction() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        assertThatThrownBy(() -> binder.inTenantTransaction(first,
                status -> binder.inTenantTransaction(second, inner -> null)))
                .isInstanceOf(IllegalStateException.class);

        // joining with the same tenant is fine
        String joined = binder.inTenantTransaction(first, status -> binder.inTenantReadOnly(first, inner -> "ok"));
        assertThat(joined).isEqualTo("ok");
        assertThat(TenantContextHolder.currentTenant()).isEmpty();
    }

    @Test
    void exhaustedPoolFailsFastWithoutLeakingBindings() throws Exception {
        UUID tenant = UUID.randomUUID();
        Connection first = dataSource.checkout(tenant);
        Connection second = dataSource.checkout(tenant);
        try {
            assertThatThrownBy(() -> binder.withTenantConnection(UUID.randomUUID(), c -> null))
                    .isInstanceOf(PoolExhaustedException.class);
            assertThatThrownBy(() -> binder.inTenantTransaction(UUID.randomUUID(), s -> null))
                    .isInstanceOf(PoolExhaustedException.class);
        } finally {
            first.close();
            second.close();
        }

        assertThat(pooledBindings()).containsOnly(Optional.empty());
        assertThat(pool.getHikariPoolMXBean().getActiveConnections()).isZero();
    }
}
