package com.clinic.records.tenant;

import com.clinic.records.config.ClinicProperties;
import jakarta.persistence.EntityManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Applies {@link RowIsolationPolicy} once the schema exists and before the application takes traffic.
 * Safe to re-run: every policy is dropped and recreated.
 */
@Component
@ConditionalOnProperty(prefix = "clinic.tenancy", name = "dialect", havingValue = "postgres", matchIfMissing = true)
public class RowIsolationPolicyInstaller implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(RowIsolationPolicyInstaller.class);

    private final ConnectionScopeBinder binder;
    private final ClinicProperties properties;

    /** The factory is injected only so Hibernate has created the tables before policies are attached. */
    public RowIsolationPolicyInstaller(EntityManagerFactory entityManagerFactory,
                                       ConnectionScopeBinder binder,
                                       ClinicProperties properties) {
        this.binder = binder;
        this.properties = properties;
    }

    @Override
    public void afterPropertiesSet() {
        if (!properties.getTenancy().isInstallPolicies()) {
            log.info("Row isolation policy installation disabled; policies are expected to be managed externally");
            return;
        }
        RowIsolationPolicy policy = new RowIsolationPolicy(properties.getTenancy().getSessionVariable());
        binder.withUnboundConnection(connection -> {
            install(connection, policy);
            warnIfRoleBypassesPolicies(connection);
            return null;
        });
    }

    static void install(Connection connection, RowIsolationPolicy policy) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try (Statement st = connection.createStatement()) {
            for (RowIsolationPolicy.TablePolicy table : policy.tables()) {
                for (String sql : policy.ddl(table)) {
                    st.execute(sql);
                }
                log.info("Row isolation installed on {}{}", table.table(), table.sharedCatalog() ? " (shared catalog)" : "");
            }
            connection.commit();
        } catch (SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private static void warnIfRoleBypassesPolicies(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT rolsuper OR rolbypassrls FROM pg_roles WHERE rolname = current_user")) {
            if (rs.next() && rs.getBoolean(1)) {
                log.error("SECURITY: database role bypasses row level security; tenant isolation is NOT enforced. "
                        + "Connect as a non-superuser role without BYPASSRLS.");
            }
        }
    }
}
