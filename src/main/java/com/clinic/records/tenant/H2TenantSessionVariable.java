package com.clinic.records.tenant;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;
import java.util.UUID;

/**
 * H2 user variable, used by the test profile. H2 has no row policies, so only the binding lifecycle is real here.
 */
public class H2TenantSessionVariable implements TenantSessionVariable {

    private final String name;
    private final String variable;

    public H2TenantSessionVariable(String name) {
        this.name = name;
        this.variable = "@" + name.replaceAll("[^A-Za-z0-9_]", "_");
    }

    @Override
    public void bind(Connection connection, UUID tenantId) throws SQLException {
        try (Statement st = connection.createStatement()) {
            // UUID#toString is always [0-9a-f-], safe to inline
            st.execute("SET " + variable + " = '" + tenantId + "'");
        }
    }

    @Override
    public void clear(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET " + variable + " = NULL");
        }
    }

    @Override
    public Optional<UUID> read(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT " + variable)) {
            if (!rs.next() || rs.getString(1) == null) {
                return Optional.empty();
            }
            return Optional.of(UUID.fromString(rs.getString(1)));
        }
    }

    @Override
    public String name() {
        return name;
    }
}
