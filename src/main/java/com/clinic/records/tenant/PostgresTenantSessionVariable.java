package com.clinic.records.tenant;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Custom GUC such as {@code app.current_tenant_id}. Set at session level because one checkout may span
 * several transactions; {@link TenantBindingDataSource} resets it before the connection goes back to the pool.
 */
public class PostgresTenantSessionVariable implements TenantSessionVariable {

    static final Pattern GUC_NAME = Pattern.compile("^[a-z_][a-z0-9_]*\\.[a-z_][a-z0-9_]*$");

    private final String name;

    public PostgresTenantSessionVariable(String name) {
        if (name == null || !GUC_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid session variable name: " + name);
        }
        this.name = name;
    }

    @Override
    public void bind(Connection connection, UUID tenantId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT set_config(?, ?, false)")) {
            ps.setString(1, name);
            ps.setString(2, tenantId.toString());
            ps.executeQuery().close();
        }
    }

    @Override
    public void clear(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("RESET " + name);
        }
    }

    @Override
    public Optional<UUID> read(Connection connection) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT NULLIF(current_setting(?, true), '')")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next() || rs.getString(1) == null) {
                    return Optional.empty();
                }
                return Optional.of(UUID.fromString(rs.getString(1)));
            }
        }
    }

    @Override
    public String name() {
        return name;
    }
}
