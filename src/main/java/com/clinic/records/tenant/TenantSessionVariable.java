package com.clinic.records.tenant;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

/**
 * Connection-local variable the row-isolation predicates read.
 */
public interface TenantSessionVariable {

    void bind(Connection connection, UUID tenantId) throws SQLException;

    void clear(Connection connection) throws SQLException;

    Optional<UUID> read(Connection connection) throws SQLException;

    String name();
}
