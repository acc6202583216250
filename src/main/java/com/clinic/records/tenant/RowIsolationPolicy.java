package com.clinic.records.tenant;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Row-level security definitions for every tenant-owned table.
 * <p>
 * Reads return only rows whose {@code tenant_id} equals the session tenant; a connection with no tenant bound
 * sees none. Writes are checked against the same predicate, so a row can neither be created nor moved into
 * another tenant. Shared catalogues additionally expose rows with a null {@code tenant_id} to everyone, but only
 * a connection with no tenant bound may write them.
 */
public class RowIsolationPolicy {

    /** Tables partitioned by tenant. */
    public static final List<String> TENANT_OWNED_TABLES = List.of(
            "doctors",
            "doctor_offices",
            "doctor_working_hours",
            "patients",
            "appointments",
            "prescription_templates",
            "prescriptions",
            "prescription_items");

    /** Tables mixing global rows (null tenant) with tenant-private rows. */
    public static final List<String> SHARED_CATALOG_TABLES = List.of("medicines");

    /** Read before a tenant is known (login, registration), so never isolated. */
    public static final Set<String> UNISOLATED_TABLES = Set.of("tenants", "users");

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]*$");

    private final String sessionTenant;

    public RowIsolationPolicy(String sessionVariable) {
        if (sessionVariable == null || !PostgresTenantSessionVariable.GUC_NAME.matcher(sessionVariable).matches()) {
            throw new IllegalArgumentException("Invalid session variable name: " + sessionVariable);
        }
        // RESET leaves an empty string behind, which must read as "no tenant" rather than fail the cast
        this.sessionTenant = "NULLIF(current_setting('" + sessionVariable + "', true), '')::uuid";
    }

    public record TablePolicy(String table, boolean sharedCatalog) {

        public TablePolicy {
            if (!IDENTIFIER.matcher(table).matches()) {
                throw new IllegalArgumentException("Invalid table name: " + table);
            }
        }

        public String policyName() {
            return table + "_tenant_isolation";
        }
    }

    public List<TablePolicy> tables() {
        List<TablePolicy> tables = new ArrayList<>();
        TENANT_OWNED_TABLES.forEach(t -> tables.add(new TablePolicy(t, false)));
        SHARED_CATALOG_TABLES.forEach(t -> tables.add(new TablePolicy(t, true)));
        return tables;
    }

    public String readPredicate(TablePolicy policy) {
        return policy.sharedCatalog() ? "(tenant_id IS NULL OR " + owned() + ")" : owned();
    }

    /** Tenant-owned tables reuse the read predicate. Global catalogue rows are writable only while unbound. */
    public String writeCheckPredicate(TablePolicy policy) {
        if (!policy.sharedCatalog()) {
            return readPredicate(policy);
        }
        return "((" + sessionTenant + " IS NULL AND tenant_id IS NULL) OR " + owned() + ")";
    }

    private String owned() {
        return "(" + sessionTenant + " IS NOT NULL AND tenant_id = " + sessionTenant + ")";
    }

    /**
     * Idempotent DDL for one table. FORCE makes the table owner subject to the policy too; superusers and
     * roles with BYPASSRLS still are not.
     */
    public List<String> ddl(TablePolicy policy) {
        String table = policy.table();
        return List.of(
                "ALTER TABLE " + table + " ENABLE ROW LEVEL SECURITY",
                "ALTER TABLE " + table + " FORCE ROW LEVEL SECURITY",
                "DROP POLICY IF EXISTS " + policy.policyName() + " ON " + table,
                "CREATE POLICY " + policy.policyName() + " ON " + table + " FOR ALL"
                        + " USING " + readPredicate(policy)
                        + " WITH CHECK " + writeCheckPredicate(policy));
    }

    public List<String> ddl() {
        List<String> statements = new ArrayList<>();
        tables().forEach(t -> statements.addAll(ddl(t)));
        return statements;
    }
}
