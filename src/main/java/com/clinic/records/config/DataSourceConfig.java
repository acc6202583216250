package com.clinic.records.config;

import com.clinic.records.tenant.H2TenantSessionVariable;
import com.clinic.records.tenant.PostgresTenantSessionVariable;
import com.clinic.records.tenant.TenantBindingDataSource;
import com.clinic.records.tenant.TenantSessionVariable;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Hikari is the physical pool; everything else (JPA, JdbcTemplate, the binder) borrows through
 * {@link TenantBindingDataSource}.
 */
@Configuration
@EnableConfigurationProperties(ClinicProperties.class)
public class DataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    @Bean
    @ConfigurationProperties(prefix = "spring.datasource.hikari")
    public HikariDataSource connectionPool(DataSourceProperties properties) {
        return properties.initializeDataSourceBuilder().type(HikariDataSource.class).build();
    }

    @Bean
    public TenantSessionVariable tenantSessionVariable(ClinicProperties properties) {
        ClinicProperties.Tenancy tenancy = properties.getTenancy();
        log.info("Tenant session variable {} ({})", tenancy.getSessionVariable(), tenancy.getDialect());
        if (tenancy.getDialect() == ClinicProperties.Dialect.H2) {
            return new H2TenantSessionVariable(tenancy.getSessionVariable());
        }
        return new PostgresTenantSessionVariable(tenancy.getSessionVariable());
    }

    @Bean
    @Primary
    public TenantBindingDataSource dataSource(HikariDataSource connectionPool, TenantSessionVariable sessionVariable) {
        return new TenantBindingDataSource(connectionPool, sessionVariable);
    }
}
