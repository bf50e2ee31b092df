package com.di.insightnova.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Builds the HikariCP pool and {@link JdbcTemplate} used by the JDBC stores. DataSource
 * auto-configuration is excluded in {@link com.di.insightnova.InsightNovaApplication}, so nothing
 * touches a database unless {@code insightnova.persistence.jdbc-enabled=true}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "insightnova.persistence.jdbc-enabled", havingValue = "true")
public class PersistenceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource insightDataSource(PersistenceProperties props) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("insightnova-pool");
        config.setJdbcUrl(props.getJdbcUrl());
        config.setUsername(props.getUsername());
        config.setPassword(props.getPassword());
        config.setDriverClassName(props.getDriverClassName());
        config.setMaximumPoolSize(props.getMaximumPoolSize());
        config.setMinimumIdle(Math.min(props.getMinimumIdle(), props.getMaximumPoolSize()));
        config.setConnectionTimeout(props.getConnectionTimeoutMs());
        if (props.getJdbcUrl() != null && props.getJdbcUrl().contains("postgresql")) {
            config.addDataSourceProperty("tcpKeepAlive", "true");
        }
        log.info("[PERSISTENCE] Creating HikariCP pool for {} (user: {}, maxPool={})",
                sanitizeUrl(props.getJdbcUrl()), props.getUsername(), props.getMaximumPoolSize());
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource insightDataSource) {
        return new JdbcTemplate(insightDataSource);
    }

    @Bean
    public DataSourceInitializer schemaInitializer(DataSource insightDataSource, PersistenceProperties props) {
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(insightDataSource);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")));
        initializer.setEnabled(props.isInitializeSchema());
        return initializer;
    }

    private static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        int idx = jdbcUrl.indexOf("password=");
        if (idx < 0) {
            return jdbcUrl;
        }
        int end = jdbcUrl.indexOf('&', idx);
        return jdbcUrl.substring(0, idx + 9) + "***" + (end < 0 ? "" : jdbcUrl.substring(end));
    }
}
