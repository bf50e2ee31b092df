package com.di.insightnova.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code insightnova.persistence.*}. With {@code jdbc-enabled=false} (the default) the staging
 * store, task ledger and scaling policies live in memory and none of the connection settings
 * are read.
 */
@ConfigurationProperties(prefix = "insightnova.persistence")
public class PersistenceProperties {

    private boolean jdbcEnabled = false;
    private String jdbcUrl = "jdbc:postgresql://localhost:5432/insightnova";
    private String username = "insightnova";
    private String password = "";
    private String driverClassName = "org.postgresql.Driver";
    private int maximumPoolSize = 10;
    private int minimumIdle = 2;
    private long connectionTimeoutMs = 30_000;
    /** Run {@code classpath:db/schema.sql} at startup (statements are idempotent). */
    private boolean initializeSchema = true;

    public boolean isJdbcEnabled() { return jdbcEnabled; }
    public void setJdbcEnabled(boolean jdbcEnabled) { this.jdbcEnabled = jdbcEnabled; }
    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getDriverClassName() { return driverClassName; }
    public void setDriverClassName(String driverClassName) { this.driverClassName = driverClassName; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public int getMinimumIdle() { return minimumIdle; }
    public void setMinimumIdle(int minimumIdle) { this.minimumIdle = minimumIdle; }
    public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
    public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }
    public boolean isInitializeSchema() { return initializeSchema; }
    public void setInitializeSchema(boolean initializeSchema) { this.initializeSchema = initializeSchema; }
}
