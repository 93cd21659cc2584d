package com.incoresoft.sosync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * PostgreSQL settings for the record store.
 */
@Data
@ConfigurationProperties(prefix = "postgres")
public class PostgresProps {
    private String host = "localhost";
    private int port = 5432;
    /**
     * Database holding groups, safety checks and SOS alerts.
     */
    private String database = "sosync";
    private String username;
    private String password;
    private int maxPoolSize = 10;

    public String jdbcUrl() {
        String db = (database == null || database.isBlank()) ? "postgres" : database;
        return "jdbc:postgresql://" + host + ":" + port + "/" + db;
    }
}
