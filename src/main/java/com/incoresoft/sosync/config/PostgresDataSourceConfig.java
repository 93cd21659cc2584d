package com.incoresoft.sosync.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Creates the DataSource from {@link PostgresProps} instead of spring.datasource.*.
 */
@Configuration
@RequiredArgsConstructor
public class PostgresDataSourceConfig {

    private final PostgresProps props;

    @Bean
    public DataSource dataSource() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(props.jdbcUrl());
        cfg.setUsername(props.getUsername());
        cfg.setPassword(props.getPassword());
        cfg.setDriverClassName("org.postgresql.Driver");

        cfg.setMaximumPoolSize(props.getMaxPoolSize());
        cfg.setMinimumIdle(1);
        cfg.setPoolName("sosync-hikari");

        return new HikariDataSource(cfg);
    }
}
