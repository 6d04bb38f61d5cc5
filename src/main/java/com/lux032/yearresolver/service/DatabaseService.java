package com.lux032.yearresolver.service;

import com.lux032.yearresolver.config.YearResolverConfig;
import com.lux032.yearresolver.util.I18nUtil;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Shared HikariCP pool, only created when {@code db.type=mysql}.
 */
@Slf4j
public class DatabaseService {

    private final HikariDataSource dataSource;
    private final YearResolverConfig config;

    public DatabaseService(YearResolverConfig config) {
        this.config = config;
        this.dataSource = initDataSource();
        log.info(I18nUtil.getMessage("db.service.initialized"));
    }

    private HikariDataSource initDataSource() {
        HikariConfig hikariConfig = new HikariConfig();

        String jdbcUrl = String.format(
            "jdbc:mysql://%s:%s/%s?useUnicode=true&characterEncoding=UTF-8&useSSL=false&allowPublicKeyRetrieval=true",
            config.getDbHost(),
            config.getDbPort(),
            config.getDbDatabase()
        );

        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setUsername(config.getDbUsername());
        hikariConfig.setPassword(config.getDbPassword());
        hikariConfig.setMaximumPoolSize(config.getDbMaxPoolSize());
        hikariConfig.setMinimumIdle(config.getDbMinIdle());
        hikariConfig.setConnectionTimeout(config.getDbConnectionTimeout());
        hikariConfig.setConnectionTestQuery("SELECT 1");

        log.info(I18nUtil.getMessage("db.config"), jdbcUrl);
        log.info(I18nUtil.getMessage("db.pool.config"), config.getDbMaxPoolSize(), config.getDbMinIdle());

        try {
            HikariDataSource ds = new HikariDataSource(hikariConfig);
            try (Connection conn = ds.getConnection()) {
                log.info(I18nUtil.getMessage("db.connection.test.success"));
            }
            return ds;
        } catch (SQLException e) {
            log.error(I18nUtil.getMessage("db.connection.test.failed"), e);
            log.error(I18nUtil.getMessage("db.check.database.created"), config.getDbDatabase());
            throw new IllegalStateException("Database connection failed", e);
        }
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info(I18nUtil.getMessage("db.pool.closed"));
        }
    }
}
