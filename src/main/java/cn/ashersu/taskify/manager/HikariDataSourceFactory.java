package cn.ashersu.taskify.manager;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 基于 HikariCP 的 SQL Server 连接池工厂。
 */
@Slf4j
public class HikariDataSourceFactory implements DataSourceFactory {

    static final String DRIVER_CLASS_NAME = "com.microsoft.sqlserver.jdbc.SQLServerDriver";

    @Override
    public HikariDataSource create(DatabaseSettings settings, String poolName) {
        Objects.requireNonNull(settings, "settings required");
        Objects.requireNonNull(settings.host(), "host required");
        Objects.requireNonNull(settings.database(), "database required");
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.jdbcUrl());
        config.setUsername(settings.user());
        config.setPassword(settings.password());
        config.setDriverClassName(DRIVER_CLASS_NAME);
        config.setMaximumPoolSize(settings.maxPoolSize());
        config.setMinimumIdle(settings.minPoolSize());
        config.setIdleTimeout(settings.idleTimeoutMs());
        config.setConnectionTimeout(settings.connectionTimeoutMs());
        config.setValidationTimeout(Math.min(TimeUnit.SECONDS.toMillis(5), settings.connectionTimeoutMs()));
        config.setPoolName(poolName);
        // 构造时即校验连通性，失败直接抛出 PoolInitializationException
        HikariDataSource ds = new HikariDataSource(config);
        log.info("Created pool {} => {} (user={}, size={}..{})", poolName, settings.jdbcUrl(),
                settings.user(), settings.minPoolSize(), settings.maxPoolSize());
        return ds;
    }
}
