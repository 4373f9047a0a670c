package cn.ashersu.taskify.manager;

import com.zaxxer.hikari.HikariDataSource;

/**
 * 按连接参数创建连接池。调用方负责关闭返回的数据源。
 */
@FunctionalInterface
public interface DataSourceFactory {

    HikariDataSource create(DatabaseSettings settings, String poolName);
}
