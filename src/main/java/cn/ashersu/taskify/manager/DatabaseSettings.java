package cn.ashersu.taskify.manager;

import java.util.Locale;

/**
 * 不可变的 SQL Server 连接参数。基础配置（管理库）与应用配置只在 {@code database} 上不同。
 *
 * @param host                   服务器地址
 * @param port                   端口
 * @param user                   SQL 登录名
 * @param password               密码
 * @param database               目标数据库
 * @param minPoolSize            最小空闲连接数
 * @param maxPoolSize            最大连接数
 * @param idleTimeoutMs          空闲连接回收时间（毫秒）
 * @param connectionTimeoutMs    借用连接的最长等待时间（毫秒）
 * @param encrypt                传输加密
 * @param trustServerCertificate 是否信任服务器证书
 */
public record DatabaseSettings(String host,
                               int port,
                               String user,
                               String password,
                               String database,
                               int minPoolSize,
                               int maxPoolSize,
                               long idleTimeoutMs,
                               long connectionTimeoutMs,
                               boolean encrypt,
                               boolean trustServerCertificate) {

    public DatabaseSettings withDatabase(String otherDatabase) {
        return new DatabaseSettings(host, port, user, password, otherDatabase, minPoolSize, maxPoolSize,
                idleTimeoutMs, connectionTimeoutMs, encrypt, trustServerCertificate);
    }

    public DatabaseSettings withPoolSize(int min, int max) {
        return new DatabaseSettings(host, port, user, password, database, min, max,
                idleTimeoutMs, connectionTimeoutMs, encrypt, trustServerCertificate);
    }

    public String jdbcUrl() {
        return String.format(Locale.ROOT,
                "jdbc:sqlserver://%s:%d;databaseName=%s;encrypt=%b;trustServerCertificate=%b",
                host, port, database, encrypt, trustServerCertificate);
    }

    @Override
    public String toString() {
        return "DatabaseSettings[host=" + host + ", port=" + port + ", user=" + user
                + ", password=" + (password == null || password.isEmpty() ? "" : "******")
                + ", database=" + database + ", pool=" + minPoolSize + ".." + maxPoolSize + "]";
    }
}
