package cn.ashersu.taskify.config;

import cn.ashersu.taskify.manager.DatabaseSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection parameters for the SQL Server instance, bound from {@code taskify.db.*}
 * (environment variables are mapped in application.yml).
 */
@ConfigurationProperties(prefix = "taskify.db")
public class TaskifyDatabaseProperties {

    private String host = "localhost";
    private int port = 1433;
    private String user;
    private String password;
    /** Administrative database used while provisioning */
    private String adminDatabase = "master";
    /** Application database holding dbo.tasks */
    private String database = "taskify_db";
    private boolean encrypt = false;
    private boolean trustServerCertificate = true;
    private final Pool pool = new Pool();

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getAdminDatabase() { return adminDatabase; }
    public void setAdminDatabase(String adminDatabase) { this.adminDatabase = adminDatabase; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public boolean isEncrypt() { return encrypt; }
    public void setEncrypt(boolean encrypt) { this.encrypt = encrypt; }
    public boolean isTrustServerCertificate() { return trustServerCertificate; }
    public void setTrustServerCertificate(boolean trustServerCertificate) { this.trustServerCertificate = trustServerCertificate; }
    public Pool getPool() { return pool; }

    /**
     * Settings pointing at the administrative database, sufficient to run provisioning DDL.
     */
    public DatabaseSettings baseSettings() {
        return new DatabaseSettings(host, port, user, password, adminDatabase,
                pool.getMinSize(), pool.getMaxSize(), pool.getIdleTimeoutMs(), pool.getConnectionTimeoutMs(),
                encrypt, trustServerCertificate);
    }

    /**
     * Same as {@link #baseSettings()} but bound to the application database.
     */
    public DatabaseSettings applicationSettings() {
        return baseSettings().withDatabase(database);
    }

    public static class Pool {
        private int minSize = 0;
        private int maxSize = 10;
        private long idleTimeoutMs = 30_000;
        private long connectionTimeoutMs = 15_000;

        public int getMinSize() { return minSize; }
        public void setMinSize(int minSize) { this.minSize = minSize; }
        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
        public long getIdleTimeoutMs() { return idleTimeoutMs; }
        public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }
        public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
        public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }
    }
}
