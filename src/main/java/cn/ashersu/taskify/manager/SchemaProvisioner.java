package cn.ashersu.taskify.manager;

import cn.ashersu.taskify.exception.SchemaProvisioningException;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 确保应用数据库与 dbo.tasks 表存在。
 * <p>
 * 使用指向管理库（默认 master）的临时连接执行两段幂等 DDL，每次启动都可以安全重复执行。
 * 临时连接在两步结束后立即释放，无论成功与否。
 */
@Slf4j
public class SchemaProvisioner {

    static final String PROVISIONING_POOL_NAME = "taskify-provisioning";

    /** 数据库名会拼进 DDL（标识符无法参数化），只接受普通标识符 */
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,127}");

    private static final String CREATE_DATABASE_SQL = """
            IF NOT EXISTS (SELECT name FROM sys.databases WHERE name = N'%1$s')
            BEGIN
                CREATE DATABASE [%1$s];
            END
            """;

    private static final String CREATE_TABLE_SQL = """
            IF OBJECT_ID(N'[%1$s].dbo.tasks', N'U') IS NULL
            BEGIN
                CREATE TABLE [%1$s].dbo.tasks (
                    id INT IDENTITY(1,1) PRIMARY KEY,
                    title NVARCHAR(255) NOT NULL,
                    description NVARCHAR(1000) NULL,
                    isCompleted BIT NOT NULL DEFAULT 0,
                    createdAt DATETIME2 NOT NULL DEFAULT SYSUTCDATETIME(),
                    updatedAt DATETIME2 NULL
                );
            END
            """;

    private final DatabaseSettings baseSettings;
    private final String applicationDatabase;
    private final DataSourceFactory dataSourceFactory;

    public SchemaProvisioner(DatabaseSettings baseSettings, String applicationDatabase, DataSourceFactory dataSourceFactory) {
        this.baseSettings = Objects.requireNonNull(baseSettings, "baseSettings required");
        this.applicationDatabase = applicationDatabase;
        this.dataSourceFactory = Objects.requireNonNull(dataSourceFactory, "dataSourceFactory required");
    }

    /**
     * 依次执行建库、建表。
     *
     * @throws SchemaProvisioningException 数据库名非法、连接失败或 DDL 执行失败
     */
    public void ensureSchema() {
        if (applicationDatabase == null || !IDENTIFIER.matcher(applicationDatabase).matches()) {
            throw new SchemaProvisioningException("Invalid application database name: " + applicationDatabase);
        }
        log.info("Ensuring schema with: server={} port={} user={} database={}",
                baseSettings.host(), baseSettings.port(), baseSettings.user(), baseSettings.database());

        try (HikariDataSource admin = dataSourceFactory.create(baseSettings.withPoolSize(0, 1), PROVISIONING_POOL_NAME);
             Connection connection = admin.getConnection()) {
            execute(connection, String.format(Locale.ROOT, CREATE_DATABASE_SQL, applicationDatabase));
            execute(connection, String.format(Locale.ROOT, CREATE_TABLE_SQL, applicationDatabase));
        } catch (SQLException | RuntimeException e) {
            log.error("Schema provisioning failed: {}", e.getMessage());
            throw new SchemaProvisioningException("Failed to ensure schema for " + applicationDatabase + ": " + e.getMessage(), e);
        }
        log.info("Schema ensured: {} + dbo.tasks ready", applicationDatabase);
    }

    private static void execute(Connection connection, String ddl) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        }
    }
}
