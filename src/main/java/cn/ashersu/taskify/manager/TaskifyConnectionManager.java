package cn.ashersu.taskify.manager;

import cn.ashersu.taskify.exception.ConnectionPoolException;
import cn.ashersu.taskify.exception.TaskifyException;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 进程级连接池管理器。
 * <p>
 * 首次调用 {@link #getPool()} 时同步执行建库建表，再创建指向应用数据库的连接池并缓存；
 * 之后的调用直接返回缓存的连接池。初始化过程是 single-flight 的：并发的首批调用方
 * 等待同一个进行中的初始化，而不会重复建库或重复建池。初始化失败时清空缓存，下次调用会重新尝试。
 */
@Slf4j
public class TaskifyConnectionManager implements AutoCloseable {

    static final String POOL_NAME = "taskify-pool";

    private final DatabaseSettings applicationSettings;
    private final SchemaProvisioner schemaProvisioner;
    private final DataSourceFactory dataSourceFactory;

    /** 进行中或已完成的初始化；null 表示尚未初始化或上次失败 */
    private final AtomicReference<CompletableFuture<HikariDataSource>> pool = new AtomicReference<>();

    private volatile boolean closed;

    public TaskifyConnectionManager(DatabaseSettings applicationSettings,
                                    SchemaProvisioner schemaProvisioner,
                                    DataSourceFactory dataSourceFactory) {
        this.applicationSettings = Objects.requireNonNull(applicationSettings, "applicationSettings required");
        this.schemaProvisioner = Objects.requireNonNull(schemaProvisioner, "schemaProvisioner required");
        this.dataSourceFactory = Objects.requireNonNull(dataSourceFactory, "dataSourceFactory required");
    }

    /**
     * 获取应用数据库连接池，必要时先完成初始化。
     *
     * @return 进程内唯一的连接池
     * @throws cn.ashersu.taskify.exception.SchemaProvisioningException 建库建表失败
     * @throws ConnectionPoolException 应用数据库连接池无法打开
     * @throws IllegalStateException 管理器已关闭
     */
    public HikariDataSource getPool() {
        ensureOpen();
        CompletableFuture<HikariDataSource> inFlight = pool.get();
        if (inFlight == null) {
            CompletableFuture<HikariDataSource> candidate = new CompletableFuture<>();
            inFlight = pool.compareAndExchange(null, candidate);
            if (inFlight == null) {
                inFlight = candidate;
                initialize(candidate);
            }
        }
        HikariDataSource ds = await(inFlight);
        ensureOpen();
        return ds;
    }

    /**
     * 是否已经持有可用的连接池。
     */
    public boolean isOpen() {
        CompletableFuture<HikariDataSource> current = pool.get();
        return !closed && current != null && current.isDone() && !current.isCompletedExceptionally();
    }

    private void initialize(CompletableFuture<HikariDataSource> candidate) {
        try {
            schemaProvisioner.ensureSchema();
            HikariDataSource ds = openPool();
            log.info("SQL Server pool {} ready for {}", POOL_NAME, applicationSettings.database());
            candidate.complete(ds);
            if (closed) {
                // close() 已在初始化期间执行，它看不到尚未完成的连接池
                ds.close();
                log.info("Database pool {} closed after shutdown during initialization", POOL_NAME);
            }
        } catch (Throwable e) {
            pool.compareAndSet(candidate, null);
            candidate.completeExceptionally(e);
        }
    }

    private HikariDataSource openPool() {
        log.info("Connecting with: server={} port={} user={} database={}",
                applicationSettings.host(), applicationSettings.port(),
                applicationSettings.user(), applicationSettings.database());
        try {
            return dataSourceFactory.create(applicationSettings, POOL_NAME);
        } catch (RuntimeException e) {
            log.error("Failed to open pool {}: {}", POOL_NAME, e.getMessage());
            throw new ConnectionPoolException("Failed to open pool for " + applicationSettings.database()
                    + ": " + e.getMessage(), e);
        }
    }

    private static HikariDataSource await(CompletableFuture<HikariDataSource> inFlight) {
        try {
            return inFlight.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new TaskifyException("Pool initialization failed: " + cause, cause);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
    }

    /**
     * 关闭连接池（如已打开）。关闭失败只记录日志，不向上抛出。
     */
    @Override
    public void close() {
        closed = true;
        CompletableFuture<HikariDataSource> current = pool.getAndSet(null);
        if (current == null || !current.isDone() || current.isCompletedExceptionally()) {
            return;
        }
        HikariDataSource ds = current.join();
        try {
            ds.close();
            log.info("Database pool {} closed", POOL_NAME);
        } catch (RuntimeException e) {
            log.error("Error closing pool: {}", e.getMessage(), e);
        }
    }
}
