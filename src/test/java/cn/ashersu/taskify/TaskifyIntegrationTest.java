package cn.ashersu.taskify;

import cn.ashersu.taskify.config.TaskifyDatabaseProperties;
import cn.ashersu.taskify.exception.TaskNotFoundException;
import cn.ashersu.taskify.manager.HikariDataSourceFactory;
import cn.ashersu.taskify.manager.QueryExecutor;
import cn.ashersu.taskify.manager.SchemaProvisioner;
import cn.ashersu.taskify.manager.TaskifyConnectionManager;
import cn.ashersu.taskify.model.Task;
import cn.ashersu.taskify.service.TaskService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MSSQLServerContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

/**
 * 真实 SQL Server 上的端到端验证；没有 Docker 时跳过。
 */
@Testcontainers(disabledWithoutDocker = true)
class TaskifyIntegrationTest {

    @Container
    static MSSQLServerContainer<?> mssql = new MSSQLServerContainer<>("mcr.microsoft.com/mssql/server:2022-latest")
            .acceptLicense();

    // 每个测试使用独立的数据库，互不影响
    private String database;
    private TaskifyDatabaseProperties props;
    private SchemaProvisioner provisioner;
    private TaskifyConnectionManager manager;
    private TaskService service;

    @BeforeEach
    void setUp() {
        Assertions.assertTrue(mssql.isRunning());
        database = "taskify_it_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        props = new TaskifyDatabaseProperties();
        props.setHost(mssql.getHost());
        props.setPort(mssql.getMappedPort(MSSQLServerContainer.MS_SQL_SERVER_PORT));
        props.setUser(mssql.getUsername());
        props.setPassword(mssql.getPassword());
        props.setDatabase(database);
        HikariDataSourceFactory factory = new HikariDataSourceFactory();
        provisioner = new SchemaProvisioner(props.baseSettings(), database, factory);
        manager = new TaskifyConnectionManager(props.applicationSettings(), provisioner, factory);
        service = new TaskService(new QueryExecutor(manager));
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private int countRows(String sql) throws Exception {
        try (Connection c = DriverManager.getConnection(props.baseSettings().jdbcUrl(), mssql.getUsername(), mssql.getPassword());
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @Test
    @DisplayName("ensureSchema 连续执行两次不报错，只有一个库一张表")
    void testEnsureSchemaIsIdempotent() throws Exception {
        provisioner.ensureSchema();
        Assertions.assertDoesNotThrow(provisioner::ensureSchema);

        Assertions.assertEquals(1, countRows("SELECT COUNT(*) FROM sys.databases WHERE name = '" + database + "'"));
        Assertions.assertEquals(1, countRows("SELECT COUNT(*) FROM [" + database + "].sys.tables WHERE name = 'tasks'"));
    }

    @Test
    @DisplayName("创建、完成、删除一条任务的完整流程")
    void testTaskLifecycle() throws InterruptedException {
        Task created = service.createTask("Buy milk", null);
        Assertions.assertTrue(created.id() > 0);
        Assertions.assertEquals("Buy milk", created.title());
        Assertions.assertFalse(created.isCompleted());
        Assertions.assertNull(created.updatedAt());
        Assertions.assertNotNull(created.createdAt());

        Thread.sleep(20);
        Task updated = service.updateTask(created.id(), null, null, true);
        Assertions.assertEquals("Buy milk", updated.title());
        Assertions.assertTrue(updated.isCompleted());
        Assertions.assertNotNull(updated.updatedAt());
        Assertions.assertTrue(updated.updatedAt().isAfter(updated.createdAt()));

        service.deleteTask(created.id());
        Assertions.assertTrue(service.listTasks().isEmpty());
    }

    @Test
    @DisplayName("列表按 id 倒序，删除后 id 不复用")
    void testOrderingAndIdsNotReused() {
        Task first = service.createTask("first task", null);
        Task second = service.createTask("second task", "with description");
        Task third = service.createTask("third task", null);

        List<Integer> ids = service.listTasks().stream().map(Task::id).toList();
        Assertions.assertEquals(List.of(third.id(), second.id(), first.id()), ids);

        service.deleteTask(third.id());
        Task fourth = service.createTask("fourth task", null);
        Assertions.assertTrue(fourth.id() > third.id());
    }

    @Test
    @DisplayName("更新或删除不存在的 id 不改变表内容")
    void testMissingIdLeavesTableUnchanged() {
        Task only = service.createTask("only task", null);

        Assertions.assertThrows(TaskNotFoundException.class, () -> service.updateTask(only.id() + 100, null, null, true));
        Assertions.assertThrows(TaskNotFoundException.class, () -> service.deleteTask(only.id() + 100));

        List<Task> tasks = service.listTasks();
        Assertions.assertEquals(1, tasks.size());
        Assertions.assertFalse(tasks.get(0).isCompleted());
        Assertions.assertNull(tasks.get(0).updatedAt());
    }
}
