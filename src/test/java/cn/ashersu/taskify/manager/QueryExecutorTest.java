package cn.ashersu.taskify.manager;

import cn.ashersu.taskify.exception.QueryExecutionException;
import cn.ashersu.taskify.exception.SchemaProvisioningException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueryExecutorTest {

    private HikariDataSource pool;
    private TaskifyConnectionManager manager;
    private QueryExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:executor_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        config.setMaximumPoolSize(2);
        config.setPoolName("executor-test-pool");
        pool = new HikariDataSource(config);
        try (Connection c = pool.getConnection(); Statement st = c.createStatement()) {
            st.executeUpdate("CREATE TABLE notes (id INT AUTO_INCREMENT PRIMARY KEY, body VARCHAR(200), done BOOLEAN DEFAULT FALSE NOT NULL)");
        }
        manager = mock(TaskifyConnectionManager.class);
        when(manager.getPool()).thenReturn(pool);
        executor = new QueryExecutor(manager);
    }

    @AfterEach
    void tearDown() {
        if (pool != null && !pool.isClosed()) {
            pool.close();
        }
    }

    @Test
    @DisplayName("插入返回影响行数，查询按列标签返回行")
    void testInsertThenSelect() {
        QueryResult insert = executor.execute("INSERT INTO notes (body, done) VALUES (:body, :done)",
                Map.of("body", SqlValue.of("Buy milk"), "done", SqlValue.of(true)));
        Assertions.assertEquals(List.of(1), insert.rowsAffected());
        Assertions.assertTrue(insert.rows().isEmpty());

        QueryResult select = executor.execute("SELECT id, body, done FROM notes WHERE body = :body",
                Map.of("body", SqlValue.of("Buy milk")));
        Assertions.assertEquals(1, select.rows().size());
        Map<String, Object> row = select.firstRow().orElseThrow();
        Assertions.assertEquals(List.of("ID", "BODY", "DONE"), List.copyOf(row.keySet()));
        Assertions.assertEquals("Buy milk", row.get("BODY"));
        Assertions.assertEquals(Boolean.TRUE, row.get("DONE"));
        Assertions.assertTrue(select.rowsAffected().isEmpty());
    }

    @Test
    @DisplayName("参数按值绑定，不会被当作 SQL 执行")
    void testParametersAreNotInterpolated() {
        String hostile = "x'); DROP TABLE notes; --";
        executor.execute("INSERT INTO notes (body) VALUES (:body)", Map.of("body", SqlValue.of(hostile)));

        QueryResult rows = executor.execute("SELECT body FROM notes");
        Assertions.assertEquals(hostile, rows.firstRow().orElseThrow().get("BODY"));
    }

    @Test
    @DisplayName("NULL 参数与整型参数")
    void testNullAndIntegerParameters() {
        executor.execute("INSERT INTO notes (body) VALUES (:body)", Map.of("body", SqlValue.nullOf(Types.VARCHAR)));
        executor.execute("INSERT INTO notes (body) VALUES (:body)", Map.of("body", SqlValue.of("second")));

        QueryResult updated = executor.execute("UPDATE notes SET body = COALESCE(:body, body) WHERE id = :id",
                Map.of("body", SqlValue.nullOf(Types.VARCHAR), "id", SqlValue.of(2)));
        Assertions.assertEquals(1, updated.totalRowsAffected());

        QueryResult rows = executor.execute("SELECT id, body FROM notes ORDER BY id DESC");
        Assertions.assertEquals(2, rows.rows().size());
        Assertions.assertEquals("second", rows.rows().get(0).get("BODY"));
        Assertions.assertNull(rows.rows().get(1).get("BODY"));
    }

    @Test
    @DisplayName("不匹配的更新返回 0 行")
    void testUpdateMissingRow() {
        QueryResult deleted = executor.execute("DELETE FROM notes WHERE id = :id", Map.of("id", SqlValue.of(999)));
        Assertions.assertEquals(List.of(0), deleted.rowsAffected());
        Assertions.assertEquals(0, deleted.totalRowsAffected());
    }

    @Test
    @DisplayName("SQL 错误包装为 QueryExecutionException")
    void testSqlErrorIsWrapped() {
        QueryExecutionException e = Assertions.assertThrows(QueryExecutionException.class,
                () -> executor.execute("SELECT * FROM no_such_table"));
        Assertions.assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("缺少参数同样视为执行失败")
    void testMissingParameter() {
        Assertions.assertThrows(QueryExecutionException.class,
                () -> executor.execute("SELECT * FROM notes WHERE id = :id", Map.of()));
    }

    @Test
    @DisplayName("获取连接池失败原样抛出")
    void testPoolFailurePropagatesUnchanged() {
        when(manager.getPool()).thenThrow(new SchemaProvisioningException("provisioning failed"));
        Assertions.assertThrows(SchemaProvisioningException.class, () -> executor.execute("SELECT 1"));
    }
}
