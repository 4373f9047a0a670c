package cn.ashersu.taskify.manager;

import cn.ashersu.taskify.exception.QueryExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 通过进程级连接池执行带命名参数（{@code :name}）的语句。
 * <p>
 * 参数一律交给驱动的 PreparedStatement 绑定。执行失败时记录日志并抛出
 * {@link QueryExecutionException}，不做重试。
 */
@Slf4j
public class QueryExecutor {

    private final TaskifyConnectionManager connectionManager;

    /** 与当前连接池绑定的模板，连接池只创建一次 */
    private volatile NamedParameterJdbcTemplate template;

    public QueryExecutor(TaskifyConnectionManager connectionManager) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager required");
    }

    public QueryResult execute(String sql) {
        return execute(sql, Map.of());
    }

    /**
     * @param sql        语句文本
     * @param parameters 参数名到取值
     * @return 结果集行与影响行数
     * @throws QueryExecutionException 语句执行失败
     */
    public QueryResult execute(String sql, Map<String, SqlValue> parameters) {
        Objects.requireNonNull(sql, "sql required");
        DataSource pool = connectionManager.getPool();
        MapSqlParameterSource source = new MapSqlParameterSource();
        if (parameters != null) {
            parameters.forEach((name, value) -> {
                SqlValue v = value == null ? SqlValue.nullValue() : value;
                source.addValue(name, v.jdbcValue(), v.sqlType());
            });
        }
        long start = System.currentTimeMillis();
        try {
            QueryResult result = templateFor(pool).execute(sql, source, QueryExecutor::collect);
            if (log.isDebugEnabled()) {
                log.debug("Executed statement in {} ms, rows={} rowsAffected={}",
                        System.currentTimeMillis() - start, result.rows().size(), result.rowsAffected());
            }
            return result;
        } catch (DataAccessException e) {
            log.error("SQL error: {}", e.getMostSpecificCause().getMessage());
            throw new QueryExecutionException("Query failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private NamedParameterJdbcTemplate templateFor(DataSource pool) {
        NamedParameterJdbcTemplate current = template;
        if (current == null || current.getJdbcTemplate().getDataSource() != pool) {
            current = new NamedParameterJdbcTemplate(pool);
            template = current;
        }
        return current;
    }

    private static QueryResult collect(PreparedStatement ps) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        List<Integer> rowsAffected = new ArrayList<>();
        boolean isResultSet = ps.execute();
        while (true) {
            if (isResultSet) {
                try (ResultSet rs = ps.getResultSet()) {
                    readRows(rs, rows);
                }
            } else {
                int count = ps.getUpdateCount();
                if (count == -1) {
                    break;
                }
                rowsAffected.add(count);
            }
            isResultSet = ps.getMoreResults();
        }
        return new QueryResult(rows, rowsAffected);
    }

    private static void readRows(ResultSet rs, List<Map<String, Object>> rows) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int colCount = meta.getColumnCount();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= colCount; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
    }
}
