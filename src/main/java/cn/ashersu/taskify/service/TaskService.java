package cn.ashersu.taskify.service;

import cn.ashersu.taskify.exception.InvalidTaskException;
import cn.ashersu.taskify.exception.TaskNotFoundException;
import cn.ashersu.taskify.exception.TaskOperationException;
import cn.ashersu.taskify.exception.TaskifyException;
import cn.ashersu.taskify.manager.QueryExecutor;
import cn.ashersu.taskify.manager.QueryResult;
import cn.ashersu.taskify.manager.SqlValue;
import cn.ashersu.taskify.model.Task;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Types;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * dbo.tasks 的增删改查。参数校验在访问数据库之前完成。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

    static final int MIN_TITLE_LENGTH = 3;
    static final int MAX_TITLE_LENGTH = 255;
    static final int MAX_DESCRIPTION_LENGTH = 1000;

    private static final String SELECT_ALL_SQL = "SELECT * FROM dbo.tasks ORDER BY id DESC";

    private static final String INSERT_SQL = """
            INSERT INTO dbo.tasks (title, description, isCompleted)
            OUTPUT INSERTED.*
            VALUES (:title, :description, 0)""";

    private static final String UPDATE_SQL = """
            UPDATE dbo.tasks
            SET
                title = COALESCE(:title, title),
                description = COALESCE(:description, description),
                isCompleted = COALESCE(:isCompleted, isCompleted),
                updatedAt = SYSUTCDATETIME()
            OUTPUT INSERTED.*
            WHERE id = :id""";

    private static final String DELETE_SQL = "DELETE FROM dbo.tasks WHERE id = :id";

    private final QueryExecutor queryExecutor;

    public List<Task> listTasks() {
        QueryResult result = run("Failed to fetch tasks", SELECT_ALL_SQL, Map.of());
        return result.rows().stream().map(Task::fromRow).toList();
    }

    /**
     * @param title       任务标题，去除首尾空白后至少 3 个字符
     * @param description 可选描述
     */
    public Task createTask(String title, String description) {
        String trimmed = requireTitle(title);
        String desc = checkDescription(description);
        Map<String, SqlValue> params = new HashMap<>();
        params.put("title", SqlValue.of(trimmed));
        params.put("description", desc == null ? SqlValue.nullOf(Types.NVARCHAR) : SqlValue.of(desc));
        QueryResult result = run("Failed to create task", INSERT_SQL, params);
        Task created = result.firstRow()
                .map(Task::fromRow)
                .orElseThrow(() -> new TaskOperationException("Failed to create task",
                        new IllegalStateException("INSERT returned no row")));
        log.info("Created task id={}", created.id());
        return created;
    }

    /**
     * 只更新传入的字段；{@code updatedAt} 每次都会刷新。
     *
     * @throws TaskNotFoundException id 不存在
     */
    public Task updateTask(int id, String title, String description, Boolean isCompleted) {
        String trimmed = title == null ? null : requireTitle(title);
        String desc = checkDescription(description);
        Map<String, SqlValue> params = new HashMap<>();
        params.put("id", SqlValue.of(id));
        params.put("title", trimmed == null ? SqlValue.nullOf(Types.NVARCHAR) : SqlValue.of(trimmed));
        params.put("description", desc == null ? SqlValue.nullOf(Types.NVARCHAR) : SqlValue.of(desc));
        params.put("isCompleted", isCompleted == null ? SqlValue.nullOf(Types.BOOLEAN) : SqlValue.of(isCompleted.booleanValue()));
        QueryResult result = run("Failed to update task", UPDATE_SQL, params);
        return result.firstRow()
                .map(Task::fromRow)
                .orElseThrow(() -> new TaskNotFoundException(id));
    }

    /**
     * @throws TaskNotFoundException id 不存在
     */
    public void deleteTask(int id) {
        QueryResult result = run("Failed to delete task", DELETE_SQL, Map.of("id", SqlValue.of(id)));
        if (result.totalRowsAffected() == 0) {
            throw new TaskNotFoundException(id);
        }
        log.info("Deleted task id={}", id);
    }

    /**
     * 解析路径中的任务 id。
     *
     * @throws InvalidTaskException 非整数
     */
    public static int parseTaskId(String raw) {
        try {
            return Integer.parseInt(raw == null ? "" : raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidTaskException("Invalid task id");
        }
    }

    private QueryResult run(String failureMessage, String sql, Map<String, SqlValue> params) {
        try {
            return queryExecutor.execute(sql, params);
        } catch (TaskifyException e) {
            log.error("{}: {}", failureMessage, e.getMessage());
            throw new TaskOperationException(failureMessage, e);
        }
    }

    private static String requireTitle(String title) {
        String trimmed = title == null ? "" : title.trim();
        if (trimmed.length() < MIN_TITLE_LENGTH) {
            throw new InvalidTaskException("Task title must be at least " + MIN_TITLE_LENGTH + " characters");
        }
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            throw new InvalidTaskException("Task title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        return trimmed;
    }

    private static String checkDescription(String description) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidTaskException("Task description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return description;
    }
}
