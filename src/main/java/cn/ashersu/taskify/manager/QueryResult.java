package cn.ashersu.taskify.manager;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 语句执行结果。
 *
 * @param rows         所有结果集中的行，列标签到值，保持列顺序
 * @param rowsAffected 每条 DML 语句的影响行数
 */
public record QueryResult(List<Map<String, Object>> rows, List<Integer> rowsAffected) {

    public QueryResult {
        rows = List.copyOf(rows);
        rowsAffected = List.copyOf(rowsAffected);
    }

    public Optional<Map<String, Object>> firstRow() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int totalRowsAffected() {
        return rowsAffected.stream().mapToInt(Integer::intValue).sum();
    }
}
