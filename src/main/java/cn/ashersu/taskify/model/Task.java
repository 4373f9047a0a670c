package cn.ashersu.taskify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * dbo.tasks 的一行。时间列以 UTC 写入（SYSUTCDATETIME）。
 */
public record Task(int id,
                   String title,
                   String description,
                   @JsonProperty("isCompleted") boolean isCompleted,
                   Instant createdAt,
                   Instant updatedAt) {

    public static Task fromRow(Map<String, Object> row) {
        return new Task(
                ((Number) row.get("id")).intValue(),
                (String) row.get("title"),
                (String) row.get("description"),
                toBoolean(row.get("isCompleted")),
                toInstant(row.get("createdAt")),
                toInstant(row.get("updatedAt")));
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value instanceof Number n && n.intValue() != 0;
    }

    private static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp ts) {
            return ts.toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        throw new IllegalArgumentException("Unsupported timestamp value: " + value.getClass().getName());
    }
}
