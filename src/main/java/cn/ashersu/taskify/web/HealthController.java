package cn.ashersu.taskify.web;

import cn.ashersu.taskify.exception.TaskifyException;
import cn.ashersu.taskify.manager.QueryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 数据库连通性检查；首次调用同样会触发建库建表。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final QueryExecutor queryExecutor;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            queryExecutor.execute("SELECT 1 AS connected");
        } catch (TaskifyException e) {
            log.error("Health check failed: {}", e.getMessage());
            body.put("error", "Database connection failed");
            body.put("details", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
        body.put("status", "OK");
        body.put("message", "Database connected successfully!");
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }
}
