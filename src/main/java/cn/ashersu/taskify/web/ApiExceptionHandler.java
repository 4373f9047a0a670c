package cn.ashersu.taskify.web;

import cn.ashersu.taskify.exception.InvalidTaskException;
import cn.ashersu.taskify.exception.TaskNotFoundException;
import cn.ashersu.taskify.exception.TaskOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.Map;

/**
 * 统一错误响应：{@code {"error": "..."}}。
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(InvalidTaskException.class)
    public ResponseEntity<Object> handleInvalid(InvalidTaskException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(TaskNotFoundException e) {
        log.debug("Task {} not found", e.getTaskId());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(TaskOperationException.class)
    public ResponseEntity<Object> handleOperation(TaskOperationException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    /**
     * Spring MVC 自身的异常（405、415、请求体无法解析等）保留原状态码，只替换响应体。
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex, Object body, HttpHeaders headers,
                                                             HttpStatusCode statusCode, WebRequest request) {
        String message;
        if (ex instanceof HttpMessageNotReadableException) {
            message = "Malformed request body";
        } else {
            HttpStatus status = HttpStatus.resolve(statusCode.value());
            message = status != null ? status.getReasonPhrase() : "Request failed";
        }
        return ResponseEntity.status(statusCode).headers(headers).body(Map.of("error", message));
    }

    private static ResponseEntity<Object> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
