package cn.ashersu.taskify.exception;

/**
 * 所有业务异常的基类（非受检）。
 */
public class TaskifyException extends RuntimeException {

    public TaskifyException(String message) {
        super(message);
    }

    public TaskifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
