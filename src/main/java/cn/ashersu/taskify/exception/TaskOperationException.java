package cn.ashersu.taskify.exception;

/**
 * 数据库操作失败；message 即返回给客户端的错误描述，原始异常保留在 cause 中。
 */
public class TaskOperationException extends TaskifyException {

    public TaskOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
