package cn.ashersu.taskify.exception;

/**
 * 请求参数校验失败，映射为 HTTP 400。
 */
public class InvalidTaskException extends TaskifyException {

    public InvalidTaskException(String message) {
        super(message);
    }
}
