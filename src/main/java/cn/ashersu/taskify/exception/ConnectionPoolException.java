package cn.ashersu.taskify.exception;

/**
 * 应用数据库连接池无法打开（服务器不可达、登录失败等），与建库失败一样属于致命的初始化错误。
 */
public class ConnectionPoolException extends TaskifyException {

    public ConnectionPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
