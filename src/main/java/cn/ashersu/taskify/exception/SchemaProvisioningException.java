package cn.ashersu.taskify.exception;

/**
 * 建库/建表失败，属于致命的初始化错误。
 */
public class SchemaProvisioningException extends TaskifyException {

    public SchemaProvisioningException(String message) {
        super(message);
    }

    public SchemaProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
