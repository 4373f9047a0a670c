package cn.ashersu.taskify.exception;

public class QueryExecutionException extends TaskifyException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
