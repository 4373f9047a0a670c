package cn.ashersu.taskify.exception;

public class TaskNotFoundException extends TaskifyException {

    private final int taskId;

    public TaskNotFoundException(int taskId) {
        super("Task not found");
        this.taskId = taskId;
    }

    public int getTaskId() {
        return taskId;
    }
}
