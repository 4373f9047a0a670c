package cn.ashersu.taskify.model;

public record CreateTaskRequest(String title, String description) {
}
