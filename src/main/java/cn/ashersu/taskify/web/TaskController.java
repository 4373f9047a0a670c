package cn.ashersu.taskify.web;

import cn.ashersu.taskify.model.CreateTaskRequest;
import cn.ashersu.taskify.model.Task;
import cn.ashersu.taskify.model.UpdateTaskRequest;
import cn.ashersu.taskify.service.TaskService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskService taskService;

    @GetMapping
    public List<Task> listTasks() {
        return taskService.listTasks();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Task createTask(@RequestBody(required = false) CreateTaskRequest request) {
        if (request == null) {
            return taskService.createTask(null, null);
        }
        return taskService.createTask(request.title(), request.description());
    }

    @PutMapping("/{id}")
    public Task updateTask(@PathVariable("id") String id, @RequestBody(required = false) UpdateTaskRequest request) {
        int taskId = TaskService.parseTaskId(id);
        UpdateTaskRequest body = request == null ? new UpdateTaskRequest(null, null, null) : request;
        return taskService.updateTask(taskId, body.title(), body.description(), body.isCompleted());
    }

    @DeleteMapping("/{id}")
    public Map<String, String> deleteTask(@PathVariable("id") String id) {
        taskService.deleteTask(TaskService.parseTaskId(id));
        return Map.of("message", "Task deleted successfully");
    }
}
