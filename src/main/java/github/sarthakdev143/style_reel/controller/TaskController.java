package github.sarthakdev143.style_reel.controller;

import github.sarthakdev143.style_reel.dto.CreateTaskRequest;
import github.sarthakdev143.style_reel.dto.RegenerateRequest;
import github.sarthakdev143.style_reel.dto.SelectionRequest;
import github.sarthakdev143.style_reel.dto.TaskSubmissionResponse;
import github.sarthakdev143.style_reel.exception.InvalidTaskTransitionException;
import github.sarthakdev143.style_reel.exception.StoreUnavailableException;
import github.sarthakdev143.style_reel.exception.StoredFileNotFoundException;
import github.sarthakdev143.style_reel.exception.TaskNotFoundException;
import github.sarthakdev143.style_reel.model.TaskRecord;
import github.sarthakdev143.style_reel.model.TaskStatus;
import github.sarthakdev143.style_reel.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private static final Logger logger = LoggerFactory.getLogger(TaskController.class);

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping
    public ResponseEntity<?> createTask(@RequestBody CreateTaskRequest request) {
        return handle("create task", () -> {
            TaskRecord task = taskService.createTask(request);
            return ResponseEntity.accepted()
                    .body(submissionResponse(task, "Task accepted. Poll the status URL for progress."));
        });
    }

    @GetMapping
    public ResponseEntity<?> listTasks(@RequestParam(value = "status", required = false) String statusInput) {
        return handle("list tasks", () -> ResponseEntity.ok(taskService.listTasks(parseStatus(statusInput))));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<?> getTask(@PathVariable String taskId) {
        return handle("read task", () -> taskService.getTask(taskId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Task not found for id: " + taskId)));
    }

    @PostMapping("/{taskId}/selection")
    public ResponseEntity<?> submitSelection(@PathVariable String taskId, @RequestBody SelectionRequest request) {
        return handle("submit selection", () -> {
            TaskRecord task = taskService.submitSelection(taskId, request);
            return ResponseEntity.accepted()
                    .body(submissionResponse(task, "Selection accepted. Composition started."));
        });
    }

    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<?> cancelTask(@PathVariable String taskId) {
        return handle("cancel task", () -> ResponseEntity.ok(taskService.cancelTask(taskId)));
    }

    @PostMapping("/{taskId}/regenerate")
    public ResponseEntity<?> regenerate(@PathVariable String taskId, @RequestBody RegenerateRequest request) {
        return handle("regenerate task", () -> {
            TaskRecord task = taskService.regenerate(taskId, request);
            return ResponseEntity.accepted()
                    .body(submissionResponse(task, "Recomposition accepted from task " + taskId + "."));
        });
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<?> deleteTask(@PathVariable String taskId) {
        return handle("delete task", () -> ResponseEntity.ok(taskService.deleteTask(taskId)));
    }

    private ResponseEntity<?> handle(String action, Supplier<ResponseEntity<?>> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (TaskNotFoundException | StoredFileNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (InvalidTaskTransitionException | IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        } catch (StoreUnavailableException e) {
            logger.error("Store unavailable during {}", action, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Storage is unavailable. Please try again later.");
        } catch (TaskRejectedException e) {
            logger.warn("Task executor rejected work during {}: {}", action, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Too many tasks are running. Please try again later.");
        } catch (Exception e) {
            logger.error("Failed to {}", action, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to " + action + ". Please try again.");
        }
    }

    private TaskStatus parseStatus(String statusInput) {
        if (statusInput == null || statusInput.isBlank()) {
            return null;
        }
        try {
            return TaskStatus.valueOf(statusInput.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown status: " + statusInput);
        }
    }

    private TaskSubmissionResponse submissionResponse(TaskRecord task, String message) {
        return new TaskSubmissionResponse(task.taskId(), task.status(), message, "/api/tasks/" + task.taskId());
    }
}
