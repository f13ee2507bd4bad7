package github.sarthakdev143.style_reel.service;

import github.sarthakdev143.style_reel.dto.CreateTaskRequest;
import github.sarthakdev143.style_reel.dto.RegenerateRequest;
import github.sarthakdev143.style_reel.dto.SelectionRequest;
import github.sarthakdev143.style_reel.model.TaskDeletionReport;
import github.sarthakdev143.style_reel.model.TaskRecord;
import github.sarthakdev143.style_reel.model.TaskStatus;

import java.util.List;
import java.util.Optional;

public interface TaskService {

    TaskRecord createTask(CreateTaskRequest request);

    Optional<TaskRecord> getTask(String taskId);

    List<TaskRecord> listTasks(TaskStatus status);

    TaskRecord submitSelection(String taskId, SelectionRequest request);

    TaskRecord cancelTask(String taskId);

    TaskRecord regenerate(String sourceTaskId, RegenerateRequest request);

    TaskDeletionReport deleteTask(String taskId);

    int recoverInterruptedTasks();

    int expireStaleSelections();
}
