package github.sarthakdev143.style_reel.controller;

import github.sarthakdev143.style_reel.dto.CreateTaskRequest;
import github.sarthakdev143.style_reel.dto.SelectionRequest;
import github.sarthakdev143.style_reel.exception.InvalidTaskTransitionException;
import github.sarthakdev143.style_reel.exception.StoreUnavailableException;
import github.sarthakdev143.style_reel.exception.StoredFileNotFoundException;
import github.sarthakdev143.style_reel.model.TaskConfig;
import github.sarthakdev143.style_reel.model.TaskDeletionReport;
import github.sarthakdev143.style_reel.model.TaskImage;
import github.sarthakdev143.style_reel.model.TaskRecord;
import github.sarthakdev143.style_reel.model.TaskStatus;
import github.sarthakdev143.style_reel.service.TaskService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webmvc.test.autoconfigure.WebMvcTest;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TaskController.class)
class TaskControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TaskService taskService;

    @Test
    void createReturnsAcceptedWithStatusUrl() throws Exception {
        when(taskService.createTask(any(CreateTaskRequest.class))).thenReturn(task("task-123", TaskStatus.QUEUED));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"originalImageId\":\"file-1\",\"styleCount\":3,\"autoCompose\":true}"))
                .andExpect(status().isAccepted())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.taskId").value("task-123"))
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andExpect(jsonPath("$.statusUrl").value("/api/tasks/task-123"));

        ArgumentCaptor<CreateTaskRequest> requestCaptor = ArgumentCaptor.forClass(CreateTaskRequest.class);
        verify(taskService).createTask(requestCaptor.capture());
        assertThat(requestCaptor.getValue().originalImageId()).isEqualTo("file-1");
        assertThat(requestCaptor.getValue().styleCount()).isEqualTo(3);
        assertThat(requestCaptor.getValue().autoCompose()).isTrue();
        assertThat(requestCaptor.getValue().styles()).isEmpty();
    }

    @Test
    void createReturnsBadRequestForInvalidParameters() throws Exception {
        when(taskService.createTask(any(CreateTaskRequest.class)))
                .thenThrow(new IllegalArgumentException("styleCount must be between 1 and 20."));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"originalImageId\":\"file-1\",\"styleCount\":99}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Invalid request: styleCount")));
    }

    @Test
    void createReturnsNotFoundForUnknownOriginal() throws Exception {
        when(taskService.createTask(any(CreateTaskRequest.class))).thenThrow(new StoredFileNotFoundException("file-9"));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"originalImageId\":\"file-9\",\"styleCount\":1}"))
                .andExpect(status().isNotFound())
                .andExpect(content().string(containsString("file-9")));
    }

    @Test
    void selectionReturnsServiceUnavailableWhenNoWorkerIsFree() throws Exception {
        when(taskService.submitSelection(eq("task-1"), any(SelectionRequest.class)))
                .thenThrow(new TaskRejectedException("Task executor queue is full"));

        mockMvc.perform(post("/api/tasks/task-1/selection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageFileIds\":[\"img-1\"]}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(content().string(containsString("Too many tasks")));
    }

    @Test
    void createReturnsServiceUnavailableWhenStoreIsDown() throws Exception {
        when(taskService.createTask(any(CreateTaskRequest.class)))
                .thenThrow(new StoreUnavailableException("disk full", new IOException("ENOSPC")));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"originalImageId\":\"file-1\",\"styleCount\":1}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void getReturnsTaskSnapshot() throws Exception {
        TaskRecord task = task("task-123", TaskStatus.AWAITING_SELECTION)
                .withProgress(40)
                .withImages(List.of(TaskImage.generated("img-1", "Cyberpunk", 0)));
        when(taskService.getTask("task-123")).thenReturn(Optional.of(task));

        mockMvc.perform(get("/api/tasks/task-123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("AWAITING_SELECTION"))
                .andExpect(jsonPath("$.progress").value(40))
                .andExpect(jsonPath("$.images[0].fileId").value("img-1"))
                .andExpect(jsonPath("$.images[0].styleLabel").value("Cyberpunk"));
    }

    @Test
    void getReturnsNotFoundForUnknownTask() throws Exception {
        when(taskService.getTask("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/tasks/missing"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Task not found for id: missing"));
    }

    @Test
    void listPassesParsedStatusFilter() throws Exception {
        when(taskService.listTasks(TaskStatus.COMPLETED)).thenReturn(List.of(task("task-1", TaskStatus.COMPLETED)));

        mockMvc.perform(get("/api/tasks").param("status", "completed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].taskId").value("task-1"));
    }

    @Test
    void listRejectsUnknownStatus() throws Exception {
        mockMvc.perform(get("/api/tasks").param("status", "sleeping"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Unknown status")));

        verifyNoInteractions(taskService);
    }

    @Test
    void selectionOutsideAwaitingSelectionIsConflict() throws Exception {
        when(taskService.submitSelection(eq("task-123"), any(SelectionRequest.class)))
                .thenThrow(new InvalidTaskTransitionException("task-123", TaskStatus.GENERATING, TaskStatus.COMPOSING));

        mockMvc.perform(post("/api/tasks/task-123/selection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageFileIds\":[\"img-1\"]}"))
                .andExpect(status().isConflict());
    }

    @Test
    void selectionReturnsAccepted() throws Exception {
        when(taskService.submitSelection(eq("task-123"), any(SelectionRequest.class)))
                .thenReturn(task("task-123", TaskStatus.COMPOSING));

        mockMvc.perform(post("/api/tasks/task-123/selection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageFileIds\":[\"img-2\",\"img-1\"],\"includeOriginal\":false}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("COMPOSING"));

        ArgumentCaptor<SelectionRequest> requestCaptor = ArgumentCaptor.forClass(SelectionRequest.class);
        verify(taskService).submitSelection(eq("task-123"), requestCaptor.capture());
        assertThat(requestCaptor.getValue().imageFileIds()).containsExactly("img-2", "img-1");
        assertThat(requestCaptor.getValue().includeOriginal()).isFalse();
    }

    @Test
    void deleteOfRunningTaskIsConflict() throws Exception {
        when(taskService.deleteTask("task-123"))
                .thenThrow(new IllegalStateException("Task task-123 is GENERATING and cannot be deleted yet."));

        mockMvc.perform(delete("/api/tasks/task-123"))
                .andExpect(status().isConflict())
                .andExpect(content().string(containsString("GENERATING")));
    }

    @Test
    void deleteReturnsReport() throws Exception {
        when(taskService.deleteTask("task-123"))
                .thenReturn(new TaskDeletionReport("task-123", List.of("img-1"), List.of("file-1"), List.of()));

        mockMvc.perform(delete("/api/tasks/task-123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removedFileIds[0]").value("img-1"))
                .andExpect(jsonPath("$.keptFileIds[0]").value("file-1"));
    }

    @Test
    void cancelReturnsCancelledTask() throws Exception {
        when(taskService.cancelTask("task-123")).thenReturn(task("task-123", TaskStatus.CANCELLED));

        mockMvc.perform(post("/api/tasks/task-123/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    private TaskRecord task(String taskId, TaskStatus status) {
        TaskConfig config = new TaskConfig(1, List.of("Cyberpunk"), 1280, 720, 30, List.of("slideleft"), 1, null);
        TaskRecord queued = TaskRecord.queued(taskId, config, "file-1", null, List.of(), NOW);
        return new TaskRecord(
                queued.taskId(),
                1L,
                status,
                queued.progress(),
                queued.message(),
                queued.config(),
                queued.originalImageId(),
                null,
                queued.images(),
                null,
                null,
                NOW,
                NOW,
                null,
                null,
                null);
    }
}
