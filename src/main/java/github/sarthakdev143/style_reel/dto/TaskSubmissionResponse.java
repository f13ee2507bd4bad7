package github.sarthakdev143.style_reel.dto;

import github.sarthakdev143.style_reel.model.TaskStatus;

public record TaskSubmissionResponse(
        String taskId,
        TaskStatus status,
        String message,
        String statusUrl) {
}
