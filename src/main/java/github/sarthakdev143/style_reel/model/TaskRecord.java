package github.sarthakdev143.style_reel.model;

import github.sarthakdev143.style_reel.exception.InvalidTaskTransitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public record TaskRecord(
        String taskId,
        long version,
        TaskStatus status,
        int progress,
        String message,
        TaskConfig config,
        String originalImageId,
        String sourceTaskId,
        List<TaskImage> images,
        CompositionSelection selection,
        String videoId,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        TaskError error,
        String warningMessage) {

    public TaskRecord {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static TaskRecord queued(
            String taskId,
            TaskConfig config,
            String originalImageId,
            String sourceTaskId,
            List<TaskImage> inheritedImages,
            Instant now) {
        return new TaskRecord(
                taskId,
                0L,
                TaskStatus.QUEUED,
                0,
                "Task queued.",
                config,
                originalImageId,
                sourceTaskId,
                inheritedImages,
                null,
                null,
                now,
                now,
                null,
                null,
                null);
    }

    public TaskRecord transitionTo(TaskStatus target, String newMessage, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTaskTransitionException(taskId, status, target);
        }
        Instant completed = target.isTerminal() && completedAt == null ? now : completedAt;
        return new TaskRecord(
                taskId,
                version,
                target,
                progress,
                newMessage,
                config,
                originalImageId,
                sourceTaskId,
                images,
                selection,
                videoId,
                createdAt,
                updatedAt,
                completed,
                error,
                warningMessage);
    }

    public TaskRecord withProgress(int newProgress) {
        int bounded = Math.max(0, Math.min(100, newProgress));
        if (bounded <= progress) {
            return this;
        }
        return new TaskRecord(
                taskId,
                version,
                status,
                bounded,
                message,
                config,
                originalImageId,
                sourceTaskId,
                images,
                selection,
                videoId,
                createdAt,
                updatedAt,
                completedAt,
                error,
                warningMessage);
    }

    public TaskRecord withImages(List<TaskImage> newImages) {
        if (newImages == null || newImages.isEmpty()) {
            return this;
        }
        Map<Integer, TaskImage> byIndex = new TreeMap<>();
        for (TaskImage image : images) {
            byIndex.put(image.generationIndex(), image);
        }
        for (TaskImage image : newImages) {
            byIndex.put(image.generationIndex(), image);
        }
        List<TaskImage> merged = new ArrayList<>(byIndex.values());
        if (merged.equals(images)) {
            return this;
        }
        return new TaskRecord(
                taskId,
                version,
                status,
                progress,
                message,
                config,
                originalImageId,
                sourceTaskId,
                merged,
                selection,
                videoId,
                createdAt,
                updatedAt,
                completedAt,
                error,
                warningMessage);
    }

    public TaskRecord withSelection(CompositionSelection newSelection) {
        return new TaskRecord(
                taskId,
                version,
                status,
                progress,
                message,
                config,
                originalImageId,
                sourceTaskId,
                images,
                newSelection,
                videoId,
                createdAt,
                updatedAt,
                completedAt,
                error,
                warningMessage);
    }

    public TaskRecord withVideo(String newVideoId) {
        return new TaskRecord(
                taskId,
                version,
                status,
                progress,
                message,
                config,
                originalImageId,
                sourceTaskId,
                images,
                selection,
                newVideoId,
                createdAt,
                updatedAt,
                completedAt,
                error,
                warningMessage);
    }

    public TaskRecord withError(TaskError newError) {
        return new TaskRecord(
                taskId,
                version,
                status,
                progress,
                message,
                config,
                originalImageId,
                sourceTaskId,
                images,
                selection,
                videoId,
                createdAt,
                updatedAt,
                completedAt,
                newError,
                warningMessage);
    }

    public TaskRecord withWarning(String newWarning) {
        return new TaskRecord(
                taskId,
                version,
                status,
                progress,
                message,
                config,
                originalImageId,
                sourceTaskId,
                images,
                selection,
                videoId,
                createdAt,
                updatedAt,
                completedAt,
                error,
                newWarning);
    }

    public TaskRecord withVersion(long newVersion, Instant now) {
        return new TaskRecord(
                taskId,
                newVersion,
                status,
                progress,
                message,
                config,
                originalImageId,
                sourceTaskId,
                images,
                selection,
                videoId,
                createdAt,
                now,
                completedAt,
                error,
                warningMessage);
    }

    public List<TaskImage> successfulImages() {
        return images.stream().filter(TaskImage::succeeded).toList();
    }

    public Set<String> referencedFileIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (originalImageId != null) {
            ids.add(originalImageId);
        }
        for (TaskImage image : images) {
            if (image.fileId() != null) {
                ids.add(image.fileId());
            }
        }
        if (selection != null && selection.audioFileId() != null) {
            ids.add(selection.audioFileId());
        }
        if (config != null && config.autoSelection() != null && config.autoSelection().audioFileId() != null) {
            ids.add(config.autoSelection().audioFileId());
        }
        if (videoId != null) {
            ids.add(videoId);
        }
        return ids;
    }
}
