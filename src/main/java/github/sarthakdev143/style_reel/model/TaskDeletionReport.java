package github.sarthakdev143.style_reel.model;

import java.util.List;

public record TaskDeletionReport(
        String taskId,
        List<String> removedFileIds,
        List<String> keptFileIds,
        List<String> failedFileIds) {

    public TaskDeletionReport {
        removedFileIds = removedFileIds == null ? List.of() : List.copyOf(removedFileIds);
        keptFileIds = keptFileIds == null ? List.of() : List.copyOf(keptFileIds);
        failedFileIds = failedFileIds == null ? List.of() : List.copyOf(failedFileIds);
    }
}
