package github.sarthakdev143.style_reel.dto;

import java.util.List;

public record SelectionRequest(
        List<String> imageFileIds,
        Boolean includeOriginal,
        List<String> transitions,
        String audioFileId,
        String audioPolicy,
        Double totalDurationSeconds) {

    public SelectionRequest {
        imageFileIds = imageFileIds == null ? List.of() : List.copyOf(imageFileIds);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }
}
