package github.sarthakdev143.style_reel.dto;

import java.util.List;

public record CreateTaskRequest(
        String originalImageId,
        Integer styleCount,
        List<String> styles,
        Integer width,
        Integer height,
        Integer fps,
        List<String> transitions,
        Integer concurrencyLimit,
        Boolean autoCompose,
        Boolean includeOriginal,
        String audioFileId,
        String audioPolicy,
        Double totalDurationSeconds) {

    public CreateTaskRequest {
        styles = styles == null ? List.of() : List.copyOf(styles);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }
}
