package github.sarthakdev143.style_reel.model;

import java.util.List;

public record CompositionSelection(
        List<String> imageFileIds,
        boolean includeOriginal,
        List<String> transitions,
        String audioFileId,
        AudioPolicy audioPolicy,
        Double totalDurationSeconds) {

    public CompositionSelection {
        imageFileIds = imageFileIds == null ? List.of() : List.copyOf(imageFileIds);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        audioPolicy = audioPolicy == null ? AudioPolicy.SILENCE_PAD : audioPolicy;
    }

    public CompositionSelection withImageFileIds(List<String> ids) {
        return new CompositionSelection(ids, includeOriginal, transitions, audioFileId, audioPolicy, totalDurationSeconds);
    }
}
