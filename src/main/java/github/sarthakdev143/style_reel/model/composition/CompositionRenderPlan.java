package github.sarthakdev143.style_reel.model.composition;

import github.sarthakdev143.style_reel.model.AudioPolicy;

import java.nio.file.Path;
import java.util.List;

public record CompositionRenderPlan(
        List<CompositionFramePlan> frames,
        Path audioPath,
        AudioPolicy audioPolicy,
        int width,
        int height,
        int fps,
        double totalDurationSec) {

    public CompositionRenderPlan {
        frames = frames == null ? List.of() : List.copyOf(frames);
        audioPolicy = audioPolicy == null ? AudioPolicy.SILENCE_PAD : audioPolicy;
    }
}
