package github.sarthakdev143.style_reel.model.composition;

import java.nio.file.Path;

// displaySec is the frame's share of the timeline; clipSec adds the overlap of the outgoing transition.
public record CompositionFramePlan(
        String fileId,
        Path imagePath,
        double displaySec,
        double clipSec,
        CompositionTransitionPlan transitionIn) {
}
