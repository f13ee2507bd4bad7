package github.sarthakdev143.style_reel.model;

import java.util.List;

public record GenerationOutcome(
        List<TaskImage> images,
        boolean timedOut) {

    public GenerationOutcome {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public long successCount() {
        return images.stream().filter(TaskImage::succeeded).count();
    }

    public long failureCount() {
        return images.size() - successCount();
    }
}
