package github.sarthakdev143.style_reel.service;

import github.sarthakdev143.style_reel.model.composition.CompositionRenderPlan;

import java.io.IOException;
import java.nio.file.Path;

public interface CompositionRenderer {

    void renderComposition(
            CompositionRenderPlan plan,
            Path outputVideoPath,
            CompositionProgressListener progressListener) throws IOException, InterruptedException;
}
