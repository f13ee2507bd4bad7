package github.sarthakdev143.style_reel.service;

import github.sarthakdev143.style_reel.model.TaskImage;

// Called once per resolved style, possibly from several worker threads at once.
public interface GenerationListener {

    void onStyleResolved(TaskImage image, int resolvedCount, int totalCount);

    default boolean abortRequested() {
        return false;
    }
}
