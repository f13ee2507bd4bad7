package github.sarthakdev143.style_reel.model;

import github.sarthakdev143.style_reel.exception.InvalidTaskTransitionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskRecordTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void progressNeverMovesBackwards() {
        TaskRecord task = queuedTask().withProgress(40);

        assertThat(task.withProgress(25)).isSameAs(task);
        assertThat(task.withProgress(60).progress()).isEqualTo(60);
        assertThat(task.withProgress(150).progress()).isEqualTo(100);
    }

    @Test
    void transitionToTerminalStatusStampsCompletion() {
        TaskRecord failed = queuedTask().transitionTo(TaskStatus.FAILED, "boom", NOW);

        assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(failed.completedAt()).isEqualTo(NOW);
    }

    @Test
    void illegalTransitionIsRejected() {
        assertThatThrownBy(() -> queuedTask().transitionTo(TaskStatus.COMPOSING, "skip", NOW))
                .isInstanceOf(InvalidTaskTransitionException.class)
                .hasMessageContaining("QUEUED")
                .hasMessageContaining("COMPOSING");
    }

    @Test
    void referencedFileIdsCoverEveryFileTheTaskPointsAt() {
        CompositionSelection selection = new CompositionSelection(
                List.of("img-1"), true, List.of(), "audio-1", AudioPolicy.LOOP, null);
        TaskRecord task = queuedTask()
                .withImages(List.of(
                        TaskImage.generated("img-1", "Cyberpunk", 0),
                        TaskImage.failed("Fauvism", 1, GenerationFailureKind.INVALID_INPUT, "rejected")))
                .withSelection(selection)
                .withVideo("video-1");

        assertThat(task.referencedFileIds()).containsExactly("original-1", "img-1", "audio-1", "video-1");
        assertThat(task.successfulImages()).extracting(TaskImage::fileId).containsExactly("img-1");
    }

    @Test
    void imagesArePlacedByGenerationIndex() {
        TaskRecord partial = queuedTask()
                .withImages(List.of(TaskImage.generated("img-2", "Fauvism", 1)))
                .withImages(List.of(TaskImage.generated("img-1", "Cyberpunk", 0)));

        assertThat(partial.images()).extracting(TaskImage::generationIndex).containsExactly(0, 1);
        assertThat(partial.withImages(List.of(TaskImage.generated("img-1", "Cyberpunk", 0)))).isSameAs(partial);

        TaskRecord replaced = partial.withImages(List.of(
                TaskImage.generated("img-1", "Cyberpunk", 0),
                TaskImage.failed("Fauvism", 1, GenerationFailureKind.TIMEOUT, "late")));
        assertThat(replaced.images()).hasSize(2);
        assertThat(replaced.successfulImages()).extracting(TaskImage::fileId).containsExactly("img-1");
    }

    private TaskRecord queuedTask() {
        TaskConfig config = new TaskConfig(2, List.of("Cyberpunk", "Fauvism"), 1280, 720, 30, List.of("fade"), 2, null);
        return TaskRecord.queued("task-1", config, "original-1", null, List.of(), NOW);
    }
}
