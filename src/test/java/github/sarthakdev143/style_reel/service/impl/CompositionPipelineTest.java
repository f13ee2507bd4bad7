package github.sarthakdev143.style_reel.service.impl;

import github.sarthakdev143.style_reel.config.StyleReelPropertiesFixtures;
import github.sarthakdev143.style_reel.exception.CompositionException;
import github.sarthakdev143.style_reel.model.AudioPolicy;
import github.sarthakdev143.style_reel.model.CompositionFailureKind;
import github.sarthakdev143.style_reel.model.CompositionSelection;
import github.sarthakdev143.style_reel.model.FileKind;
import github.sarthakdev143.style_reel.model.StoredFile;
import github.sarthakdev143.style_reel.model.TaskConfig;
import github.sarthakdev143.style_reel.model.TaskImage;
import github.sarthakdev143.style_reel.model.TaskRecord;
import github.sarthakdev143.style_reel.model.composition.CompositionFramePlan;
import github.sarthakdev143.style_reel.model.composition.CompositionRenderPlan;
import github.sarthakdev143.style_reel.service.CompositionProgressListener;
import github.sarthakdev143.style_reel.service.CompositionRenderer;
import github.sarthakdev143.style_reel.store.LocalFileStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CompositionPipelineTest {

    @TempDir
    Path tempDir;

    @Mock
    private CompositionRenderer compositionRenderer;

    private LocalFileStore fileStore;
    private CompositionPipeline pipeline;
    private String originalId;
    private List<String> imageIds;

    @BeforeEach
    void setUp() {
        fileStore = new LocalFileStore(tempDir.resolve("files"), Clock.systemUTC());
        pipeline = new CompositionPipeline(fileStore, compositionRenderer, StyleReelPropertiesFixtures.defaults(tempDir));
        originalId = fileStore.put(new byte[] {1}, FileKind.UPLOAD, "image/jpeg").fileId();
        imageIds = List.of(
                fileStore.put(new byte[] {2}, FileKind.GENERATED_IMAGE, "image/png").fileId(),
                fileStore.put(new byte[] {3}, FileKind.GENERATED_IMAGE, "image/png").fileId(),
                fileStore.put(new byte[] {4}, FileKind.GENERATED_IMAGE, "image/webp").fileId());
    }

    @Test
    void frameDurationsAddUpToTheTotalAndDifferByAtMostOneVideoFrame() {
        List<Double> durations = CompositionPipeline.frameDurations(7, 10.0, 30);

        assertThat(durations.stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(10.0, within(1e-9));
        double shortest = durations.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        double longest = durations.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        assertThat(longest - shortest).isLessThanOrEqualTo(1.0 / 30 + 1e-9);
        assertThat(durations.get(0)).isGreaterThanOrEqualTo(durations.get(6));
    }

    @Test
    void frameDurationsGiveEveryImageAtLeastOneVideoFrame() {
        assertThat(CompositionPipeline.frameDurations(3, 0.01, 30)).containsOnly(1.0 / 30);
    }

    @Test
    void planCyclesTransitionsAndCapsTheirLength() {
        CompositionSelection selection = new CompositionSelection(
                List.of(), true, List.of("fade", "wipeleft"), null, AudioPolicy.SILENCE_PAD, null);

        CompositionRenderPlan plan = pipeline.buildPlan(
                List.of("f0", "f1", "f2", "f3"),
                paths(4),
                null,
                selection,
                config(List.of("slideleft")));

        List<CompositionFramePlan> frames = plan.frames();
        assertThat(frames.get(0).transitionIn().isCut()).isTrue();
        assertThat(frames.subList(1, 4)).extracting(frame -> frame.transitionIn().transitionId())
                .containsExactly("fade", "wipeleft", "fade");
        assertThat(frames.get(1).transitionIn().durationSec()).isEqualTo(0.6);
        assertThat(frames.get(0).displaySec()).isEqualTo(3.0);
        assertThat(frames.get(0).clipSec()).isCloseTo(3.6, within(1e-9));
        assertThat(frames.get(3).clipSec()).isEqualTo(3.0);
        assertThat(plan.totalDurationSec()).isCloseTo(12.0, within(1e-9));
        assertThat(plan.width()).isEqualTo(640);
    }

    @Test
    void planFallsBackToTaskTransitionsAndHonoursCuts() {
        CompositionSelection selection = new CompositionSelection(
                List.of(), false, List.of(), null, AudioPolicy.LOOP, 2.0);

        CompositionRenderPlan plan = pipeline.buildPlan(
                List.of("f0", "f1", "f2"),
                paths(3),
                tempDir.resolve("audio.mp3"),
                selection,
                config(List.of("cut", "slideup")));

        assertThat(plan.frames().get(1).transitionIn().isCut()).isTrue();
        assertThat(plan.frames().get(2).transitionIn().transitionId()).isEqualTo("slideup");
        assertThat(plan.frames().get(2).transitionIn().durationSec()).isLessThanOrEqualTo(
                plan.frames().get(2).displaySec() / 2.0);
        assertThat(plan.totalDurationSec()).isCloseTo(2.0, within(1e-9));
        assertThat(plan.audioPolicy()).isEqualTo(AudioPolicy.LOOP);
    }

    @Test
    void composeRendersFramesInSelectionOrderAfterTheOriginal() throws Exception {
        rendererWritesVideo();
        TaskRecord task = taskWithSelection(new CompositionSelection(
                List.of(imageIds.get(2), imageIds.get(0)), true, List.of(), null, null, null));

        StoredFile video = pipeline.compose(task, CompositionProgressListener.NONE, () -> false);

        ArgumentCaptor<CompositionRenderPlan> planCaptor = ArgumentCaptor.forClass(CompositionRenderPlan.class);
        verify(compositionRenderer).renderComposition(planCaptor.capture(), any(), any());
        assertThat(planCaptor.getValue().frames()).extracting(CompositionFramePlan::fileId)
                .containsExactly(originalId, imageIds.get(2), imageIds.get(0));
        assertThat(planCaptor.getValue().frames().get(2).imagePath().toString()).endsWith(".png");
        assertThat(video.kind()).isEqualTo(FileKind.VIDEO);
        assertThat(video.contentType()).isEqualTo("video/mp4");
        assertThat(fileStore.read(video.fileId())).containsExactly(7, 7, 7);
    }

    @Test
    void emptyAutoSelectionUsesEverySuccessfulImage() throws Exception {
        rendererWritesVideo();
        TaskRecord task = taskWithSelection(new CompositionSelection(
                List.of(), false, List.of(), null, null, null));

        pipeline.compose(task, CompositionProgressListener.NONE, () -> false);

        ArgumentCaptor<CompositionRenderPlan> planCaptor = ArgumentCaptor.forClass(CompositionRenderPlan.class);
        verify(compositionRenderer).renderComposition(planCaptor.capture(), any(), any());
        assertThat(planCaptor.getValue().frames()).extracting(CompositionFramePlan::fileId)
                .containsExactlyElementsOf(imageIds);
    }

    @Test
    void rendererFailureBecomesEncodeError() throws Exception {
        doThrow(new IOException("ffmpeg exploded"))
                .when(compositionRenderer).renderComposition(any(), any(), any());
        TaskRecord task = taskWithSelection(new CompositionSelection(
                List.of(imageIds.get(0)), true, List.of(), null, null, null));

        assertThatThrownBy(() -> pipeline.compose(task, CompositionProgressListener.NONE, () -> false))
                .isInstanceOfSatisfying(CompositionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CompositionFailureKind.ENCODE_ERROR));
        assertThat(fileStore.list()).noneMatch(file -> file.kind() == FileKind.VIDEO);
    }

    @Test
    void emptyRendererOutputIsAnEncodeError() {
        TaskRecord task = taskWithSelection(new CompositionSelection(
                List.of(imageIds.get(0)), false, List.of(), null, null, null));

        assertThatThrownBy(() -> pipeline.compose(task, CompositionProgressListener.NONE, () -> false))
                .isInstanceOf(CompositionException.class)
                .hasMessageContaining("no output");
    }

    @Test
    void abandonedCompositionIsNotStored() throws Exception {
        rendererWritesVideo();
        TaskRecord task = taskWithSelection(new CompositionSelection(
                List.of(imageIds.get(0)), false, List.of(), null, null, null));

        assertThatThrownBy(() -> pipeline.compose(task, CompositionProgressListener.NONE, () -> true))
                .isInstanceOfSatisfying(CompositionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CompositionFailureKind.TIMEOUT));
        assertThat(fileStore.list()).noneMatch(file -> file.kind() == FileKind.VIDEO);
    }

    private void rendererWritesVideo() throws Exception {
        doAnswer(invocation -> {
            Path output = invocation.getArgument(1);
            Files.write(output, new byte[] {7, 7, 7});
            CompositionProgressListener listener = invocation.getArgument(2);
            listener.onProgress(1.0);
            return null;
        }).when(compositionRenderer).renderComposition(any(), any(), any());
    }

    private TaskRecord taskWithSelection(CompositionSelection selection) {
        List<TaskImage> images = List.of(
                TaskImage.generated(imageIds.get(0), "Cyberpunk", 0),
                TaskImage.generated(imageIds.get(1), "Fauvism", 1),
                TaskImage.generated(imageIds.get(2), "Ukiyo-e", 2));
        return TaskRecord.queued("task-1", config(List.of("fade")), originalId, null, images, Instant.now())
                .withSelection(selection);
    }

    private TaskConfig config(List<String> transitions) {
        return new TaskConfig(3, List.of("Cyberpunk", "Fauvism", "Ukiyo-e"), 640, 480, 30, transitions, 2, null);
    }

    private List<Path> paths(int count) {
        return IntStream.range(0, count)
                .mapToObj(index -> tempDir.resolve("frame-" + index + ".png"))
                .toList();
    }
}
