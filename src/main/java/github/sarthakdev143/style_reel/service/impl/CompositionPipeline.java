package github.sarthakdev143.style_reel.service.impl;

import github.sarthakdev143.style_reel.config.StyleReelProperties;
import github.sarthakdev143.style_reel.exception.CompositionException;
import github.sarthakdev143.style_reel.exception.StoredFileNotFoundException;
import github.sarthakdev143.style_reel.model.CompositionFailureKind;
import github.sarthakdev143.style_reel.model.CompositionSelection;
import github.sarthakdev143.style_reel.model.FileKind;
import github.sarthakdev143.style_reel.model.StoredFile;
import github.sarthakdev143.style_reel.model.TaskConfig;
import github.sarthakdev143.style_reel.model.TaskImage;
import github.sarthakdev143.style_reel.model.TaskRecord;
import github.sarthakdev143.style_reel.model.composition.CompositionFramePlan;
import github.sarthakdev143.style_reel.model.composition.CompositionRenderPlan;
import github.sarthakdev143.style_reel.model.composition.CompositionTransitionPlan;
import github.sarthakdev143.style_reel.service.CompositionProgressListener;
import github.sarthakdev143.style_reel.service.CompositionRenderer;
import github.sarthakdev143.style_reel.store.FileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BooleanSupplier;

/**
 * Turns a task's selection into a timed frame sequence, hands it to the renderer and stores the finished video.
 * <p>
 * The frame order is exactly the selection order, optionally preceded by the original upload. The visual length
 * always equals the requested total duration; audio never shortens it.
 */
@Component
public class CompositionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(CompositionPipeline.class);
    private static final String VIDEO_CONTENT_TYPE = "video/mp4";

    private final FileStore fileStore;
    private final CompositionRenderer compositionRenderer;
    private final double defaultSecondsPerImage;
    private final double transitionSeconds;

    public CompositionPipeline(
            FileStore fileStore,
            CompositionRenderer compositionRenderer,
            StyleReelProperties properties) {
        this.fileStore = fileStore;
        this.compositionRenderer = compositionRenderer;
        this.defaultSecondsPerImage = properties.composition().defaultSecondsPerImage();
        this.transitionSeconds = properties.composition().transitionSeconds();
    }

    public StoredFile compose(
            TaskRecord task,
            CompositionProgressListener progressListener,
            BooleanSupplier abandoned) throws CompositionException {
        CompositionSelection selection = task.selection();
        if (selection == null) {
            throw new CompositionException(CompositionFailureKind.INVALID_PARAMS, "Task " + task.taskId() + " has no selection.");
        }
        List<String> frameIds = frameSequence(task, selection);

        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("style-reel-composition-");
            List<Path> imagePaths = new ArrayList<>();
            for (int index = 0; index < frameIds.size(); index++) {
                imagePaths.add(materialize(frameIds.get(index), workDir, "frame-" + index));
            }
            Path audioPath = selection.audioFileId() == null
                    ? null
                    : materialize(selection.audioFileId(), workDir, "audio");

            CompositionRenderPlan plan = buildPlan(frameIds, imagePaths, audioPath, selection, task.config());
            Path outputPath = workDir.resolve("output.mp4");
            logger.info(
                    "Composing task {} frames={} duration={}s audio={} policy={}",
                    task.taskId(),
                    plan.frames().size(),
                    String.format(Locale.ROOT, "%.3f", plan.totalDurationSec()),
                    audioPath != null,
                    plan.audioPolicy());

            compositionRenderer.renderComposition(plan, outputPath, progressListener);

            if (abandoned.getAsBoolean()) {
                throw new CompositionException(
                        CompositionFailureKind.TIMEOUT,
                        "Composition finished after the task gave up on it; output discarded.");
            }
            if (Files.notExists(outputPath) || Files.size(outputPath) == 0) {
                throw new CompositionException(CompositionFailureKind.ENCODE_ERROR, "Renderer produced no output.");
            }
            return fileStore.put(Files.readAllBytes(outputPath), FileKind.VIDEO, VIDEO_CONTENT_TYPE);
        } catch (IllegalArgumentException e) {
            throw new CompositionException(CompositionFailureKind.INVALID_PARAMS, e.getMessage(), e);
        } catch (IOException e) {
            throw new CompositionException(CompositionFailureKind.ENCODE_ERROR, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompositionException(CompositionFailureKind.TIMEOUT, "Composition was interrupted.", e);
        } finally {
            deleteRecursively(workDir);
        }
    }

    List<String> frameSequence(TaskRecord task, CompositionSelection selection) throws CompositionException {
        List<String> frameIds = new ArrayList<>();
        if (selection.includeOriginal()) {
            frameIds.add(task.originalImageId());
        }
        if (selection.imageFileIds().isEmpty()) {
            for (TaskImage image : task.successfulImages()) {
                frameIds.add(image.fileId());
            }
        } else {
            frameIds.addAll(selection.imageFileIds());
        }
        if (frameIds.isEmpty()) {
            throw new CompositionException(CompositionFailureKind.INVALID_PARAMS, "Selection contains no frames.");
        }
        return frameIds;
    }

    CompositionRenderPlan buildPlan(
            List<String> frameIds,
            List<Path> imagePaths,
            Path audioPath,
            CompositionSelection selection,
            TaskConfig config) {
        int frameCount = frameIds.size();
        double totalSeconds = selection.totalDurationSeconds() != null
                ? selection.totalDurationSeconds()
                : frameCount * defaultSecondsPerImage;
        List<Double> displayDurations = frameDurations(frameCount, totalSeconds, config.fps());

        List<String> transitionCycle = selection.transitions().isEmpty() ? config.transitions() : selection.transitions();
        List<CompositionTransitionPlan> transitions = new ArrayList<>();
        transitions.add(CompositionTransitionPlan.cut());
        for (int index = 1; index < frameCount; index++) {
            String transitionId = transitionCycle.isEmpty()
                    ? CompositionTransitionPlan.CUT
                    : transitionCycle.get((index - 1) % transitionCycle.size());
            if (CompositionTransitionPlan.CUT.equals(transitionId)) {
                transitions.add(CompositionTransitionPlan.cut());
                continue;
            }
            double limit = Math.min(displayDurations.get(index - 1), displayDurations.get(index)) / 2.0;
            transitions.add(new CompositionTransitionPlan(transitionId, Math.min(transitionSeconds, limit)));
        }

        List<CompositionFramePlan> frames = new ArrayList<>();
        double visualSeconds = 0.0;
        for (int index = 0; index < frameCount; index++) {
            double display = displayDurations.get(index);
            double overlap = index + 1 < frameCount ? transitions.get(index + 1).durationSec() : 0.0;
            frames.add(new CompositionFramePlan(
                    frameIds.get(index),
                    imagePaths.get(index),
                    display,
                    display + overlap,
                    transitions.get(index)));
            visualSeconds += display;
        }

        return new CompositionRenderPlan(
                frames,
                audioPath,
                selection.audioPolicy(),
                config.width(),
                config.height(),
                config.fps(),
                visualSeconds);
    }

    /**
     * Splits {@code totalSeconds} into whole video frames across {@code frameCount} images. The first images
     * absorb the remainder, so the durations differ by at most one video frame and add up to the total.
     */
    static List<Double> frameDurations(int frameCount, double totalSeconds, int fps) {
        if (frameCount < 1) {
            throw new IllegalArgumentException("At least one frame is required.");
        }
        long totalVideoFrames = Math.max(frameCount, Math.round(totalSeconds * fps));
        long base = totalVideoFrames / frameCount;
        long remainder = totalVideoFrames % frameCount;

        List<Double> durations = new ArrayList<>(frameCount);
        for (int index = 0; index < frameCount; index++) {
            long videoFrames = base + (index < remainder ? 1 : 0);
            durations.add((double) videoFrames / fps);
        }
        return durations;
    }

    private Path materialize(String fileId, Path workDir, String baseName) throws IOException {
        StoredFile file = fileStore.find(fileId)
                .orElseThrow(() -> new StoredFileNotFoundException(fileId));
        Path target = workDir.resolve(baseName + extensionFor(file.contentType()));
        Files.write(target, fileStore.read(fileId));
        return target;
    }

    private String extensionFor(String contentType) {
        String normalized = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (normalized.contains("png")) {
            return ".png";
        }
        if (normalized.contains("webp")) {
            return ".webp";
        }
        if (normalized.contains("jpeg") || normalized.contains("jpg")) {
            return ".jpg";
        }
        if (normalized.contains("mpeg") || normalized.contains("mp3")) {
            return ".mp3";
        }
        if (normalized.contains("wav")) {
            return ".wav";
        }
        if (normalized.startsWith("audio/")) {
            return ".m4a";
        }
        return ".bin";
    }

    private void deleteRecursively(Path directory) {
        try {
            FileSystemUtils.deleteRecursively(directory);
        } catch (IOException e) {
            logger.warn("Could not remove composition work directory {}", directory, e);
        }
    }
}
