package github.sarthakdev143.style_reel.service.impl;

import github.sarthakdev143.style_reel.config.StyleReelProperties;
import github.sarthakdev143.style_reel.dto.CreateTaskRequest;
import github.sarthakdev143.style_reel.dto.RegenerateRequest;
import github.sarthakdev143.style_reel.dto.SelectionRequest;
import github.sarthakdev143.style_reel.exception.StoredFileNotFoundException;
import github.sarthakdev143.style_reel.model.AudioPolicy;
import github.sarthakdev143.style_reel.model.CompositionSelection;
import github.sarthakdev143.style_reel.model.FileKind;
import github.sarthakdev143.style_reel.model.StoredFile;
import github.sarthakdev143.style_reel.model.TaskConfig;
import github.sarthakdev143.style_reel.model.TaskImage;
import github.sarthakdev143.style_reel.model.TaskRecord;
import github.sarthakdev143.style_reel.store.FileStore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class TaskRequestValidator {

    private static final int MIN_DIMENSION = 64;
    private static final int MAX_DIMENSION = 3840;
    private static final int MIN_FPS = 1;
    private static final int MAX_FPS = 60;
    private static final int MAX_TRANSITIONS = 20;
    private static final int MAX_SELECTED_IMAGES = 100;
    private static final double MIN_SECONDS_PER_FRAME = 0.5;
    private static final double MAX_TOTAL_DURATION_SECONDS = 60.0 * 60.0;
    private static final Pattern TRANSITION_ID_PATTERN = Pattern.compile("^[a-z0-9_]{1,32}$");

    private final FileStore fileStore;
    private final StylePicker stylePicker;
    private final StyleReelProperties properties;

    public TaskRequestValidator(FileStore fileStore, StylePicker stylePicker, StyleReelProperties properties) {
        this.fileStore = fileStore;
        this.stylePicker = stylePicker;
        this.properties = properties;
    }

    public TaskConfig normalizeCreate(CreateTaskRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required.");
        }
        requireUpload("originalImageId", request.originalImageId(), "image/");

        int styleCount = request.styleCount() != null ? request.styleCount() : request.styles().size();
        int maxStyleCount = properties.generation().maxStyleCount();
        if (styleCount < 1 || styleCount > maxStyleCount) {
            throw new IllegalArgumentException("styleCount must be between 1 and " + maxStyleCount + ".");
        }
        List<String> styles = stylePicker.pick(request.styles(), styleCount);

        int concurrencyLimit = request.concurrencyLimit() != null
                ? request.concurrencyLimit()
                : properties.generation().defaultConcurrency();
        int maxConcurrency = properties.generation().maxConcurrency();
        if (concurrencyLimit < 1 || concurrencyLimit > maxConcurrency) {
            throw new IllegalArgumentException("concurrencyLimit must be between 1 and " + maxConcurrency + ".");
        }

        int width = dimension("width", request.width(), properties.composition().defaultWidth());
        int height = dimension("height", request.height(), properties.composition().defaultHeight());
        int fps = fps(request.fps());
        List<String> transitions = normalizeTransitions(request.transitions());

        CompositionSelection autoSelection = null;
        if (Boolean.TRUE.equals(request.autoCompose())) {
            boolean includeOriginal = request.includeOriginal() == null || request.includeOriginal();
            autoSelection = new CompositionSelection(
                    List.of(),
                    includeOriginal,
                    transitions,
                    normalizeAudio(request.audioFileId()),
                    AudioPolicy.fromInput(request.audioPolicy()),
                    normalizeTotalDuration(request.totalDurationSeconds(), styleCount + (includeOriginal ? 1 : 0)));
        } else if (request.audioFileId() != null && !request.audioFileId().isBlank()) {
            throw new IllegalArgumentException("audioFileId is only accepted together with autoCompose=true.");
        }

        return new TaskConfig(styleCount, styles, width, height, fps, transitions, concurrencyLimit, autoSelection);
    }

    public CompositionSelection normalizeSelection(TaskRecord task, SelectionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required.");
        }
        List<String> imageFileIds = requireSelectableImages(task, request.imageFileIds());
        boolean includeOriginal = request.includeOriginal() == null || request.includeOriginal();
        List<String> transitions = request.transitions().isEmpty()
                ? task.config().transitions()
                : normalizeTransitions(request.transitions());

        return new CompositionSelection(
                imageFileIds,
                includeOriginal,
                transitions,
                normalizeAudio(request.audioFileId()),
                AudioPolicy.fromInput(request.audioPolicy()),
                normalizeTotalDuration(request.totalDurationSeconds(), imageFileIds.size() + (includeOriginal ? 1 : 0)));
    }

    public TaskConfig normalizeRegenerate(TaskRecord source, RegenerateRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required.");
        }
        if (source.successfulImages().isEmpty()) {
            throw new IllegalArgumentException("Task " + source.taskId() + " has no generated images to reuse.");
        }

        List<String> imageFileIds = request.imageFileIds().isEmpty()
                ? List.of()
                : requireSelectableImages(source, request.imageFileIds());
        int frameCount = imageFileIds.isEmpty() ? source.successfulImages().size() : imageFileIds.size();

        CompositionSelection previous = source.selection() != null ? source.selection() : source.config().autoSelection();
        boolean includeOriginal = request.includeOriginal() != null
                ? request.includeOriginal()
                : previous == null || previous.includeOriginal();
        List<String> transitions = request.transitions().isEmpty()
                ? source.config().transitions()
                : normalizeTransitions(request.transitions());

        CompositionSelection selection = new CompositionSelection(
                imageFileIds,
                includeOriginal,
                transitions,
                normalizeAudio(request.audioFileId()),
                AudioPolicy.fromInput(request.audioPolicy()),
                normalizeTotalDuration(request.totalDurationSeconds(), frameCount + (includeOriginal ? 1 : 0)));

        TaskConfig sourceConfig = source.config();
        return new TaskConfig(
                0,
                List.of(),
                request.width() != null ? dimension("width", request.width(), sourceConfig.width()) : sourceConfig.width(),
                request.height() != null ? dimension("height", request.height(), sourceConfig.height()) : sourceConfig.height(),
                request.fps() != null ? fps(request.fps()) : sourceConfig.fps(),
                transitions,
                sourceConfig.concurrencyLimit(),
                selection);
    }

    private List<String> requireSelectableImages(TaskRecord task, List<String> imageFileIdsInput) {
        if (imageFileIdsInput == null || imageFileIdsInput.isEmpty()) {
            throw new IllegalArgumentException("imageFileIds must contain at least one image.");
        }
        if (imageFileIdsInput.size() > MAX_SELECTED_IMAGES) {
            throw new IllegalArgumentException("imageFileIds supports at most " + MAX_SELECTED_IMAGES + " images.");
        }

        Set<String> selectable = new HashSet<>();
        for (TaskImage image : task.successfulImages()) {
            selectable.add(image.fileId());
        }

        List<String> normalized = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int index = 0; index < imageFileIdsInput.size(); index++) {
            String fileId = imageFileIdsInput.get(index);
            if (fileId == null || fileId.isBlank()) {
                throw new IllegalArgumentException("imageFileIds[" + index + "] must not be blank.");
            }
            String trimmed = fileId.trim();
            if (!selectable.contains(trimmed)) {
                throw new IllegalArgumentException(
                        "imageFileIds[" + index + "] is not a generated image of task " + task.taskId() + ".");
            }
            if (!seen.add(trimmed)) {
                throw new IllegalArgumentException("imageFileIds[" + index + "] repeats an image already selected.");
            }
            normalized.add(trimmed);
        }
        return normalized;
    }

    private List<String> normalizeTransitions(List<String> transitionsInput) {
        if (transitionsInput == null || transitionsInput.isEmpty()) {
            return properties.composition().transitions();
        }
        if (transitionsInput.size() > MAX_TRANSITIONS) {
            throw new IllegalArgumentException("transitions supports at most " + MAX_TRANSITIONS + " entries.");
        }

        List<String> normalized = new ArrayList<>();
        for (String transition : transitionsInput) {
            String candidate = transition == null ? "" : transition.trim().toLowerCase(Locale.ROOT);
            if (!TRANSITION_ID_PATTERN.matcher(candidate).matches()) {
                throw new IllegalArgumentException("transition '" + transition + "' must match ^[a-z0-9_]{1,32}$.");
            }
            normalized.add(candidate);
        }
        return normalized;
    }

    private String normalizeAudio(String audioFileId) {
        if (audioFileId == null || audioFileId.isBlank()) {
            return null;
        }
        return requireUpload("audioFileId", audioFileId.trim(), "audio/").fileId();
    }

    private Double normalizeTotalDuration(Double totalDurationSeconds, int frameCount) {
        if (totalDurationSeconds == null) {
            return null;
        }
        if (!Double.isFinite(totalDurationSeconds)) {
            throw new IllegalArgumentException("totalDurationSeconds must be a finite number.");
        }
        double minimum = MIN_SECONDS_PER_FRAME * Math.max(frameCount, 1);
        if (totalDurationSeconds < minimum || totalDurationSeconds > MAX_TOTAL_DURATION_SECONDS) {
            throw new IllegalArgumentException(
                    "totalDurationSeconds must be between " + minimum + " and " + MAX_TOTAL_DURATION_SECONDS + " seconds.");
        }
        return totalDurationSeconds;
    }

    private StoredFile requireUpload(String fieldName, String fileId, String expectedTypePrefix) {
        if (fileId == null || fileId.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required.");
        }
        StoredFile file = fileStore.find(fileId.trim()).orElseThrow(() -> new StoredFileNotFoundException(fileId));
        String contentType = file.contentType() == null ? "" : file.contentType().toLowerCase(Locale.ROOT);
        if (file.kind() != FileKind.UPLOAD || !contentType.startsWith(expectedTypePrefix)) {
            throw new IllegalArgumentException(fieldName + " must reference an uploaded " + expectedTypePrefix + "* file.");
        }
        return file;
    }

    private int dimension(String fieldName, Integer value, int defaultValue) {
        int resolved = value == null ? defaultValue : value;
        if (resolved < MIN_DIMENSION || resolved > MAX_DIMENSION || resolved % 2 != 0) {
            throw new IllegalArgumentException(
                    fieldName + " must be an even number between " + MIN_DIMENSION + " and " + MAX_DIMENSION + ".");
        }
        return resolved;
    }

    private int fps(Integer value) {
        int resolved = value == null ? properties.composition().defaultFps() : value;
        if (resolved < MIN_FPS || resolved > MAX_FPS) {
            throw new IllegalArgumentException("fps must be between " + MIN_FPS + " and " + MAX_FPS + ".");
        }
        return resolved;
    }
}
