package github.sarthakdev143.style_reel.service.impl;

import github.sarthakdev143.style_reel.config.StyleReelProperties;
import github.sarthakdev143.style_reel.dto.CreateTaskRequest;
import github.sarthakdev143.style_reel.dto.RegenerateRequest;
import github.sarthakdev143.style_reel.dto.SelectionRequest;
import github.sarthakdev143.style_reel.exception.CompositionException;
import github.sarthakdev143.style_reel.exception.InvalidTaskTransitionException;
import github.sarthakdev143.style_reel.exception.StaleTaskVersionException;
import github.sarthakdev143.style_reel.exception.StoreUnavailableException;
import github.sarthakdev143.style_reel.exception.StoredFileNotFoundException;
import github.sarthakdev143.style_reel.exception.TaskNotFoundException;
import github.sarthakdev143.style_reel.model.CompositionSelection;
import github.sarthakdev143.style_reel.model.GenerationOutcome;
import github.sarthakdev143.style_reel.model.StoredFile;
import github.sarthakdev143.style_reel.model.TaskConfig;
import github.sarthakdev143.style_reel.model.TaskDeletionReport;
import github.sarthakdev143.style_reel.model.TaskError;
import github.sarthakdev143.style_reel.model.TaskErrorKind;
import github.sarthakdev143.style_reel.model.TaskImage;
import github.sarthakdev143.style_reel.model.TaskRecord;
import github.sarthakdev143.style_reel.model.TaskStatus;
import github.sarthakdev143.style_reel.service.GenerationListener;
import github.sarthakdev143.style_reel.service.TaskService;
import github.sarthakdev143.style_reel.store.FileStore;
import github.sarthakdev143.style_reel.store.TaskRecordStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

@Service
public class DefaultTaskService implements TaskService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultTaskService.class);
    static final int GENERATION_PROGRESS_WEIGHT = 40;
    static final int COMPOSITION_PROGRESS_CEILING = 99;
    private static final int MAX_UPDATE_ATTEMPTS = 25;
    private static final Set<TaskStatus> RUNNING_STATUSES =
            EnumSet.of(TaskStatus.QUEUED, TaskStatus.GENERATING, TaskStatus.COMPOSING);

    private final TaskRecordStore taskRecordStore;
    private final FileStore fileStore;
    private final GenerationScheduler generationScheduler;
    private final CompositionPipeline compositionPipeline;
    private final ReferenceProtectionService referenceProtectionService;
    private final TaskRequestValidator taskRequestValidator;
    private final TaskExecutor taskExecutor;
    private final Executor compositionExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Duration generationTimeout;
    private final Duration compositionTimeout;
    private final Duration selectionTimeout;
    private final Set<String> activeGenerations = ConcurrentHashMap.newKeySet();
    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();
    private final Counter tasksCreatedCounter;

    public DefaultTaskService(
            TaskRecordStore taskRecordStore,
            FileStore fileStore,
            GenerationScheduler generationScheduler,
            CompositionPipeline compositionPipeline,
            ReferenceProtectionService referenceProtectionService,
            TaskRequestValidator taskRequestValidator,
            @Qualifier("taskExecutor") TaskExecutor taskExecutor,
            @Qualifier("compositionExecutor") Executor compositionExecutor,
            StyleReelProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.taskRecordStore = taskRecordStore;
        this.fileStore = fileStore;
        this.generationScheduler = generationScheduler;
        this.compositionPipeline = compositionPipeline;
        this.referenceProtectionService = referenceProtectionService;
        this.taskRequestValidator = taskRequestValidator;
        this.taskExecutor = taskExecutor;
        this.compositionExecutor = compositionExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.generationTimeout = properties.generation().phaseTimeout();
        this.compositionTimeout = properties.composition().phaseTimeout();
        this.selectionTimeout = properties.maintenance().selectionTimeout();
        this.tasksCreatedCounter = meterRegistry.counter("style_reel.tasks.created");
    }

    @Override
    public TaskRecord createTask(CreateTaskRequest request) {
        TaskConfig config = taskRequestValidator.normalizeCreate(request);
        TaskRecord task = taskRecordStore.create(TaskRecord.queued(
                UUID.randomUUID().toString(),
                config,
                request.originalImageId().trim(),
                null,
                List.of(),
                clock.instant()));
        tasksCreatedCounter.increment();

        logger.info(
                "Accepted task {} styles={} concurrency={} autoCompose={}",
                task.taskId(),
                config.styles(),
                config.concurrencyLimit(),
                config.autoSelection() != null);
        dispatchGeneration(task.taskId());
        return task;
    }

    @Override
    public Optional<TaskRecord> getTask(String taskId) {
        return taskRecordStore.get(taskId);
    }

    @Override
    public List<TaskRecord> listTasks(TaskStatus status) {
        return taskRecordStore.list(record -> status == null || record.status() == status);
    }

    @Override
    public TaskRecord submitSelection(String taskId, SelectionRequest request) {
        TaskRecord task = requireTask(taskId);
        if (task.status() != TaskStatus.AWAITING_SELECTION) {
            throw new InvalidTaskTransitionException(taskId, task.status(), TaskStatus.COMPOSING);
        }
        CompositionSelection selection = taskRequestValidator.normalizeSelection(task, request);
        TaskRecord composing = startComposition(taskId, selection);
        logger.info("Task {} selection accepted frames={}", taskId, selection.imageFileIds().size());
        return composing;
    }

    @Override
    public TaskRecord cancelTask(String taskId) {
        cancelRequests.add(taskId);
        try {
            TaskRecord cancelled = update(taskId, current -> current.transitionTo(
                    TaskStatus.CANCELLED,
                    "Task cancelled.",
                    clock.instant()));
            if (!activeGenerations.contains(taskId)) {
                cancelRequests.remove(taskId);
            }
            logger.info("Task {} cancelled", taskId);
            return cancelled;
        } catch (RuntimeException e) {
            cancelRequests.remove(taskId);
            throw e;
        }
    }

    @Override
    public TaskRecord regenerate(String sourceTaskId, RegenerateRequest request) {
        TaskRecord source = requireTask(sourceTaskId);
        if (source.status() != TaskStatus.AWAITING_SELECTION && source.status() != TaskStatus.COMPLETED) {
            throw new IllegalStateException(
                    "Task " + sourceTaskId + " is " + source.status() + "; only tasks with finished images can be recomposed.");
        }
        TaskConfig config = taskRequestValidator.normalizeRegenerate(source, request);
        TaskRecord task = taskRecordStore.create(TaskRecord.queued(
                UUID.randomUUID().toString(),
                config,
                source.originalImageId(),
                sourceTaskId,
                source.successfulImages(),
                clock.instant()));
        tasksCreatedCounter.increment();

        logger.info("Accepted task {} recomposing {} images of task {}", task.taskId(), task.images().size(), sourceTaskId);
        dispatchGeneration(task.taskId());
        return task;
    }

    @Override
    public TaskDeletionReport deleteTask(String taskId) {
        TaskRecord task = requireTask(taskId);
        if (RUNNING_STATUSES.contains(task.status())) {
            throw new IllegalStateException("Task " + taskId + " is " + task.status() + " and cannot be deleted yet.");
        }
        return referenceProtectionService.deleteTask(task);
    }

    @Override
    public int recoverInterruptedTasks() {
        int recovered = 0;
        for (TaskRecord task : taskRecordStore.list(record -> RUNNING_STATUSES.contains(record.status()))) {
            if (task.status() == TaskStatus.QUEUED) {
                logger.info("Re-dispatching queued task {} after restart", task.taskId());
                try {
                    dispatchGeneration(task.taskId());
                } catch (TaskRejectedException e) {
                    logger.warn("Could not re-dispatch task {}: {}", task.taskId(), e.getMessage());
                }
            } else {
                failTask(task.taskId(), TaskErrorKind.INTERRUPTED, "Task was " + task.status() + " when the service stopped.");
            }
            recovered++;
        }
        return recovered;
    }

    @Override
    public int expireStaleSelections() {
        Instant cutoff = clock.instant().minus(selectionTimeout);
        int expired = 0;
        for (TaskRecord task : taskRecordStore.list(record -> record.status() == TaskStatus.AWAITING_SELECTION
                && record.updatedAt().isBefore(cutoff))) {
            if (failTask(task.taskId(), TaskErrorKind.TIMEOUT, "No selection was submitted in time.")) {
                expired++;
            }
        }
        return expired;
    }

    private void dispatchGeneration(String taskId) {
        submit(taskId, () -> runGeneration(taskId));
    }

    // A rejected worker fails the persisted task before the rejection reaches the caller.
    private void submit(String taskId, Runnable worker) {
        try {
            taskExecutor.execute(worker);
        } catch (TaskRejectedException e) {
            failTask(taskId, TaskErrorKind.CAPACITY_EXHAUSTED, "No worker was available to run the task.");
            throw e;
        }
    }

    private void runGeneration(String taskId) {
        activeGenerations.add(taskId);
        try {
            TaskRecord task = update(taskId, current -> current.status() == TaskStatus.QUEUED
                    ? current.transitionTo(
                            TaskStatus.GENERATING,
                            "Generating " + current.config().styles().size() + " styles.",
                            clock.instant())
                    : current);
            if (task.status() != TaskStatus.GENERATING) {
                logger.info("Task {} left the queue as {}; skipping generation", taskId, task.status());
                return;
            }

            StoredFile original = fileStore.find(task.originalImageId())
                    .orElseThrow(() -> new StoredFileNotFoundException(task.originalImageId()));
            GenerationOutcome outcome = task.config().styles().isEmpty()
                    ? new GenerationOutcome(List.of(), false)
                    : generationScheduler.run(
                            new GenerationScheduler.GenerationRequest(
                                    taskId,
                                    fileStore.read(original.fileId()),
                                    original.contentType(),
                                    task.config().styles(),
                                    task.config().concurrencyLimit(),
                                    generationTimeout),
                            new ProgressUpdater(taskId));

            TaskRecord finished = finishGeneration(taskId, outcome);
            if (finished.status() == TaskStatus.AWAITING_SELECTION && finished.config().autoSelection() != null) {
                startComposition(taskId, finished.config().autoSelection());
            }
        } catch (StoredFileNotFoundException e) {
            failTask(taskId, TaskErrorKind.NOT_FOUND, e.getMessage());
        } catch (TaskNotFoundException e) {
            logger.warn("Task {} disappeared during generation", taskId);
        } catch (InvalidTaskTransitionException e) {
            logger.info("Task {} changed state before composition could start: {}", taskId, e.getMessage());
        } catch (TaskRejectedException e) {
            logger.warn("Composition of task {} could not be scheduled: {}", taskId, e.getMessage());
        } catch (StoreUnavailableException e) {
            logger.error("Store unavailable while generating task {}", taskId, e);
            failTask(taskId, TaskErrorKind.STORE_UNAVAILABLE, "Storage became unavailable during generation.");
        } catch (RuntimeException e) {
            logger.error("Generation of task {} failed", taskId, e);
            failTask(taskId, TaskErrorKind.GENERATION_EXHAUSTED, "Generation failed. Check server logs.");
        } finally {
            activeGenerations.remove(taskId);
            cancelRequests.remove(taskId);
        }
    }

    private TaskRecord finishGeneration(String taskId, GenerationOutcome outcome) {
        TaskRecord finished = update(taskId, current -> {
            TaskRecord withImages = current.withImages(outcome.images());
            if (current.status() != TaskStatus.GENERATING) {
                return withImages;
            }
            Instant now = clock.instant();
            if (withImages.successfulImages().isEmpty()) {
                TaskErrorKind kind = outcome.timedOut() ? TaskErrorKind.TIMEOUT : TaskErrorKind.GENERATION_EXHAUSTED;
                String message = outcome.timedOut()
                        ? "Generation timed out before any style succeeded."
                        : "All " + outcome.images().size() + " styles failed.";
                return withImages.transitionTo(TaskStatus.FAILED, message, now).withError(new TaskError(kind, message));
            }

            TaskRecord awaiting = withImages
                    .transitionTo(TaskStatus.AWAITING_SELECTION, "Images ready for selection.", now)
                    .withProgress(GENERATION_PROGRESS_WEIGHT);
            if (outcome.failureCount() > 0) {
                awaiting = awaiting.withWarning(
                        outcome.failureCount() + " of " + outcome.images().size() + " styles failed.");
            }
            return awaiting;
        });

        if (finished.status() == TaskStatus.FAILED && finished.error() != null) {
            meterRegistry.counter("style_reel.tasks.failed", "kind", finished.error().kind().name()).increment();
            logger.error("Task {} failed after generation: {}", taskId, finished.error().message());
        } else {
            logger.info(
                    "Task {} finished generation status={} succeeded={} failed={}",
                    taskId,
                    finished.status(),
                    outcome.successCount(),
                    outcome.failureCount());
        }
        return finished;
    }

    private TaskRecord startComposition(String taskId, CompositionSelection selection) {
        TaskRecord composing = update(taskId, current -> current
                .withSelection(selection)
                .transitionTo(TaskStatus.COMPOSING, "Composing video.", clock.instant()));
        submit(taskId, () -> runComposition(taskId));
        return composing;
    }

    private void runComposition(String taskId) {
        AtomicBoolean abandoned = new AtomicBoolean();
        try {
            TaskRecord task = requireTask(taskId);
            CompletableFuture<StoredFile> render = CompletableFuture.supplyAsync(() -> {
                try {
                    return compositionPipeline.compose(
                            task,
                            fraction -> recordCompositionProgress(taskId, fraction),
                            abandoned::get);
                } catch (CompositionException e) {
                    throw new CompletionException(e);
                }
            }, compositionExecutor);

            StoredFile video = render.get(compositionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            completeComposition(taskId, video);
        } catch (TimeoutException e) {
            abandoned.set(true);
            failTask(taskId, TaskErrorKind.TIMEOUT, "Composition exceeded " + compositionTimeout + ".");
        } catch (ExecutionException e) {
            failComposition(taskId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandoned.set(true);
            failTask(taskId, TaskErrorKind.INTERRUPTED, "Composition was interrupted.");
        } catch (TaskNotFoundException e) {
            logger.warn("Task {} disappeared before composition", taskId);
        } catch (RuntimeException e) {
            failComposition(taskId, e);
        }
    }

    private void completeComposition(String taskId, StoredFile video) {
        TaskRecord completed = update(taskId, current -> current.status() != TaskStatus.COMPOSING
                ? current
                : current.withVideo(video.fileId())
                        .withProgress(100)
                        .transitionTo(TaskStatus.COMPLETED, completionMessage(current), clock.instant()));
        if (completed.status() != TaskStatus.COMPLETED || !video.fileId().equals(completed.videoId())) {
            logger.warn("Task {} is {}; discarding composed video {}", taskId, completed.status(), video.fileId());
            fileStore.delete(video.fileId());
            return;
        }
        logger.info("Completed task {} video={}", taskId, video.fileId());
    }

    private void failComposition(String taskId, Throwable cause) {
        if (cause instanceof CompositionException compositionError) {
            TaskErrorKind kind = switch (compositionError.getKind()) {
                case TIMEOUT -> TaskErrorKind.TIMEOUT;
                case ENCODE_ERROR, INVALID_PARAMS -> TaskErrorKind.ENCODE_ERROR;
            };
            logger.error("Composition of task {} failed ({})", taskId, compositionError.getKind(), compositionError);
            failTask(taskId, kind, "Video composition failed: " + compositionError.getMessage());
        } else if (cause instanceof StoredFileNotFoundException notFound) {
            failTask(taskId, TaskErrorKind.NOT_FOUND, notFound.getMessage());
        } else if (cause instanceof StoreUnavailableException) {
            logger.error("Store unavailable while composing task {}", taskId, cause);
            failTask(taskId, TaskErrorKind.STORE_UNAVAILABLE, "Storage became unavailable during composition.");
        } else {
            logger.error("Composition of task {} failed", taskId, cause);
            failTask(taskId, TaskErrorKind.ENCODE_ERROR, "Video composition failed. Check server logs.");
        }
    }

    private void recordCompositionProgress(String taskId, double fraction) {
        double bounded = Math.max(0.0, Math.min(1.0, fraction));
        int progress = GENERATION_PROGRESS_WEIGHT
                + (int) Math.floor(bounded * (COMPOSITION_PROGRESS_CEILING - GENERATION_PROGRESS_WEIGHT));
        try {
            update(taskId, current -> current.status() == TaskStatus.COMPOSING ? current.withProgress(progress) : current);
        } catch (RuntimeException e) {
            logger.warn("Could not record composition progress for task {}", taskId, e);
        }
    }

    private boolean failTask(String taskId, TaskErrorKind kind, String message) {
        try {
            AtomicBoolean transitioned = new AtomicBoolean();
            update(taskId, current -> {
                if (current.status().isTerminal()) {
                    transitioned.set(false);
                    return current;
                }
                transitioned.set(true);
                return current.transitionTo(TaskStatus.FAILED, message, clock.instant())
                        .withError(new TaskError(kind, message));
            });
            if (transitioned.get()) {
                meterRegistry.counter("style_reel.tasks.failed", "kind", kind.name()).increment();
                logger.error("Task {} failed with {}: {}", taskId, kind, message);
            }
            return transitioned.get();
        } catch (TaskNotFoundException e) {
            logger.warn("Task {} disappeared before it could be marked failed", taskId);
        } catch (StoreUnavailableException e) {
            logger.error("Could not persist failure of task {}; it keeps its last stored state", taskId, e);
        }
        return false;
    }

    /**
     * Applies {@code mutation} to the latest stored record and writes it back under compare-and-set, retrying
     * on version conflicts. A mutation that returns its input unchanged skips the write.
     */
    private TaskRecord update(String taskId, UnaryOperator<TaskRecord> mutation) {
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            TaskRecord current = requireTask(taskId);
            TaskRecord next = mutation.apply(current);
            if (next == current) {
                return current;
            }
            try {
                return taskRecordStore.compareAndSet(next, current.version());
            } catch (StaleTaskVersionException e) {
                logger.debug("Retrying update of task {} after a concurrent write (attempt {})", taskId, attempt);
            }
        }
        throw new IllegalStateException("Task " + taskId + " kept changing; update abandoned after "
                + MAX_UPDATE_ATTEMPTS + " attempts.");
    }

    private TaskRecord requireTask(String taskId) {
        return taskRecordStore.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private String completionMessage(TaskRecord task) {
        return task.warningMessage() == null
                ? "Video composed successfully."
                : "Video composed with warnings.";
    }

    static int generationProgress(int resolvedCount, int totalCount) {
        if (totalCount <= 0) {
            return GENERATION_PROGRESS_WEIGHT;
        }
        return Math.round((float) resolvedCount / totalCount * GENERATION_PROGRESS_WEIGHT);
    }

    private final class ProgressUpdater implements GenerationListener {

        private final String taskId;

        private ProgressUpdater(String taskId) {
            this.taskId = taskId;
        }

        // Successful images are attached as they land, so their files stay referenced for the rest of the phase.
        @Override
        public void onStyleResolved(TaskImage image, int resolvedCount, int totalCount) {
            int progress = generationProgress(resolvedCount, totalCount);
            update(taskId, current -> {
                TaskRecord next = image.succeeded() ? current.withImages(List.of(image)) : current;
                return current.status() == TaskStatus.GENERATING ? next.withProgress(progress) : next;
            });
        }

        @Override
        public boolean abortRequested() {
            return cancelRequests.contains(taskId);
        }
    }
}
