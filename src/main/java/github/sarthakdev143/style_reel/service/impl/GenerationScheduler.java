package github.sarthakdev143.style_reel.service.impl;

import github.sarthakdev143.style_reel.config.StyleReelProperties;
import github.sarthakdev143.style_reel.exception.StyleGenerationException;
import github.sarthakdev143.style_reel.model.FileKind;
import github.sarthakdev143.style_reel.model.GeneratedImage;
import github.sarthakdev143.style_reel.model.GenerationFailureKind;
import github.sarthakdev143.style_reel.model.GenerationOutcome;
import github.sarthakdev143.style_reel.model.StoredFile;
import github.sarthakdev143.style_reel.model.TaskImage;
import github.sarthakdev143.style_reel.service.GenerationListener;
import github.sarthakdev143.style_reel.service.StyleImageGenerator;
import github.sarthakdev143.style_reel.store.FileStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Fans one generation call per style out to the image generator with at most {@code concurrencyLimit} calls in
 * flight, then joins once every style has resolved or the phase budget has elapsed.
 * <p>
 * Results land in a slot per request index, so the returned images keep request order whatever the completion
 * order was. A slot is written once; results that arrive after the slot was closed (timeout or abort) are
 * discarded and their stored bytes removed.
 */
@Component
public class GenerationScheduler {

    private static final Logger logger = LoggerFactory.getLogger(GenerationScheduler.class);
    private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(250);
    private static final int MAX_ATTEMPTS = 2;

    private final StyleImageGenerator styleImageGenerator;
    private final FileStore fileStore;
    private final Executor generationExecutor;
    private final MeterRegistry meterRegistry;
    private final Duration retryBackoff;
    private final String promptTemplate;

    public GenerationScheduler(
            StyleImageGenerator styleImageGenerator,
            FileStore fileStore,
            @Qualifier("generationExecutor") Executor generationExecutor,
            StyleReelProperties properties,
            MeterRegistry meterRegistry) {
        this.styleImageGenerator = styleImageGenerator;
        this.fileStore = fileStore;
        this.generationExecutor = generationExecutor;
        this.meterRegistry = meterRegistry;
        this.retryBackoff = properties.generation().retryBackoff();
        this.promptTemplate = properties.generation().promptTemplate();
    }

    public GenerationOutcome run(GenerationRequest request, GenerationListener listener) {
        int total = request.styles().size();
        if (total == 0) {
            return new GenerationOutcome(List.of(), false);
        }

        FanOut fanOut = new FanOut(request, listener);
        long deadline = System.nanoTime() + request.phaseTimeout().toNanos();
        boolean timedOut = false;

        try {
            int dispatched = 0;
            while (dispatched < total) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    timedOut = true;
                    break;
                }
                if (listener.abortRequested()) {
                    break;
                }
                if (!fanOut.permits.tryAcquire(Math.min(remaining, WAIT_SLICE_NANOS), TimeUnit.NANOSECONDS)) {
                    continue;
                }
                dispatch(fanOut, dispatched);
                dispatched++;
            }

            while (!timedOut && fanOut.pending.getCount() > 0 && !listener.abortRequested()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    timedOut = true;
                    break;
                }
                fanOut.pending.await(Math.min(remaining, WAIT_SLICE_NANOS), TimeUnit.NANOSECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Generation for task {} was interrupted; open styles are abandoned", request.taskId());
        }

        fanOut.closed.set(true);
        List<TaskImage> images = new ArrayList<>(total);
        int abandoned = 0;
        for (int index = 0; index < total; index++) {
            TaskImage abandonedImage = TaskImage.failed(
                    request.styles().get(index),
                    index,
                    GenerationFailureKind.TIMEOUT,
                    timedOut ? "Generation phase timed out." : "Generation was abandoned.");
            if (fanOut.slots.compareAndSet(index, null, abandonedImage)) {
                abandoned++;
            }
            images.add(fanOut.slots.get(index));
        }

        if (abandoned > 0) {
            logger.warn(
                    "Task {} closed generation with {} of {} styles unresolved (timedOut={})",
                    request.taskId(),
                    abandoned,
                    total,
                    timedOut);
        }
        return new GenerationOutcome(images, timedOut);
    }

    private void dispatch(FanOut fanOut, int index) {
        try {
            CompletableFuture.runAsync(() -> {
                try {
                    generateStyle(fanOut, index);
                } finally {
                    fanOut.permits.release();
                }
            }, generationExecutor);
        } catch (RejectedExecutionException e) {
            fanOut.permits.release();
            logger.error("Generation executor rejected style {} of task {}", index, fanOut.request.taskId(), e);
            resolve(fanOut, index, TaskImage.failed(
                    fanOut.request.styles().get(index),
                    index,
                    GenerationFailureKind.UPSTREAM_ERROR,
                    "Generation capacity exhausted."));
        }
    }

    private void generateStyle(FanOut fanOut, int index) {
        GenerationRequest request = fanOut.request;
        String style = request.styles().get(index);
        String prompt = buildPrompt(style);
        StyleGenerationException lastFailure = null;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            if (fanOut.closed.get()) {
                return;
            }
            try {
                GeneratedImage image = styleImageGenerator.generate(
                        request.sourceImage(),
                        request.contentType(),
                        style,
                        prompt);
                storeResult(fanOut, index, style, image);
                return;
            } catch (StyleGenerationException e) {
                lastFailure = e;
                meterRegistry.counter("style_reel.generation.failures", "kind", e.getKind().name()).increment();
                if (attempt < MAX_ATTEMPTS && e.getKind().transientFailure()) {
                    logger.warn(
                            "Style '{}' of task {} failed with {}; retrying once in {}",
                            style,
                            request.taskId(),
                            e.getKind(),
                            retryBackoff);
                    if (!sleepBeforeRetry(fanOut)) {
                        return;
                    }
                    continue;
                }
                break;
            } catch (RuntimeException e) {
                logger.error("Style '{}' of task {} failed unexpectedly", style, request.taskId(), e);
                lastFailure = new StyleGenerationException(GenerationFailureKind.UPSTREAM_ERROR, e.getMessage(), e);
                break;
            }
        }

        logger.warn(
                "Style '{}' of task {} failed: {} {}",
                style,
                request.taskId(),
                lastFailure.getKind(),
                lastFailure.getMessage());
        resolve(fanOut, index, TaskImage.failed(style, index, lastFailure.getKind(), lastFailure.getMessage()));
    }

    private void storeResult(FanOut fanOut, int index, String style, GeneratedImage image) {
        if (fanOut.closed.get() || fanOut.slots.get(index) != null) {
            logger.info("Discarding late result for style '{}' of task {}", style, fanOut.request.taskId());
            return;
        }

        StoredFile stored = fileStore.put(image.bytes(), FileKind.GENERATED_IMAGE, image.contentType());
        if (!resolve(fanOut, index, TaskImage.generated(stored.fileId(), style, index))) {
            // The slot closed while the bytes were being written; nothing references the file.
            fileStore.delete(stored.fileId());
        }
    }

    private boolean resolve(FanOut fanOut, int index, TaskImage image) {
        if (!fanOut.slots.compareAndSet(index, null, image)) {
            return false;
        }
        int resolved = fanOut.resolved.incrementAndGet();
        fanOut.pending.countDown();
        try {
            fanOut.listener.onStyleResolved(image, resolved, fanOut.request.styles().size());
        } catch (RuntimeException e) {
            logger.error("Progress listener failed for task {}", fanOut.request.taskId(), e);
        }
        return true;
    }

    private boolean sleepBeforeRetry(FanOut fanOut) {
        try {
            Thread.sleep(retryBackoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return !fanOut.closed.get();
    }

    String buildPrompt(String style) {
        return String.format(Locale.ROOT, promptTemplate, style);
    }

    public record GenerationRequest(
            String taskId,
            byte[] sourceImage,
            String contentType,
            List<String> styles,
            int concurrencyLimit,
            Duration phaseTimeout) {

        public GenerationRequest {
            styles = styles == null ? List.of() : List.copyOf(styles);
            if (concurrencyLimit < 1) {
                throw new IllegalArgumentException("concurrencyLimit must be at least 1.");
            }
        }
    }

    private static final class FanOut {

        private final GenerationRequest request;
        private final GenerationListener listener;
        private final Semaphore permits;
        private final AtomicReferenceArray<TaskImage> slots;
        private final AtomicInteger resolved = new AtomicInteger();
        private final AtomicBoolean closed = new AtomicBoolean();
        private final CountDownLatch pending;

        private FanOut(GenerationRequest request, GenerationListener listener) {
            this.request = request;
            this.listener = listener;
            this.permits = new Semaphore(request.concurrencyLimit());
            this.slots = new AtomicReferenceArray<>(request.styles().size());
            this.pending = new CountDownLatch(request.styles().size());
        }
    }
}
