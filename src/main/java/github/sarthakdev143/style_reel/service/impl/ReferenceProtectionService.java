package github.sarthakdev143.style_reel.service.impl;

import github.sarthakdev143.style_reel.config.StyleReelProperties;
import github.sarthakdev143.style_reel.exception.StoreUnavailableException;
import github.sarthakdev143.style_reel.model.FileDeletionOutcome;
import github.sarthakdev143.style_reel.model.StoredFile;
import github.sarthakdev143.style_reel.model.TaskDeletionReport;
import github.sarthakdev143.style_reel.model.TaskRecord;
import github.sarthakdev143.style_reel.store.FileStore;
import github.sarthakdev143.style_reel.store.TaskRecordStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Deletes files only when no task other than the one being removed still points at them.
 * <p>
 * Reference sets are computed by scanning every task record. Records only ever gain references while a task is
 * active, so a scan can report a file as referenced when it no longer is, but never the other way round.
 */
@Service
public class ReferenceProtectionService {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceProtectionService.class);

    private final FileStore fileStore;
    private final TaskRecordStore taskRecordStore;
    private final Clock clock;
    private final Duration orphanGrace;
    private final Counter filesDeletedCounter;
    private final Counter filesProtectedCounter;
    private final Counter sweepRemovedCounter;

    public ReferenceProtectionService(
            FileStore fileStore,
            TaskRecordStore taskRecordStore,
            StyleReelProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.fileStore = fileStore;
        this.taskRecordStore = taskRecordStore;
        this.clock = clock;
        this.orphanGrace = properties.maintenance().orphanGrace();
        this.filesDeletedCounter = meterRegistry.counter("style_reel.files.deleted");
        this.filesProtectedCounter = meterRegistry.counter("style_reel.files.protected");
        this.sweepRemovedCounter = meterRegistry.counter("style_reel.sweep.removed");
    }

    public FileDeletionOutcome deleteIfUnreferenced(String fileId, String excludingTaskId) {
        if (referencedFileIds(excludingTaskId).contains(fileId)) {
            filesProtectedCounter.increment();
            return FileDeletionOutcome.PROTECTED;
        }
        if (!fileStore.delete(fileId)) {
            return FileDeletionOutcome.NOT_FOUND;
        }
        filesDeletedCounter.increment();
        return FileDeletionOutcome.DELETED;
    }

    public TaskDeletionReport deleteTask(TaskRecord task) {
        List<String> removed = new ArrayList<>();
        List<String> kept = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (String fileId : task.referencedFileIds()) {
            try {
                FileDeletionOutcome outcome = deleteIfUnreferenced(fileId, task.taskId());
                switch (outcome) {
                    case DELETED -> removed.add(fileId);
                    case PROTECTED -> kept.add(fileId);
                    case NOT_FOUND -> logger.debug("File {} of task {} was already gone", fileId, task.taskId());
                }
            } catch (StoreUnavailableException e) {
                failed.add(fileId);
                logger.warn("Could not delete file {} of task {}; leaving it for the orphan sweep", fileId, task.taskId(), e);
            }
        }

        taskRecordStore.delete(task.taskId());

        if (!kept.isEmpty()) {
            logger.warn("Task {} deleted; files still referenced by other tasks were kept: {}", task.taskId(), kept);
        }
        logger.info(
                "Deleted task {} removedFiles={} keptFiles={} failedFiles={}",
                task.taskId(),
                removed.size(),
                kept.size(),
                failed.size());
        return new TaskDeletionReport(task.taskId(), removed, kept, failed);
    }

    /**
     * Deletes every file that no task references and that is older than the grace window.
     *
     * @return number of files removed
     */
    public int sweepOrphans() {
        Instant cutoff = clock.instant().minus(orphanGrace);
        Set<String> referenced = referencedFileIds(null);
        int removed = 0;

        for (StoredFile file : fileStore.list()) {
            if (referenced.contains(file.fileId()) || file.createdAt().isAfter(cutoff)) {
                continue;
            }
            try {
                if (fileStore.delete(file.fileId())) {
                    removed++;
                }
            } catch (StoreUnavailableException e) {
                logger.warn("Orphan sweep could not delete file {}", file.fileId(), e);
            }
        }

        sweepRemovedCounter.increment(removed);
        logger.info("Orphan sweep removed {} files older than {}", removed, cutoff);
        return removed;
    }

    private Set<String> referencedFileIds(String excludingTaskId) {
        Set<String> ids = new HashSet<>();
        for (TaskRecord record : taskRecordStore.list(record -> !Objects.equals(record.taskId(), excludingTaskId))) {
            ids.addAll(record.referencedFileIds());
        }
        return ids;
    }
}
