package github.sarthakdev143.style_reel.store;

import github.sarthakdev143.style_reel.model.TaskRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

public interface TaskRecordStore {

    TaskRecord create(TaskRecord record);

    Optional<TaskRecord> get(String taskId);

    /**
     * Persists {@code updated} if the stored record is still at {@code expectedVersion}.
     *
     * @return the stored record with its new version
     * @throws github.sarthakdev143.style_reel.exception.StaleTaskVersionException on a version mismatch
     */
    TaskRecord compareAndSet(TaskRecord updated, long expectedVersion);

    List<TaskRecord> list(Predicate<TaskRecord> filter);

    boolean delete(String taskId);
}
