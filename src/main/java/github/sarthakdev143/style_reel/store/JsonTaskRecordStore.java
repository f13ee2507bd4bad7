package github.sarthakdev143.style_reel.store;

import github.sarthakdev143.style_reel.config.StyleReelProperties;
import github.sarthakdev143.style_reel.exception.StaleTaskVersionException;
import github.sarthakdev143.style_reel.exception.StoreUnavailableException;
import github.sarthakdev143.style_reel.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Stream;

@Component
public class JsonTaskRecordStore implements TaskRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonTaskRecordStore.class);
    private static final String JSON_SUFFIX = ".json";
    private static final Pattern TASK_ID_PATTERN = Pattern.compile("^[A-Za-z0-9-]{1,64}$");

    private final Path directory;
    private final Clock clock;
    private final ConcurrentMap<String, Object> locks = new ConcurrentHashMap<>();

    @Autowired
    public JsonTaskRecordStore(StyleReelProperties properties, Clock clock) {
        this(properties.storage().root().resolve("tasks"), clock);
    }

    public JsonTaskRecordStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            logger.error("Failed to create task record directory {}", directory.toAbsolutePath(), e);
        }
    }

    @Override
    public TaskRecord create(TaskRecord record) {
        requireValidId(record.taskId());
        synchronized (lockFor(record.taskId())) {
            Path path = recordPath(record.taskId());
            if (Files.exists(path)) {
                throw new IllegalStateException("Task " + record.taskId() + " already exists.");
            }
            TaskRecord stored = record.withVersion(1L, clock.instant());
            write(path, stored);
            return stored;
        }
    }

    @Override
    public Optional<TaskRecord> get(String taskId) {
        if (taskId == null || !TASK_ID_PATTERN.matcher(taskId).matches()) {
            return Optional.empty();
        }
        return read(recordPath(taskId));
    }

    @Override
    public TaskRecord compareAndSet(TaskRecord updated, long expectedVersion) {
        requireValidId(updated.taskId());
        synchronized (lockFor(updated.taskId())) {
            Path path = recordPath(updated.taskId());
            TaskRecord current = read(path).orElseThrow(() -> new StaleTaskVersionException(
                    updated.taskId(), expectedVersion, -1L));
            if (current.version() != expectedVersion) {
                throw new StaleTaskVersionException(updated.taskId(), expectedVersion, current.version());
            }
            TaskRecord stored = updated.withVersion(expectedVersion + 1, clock.instant());
            write(path, stored);
            return stored;
        }
    }

    @Override
    public List<TaskRecord> list(Predicate<TaskRecord> filter) {
        List<TaskRecord> records = new ArrayList<>();
        try (Stream<Path> paths = Files.list(directory)) {
            for (Path path : paths.toList()) {
                if (!path.getFileName().toString().endsWith(JSON_SUFFIX)) {
                    continue;
                }
                read(path).filter(filter == null ? record -> true : filter).ifPresent(records::add);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to list task records under " + directory, e);
        }
        records.sort(Comparator.comparing(TaskRecord::createdAt).reversed());
        return records;
    }

    @Override
    public boolean delete(String taskId) {
        requireValidId(taskId);
        synchronized (lockFor(taskId)) {
            try {
                boolean deleted = Files.deleteIfExists(recordPath(taskId));
                locks.remove(taskId);
                return deleted;
            } catch (IOException e) {
                throw new StoreUnavailableException("Failed to delete task record " + taskId, e);
            }
        }
    }

    private Optional<TaskRecord> read(Path path) {
        try {
            return Optional.of(StoreJson.MAPPER.readValue(Files.readAllBytes(path), TaskRecord.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | JacksonException e) {
            throw new StoreUnavailableException("Failed to read task record " + path.getFileName(), e);
        }
    }

    private void write(Path path, TaskRecord record) {
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, ".pending-", ".tmp");
            Files.write(temp, StoreJson.MAPPER.writeValueAsBytes(record));
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | JacksonException e) {
            throw new StoreUnavailableException("Failed to write task record " + record.taskId(), e);
        } finally {
            deleteTemp(temp);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary task record {}", temp, e);
        }
    }

    private Object lockFor(String taskId) {
        return locks.computeIfAbsent(taskId, ignored -> new Object());
    }

    private void requireValidId(String taskId) {
        if (taskId == null || !TASK_ID_PATTERN.matcher(taskId).matches()) {
            throw new IllegalArgumentException("Invalid task id: " + taskId);
        }
    }

    private Path recordPath(String taskId) {
        return directory.resolve(taskId + JSON_SUFFIX);
    }
}
