package github.sarthakdev143.style_reel.store;

import github.sarthakdev143.style_reel.config.StyleReelProperties;
import github.sarthakdev143.style_reel.exception.StoreUnavailableException;
import github.sarthakdev143.style_reel.exception.StoredFileNotFoundException;
import github.sarthakdev143.style_reel.model.FileKind;
import github.sarthakdev143.style_reel.model.StoredFile;
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
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File store on the local disk. Blobs live under one directory per {@link FileKind}; the metadata of each
 * blob sits in a {@code .meta.json} sidecar under {@code meta/}. The sidecar is written last and removed
 * first, so a file is visible exactly when its sidecar exists.
 */
@Component
public class LocalFileStore implements FileStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalFileStore.class);
    private static final String META_DIRECTORY = "meta";
    private static final String META_JSON_SUFFIX = ".meta.json";
    private static final Pattern FILE_ID_PATTERN = Pattern.compile("^[A-Za-z0-9-]{1,64}$");

    private final Path root;
    private final Clock clock;

    @Autowired
    public LocalFileStore(StyleReelProperties properties, Clock clock) {
        this(properties.storage().root().resolve("files"), clock);
    }

    public LocalFileStore(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
        try {
            Files.createDirectories(root.resolve(META_DIRECTORY));
            for (FileKind kind : FileKind.values()) {
                Files.createDirectories(root.resolve(kind.directoryName()));
            }
            logger.info("File store initialized at {}", root.toAbsolutePath());
        } catch (IOException e) {
            logger.error("Failed to create file store directories under {}", root.toAbsolutePath(), e);
        }
    }

    @Override
    public StoredFile put(byte[] bytes, FileKind kind, String contentType) {
        if (bytes == null) {
            throw new IllegalArgumentException("File content is required.");
        }
        String fileId = UUID.randomUUID().toString();
        StoredFile storedFile = new StoredFile(
                fileId,
                kind,
                contentType == null || contentType.isBlank() ? "application/octet-stream" : contentType,
                bytes.length,
                clock.instant());

        Path blobPath = blobPath(kind, fileId);
        Path metaPath = metaPath(fileId);
        try {
            writeAtomically(blobPath, bytes);
            writeAtomically(metaPath, StoreJson.MAPPER.writeValueAsBytes(storedFile));
        } catch (IOException | JacksonException e) {
            deleteQuietly(metaPath);
            deleteQuietly(blobPath);
            throw new StoreUnavailableException("Failed to store file " + fileId, e);
        }

        logger.debug("Stored {} file {} ({} bytes)", kind, fileId, bytes.length);
        return storedFile;
    }

    @Override
    public Optional<StoredFile> find(String fileId) {
        if (!isValidId(fileId)) {
            return Optional.empty();
        }
        Path metaPath = metaPath(fileId);
        if (Files.notExists(metaPath)) {
            return Optional.empty();
        }
        try {
            return Optional.of(StoreJson.MAPPER.readValue(Files.readAllBytes(metaPath), StoredFile.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | JacksonException e) {
            throw new StoreUnavailableException("Failed to read metadata of file " + fileId, e);
        }
    }

    @Override
    public byte[] read(String fileId) {
        StoredFile storedFile = find(fileId).orElseThrow(() -> new StoredFileNotFoundException(fileId));
        try {
            return Files.readAllBytes(blobPath(storedFile.kind(), fileId));
        } catch (NoSuchFileException e) {
            throw new StoredFileNotFoundException(fileId);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read file " + fileId, e);
        }
    }

    @Override
    public boolean delete(String fileId) {
        Optional<StoredFile> storedFile = find(fileId);
        if (storedFile.isEmpty()) {
            return false;
        }
        try {
            Files.deleteIfExists(metaPath(fileId));
            Files.deleteIfExists(blobPath(storedFile.get().kind(), fileId));
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to delete file " + fileId, e);
        }
        logger.info("Deleted {} file {}", storedFile.get().kind(), fileId);
        return true;
    }

    @Override
    public List<StoredFile> list() {
        List<StoredFile> files = new ArrayList<>();
        try (Stream<Path> metaFiles = Files.list(root.resolve(META_DIRECTORY))) {
            for (Path metaFile : metaFiles.toList()) {
                String name = metaFile.getFileName().toString();
                if (!name.endsWith(META_JSON_SUFFIX)) {
                    continue;
                }
                find(name.substring(0, name.length() - META_JSON_SUFFIX.length())).ifPresent(files::add);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to list files under " + root, e);
        }
        return files;
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), ".pending-", ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not remove partial file {}", path, e);
        }
    }

    private boolean isValidId(String fileId) {
        return fileId != null && FILE_ID_PATTERN.matcher(fileId).matches();
    }

    private Path blobPath(FileKind kind, String fileId) {
        return root.resolve(kind.directoryName()).resolve(fileId);
    }

    private Path metaPath(String fileId) {
        return root.resolve(META_DIRECTORY).resolve(fileId + META_JSON_SUFFIX);
    }
}
