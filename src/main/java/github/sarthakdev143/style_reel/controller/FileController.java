package github.sarthakdev143.style_reel.controller;

import github.sarthakdev143.style_reel.dto.FileUploadResponse;
import github.sarthakdev143.style_reel.exception.StoreUnavailableException;
import github.sarthakdev143.style_reel.exception.StoredFileNotFoundException;
import github.sarthakdev143.style_reel.model.FileKind;
import github.sarthakdev143.style_reel.model.StoredFile;
import github.sarthakdev143.style_reel.store.FileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;

@RestController
@RequestMapping("/api/files")
public class FileController {

    private static final Logger logger = LoggerFactory.getLogger(FileController.class);
    private static final long MAX_IMAGE_BYTES = 10L * 1024 * 1024;
    private static final long MAX_AUDIO_BYTES = 50L * 1024 * 1024;

    private final FileStore fileStore;

    public FileController(FileStore fileStore) {
        this.fileStore = fileStore;
    }

    @PostMapping(consumes = "multipart/form-data")
    public ResponseEntity<?> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "kind", required = false, defaultValue = "image") String kindInput) {
        try {
            String expectedTypePrefix = expectedTypePrefix(kindInput);
            validateUpload(file, expectedTypePrefix);

            StoredFile stored = fileStore.put(file.getBytes(), FileKind.UPLOAD, file.getContentType());
            logger.info("Stored upload {} type={} size={}", stored.fileId(), stored.contentType(), stored.size());
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(new FileUploadResponse(
                            stored.fileId(),
                            stored.contentType(),
                            stored.size(),
                            "/api/files/" + stored.fileId()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (StoreUnavailableException e) {
            logger.error("Store unavailable while saving upload", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Storage is unavailable. Please try again later.");
        } catch (IOException e) {
            logger.error("Could not read uploaded file", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to read the uploaded file. Please try again.");
        }
    }

    @GetMapping("/{fileId}")
    public ResponseEntity<?> download(@PathVariable String fileId) {
        try {
            StoredFile stored = fileStore.find(fileId).orElseThrow(() -> new StoredFileNotFoundException(fileId));
            byte[] bytes = fileStore.read(fileId);
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(stored.contentType()))
                    .contentLength(bytes.length)
                    .body(bytes);
        } catch (StoredFileNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("File not found for id: " + fileId);
        } catch (StoreUnavailableException e) {
            logger.error("Store unavailable while reading file {}", fileId, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Storage is unavailable. Please try again later.");
        }
    }

    private String expectedTypePrefix(String kindInput) {
        String kind = kindInput == null ? "" : kindInput.trim().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "image" -> "image/";
            case "audio" -> "audio/";
            default -> throw new IllegalArgumentException("kind must be one of image, audio.");
        };
    }

    private void validateUpload(MultipartFile file, String expectedTypePrefix) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("file is required.");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith(expectedTypePrefix)) {
            throw new IllegalArgumentException("file must be a " + expectedTypePrefix + "* upload.");
        }
        long maxBytes = "image/".equals(expectedTypePrefix) ? MAX_IMAGE_BYTES : MAX_AUDIO_BYTES;
        if (file.getSize() > maxBytes) {
            throw new IllegalArgumentException("file must be at most " + (maxBytes / (1024 * 1024)) + " MB.");
        }
    }
}
