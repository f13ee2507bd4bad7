package github.sarthakdev143.style_reel.model;

import java.time.Instant;

public record StoredFile(
        String fileId,
        FileKind kind,
        String contentType,
        long size,
        Instant createdAt) {
}
