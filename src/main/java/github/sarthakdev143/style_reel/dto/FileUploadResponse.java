package github.sarthakdev143.style_reel.dto;

public record FileUploadResponse(
        String fileId,
        String contentType,
        long size,
        String url) {
}
