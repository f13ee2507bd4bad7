package github.sarthakdev143.style_reel.model;

public record GeneratedImage(
        byte[] bytes,
        String contentType) {
}
