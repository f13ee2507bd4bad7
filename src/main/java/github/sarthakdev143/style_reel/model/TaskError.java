package github.sarthakdev143.style_reel.model;

public record TaskError(
        TaskErrorKind kind,
        String message) {
}
