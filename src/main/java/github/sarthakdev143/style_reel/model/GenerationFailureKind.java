package github.sarthakdev143.style_reel.model;

public enum GenerationFailureKind {
    RATE_LIMITED,
    INVALID_INPUT,
    UPSTREAM_ERROR,
    TIMEOUT;

    public boolean transientFailure() {
        return this == RATE_LIMITED || this == TIMEOUT;
    }
}
