package github.sarthakdev143.style_reel.model;

public enum TaskErrorKind {
    GENERATION_EXHAUSTED,
    TIMEOUT,
    ENCODE_ERROR,
    NOT_FOUND,
    STORE_UNAVAILABLE,
    INTERRUPTED,
    CAPACITY_EXHAUSTED
}
