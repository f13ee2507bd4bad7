package github.sarthakdev143.style_reel.model;

public enum CompositionFailureKind {
    ENCODE_ERROR,
    INVALID_PARAMS,
    TIMEOUT
}
