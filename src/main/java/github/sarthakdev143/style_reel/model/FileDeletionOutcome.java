package github.sarthakdev143.style_reel.model;

public enum FileDeletionOutcome {
    DELETED,
    PROTECTED,
    NOT_FOUND
}
