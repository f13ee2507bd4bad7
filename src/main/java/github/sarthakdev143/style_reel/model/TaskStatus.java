package github.sarthakdev143.style_reel.model;

public enum TaskStatus {
    QUEUED,
    GENERATING,
    AWAITING_SELECTION,
    COMPOSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatus target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case QUEUED -> target == GENERATING || target == FAILED || target == CANCELLED;
            case GENERATING -> target == AWAITING_SELECTION || target == FAILED || target == CANCELLED;
            case AWAITING_SELECTION -> target == COMPOSING || target == FAILED || target == CANCELLED;
            case COMPOSING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
