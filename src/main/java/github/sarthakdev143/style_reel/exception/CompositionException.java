package github.sarthakdev143.style_reel.exception;

import github.sarthakdev143.style_reel.model.CompositionFailureKind;

public class CompositionException extends Exception {

    private final CompositionFailureKind kind;

    public CompositionException(CompositionFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CompositionException(CompositionFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public CompositionFailureKind getKind() {
        return kind;
    }
}
