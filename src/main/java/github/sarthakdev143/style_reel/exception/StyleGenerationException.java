package github.sarthakdev143.style_reel.exception;

import github.sarthakdev143.style_reel.model.GenerationFailureKind;

public class StyleGenerationException extends Exception {

    private final GenerationFailureKind kind;

    public StyleGenerationException(GenerationFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StyleGenerationException(GenerationFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public GenerationFailureKind getKind() {
        return kind;
    }
}
