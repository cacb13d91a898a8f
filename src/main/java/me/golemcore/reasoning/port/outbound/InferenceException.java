package me.golemcore.reasoning.port.outbound;

/**
 * Typed failure of an inference call.
 */
public class InferenceException extends RuntimeException {

    private final InferenceErrorKind kind;

    public InferenceException(InferenceErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public InferenceException(InferenceErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public InferenceErrorKind getKind() {
        return kind;
    }

    public boolean isRetriable() {
        return kind.isRetriable();
    }
}
