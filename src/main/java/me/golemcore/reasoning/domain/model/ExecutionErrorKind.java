package me.golemcore.reasoning.domain.model;

/**
 * Failure categories of a dispatched action.
 */
public enum ExecutionErrorKind {
    TOOL_TIMEOUT(true), TOOL_NOT_FOUND(false), BREAKER_OPEN(false), INVOCATION_FAILED(true), POLICY_DENIED(false);

    private final boolean retriable;

    ExecutionErrorKind(boolean retriable) {
        this.retriable = retriable;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
