package me.golemcore.reasoning.domain.model;

/**
 * Why a loop run ended.
 */
public enum TerminationReason {
    COMPLETED, MAX_ITERATIONS, MAX_TOKENS, TIMEOUT, ERROR;

    public boolean isSuccess() {
        return this == COMPLETED;
    }
}
