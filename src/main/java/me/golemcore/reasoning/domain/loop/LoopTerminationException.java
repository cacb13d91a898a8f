package me.golemcore.reasoning.domain.loop;

import me.golemcore.reasoning.domain.model.TerminationReason;

/**
 * Ends a run from inside a phase. Caught by {@link ReasoningLoopRunner} and
 * turned into a {@link me.golemcore.reasoning.domain.model.LoopResult}; never
 * escapes {@code run(...)}.
 */
public class LoopTerminationException extends RuntimeException {

    private final TerminationReason reason;

    public LoopTerminationException(TerminationReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public LoopTerminationException(TerminationReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public TerminationReason getReason() {
        return reason;
    }
}
