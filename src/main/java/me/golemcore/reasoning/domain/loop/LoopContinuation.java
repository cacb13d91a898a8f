package me.golemcore.reasoning.domain.loop;

/**
 * Result of {@link ObservingPhase#observeResults()}: either the run is complete
 * with a final answer, or the next {@link ReasoningPhase} is ready.
 */
public final class LoopContinuation {

    private final ReasoningPhase next;
    private final String output;

    private LoopContinuation(ReasoningPhase next, String output) {
        this.next = next;
        this.output = output;
    }

    static LoopContinuation next(ReasoningPhase phase) {
        return new LoopContinuation(phase, null);
    }

    static LoopContinuation complete(String output) {
        return new LoopContinuation(null, output != null ? output : "");
    }

    public boolean isComplete() {
        return next == null;
    }

    public String output() {
        if (!isComplete()) {
            throw new IllegalStateException("Loop has not completed");
        }
        return output;
    }

    public ReasoningPhase nextPhase() {
        if (isComplete()) {
            throw new IllegalStateException("Loop has completed");
        }
        return next;
    }
}
