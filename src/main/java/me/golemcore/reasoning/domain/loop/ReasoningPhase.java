package me.golemcore.reasoning.domain.loop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.conversation.ConversationView;
import me.golemcore.reasoning.domain.model.InferenceResult;
import me.golemcore.reasoning.domain.model.LoopConfig;
import me.golemcore.reasoning.domain.model.LoopEventType;
import me.golemcore.reasoning.domain.model.LoopState;
import me.golemcore.reasoning.domain.model.Message;
import me.golemcore.reasoning.domain.model.ProposedAction;
import me.golemcore.reasoning.domain.model.TerminationReason;
import me.golemcore.reasoning.port.outbound.InferenceException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * First phase of an iteration. The only way forward is
 * {@link #produceOutput()}, which yields the {@link PolicyCheckPhase}.
 *
 * <p>
 * Every phase object allows exactly one transition. Calling it a second time
 * throws {@link IllegalStateException}.
 */
@Slf4j
public final class ReasoningPhase {

    private final LoopRun run;
    private boolean used;

    ReasoningPhase(LoopRun run) {
        this.run = run;
    }

    /**
     * Checks the run limits, refreshes knowledge context, budgets the
     * conversation and asks the model for the next actions.
     *
     * @throws LoopTerminationException
     *             when a limit is reached or inference fails for good
     * @throws IllegalStateException
     *             when this phase has already produced output
     */
    public PolicyCheckPhase produceOutput() {
        markUsed("produced output");
        checkLimits();

        run.getKnowledgeBridge().injectContext(run.getConversation());

        LoopConfig config = run.getConfig();
        ConversationView view = run.getConversation().enforceBudget(run.getBudgeter(),
                config.getContextTokenBudget());
        if (!view.diagnostics().isEmpty()) {
            log.debug("[Budget] Run {} iteration {}: {}", run.getRunId(), run.getState().getIteration() + 1,
                    view.diagnostics());
        }

        InferenceResult result = infer(view.messages());

        LoopState state = run.getState();
        state.incrementIteration();
        state.addUsage(result.usage());
        run.calibrate(view.messages(), result.usage().promptTokens());

        List<ProposedAction> actions = result.actions();
        if (actions.isEmpty()) {
            // nothing proposed: the reply text is the answer
            actions = List.of(ProposedAction.finalAnswer(null, result.text() != null ? result.text() : ""));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("actionCount", actions.size());
        payload.put("promptTokens", result.usage().promptTokens());
        payload.put("completionTokens", result.usage().completionTokens());
        payload.put("estimatedTokens", view.estimatedTokens());
        payload.put("finishReason", result.finishReason().name());
        run.record(LoopEventType.REASONING_COMPLETE, payload);
        log.debug("[Loop] Run {} iteration {}: {} action(s) proposed", run.getRunId(), state.getIteration(),
                actions.size());

        return new PolicyCheckPhase(run, actions, result.text());
    }

    private void checkLimits() {
        LoopConfig config = run.getConfig();
        LoopState state = run.getState();
        if (state.getIteration() >= config.getMaxIterations()) {
            throw new LoopTerminationException(TerminationReason.MAX_ITERATIONS,
                    "Maximum iterations reached (" + config.getMaxIterations() + ")");
        }
        if (state.getTotalTokens() >= config.getMaxTotalTokens()) {
            throw new LoopTerminationException(TerminationReason.MAX_TOKENS,
                    "Token budget exhausted (" + state.getTotalTokens() + " of " + config.getMaxTotalTokens() + ")");
        }
        Duration elapsed = state.elapsed(run.getClock());
        if (elapsed.compareTo(config.getTimeout()) >= 0) {
            throw new LoopTerminationException(TerminationReason.TIMEOUT,
                    "Run timed out after " + elapsed.toMillis() + "ms");
        }
    }

    private InferenceResult infer(List<Message> messages) {
        InferenceRetryPolicy policy = run.getRetryPolicy();
        int attempt = 1;
        while (true) {
            try {
                return inferOnce(messages);
            } catch (InferenceException e) {
                if (!e.isRetriable() || !policy.hasAttemptsAfter(attempt)) {
                    throw new LoopTerminationException(TerminationReason.ERROR,
                            "Inference failed (" + e.getKind() + "): " + e.getMessage(), e);
                }
                Duration backoff = policy.backoffFor(attempt);
                if (backoff.compareTo(run.remaining()) >= 0) {
                    throw new LoopTerminationException(TerminationReason.TIMEOUT,
                            "Run deadline reached while backing off from " + e.getKind() + " inference failure");
                }
                log.warn("[Inference] {} failure on attempt {}/{}, retrying in {}ms: {}", e.getKind(), attempt,
                        policy.maxAttempts(), backoff.toMillis(), e.getMessage());
                sleep(backoff);
                attempt++;
            }
        }
    }

    private InferenceResult inferOnce(List<Message> messages) {
        Duration remaining = run.remaining();
        if (remaining.isZero()) {
            throw new LoopTerminationException(TerminationReason.TIMEOUT, "Run deadline reached before inference");
        }

        CompletableFuture<InferenceResult> future;
        try {
            future = run.getInference().infer(messages, run.getInferenceOptions());
        } catch (InferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LoopTerminationException(TerminationReason.ERROR, "Inference failed: " + e.getMessage(), e);
        }

        try {
            InferenceResult result = future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new LoopTerminationException(TerminationReason.ERROR, "Inference returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LoopTerminationException(TerminationReason.TIMEOUT,
                    "Run timed out waiting " + remaining.toMillis() + "ms for inference");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InferenceException inferenceException) {
                throw inferenceException;
            }
            String message = cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause);
            throw new LoopTerminationException(TerminationReason.ERROR, "Inference failed: " + message, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new LoopTerminationException(TerminationReason.ERROR, "Interrupted while waiting for inference",
                    e);
        }
    }

    private void sleep(Duration backoff) {
        try {
            run.getSleeper().sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoopTerminationException(TerminationReason.ERROR, "Interrupted during inference backoff", e);
        }
    }

    private void markUsed(String transition) {
        if (used) {
            throw new IllegalStateException("Phase of run " + run.getRunId() + " already " + transition);
        }
        used = true;
    }
}
