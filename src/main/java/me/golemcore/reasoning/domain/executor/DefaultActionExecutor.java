package me.golemcore.reasoning.domain.executor;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.Sleeper;
import me.golemcore.reasoning.domain.breaker.BreakerAdmission;
import me.golemcore.reasoning.domain.breaker.CircuitBreakerRegistry;
import me.golemcore.reasoning.domain.model.ExecutionErrorKind;
import me.golemcore.reasoning.domain.model.LoopConfig;
import me.golemcore.reasoning.domain.model.Observation;
import me.golemcore.reasoning.domain.model.ProposedAction;
import me.golemcore.reasoning.domain.model.RecoveryStrategy;
import me.golemcore.reasoning.domain.model.ToolResult;
import me.golemcore.reasoning.port.outbound.ToolInvocationPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes approved tool calls concurrently through the tool invocation port.
 *
 * <p>
 * At most {@code maxConcurrentTools} calls are in flight per dispatch. Each
 * call is bounded by the smaller of the per-tool timeout and the time left in
 * the run, and is cancelled when it overruns; siblings are unaffected. An open
 * breaker short-circuits a call without invoking the tool. Failed calls are
 * handed to the recovery strategy resolved for their tool.
 */
@Slf4j
public class DefaultActionExecutor implements ActionExecutor {

    private final ToolInvocationPort tools;
    private final ExecutorService workers;
    private final ToolResultCache cache;
    private final Clock clock;
    private final Sleeper sleeper;

    public DefaultActionExecutor(ToolInvocationPort tools, ExecutorService workers, ToolResultCache cache,
            Clock clock, Sleeper sleeper) {
        this.tools = tools;
        this.workers = workers;
        this.cache = cache;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public List<Observation> executeActions(List<ProposedAction> actions, LoopConfig config,
            CircuitBreakerRegistry breakers, Instant deadline) {
        if (actions == null || actions.isEmpty()) {
            return List.of();
        }

        Semaphore permits = new Semaphore(Math.max(1, config.getMaxConcurrentTools()));
        List<CompletableFuture<Observation>> pending = new ArrayList<>(actions.size());
        for (ProposedAction action : actions) {
            pending.add(submit(action, config, breakers, deadline, permits));
        }

        // the phase waits for every call; per-call timeouts guarantee this returns
        List<Observation> observations = new ArrayList<>(actions.size());
        for (int i = 0; i < actions.size(); i++) {
            observations.add(await(pending.get(i), actions.get(i)));
        }
        return observations;
    }

    private CompletableFuture<Observation> submit(ProposedAction action, LoopConfig config,
            CircuitBreakerRegistry breakers, Instant deadline, Semaphore permits) {
        try {
            return CompletableFuture.supplyAsync(
                    () -> executeWithPermit(action, config, breakers, deadline, permits), workers);
        } catch (RejectedExecutionException e) {
            log.error("[Executor] Worker pool rejected '{}'", action.toolName(), e);
            return CompletableFuture.completedFuture(Observation.failure(action,
                    ExecutionErrorKind.INVOCATION_FAILED, "Tool execution rejected: worker pool unavailable",
                    Duration.ZERO));
        }
    }

    private Observation await(CompletableFuture<Observation> future, ProposedAction action) {
        try {
            return future.join();
        } catch (CompletionException e) {
            log.error("[Executor] Unexpected failure executing '{}'", action.toolName(), e);
            return Observation.failure(action, ExecutionErrorKind.INVOCATION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e), Duration.ZERO);
        }
    }

    private Observation executeWithPermit(ProposedAction action, LoopConfig config, CircuitBreakerRegistry breakers,
            Instant deadline, Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Observation.failure(action, ExecutionErrorKind.INVOCATION_FAILED,
                    "Tool execution interrupted before start", Duration.ZERO);
        }
        try {
            return execute(action, config, breakers, deadline);
        } finally {
            permits.release();
        }
    }

    Observation execute(ProposedAction action, LoopConfig config, CircuitBreakerRegistry breakers,
            Instant deadline) {
        Instant started = clock.instant();
        Attempt first = attempt(action.toolName(), action.arguments(), config, breakers, deadline);

        Observation observation = first.success()
                ? Observation.success(action, first.output(), null)
                : recover(action, first, config, breakers, deadline);
        return observation.toBuilder().duration(Duration.between(started, clock.instant())).build();
    }

    private Attempt attempt(String toolName, Map<String, Object> arguments, LoopConfig config,
            CircuitBreakerRegistry breakers, Instant deadline) {
        Duration timeout = callTimeout(config, deadline);
        if (timeout.isZero()) {
            return Attempt.failed(ExecutionErrorKind.TOOL_TIMEOUT,
                    "Tool '" + toolName + "' not started: run deadline reached");
        }

        BreakerAdmission admission = breakers.tryAcquire(toolName);
        if (!admission.permitted()) {
            log.warn("[Executor] Short-circuited '{}': breaker open", toolName);
            return Attempt.failed(ExecutionErrorKind.BREAKER_OPEN,
                    "Circuit breaker open for tool '" + toolName + "' after " + admission.consecutiveFailures()
                            + " consecutive failure(s); retry in " + admission.retryAfter().toSeconds() + "s");
        }

        CompletableFuture<ToolResult> future = null;
        try {
            future = tools.invoke(toolName, arguments, timeout);
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return complete(toolName, arguments, result, breakers);
        } catch (TimeoutException e) {
            future.cancel(true);
            breakers.recordFailure(toolName);
            return Attempt.failed(ExecutionErrorKind.TOOL_TIMEOUT,
                    "Tool '" + toolName + "' timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            breakers.recordFailure(toolName);
            if (e.getCause() instanceof TimeoutException) {
                return Attempt.failed(ExecutionErrorKind.TOOL_TIMEOUT,
                        "Tool '" + toolName + "' timed out after " + timeout.toMillis() + "ms");
            }
            log.warn("[Executor] Tool '{}' failed: {}", toolName, safeCauseMessage(e));
            return Attempt.failed(ExecutionErrorKind.INVOCATION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            breakers.releaseTrialCall(toolName);
            return Attempt.failed(ExecutionErrorKind.INVOCATION_FAILED, "Tool '" + toolName + "' interrupted");
        } catch (RuntimeException e) {
            breakers.recordFailure(toolName);
            log.warn("[Executor] Tool '{}' failed to start: {}", toolName, safeCauseMessage(e));
            return Attempt.failed(ExecutionErrorKind.INVOCATION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private Attempt complete(String toolName, Map<String, Object> arguments, ToolResult result,
            CircuitBreakerRegistry breakers) {
        if (result == null) {
            breakers.recordFailure(toolName);
            return Attempt.failed(ExecutionErrorKind.INVOCATION_FAILED, "Tool '" + toolName + "' returned no result");
        }
        if (result.isSuccess()) {
            breakers.recordSuccess(toolName);
            cache.put(toolName, arguments, result.getOutput());
            return Attempt.succeeded(result.getOutput());
        }

        ExecutionErrorKind kind = result.getFailureKind() != null ? result.getFailureKind()
                : ExecutionErrorKind.INVOCATION_FAILED;
        // a missing tool says nothing about the health of a real one
        if (kind == ExecutionErrorKind.TOOL_NOT_FOUND) {
            breakers.releaseTrialCall(toolName);
        } else {
            breakers.recordFailure(toolName);
        }
        String error = result.getError() != null ? result.getError() : "Tool '" + toolName + "' failed";
        return Attempt.failed(kind, error);
    }

    private Observation recover(ProposedAction action, Attempt failure, LoopConfig config,
            CircuitBreakerRegistry breakers, Instant deadline) {
        RecoveryStrategy strategy = config.recoveryFor(action.toolName());
        Observation failed = Observation.failure(action, failure.kind(), failure.error(), null);

        return switch (strategy.kind()) {
        case RETRY -> retry(action, failure, strategy, config, breakers, deadline);
        case FALLBACK -> fallback(action, failed, strategy, config, breakers, deadline);
        case CACHED_RESULT -> cached(action, failed, strategy);
        case LLM_RECOVERY -> failed.toBuilder()
                .recovery(RecoveryStrategy.Kind.LLM_RECOVERY)
                .recoveryNote("failure returned to the model")
                .build();
        case ESCALATE -> {
            log.warn("[Executor] Escalating failed '{}' to queue '{}': {}", action.toolName(), strategy.queue(),
                    failure.error());
            yield failed.toBuilder()
                    .recovery(RecoveryStrategy.Kind.ESCALATE)
                    .escalated(true)
                    .escalationQueue(strategy.queue())
                    .build();
        }
        case DEAD_LETTER -> {
            log.warn("[Executor] Dead-lettered '{}' (action {}): {}", action.toolName(), action.id(),
                    failure.error());
            yield failed.toBuilder()
                    .recovery(RecoveryStrategy.Kind.DEAD_LETTER)
                    .deadLettered(true)
                    .retriable(false)
                    .build();
        }
        };
    }

    private Observation retry(ProposedAction action, Attempt failure, RecoveryStrategy strategy, LoopConfig config,
            CircuitBreakerRegistry breakers, Instant deadline) {
        if (!failure.kind().isRetriable()) {
            return Observation.failure(action, failure.kind(), failure.error(), null);
        }

        Attempt last = failure;
        int retries = 0;
        Duration delay = strategy.baseDelay();
        while (retries < strategy.maxAttempts() && last.kind() != null && last.kind().isRetriable()) {
            if (!clock.instant().plus(delay).isBefore(deadline)) {
                break;
            }
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            retries++;
            log.debug("[Executor] Retrying '{}' ({}/{})", action.toolName(), retries, strategy.maxAttempts());
            last = attempt(action.toolName(), action.arguments(), config, breakers, deadline);
            if (last.success()) {
                return Observation.success(action, last.output(), null).toBuilder()
                        .recovery(RecoveryStrategy.Kind.RETRY)
                        .build();
            }
            delay = delay.multipliedBy(2);
        }

        return Observation.failure(action, last.kind(), last.error(), null).toBuilder()
                .recovery(RecoveryStrategy.Kind.RETRY)
                .recoveryNote("retried " + retries + " time(s)")
                .build();
    }

    private Observation fallback(ProposedAction action, Observation failed, RecoveryStrategy strategy,
            LoopConfig config, CircuitBreakerRegistry breakers, Instant deadline) {
        for (String alternative : strategy.alternatives()) {
            if (alternative.equals(action.toolName()) || !config.declaredToolNames().contains(alternative)) {
                log.debug("[Executor] Skipping undeclared fallback '{}' for '{}'", alternative, action.toolName());
                continue;
            }
            Attempt attempt = attempt(alternative, action.arguments(), config, breakers, deadline);
            if (attempt.success()) {
                log.info("[Executor] '{}' served by fallback '{}'", action.toolName(), alternative);
                return Observation.success(action, attempt.output(), null).toBuilder()
                        .recovery(RecoveryStrategy.Kind.FALLBACK)
                        .recoveryNote("served by fallback tool '" + alternative + "'")
                        .build();
            }
        }
        return failed.toBuilder()
                .recovery(RecoveryStrategy.Kind.FALLBACK)
                .recoveryNote("no fallback succeeded")
                .build();
    }

    private Observation cached(ProposedAction action, Observation failed, RecoveryStrategy strategy) {
        Optional<ToolResultCache.CachedResult> cachedResult = cache.lookup(action.toolName(), action.arguments(),
                strategy.maxStaleness());
        if (cachedResult.isPresent()) {
            log.info("[Executor] Serving cached result for '{}'", action.toolName());
            return Observation.success(action, cachedResult.get().output(), null).toBuilder()
                    .recovery(RecoveryStrategy.Kind.CACHED_RESULT)
                    .recoveryNote("cached result from " + cachedResult.get().storedAt())
                    .build();
        }
        return failed.toBuilder()
                .recovery(RecoveryStrategy.Kind.CACHED_RESULT)
                .recoveryNote("no fresh cached result")
                .build();
    }

    private Duration callTimeout(LoopConfig config, Instant deadline) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return Duration.ZERO;
        }
        return remaining.compareTo(config.getToolTimeout()) < 0 ? remaining : config.getToolTimeout();
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private record Attempt(boolean success, String output, ExecutionErrorKind kind, String error) {

        static Attempt succeeded(String output) {
            return new Attempt(true, output, null, null);
        }

        static Attempt failed(ExecutionErrorKind kind, String error) {
            return new Attempt(false, null, kind, error);
        }
    }
}
