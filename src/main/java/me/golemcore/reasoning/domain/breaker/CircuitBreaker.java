package me.golemcore.reasoning.domain.breaker;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.model.CircuitBreakerState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker of a single tool.
 *
 * <p>
 * State lives in one {@link AtomicReference} of an immutable
 * {@link CircuitBreakerState}; every transition is a compare-and-set, so
 * concurrent calls to the same tool observe a total order of transitions
 * without locking.
 */
@Slf4j
public class CircuitBreaker {

    private final String toolName;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final AtomicReference<CircuitBreakerState> state = new AtomicReference<>(
            CircuitBreakerState.initial());

    public CircuitBreaker(String toolName, CircuitBreakerConfig config, Clock clock) {
        this.toolName = toolName;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Asks whether a call may proceed. An open breaker whose cooldown elapsed
     * turns half-open and this call counts as its first trial call.
     */
    public BreakerAdmission tryAcquire() {
        while (true) {
            CircuitBreakerState current = state.get();
            switch (current.status()) {
            case CLOSED:
                return BreakerAdmission.permit(current.consecutiveFailures());
            case OPEN: {
                Duration remaining = remainingCooldown(current);
                if (!remaining.isZero()) {
                    return BreakerAdmission.reject(current.consecutiveFailures(), remaining);
                }
                CircuitBreakerState probing = CircuitBreakerState.halfOpen(current.openedAt(),
                        config.halfOpenMaxCalls() - 1, current.consecutiveFailures());
                if (state.compareAndSet(current, probing)) {
                    log.info("[Breaker] '{}' half-open after cooldown", toolName);
                    return BreakerAdmission.permit(current.consecutiveFailures());
                }
                break;
            }
            case HALF_OPEN: {
                if (current.trialCallsRemaining() <= 0) {
                    return BreakerAdmission.reject(current.consecutiveFailures(), Duration.ZERO);
                }
                CircuitBreakerState fewer = CircuitBreakerState.halfOpen(current.openedAt(),
                        current.trialCallsRemaining() - 1, current.consecutiveFailures());
                if (state.compareAndSet(current, fewer)) {
                    return BreakerAdmission.permit(current.consecutiveFailures());
                }
                break;
            }
            default:
                throw new IllegalStateException("Unknown breaker status: " + current.status());
            }
        }
    }

    public void recordSuccess() {
        CircuitBreakerState previous = state.getAndUpdate(current -> current.isOpen()
                ? current
                : CircuitBreakerState.initial());
        if (previous.isHalfOpen()) {
            log.info("[Breaker] '{}' closed after successful trial call", toolName);
        }
    }

    public void recordFailure() {
        Instant now = clock.instant();
        CircuitBreakerState next = state.updateAndGet(current -> {
            int failures = current.consecutiveFailures() + 1;
            return switch (current.status()) {
            case CLOSED -> failures >= config.failureThreshold()
                    ? CircuitBreakerState.open(now, failures)
                    : CircuitBreakerState.closed(failures);
            case HALF_OPEN -> CircuitBreakerState.open(now, failures);
            case OPEN -> CircuitBreakerState.open(current.openedAt(), failures);
            };
        });
        if (next.isOpen() && next.openedAt().equals(now)) {
            log.warn("[Breaker] '{}' opened after {} consecutive failure(s)", toolName, next.consecutiveFailures());
        }
    }

    /**
     * Returns a trial slot taken by {@link #tryAcquire()} for a call that
     * produced no health verdict (missing tool, interrupted wait). Has no effect
     * outside the half-open state.
     */
    public void releaseTrialCall() {
        state.updateAndGet(current -> current.isHalfOpen()
                ? CircuitBreakerState.halfOpen(current.openedAt(),
                        Math.min(current.trialCallsRemaining() + 1, config.halfOpenMaxCalls()),
                        current.consecutiveFailures())
                : current);
    }

    public CircuitBreakerState state() {
        return state.get();
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    private Duration remainingCooldown(CircuitBreakerState open) {
        Duration elapsed = Duration.between(open.openedAt(), clock.instant());
        Duration remaining = config.recoveryTimeout().minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
