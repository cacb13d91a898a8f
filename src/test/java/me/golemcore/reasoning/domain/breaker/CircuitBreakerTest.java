package me.golemcore.reasoning.domain.breaker;

import me.golemcore.reasoning.domain.model.CircuitBreakerState;
import me.golemcore.reasoning.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");
    private static final Duration COOLDOWN = Duration.ofSeconds(30);

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW, ZoneId.of("UTC"));
        breaker = new CircuitBreaker("search", new CircuitBreakerConfig(3, COOLDOWN, 2), clock);
    }

    @Test
    void shouldStayClosedBelowThreshold() {
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(CircuitBreakerState.Status.CLOSED, breaker.state().status());
        assertEquals(2, breaker.state().consecutiveFailures());
        assertTrue(breaker.tryAcquire().permitted());
    }

    @Test
    void shouldResetFailuresOnSuccess() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertEquals(CircuitBreakerState.Status.CLOSED, breaker.state().status());
        assertEquals(1, breaker.state().consecutiveFailures());
    }

    @Test
    void shouldOpenAtThresholdAndRejectWithRemainingCooldown() {
        openBreaker();

        assertTrue(breaker.state().isOpen());
        assertEquals(NOW, breaker.state().openedAt());

        clock.advance(Duration.ofSeconds(10));
        BreakerAdmission admission = breaker.tryAcquire();
        assertFalse(admission.permitted());
        assertEquals(3, admission.consecutiveFailures());
        assertEquals(Duration.ofSeconds(20), admission.retryAfter());
    }

    @Test
    void shouldAdmitLimitedTrialCallsAfterCooldown() {
        openBreaker();
        clock.advance(COOLDOWN);

        assertTrue(breaker.tryAcquire().permitted());
        assertTrue(breaker.state().isHalfOpen());
        assertTrue(breaker.tryAcquire().permitted());
        assertFalse(breaker.tryAcquire().permitted());
    }

    @Test
    void shouldCloseAfterSuccessfulTrialCall() {
        openBreaker();
        clock.advance(COOLDOWN);
        breaker.tryAcquire();

        breaker.recordSuccess();

        assertEquals(CircuitBreakerState.Status.CLOSED, breaker.state().status());
        assertEquals(0, breaker.state().consecutiveFailures());
    }

    @Test
    void shouldReopenAfterFailedTrialCall() {
        openBreaker();
        clock.advance(COOLDOWN);
        breaker.tryAcquire();

        clock.advance(Duration.ofSeconds(1));
        breaker.recordFailure();

        assertTrue(breaker.state().isOpen());
        assertEquals(NOW.plus(COOLDOWN).plusSeconds(1), breaker.state().openedAt());
        assertFalse(breaker.tryAcquire().permitted());
    }

    @Test
    void shouldReturnReleasedTrialSlot() {
        openBreaker();
        clock.advance(COOLDOWN);
        breaker.tryAcquire();
        breaker.tryAcquire();
        assertFalse(breaker.tryAcquire().permitted());

        breaker.releaseTrialCall();

        assertEquals(1, breaker.state().trialCallsRemaining());
        assertTrue(breaker.tryAcquire().permitted());
    }

    @Test
    void shouldNotReleaseMoreTrialCallsThanConfigured() {
        openBreaker();
        clock.advance(COOLDOWN);
        breaker.tryAcquire();

        breaker.releaseTrialCall();
        breaker.releaseTrialCall();

        assertEquals(2, breaker.state().trialCallsRemaining());
    }

    @Test
    void shouldIgnoreTrialReleaseOutsideHalfOpen() {
        breaker.releaseTrialCall();
        assertEquals(CircuitBreakerState.initial(), breaker.state());

        openBreaker();
        breaker.releaseTrialCall();
        assertTrue(breaker.state().isOpen());
    }

    @Test
    void shouldIgnoreSuccessWhileOpen() {
        openBreaker();

        breaker.recordSuccess();

        assertTrue(breaker.state().isOpen());
    }

    @Test
    void shouldRejectInvalidConfig() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerConfig(0, COOLDOWN, 1));
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerConfig(1, COOLDOWN, 0));
        assertEquals(Duration.ZERO, new CircuitBreakerConfig(1, null, 1).recoveryTimeout());
    }

    private void openBreaker() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordFailure();
    }
}
