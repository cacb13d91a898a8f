package me.golemcore.reasoning.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Instant;

/**
 * Snapshot of one tool's circuit breaker. Instances are immutable; the registry
 * swaps them atomically.
 *
 * @param status
 *            closed, open or half-open
 * @param openedAt
 *            when the breaker last opened, {@code null} when closed
 * @param trialCallsRemaining
 *            calls still admitted while half-open
 * @param consecutiveFailures
 *            failures since the last success
 */
public record CircuitBreakerState(Status status, Instant openedAt, int trialCallsRemaining, int consecutiveFailures) {

    public enum Status {
        CLOSED, OPEN, HALF_OPEN
    }

    private static final CircuitBreakerState INITIAL = new CircuitBreakerState(Status.CLOSED, null, 0, 0);

    public static CircuitBreakerState initial() {
        return INITIAL;
    }

    public static CircuitBreakerState closed(int consecutiveFailures) {
        return consecutiveFailures == 0 ? INITIAL
                : new CircuitBreakerState(Status.CLOSED, null, 0, consecutiveFailures);
    }

    public static CircuitBreakerState open(Instant since, int consecutiveFailures) {
        return new CircuitBreakerState(Status.OPEN, since, 0, consecutiveFailures);
    }

    public static CircuitBreakerState halfOpen(Instant openedAt, int trialCallsRemaining, int consecutiveFailures) {
        return new CircuitBreakerState(Status.HALF_OPEN, openedAt, trialCallsRemaining, consecutiveFailures);
    }

    public boolean isClosed() {
        return status == Status.CLOSED;
    }

    public boolean isOpen() {
        return status == Status.OPEN;
    }

    public boolean isHalfOpen() {
        return status == Status.HALF_OPEN;
    }
}
