package me.golemcore.reasoning.domain.loop;

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

import java.time.Duration;

/**
 * Capped exponential backoff for retriable inference failures.
 *
 * @param maxAttempts
 *            total calls including the first one
 * @param initialBackoff
 *            delay before the first retry
 * @param maxBackoff
 *            upper bound for any single delay
 */
public record InferenceRetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public InferenceRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public static InferenceRetryPolicy defaults() {
        return new InferenceRetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(8));
    }

    public static InferenceRetryPolicy noRetry() {
        return new InferenceRetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Delay before retrying after the given failed attempt (1-based).
     */
    public Duration backoffFor(int failedAttempt) {
        long multiplier = 1L << Math.min(Math.max(failedAttempt - 1, 0), 20);
        Duration delay = initialBackoff.multipliedBy(multiplier);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    public boolean hasAttemptsAfter(int attempt) {
        return attempt < maxAttempts;
    }
}
