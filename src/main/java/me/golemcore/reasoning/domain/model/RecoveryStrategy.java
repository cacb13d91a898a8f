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

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * How a failed action is recovered. Resolved per failed action: a tool-specific
 * override first, then the run-wide default.
 *
 * @param kind
 *            strategy variant
 * @param maxAttempts
 *            extra attempts for {@link Kind#RETRY}
 * @param baseDelay
 *            first backoff delay for {@link Kind#RETRY}, doubled per attempt
 * @param alternatives
 *            declared tools tried in order for {@link Kind#FALLBACK}
 * @param maxStaleness
 *            oldest acceptable cached result for {@link Kind#CACHED_RESULT}
 * @param queue
 *            escalation queue for {@link Kind#ESCALATE}
 */
public record RecoveryStrategy(Kind kind, int maxAttempts, Duration baseDelay, List<String> alternatives,
        Duration maxStaleness, String queue) {

    public enum Kind {
        RETRY, FALLBACK, CACHED_RESULT, LLM_RECOVERY, ESCALATE, DEAD_LETTER;

        public static Kind parse(String value) {
            return Kind.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        }
    }

    public RecoveryStrategy {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        baseDelay = baseDelay == null ? Duration.ZERO : baseDelay;
        maxStaleness = maxStaleness == null ? Duration.ZERO : maxStaleness;
    }

    public static RecoveryStrategy retry(int maxAttempts, Duration baseDelay) {
        return new RecoveryStrategy(Kind.RETRY, maxAttempts, baseDelay, List.of(), null, null);
    }

    public static RecoveryStrategy fallback(List<String> alternatives) {
        return new RecoveryStrategy(Kind.FALLBACK, 0, null, alternatives, null, null);
    }

    public static RecoveryStrategy cachedResult(Duration maxStaleness) {
        return new RecoveryStrategy(Kind.CACHED_RESULT, 0, null, List.of(), maxStaleness, null);
    }

    public static RecoveryStrategy llmRecovery() {
        return new RecoveryStrategy(Kind.LLM_RECOVERY, 0, null, List.of(), null, null);
    }

    public static RecoveryStrategy escalate(String queue) {
        return new RecoveryStrategy(Kind.ESCALATE, 0, null, List.of(), null, queue);
    }

    public static RecoveryStrategy deadLetter() {
        return new RecoveryStrategy(Kind.DEAD_LETTER, 0, null, List.of(), null, null);
    }

    public static RecoveryStrategy defaultStrategy() {
        return retry(2, Duration.ofMillis(500));
    }
}
