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

import lombok.Builder;

import java.time.Duration;
import java.util.List;

/**
 * Terminal output of a loop run.
 *
 * @param runId
 *            id of the run, shared by all of its journal entries
 * @param agentId
 *            agent the run was executed for
 * @param output
 *            final answer text, {@code null} unless completed
 * @param iterations
 *            reasoning calls made
 * @param usage
 *            cumulative token usage
 * @param terminationReason
 *            why the run ended
 * @param errorMessage
 *            why the run did not complete, {@code null} when completed
 * @param elapsed
 *            wall-clock duration of the run
 * @param conversation
 *            full raw conversation at the end of the run
 */
@Builder
public record LoopResult(String runId, String agentId, String output, int iterations, TokenUsage usage,
        TerminationReason terminationReason, String errorMessage, Duration elapsed, List<Message> conversation) {

    public LoopResult {
        conversation = conversation == null ? List.of() : List.copyOf(conversation);
        usage = usage == null ? TokenUsage.zero() : usage;
    }

    public boolean isCompleted() {
        return terminationReason == TerminationReason.COMPLETED;
    }
}
