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

import lombok.Builder;
import lombok.Getter;
import me.golemcore.reasoning.domain.Sleeper;
import me.golemcore.reasoning.domain.breaker.CircuitBreakerRegistry;
import me.golemcore.reasoning.domain.conversation.CalibratingTokenEstimator;
import me.golemcore.reasoning.domain.conversation.ContextBudgeter;
import me.golemcore.reasoning.domain.conversation.Conversation;
import me.golemcore.reasoning.domain.conversation.TokenEstimator;
import me.golemcore.reasoning.domain.executor.ActionExecutor;
import me.golemcore.reasoning.domain.journal.JournalRecorder;
import me.golemcore.reasoning.domain.knowledge.KnowledgeBridge;
import me.golemcore.reasoning.domain.model.InferenceOptions;
import me.golemcore.reasoning.domain.model.LoopConfig;
import me.golemcore.reasoning.domain.model.LoopEventType;
import me.golemcore.reasoning.domain.model.LoopState;
import me.golemcore.reasoning.domain.model.Message;
import me.golemcore.reasoning.domain.output.StructuredOutputValidator;
import me.golemcore.reasoning.domain.policy.PolicyGate;
import me.golemcore.reasoning.port.outbound.InferencePort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything one run shares between its phases. Created by the runner, owned by
 * a single thread.
 */
@Getter
@Builder
final class LoopRun {

    private final String runId;
    private final String agentId;
    private final LoopConfig config;
    private final Conversation conversation;
    private final LoopState state;
    private final Instant deadline;
    private final InferenceOptions inferenceOptions;

    private final InferencePort inference;
    private final InferenceRetryPolicy retryPolicy;
    private final PolicyGate policyGate;
    private final ActionExecutor executor;
    private final CircuitBreakerRegistry breakers;
    private final KnowledgeBridge knowledgeBridge;
    private final ContextBudgeter budgeter;
    private final TokenEstimator estimator;
    private final StructuredOutputValidator outputValidator;
    private final JournalRecorder journal;
    private final ReasoningMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    void record(LoopEventType event, Map<String, Object> payload) {
        journal.record(state.getIteration(), event, payload);
    }

    Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Feeds provider-reported prompt tokens back into the estimator when it
     * supports calibration.
     */
    void calibrate(List<Message> sentMessages, long reportedPromptTokens) {
        if (estimator instanceof CalibratingTokenEstimator calibrating) {
            calibrating.calibrate(sentMessages, reportedPromptTokens);
        }
    }
}
