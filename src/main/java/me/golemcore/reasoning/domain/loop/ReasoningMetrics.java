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

import me.golemcore.reasoning.domain.model.TerminationReason;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters across loop runs. Safe to share between concurrent
 * runs.
 */
public class ReasoningMetrics {

    private final AtomicLong loopsStarted = new AtomicLong();
    private final AtomicLong loopsCompleted = new AtomicLong();
    private final AtomicLong loopsFailed = new AtomicLong();
    private final AtomicLong totalIterations = new AtomicLong();
    private final AtomicLong totalTokens = new AtomicLong();
    private final AtomicLong toolCalls = new AtomicLong();
    private final AtomicLong toolErrors = new AtomicLong();
    private final AtomicLong policyDenials = new AtomicLong();

    public void recordLoopStarted() {
        loopsStarted.incrementAndGet();
    }

    public void recordLoopFinished(TerminationReason reason, int iterations, long tokens) {
        if (reason == TerminationReason.COMPLETED) {
            loopsCompleted.incrementAndGet();
        } else {
            loopsFailed.incrementAndGet();
        }
        totalIterations.addAndGet(iterations);
        totalTokens.addAndGet(tokens);
    }

    public void recordToolCalls(int calls, int errors) {
        toolCalls.addAndGet(calls);
        toolErrors.addAndGet(errors);
    }

    public void recordPolicyDenials(int denials) {
        policyDenials.addAndGet(denials);
    }

    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(loopsStarted.get(), loopsCompleted.get(), loopsFailed.get(),
                totalIterations.get(), totalTokens.get(), toolCalls.get(), toolErrors.get(), policyDenials.get());
    }

    public void reset() {
        loopsStarted.set(0);
        loopsCompleted.set(0);
        loopsFailed.set(0);
        totalIterations.set(0);
        totalTokens.set(0);
        toolCalls.set(0);
        toolErrors.set(0);
        policyDenials.set(0);
    }
}
