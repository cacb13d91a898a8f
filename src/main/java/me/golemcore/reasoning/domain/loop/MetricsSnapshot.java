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

/**
 * Point-in-time copy of {@link ReasoningMetrics}.
 */
public record MetricsSnapshot(long loopsStarted, long loopsCompleted, long loopsFailed, long totalIterations,
        long totalTokens, long toolCalls, long toolErrors, long policyDenials) {

    public long loopsFinished() {
        return loopsCompleted + loopsFailed;
    }

    /**
     * Share of finished runs that completed; 1.0 while nothing has finished.
     */
    public double successRate() {
        long finished = loopsFinished();
        return finished == 0 ? 1.0 : (double) loopsCompleted / finished;
    }

    public double avgIterations() {
        long finished = loopsFinished();
        return finished == 0 ? 0.0 : (double) totalIterations / finished;
    }

    public double avgTokens() {
        long finished = loopsFinished();
        return finished == 0 ? 0.0 : (double) totalTokens / finished;
    }
}
