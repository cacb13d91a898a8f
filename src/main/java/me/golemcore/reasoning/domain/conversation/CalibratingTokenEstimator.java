package me.golemcore.reasoning.domain.conversation;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.model.Message;

import java.util.List;

/**
 * Scales a base estimator by the observed ratio between provider-reported
 * prompt tokens and the base estimate. The ratio is smoothed across calls and
 * clamped to [{@value #MIN_FACTOR}, {@value #MAX_FACTOR}].
 */
@Slf4j
public class CalibratingTokenEstimator implements TokenEstimator {

    static final double MIN_FACTOR = 0.5;
    static final double MAX_FACTOR = 4.0;
    private static final double SMOOTHING = 0.5;

    private final TokenEstimator delegate;
    private double factor = 1.0;

    public CalibratingTokenEstimator(TokenEstimator delegate) {
        this.delegate = delegate;
    }

    @Override
    public int estimate(Message message) {
        return (int) Math.ceil(delegate.estimate(message) * currentFactor());
    }

    /**
     * Reconciles the estimate for {@code sentMessages} with the prompt tokens the
     * provider reported for them.
     */
    public void calibrate(List<Message> sentMessages, long reportedPromptTokens) {
        int raw = delegate.estimate(sentMessages);
        if (raw <= 0 || reportedPromptTokens <= 0) {
            return;
        }
        double observed = clamp((double) reportedPromptTokens / raw);
        synchronized (this) {
            factor = clamp(factor * (1 - SMOOTHING) + observed * SMOOTHING);
            log.debug("[Budget] Token estimate factor now {} (estimated {}, reported {})", factor, raw,
                    reportedPromptTokens);
        }
    }

    public synchronized double currentFactor() {
        return factor;
    }

    private static double clamp(double value) {
        return Math.max(MIN_FACTOR, Math.min(MAX_FACTOR, value));
    }
}
