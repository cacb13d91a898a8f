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

import java.util.List;

/**
 * What the inference provider returned for one call.
 *
 * @param actions
 *            proposed actions, possibly empty
 * @param text
 *            assistant text that accompanied the actions, if any
 * @param usage
 *            provider-reported token usage
 * @param finishReason
 *            why generation stopped
 * @param model
 *            model that served the call
 */
@Builder
public record InferenceResult(List<ProposedAction> actions, String text, TokenUsage usage, FinishReason finishReason,
        String model) {

    public InferenceResult {
        actions = actions == null ? List.of() : List.copyOf(actions);
        usage = usage == null ? TokenUsage.zero() : usage;
        finishReason = finishReason == null ? FinishReason.OTHER : finishReason;
    }
}
