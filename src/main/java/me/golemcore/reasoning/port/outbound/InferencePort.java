package me.golemcore.reasoning.port.outbound;

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

import me.golemcore.reasoning.domain.model.InferenceOptions;
import me.golemcore.reasoning.domain.model.InferenceResult;
import me.golemcore.reasoning.domain.model.Message;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for model backends. Turns a conversation into zero or more proposed
 * actions plus usage accounting.
 *
 * <p>
 * Failures complete the future exceptionally with an {@link InferenceException}
 * whose kind tells the loop whether the call may be retried.
 */
public interface InferencePort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    CompletableFuture<InferenceResult> infer(List<Message> messages, InferenceOptions options);
}
