package me.golemcore.reasoning.domain.executor;

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

import me.golemcore.reasoning.domain.breaker.CircuitBreakerRegistry;
import me.golemcore.reasoning.domain.model.LoopConfig;
import me.golemcore.reasoning.domain.model.Observation;
import me.golemcore.reasoning.domain.model.ProposedAction;

import java.time.Instant;
import java.util.List;

/**
 * Dispatches approved tool calls and turns every one of them into exactly one
 * observation, in the order the actions were given.
 */
public interface ActionExecutor {

    /**
     * @param actions
     *            approved tool calls
     * @param config
     *            run configuration (timeouts, concurrency, recovery)
     * @param breakers
     *            shared per-tool circuit breakers
     * @param deadline
     *            run deadline; no call is allowed to outlive it
     * @return one observation per action, same order
     */
    List<Observation> executeActions(List<ProposedAction> actions, LoopConfig config, CircuitBreakerRegistry breakers,
            Instant deadline);
}
