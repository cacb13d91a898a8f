package me.golemcore.reasoning.domain.knowledge;

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
import me.golemcore.reasoning.domain.breaker.CircuitBreakerRegistry;
import me.golemcore.reasoning.domain.executor.ActionExecutor;
import me.golemcore.reasoning.domain.model.ExecutionErrorKind;
import me.golemcore.reasoning.domain.model.LoopConfig;
import me.golemcore.reasoning.domain.model.Observation;
import me.golemcore.reasoning.domain.model.ProposedAction;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Answers the reserved knowledge tools from the bridge and passes every other
 * action to the wrapped executor untouched. Observations keep the order of the
 * incoming actions.
 */
@Slf4j
public class KnowledgeAwareActionExecutor implements ActionExecutor {

    static final int DEFAULT_RECALL_LIMIT = 5;
    static final double DEFAULT_CONFIDENCE = 0.8;

    private final ActionExecutor delegate;
    private final StoreBackedKnowledgeBridge bridge;

    public KnowledgeAwareActionExecutor(ActionExecutor delegate, StoreBackedKnowledgeBridge bridge) {
        this.delegate = delegate;
        this.bridge = bridge;
    }

    @Override
    public List<Observation> executeActions(List<ProposedAction> actions, LoopConfig config,
            CircuitBreakerRegistry breakers, Instant deadline) {
        List<ProposedAction> delegated = new ArrayList<>();
        for (ProposedAction action : actions) {
            if (!KnowledgeBridge.isKnowledgeTool(action.toolName())) {
                delegated.add(action);
            }
        }
        Iterator<Observation> delegatedResults = delegated.isEmpty()
                ? List.<Observation>of().iterator()
                : delegate.executeActions(delegated, config, breakers, deadline).iterator();

        List<Observation> observations = new ArrayList<>(actions.size());
        for (ProposedAction action : actions) {
            if (KnowledgeBridge.isKnowledgeTool(action.toolName())) {
                observations.add(handle(action));
            } else {
                observations.add(delegatedResults.next());
            }
        }
        return observations;
    }

    private Observation handle(ProposedAction action) {
        Map<String, Object> args = action.arguments() != null ? action.arguments() : Map.of();
        try {
            if (KnowledgeBridge.RECALL_TOOL.equals(action.toolName())) {
                String query = stringArg(args, "query");
                if (query == null) {
                    return missing(action, "query");
                }
                int limit = (int) numberArg(args, "limit", DEFAULT_RECALL_LIMIT);
                return Observation.success(action, bridge.recall(query, Math.max(1, limit)), Duration.ZERO);
            }

            String subject = stringArg(args, "subject");
            String predicate = stringArg(args, "predicate");
            String object = stringArg(args, "object");
            if (subject == null || predicate == null || object == null) {
                return missing(action, subject == null ? "subject" : predicate == null ? "predicate" : "object");
            }
            double confidence = Math.max(0.0, Math.min(1.0, numberArg(args, "confidence", DEFAULT_CONFIDENCE)));
            return Observation.success(action, bridge.store(subject, predicate, object, confidence), Duration.ZERO);
        } catch (RuntimeException e) {
            log.warn("[Knowledge] '{}' failed: {}", action.toolName(), e.getMessage());
            return Observation.failure(action, ExecutionErrorKind.INVOCATION_FAILED,
                    "Knowledge store error: " + e.getMessage(), Duration.ZERO);
        }
    }

    private static Observation missing(ProposedAction action, String name) {
        return Observation.failure(action, ExecutionErrorKind.INVOCATION_FAILED,
                "Missing required argument '" + name + "'", Duration.ZERO).toBuilder()
                .retriable(false)
                .build();
    }

    private static String stringArg(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        return value.toString();
    }

    private static double numberArg(Map<String, Object> args, String name, double defaultValue) {
        Object value = args.get(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
