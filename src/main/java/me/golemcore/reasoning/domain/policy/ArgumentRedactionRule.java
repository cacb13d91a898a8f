package me.golemcore.reasoning.domain.policy;

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

import me.golemcore.reasoning.domain.model.LoopDecision;
import me.golemcore.reasoning.domain.model.LoopState;
import me.golemcore.reasoning.domain.model.ProposedAction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Replaces the values of sensitive top-level arguments with
 * {@value #REDACTED}. Keys match case-insensitively.
 */
public class ArgumentRedactionRule implements PolicyRule {

    public static final String REDACTED = "[REDACTED]";

    private final Set<String> redactedKeys;

    public ArgumentRedactionRule(Set<String> redactedKeys) {
        this.redactedKeys = redactedKeys == null ? Set.of()
                : redactedKeys.stream()
                        .map(key -> key.toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public LoopDecision evaluate(String agentId, ProposedAction action, LoopState state) {
        if (!action.isToolCall() || redactedKeys.isEmpty() || action.arguments() == null) {
            return LoopDecision.allow();
        }

        Map<String, Object> redacted = new LinkedHashMap<>();
        List<String> touched = new ArrayList<>();
        for (Map.Entry<String, Object> entry : action.arguments().entrySet()) {
            boolean sensitive = redactedKeys.contains(entry.getKey().toLowerCase(Locale.ROOT));
            if (sensitive && !REDACTED.equals(entry.getValue())) {
                redacted.put(entry.getKey(), REDACTED);
                touched.add(entry.getKey());
            } else {
                redacted.put(entry.getKey(), entry.getValue());
            }
        }

        if (touched.isEmpty()) {
            return LoopDecision.allow();
        }
        return LoopDecision.modify(action.withArguments(redacted),
                "Redacted argument(s): " + String.join(", ", touched));
    }
}
