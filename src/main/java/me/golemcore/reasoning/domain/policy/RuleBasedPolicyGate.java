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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.model.LoopDecision;
import me.golemcore.reasoning.domain.model.LoopState;
import me.golemcore.reasoning.domain.model.ProposedAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Policy gate that runs an ordered list of rules.
 *
 * <p>
 * The first denial wins. Modifications accumulate: every later rule sees the
 * replacement produced by the earlier ones, and the final replacement is
 * returned with all reasons joined. A malformed action that a rule cannot
 * evaluate is denied.
 */
@Slf4j
public class RuleBasedPolicyGate implements PolicyGate {

    private final List<PolicyRule> rules;

    public RuleBasedPolicyGate(List<PolicyRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Gate with the default rule set: well-formedness, declared tools, the
     * deny-list and argument redaction.
     */
    public static RuleBasedPolicyGate withDefaultRules(Set<String> deniedTools, Set<String> redactedArgumentKeys) {
        return new RuleBasedPolicyGate(List.of(
                new WellFormedActionRule(),
                new DeclaredToolRule(),
                new DeniedToolsRule(deniedTools),
                new ArgumentRedactionRule(redactedArgumentKeys)));
    }

    @Override
    public LoopDecision evaluate(String agentId, ProposedAction action, LoopState state) {
        ProposedAction current = action;
        List<String> reasons = new ArrayList<>();

        for (PolicyRule rule : rules) {
            LoopDecision decision;
            try {
                decision = rule.evaluate(agentId, current, state);
            } catch (PolicyException e) {
                log.warn("[Policy] Malformed action {} from agent {}: {}", idOf(action), agentId, e.getMessage());
                return LoopDecision.deny("Malformed action: " + e.getMessage());
            }

            if (decision == null || decision.isAllowed()) {
                continue;
            }
            if (decision.isDenied()) {
                log.warn("[Policy] Denied {} for agent {}: {}", describe(current), agentId, decision.reason());
                return decision;
            }
            current = decision.replacement();
            reasons.add(decision.reason());
        }

        if (reasons.isEmpty()) {
            return LoopDecision.allow();
        }
        log.debug("[Policy] Modified {} for agent {}: {}", describe(current), agentId, reasons);
        return LoopDecision.modify(current, String.join("; ", reasons));
    }

    private static String idOf(ProposedAction action) {
        return action != null ? action.id() : null;
    }

    private static String describe(ProposedAction action) {
        if (action == null) {
            return "<null>";
        }
        return action.isToolCall() ? "tool call '" + action.toolName() + "'" : "final answer";
    }
}
