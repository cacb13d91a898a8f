package me.golemcore.reasoning.domain.policy;

import me.golemcore.reasoning.domain.model.LoopDecision;
import me.golemcore.reasoning.domain.model.LoopState;
import me.golemcore.reasoning.domain.model.ProposedAction;

/**
 * A single rule of {@link RuleBasedPolicyGate}. Throws {@link PolicyException}
 * when the action is too malformed to evaluate.
 */
public interface PolicyRule {

    LoopDecision evaluate(String agentId, ProposedAction action, LoopState state);
}
