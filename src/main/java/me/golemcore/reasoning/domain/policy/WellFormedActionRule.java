package me.golemcore.reasoning.domain.policy;

import me.golemcore.reasoning.domain.model.LoopDecision;
import me.golemcore.reasoning.domain.model.LoopState;
import me.golemcore.reasoning.domain.model.ProposedAction;

/**
 * Rejects actions that cannot be evaluated at all.
 */
public class WellFormedActionRule implements PolicyRule {

    @Override
    public LoopDecision evaluate(String agentId, ProposedAction action, LoopState state) {
        if (action == null || action.kind() == null) {
            throw new PolicyException("action kind is missing");
        }
        if (action.isFinalAnswer()) {
            if (action.text() == null) {
                throw new PolicyException("final answer has no text");
            }
            return LoopDecision.allow();
        }
        if (action.toolName() == null || action.toolName().isBlank()) {
            throw new PolicyException("tool call has no tool name");
        }
        if (action.arguments() == null) {
            throw new PolicyException("arguments for tool '" + action.toolName() + "' could not be parsed");
        }
        return LoopDecision.allow();
    }
}
