package me.golemcore.reasoning.domain.policy;

import me.golemcore.reasoning.domain.model.LoopDecision;
import me.golemcore.reasoning.domain.model.LoopState;
import me.golemcore.reasoning.domain.model.ProposedAction;

/**
 * Only tools advertised to the model in this run may be called.
 */
public class DeclaredToolRule implements PolicyRule {

    @Override
    public LoopDecision evaluate(String agentId, ProposedAction action, LoopState state) {
        if (!action.isToolCall() || state.isAdvertised(action.toolName())) {
            return LoopDecision.allow();
        }
        return LoopDecision.deny("Tool '" + action.toolName() + "' is not declared for this agent");
    }
}
