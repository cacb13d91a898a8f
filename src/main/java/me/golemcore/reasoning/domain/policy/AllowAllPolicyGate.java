package me.golemcore.reasoning.domain.policy;

import me.golemcore.reasoning.domain.model.LoopDecision;
import me.golemcore.reasoning.domain.model.LoopState;
import me.golemcore.reasoning.domain.model.ProposedAction;

/** Permissive gate for embedding and tests. */
public class AllowAllPolicyGate implements PolicyGate {

    @Override
    public LoopDecision evaluate(String agentId, ProposedAction action, LoopState state) {
        return LoopDecision.allow();
    }
}
