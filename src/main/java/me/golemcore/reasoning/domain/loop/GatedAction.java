package me.golemcore.reasoning.domain.loop;

import me.golemcore.reasoning.domain.model.LoopDecision;
import me.golemcore.reasoning.domain.model.ProposedAction;

/**
 * A proposed action paired with the gate's verdict. {@code effective} is the
 * action that may proceed: the replacement for a modify, the original
 * otherwise.
 */
record GatedAction(ProposedAction original, LoopDecision decision) {

    ProposedAction effective() {
        return decision.isModified() ? decision.replacement() : original;
    }

    boolean approved() {
        return !decision.isDenied();
    }
}
