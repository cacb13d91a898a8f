package me.golemcore.reasoning.domain.loop;

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
import me.golemcore.reasoning.domain.model.LoopEventType;
import me.golemcore.reasoning.domain.model.Message;
import me.golemcore.reasoning.domain.model.ProposedAction;
import me.golemcore.reasoning.domain.policy.PolicyException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Second phase of an iteration. {@link #checkPolicy()} puts every proposed
 * action through the policy gate and yields the {@link ToolDispatchingPhase}.
 */
@Slf4j
public final class PolicyCheckPhase {

    private final LoopRun run;
    private final List<ProposedAction> actions;
    private final String text;
    private boolean used;

    PolicyCheckPhase(LoopRun run, List<ProposedAction> actions, String text) {
        this.run = run;
        this.actions = List.copyOf(actions);
        this.text = text;
    }

    public List<ProposedAction> proposedActions() {
        return actions;
    }

    /**
     * Evaluates each action, records the assistant turn with the approved form
     * of every tool call, and carries only allowed or modified tool calls
     * forward. Denied tool calls travel on as synthetic observations.
     */
    public ToolDispatchingPhase checkPolicy() {
        markUsed("checked policy");
        List<GatedAction> toolCalls = new ArrayList<>();
        GatedAction finalAnswer = null;
        int denied = 0;
        int modified = 0;

        for (ProposedAction action : actions) {
            GatedAction gated = new GatedAction(action, evaluate(action));
            if (gated.decision().isDenied()) {
                denied++;
            } else if (gated.decision().isModified()) {
                modified++;
            }
            if (action.isToolCall()) {
                toolCalls.add(gated);
            } else if (finalAnswer == null) {
                finalAnswer = gated;
            }
        }

        run.getConversation().push(assistantMessage(toolCalls, finalAnswer));
        run.getMetrics().recordPolicyDenials(denied);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("actionCount", actions.size());
        payload.put("deniedCount", denied);
        payload.put("modifiedCount", modified);
        run.record(LoopEventType.POLICY_EVALUATED, payload);

        return new ToolDispatchingPhase(run, toolCalls, finalAnswer);
    }

    private LoopDecision evaluate(ProposedAction action) {
        LoopDecision decision;
        try {
            decision = run.getPolicyGate().evaluate(run.getAgentId(), action, run.getState());
        } catch (PolicyException e) {
            decision = LoopDecision.deny("Malformed action: " + e.getMessage());
        }
        if (decision == null) {
            decision = LoopDecision.deny("Policy gate returned no decision");
        }
        if (decision.isDenied()) {
            log.warn("[Policy] Run {} denied {}: {}", run.getRunId(),
                    action.isToolCall() ? "tool call '" + action.toolName() + "'" : "final answer",
                    decision.reason());
        }
        return decision;
    }

    private Message assistantMessage(List<GatedAction> toolCalls, GatedAction finalAnswer) {
        String content = text;
        if ((content == null || content.isBlank()) && finalAnswer != null) {
            content = finalAnswer.effective().text();
        }
        if (toolCalls.isEmpty()) {
            return Message.assistant(content);
        }
        List<Message.ToolCall> calls = new ArrayList<>(toolCalls.size());
        for (GatedAction gated : toolCalls) {
            calls.add(gated.effective().toToolCall());
        }
        return Message.assistantToolCalls(content, calls);
    }

    private void markUsed(String transition) {
        if (used) {
            throw new IllegalStateException("Phase of run " + run.getRunId() + " already " + transition);
        }
        used = true;
    }
}
