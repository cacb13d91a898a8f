package me.golemcore.reasoning.domain.conversation;

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

import me.golemcore.reasoning.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces older tool results with a short placeholder once the conversation
 * exceeds the budget, keeping message order and tool call pairing intact. Falls
 * back to a sliding window when masking is not enough.
 */
public class ObservationMaskingBudgeter implements ContextBudgeter {

    private final TokenEstimator estimator;
    private final int keepRecent;

    public ObservationMaskingBudgeter(TokenEstimator estimator, int keepRecent) {
        this.estimator = estimator;
        this.keepRecent = Math.max(0, keepRecent);
    }

    @Override
    public ConversationView apply(Conversation conversation, int tokenBudget) {
        List<Message> full = conversation.requestMessages();
        int fullTokens = estimator.estimate(full);
        if (fullTokens <= tokenBudget) {
            return ConversationView.ofMessages(full, fullTokens);
        }

        List<String> diagnostics = new ArrayList<>();
        List<Message> history = conversation.historyMessages();
        int cutoff = history.size() - keepRecent;
        List<Message> masked = new ArrayList<>(history.size());
        int maskedCount = 0;
        for (int i = 0; i < history.size(); i++) {
            Message message = history.get(i);
            if (i < cutoff && message.isToolMessage()) {
                masked.add(Message.tool(message.getToolCallId(), message.getToolName(),
                        placeholder(message.getToolName())));
                maskedCount++;
            } else {
                masked.add(message);
            }
        }
        diagnostics.add("observation-masking: masked " + maskedCount + " tool result(s)");

        List<Message> pinned = conversation.pinnedMessages();
        List<Message> projected = new ArrayList<>(pinned);
        projected.addAll(masked);
        int projectedTokens = estimator.estimate(projected);
        if (projectedTokens <= tokenBudget) {
            return new ConversationView(projected, diagnostics, projectedTokens);
        }

        List<Message> windowed = SlidingWindowBudgeter.fit(pinned, masked, tokenBudget, estimator, diagnostics);
        return new ConversationView(windowed, diagnostics, estimator.estimate(windowed));
    }

    static String placeholder(String toolName) {
        return "[Previous " + (toolName != null ? toolName : "tool") + " result omitted for context management]";
    }
}
