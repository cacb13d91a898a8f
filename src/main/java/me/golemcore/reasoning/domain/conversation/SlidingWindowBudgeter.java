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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Drops the oldest non-pinned messages until the projection fits. Tool messages
 * left at the head of the window without the assistant call they answer are
 * dropped too.
 */
public class SlidingWindowBudgeter implements ContextBudgeter {

    private final TokenEstimator estimator;

    public SlidingWindowBudgeter(TokenEstimator estimator) {
        this.estimator = estimator;
    }

    @Override
    public ConversationView apply(Conversation conversation, int tokenBudget) {
        List<String> diagnostics = new ArrayList<>();
        List<Message> messages = fit(conversation.pinnedMessages(), conversation.historyMessages(), tokenBudget,
                estimator, diagnostics);
        return new ConversationView(messages, diagnostics, estimator.estimate(messages));
    }

    static List<Message> fit(List<Message> pinned, List<Message> history, int tokenBudget,
            TokenEstimator estimator, List<String> diagnostics) {
        int remaining = tokenBudget - estimator.estimate(pinned);
        if (remaining < 0) {
            diagnostics.add("sliding-window: pinned messages alone exceed budget of " + tokenBudget);
            return new ArrayList<>(pinned);
        }

        Deque<Message> kept = new ArrayDeque<>();
        for (int i = history.size() - 1; i >= 0; i--) {
            int cost = estimator.estimate(history.get(i));
            if (cost > remaining) {
                break;
            }
            kept.addFirst(history.get(i));
            remaining -= cost;
        }

        int dropped = history.size() - kept.size();
        if (dropped > 0) {
            while (!kept.isEmpty() && kept.peekFirst().isToolMessage()) {
                kept.removeFirst();
                dropped++;
            }
            diagnostics.add("sliding-window: dropped " + dropped + " oldest message(s)");
        }

        List<Message> result = new ArrayList<>(pinned.size() + kept.size());
        result.addAll(pinned);
        result.addAll(kept);
        return result;
    }
}
