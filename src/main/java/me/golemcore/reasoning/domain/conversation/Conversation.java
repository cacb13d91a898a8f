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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, append-only message log owned by one loop run.
 *
 * <p>
 * At most one system message is allowed and it must come first. Retrieved
 * knowledge lives in a single replaceable slot that is projected right after the
 * system message; it is never part of the raw log.
 */
public class Conversation {

    public static final String KNOWLEDGE_CONTEXT_MARKER = "[KNOWLEDGE_CONTEXT]";

    private final List<Message> messages = new ArrayList<>();
    private Message knowledgeContext;

    public static Conversation of(List<Message> initialMessages) {
        Conversation conversation = new Conversation();
        if (initialMessages != null) {
            initialMessages.forEach(conversation::push);
        }
        return conversation;
    }

    public void push(Message message) {
        Objects.requireNonNull(message, "message must not be null");
        if (message.getRole() == null) {
            throw new IllegalArgumentException("message role must not be null");
        }
        if (message.isSystemMessage() && !messages.isEmpty()) {
            throw new IllegalArgumentException("A system message is only allowed as the first message");
        }
        messages.add(message);
    }

    public List<Message> messages() {
        return Collections.unmodifiableList(messages);
    }

    public int size() {
        return messages.size();
    }

    public Optional<Message> systemMessage() {
        if (!messages.isEmpty() && messages.get(0).isSystemMessage()) {
            return Optional.of(messages.get(0));
        }
        return Optional.empty();
    }

    /**
     * Replaces the knowledge slot. A {@code null} or blank context clears it.
     */
    public void injectKnowledgeContext(String context) {
        if (context == null || context.isBlank()) {
            knowledgeContext = null;
            return;
        }
        knowledgeContext = Message.user(KNOWLEDGE_CONTEXT_MARKER + "\n" + context);
    }

    public Optional<Message> knowledgeContextMessage() {
        return Optional.ofNullable(knowledgeContext);
    }

    /**
     * Messages every projection keeps: the system message and the knowledge
     * slot.
     */
    public List<Message> pinnedMessages() {
        List<Message> pinned = new ArrayList<>(2);
        systemMessage().ifPresent(pinned::add);
        knowledgeContextMessage().ifPresent(pinned::add);
        return pinned;
    }

    /**
     * Everything after the system message, oldest first.
     */
    public List<Message> historyMessages() {
        int from = systemMessage().isPresent() ? 1 : 0;
        return Collections.unmodifiableList(messages.subList(from, messages.size()));
    }

    /**
     * Full projection before budgeting: pinned messages followed by history.
     */
    public List<Message> requestMessages() {
        List<Message> result = new ArrayList<>(pinnedMessages());
        result.addAll(historyMessages());
        return result;
    }

    public ConversationView enforceBudget(ContextBudgeter budgeter, int tokenBudget) {
        return budgeter.apply(this, tokenBudget);
    }

    public RenderedConversation renderForProvider(ProviderMessageRenderer renderer, ProviderFormat format) {
        return renderer.render(requestMessages(), format);
    }
}
