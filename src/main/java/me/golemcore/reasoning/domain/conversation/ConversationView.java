package me.golemcore.reasoning.domain.conversation;

import me.golemcore.reasoning.domain.model.Message;

import java.util.List;

/**
 * Request-time projection of a conversation.
 *
 * <p>
 * Raw history is never mutated. Any eviction, masking or summarization done to
 * stay inside the token budget is represented only in the view.
 */
public record ConversationView(List<Message> messages, List<String> diagnostics, int estimatedTokens) {

    public ConversationView {
        messages = messages == null ? List.of() : List.copyOf(messages);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static ConversationView ofMessages(List<Message> messages, int estimatedTokens) {
        return new ConversationView(messages, List.of(), estimatedTokens);
    }
}
