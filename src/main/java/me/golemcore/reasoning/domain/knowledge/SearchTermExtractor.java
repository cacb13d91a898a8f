package me.golemcore.reasoning.domain.knowledge;

import me.golemcore.reasoning.domain.conversation.Conversation;
import me.golemcore.reasoning.domain.model.Message;

import java.util.List;

/**
 * Builds the knowledge query from the most recent user messages.
 */
final class SearchTermExtractor {

    static final int MAX_MESSAGES = 3;
    static final int MAX_CHARS = 500;

    private SearchTermExtractor() {
    }

    static String extract(Conversation conversation) {
        List<Message> history = conversation.historyMessages();
        StringBuilder query = new StringBuilder();
        int used = 0;
        for (int i = history.size() - 1; i >= 0 && used < MAX_MESSAGES; i--) {
            Message message = history.get(i);
            if (!message.isUserMessage() || message.getContent() == null || message.getContent().isBlank()) {
                continue;
            }
            if (query.length() > 0) {
                query.append(' ');
            }
            query.append(message.getContent().strip());
            used++;
        }
        return query.length() > MAX_CHARS ? query.substring(0, MAX_CHARS) : query.toString();
    }
}
