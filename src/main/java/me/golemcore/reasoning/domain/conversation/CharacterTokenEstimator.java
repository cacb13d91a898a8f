package me.golemcore.reasoning.domain.conversation;

import me.golemcore.reasoning.domain.model.Message;

/**
 * Roughly four characters per token, plus a fixed per-message overhead for
 * role and framing.
 */
public class CharacterTokenEstimator implements TokenEstimator {

    static final int CHARS_PER_TOKEN = 4;
    static final int MESSAGE_OVERHEAD = 4;

    @Override
    public int estimate(Message message) {
        if (message == null) {
            return 0;
        }
        int chars = message.getContent() != null ? message.getContent().length() : 0;
        if (message.hasToolCalls()) {
            for (Message.ToolCall toolCall : message.getToolCalls()) {
                chars += toolCall.getName() != null ? toolCall.getName().length() : 0;
                chars += toolCall.getArguments() != null ? toolCall.getArguments().toString().length() : 2;
            }
        }
        return Math.max(1, chars / CHARS_PER_TOKEN) + MESSAGE_OVERHEAD;
    }
}
