package me.golemcore.reasoning.domain.conversation;

import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Conversation rendered for a provider.
 *
 * @param system
 *            system prompt when the provider takes it out of band, otherwise
 *            {@code null}
 * @param messages
 *            provider-native message array
 */
public record RenderedConversation(String system, ArrayNode messages) {
}
