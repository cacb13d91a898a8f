package me.golemcore.reasoning.domain.conversation;

/**
 * Provider-native conversation wire shapes.
 */
public enum ProviderFormat {
    OPENAI, ANTHROPIC
}
