package me.golemcore.reasoning.domain.knowledge;

import me.golemcore.reasoning.domain.conversation.Conversation;
import me.golemcore.reasoning.domain.executor.ActionExecutor;
import me.golemcore.reasoning.domain.model.ToolDefinition;

import java.util.List;

/**
 * Bridge used when no knowledge store is configured.
 */
public final class NoOpKnowledgeBridge implements KnowledgeBridge {

    public static final NoOpKnowledgeBridge INSTANCE = new NoOpKnowledgeBridge();

    private NoOpKnowledgeBridge() {
    }

    @Override
    public void injectContext(Conversation conversation) {
        // nothing to inject
    }

    @Override
    public ActionExecutor intercept(ActionExecutor delegate) {
        return delegate;
    }

    @Override
    public List<ToolDefinition> toolDefinitions() {
        return List.of();
    }

    @Override
    public void persistLearnings(String agentId, Conversation conversation) {
        // nothing to persist
    }
}
