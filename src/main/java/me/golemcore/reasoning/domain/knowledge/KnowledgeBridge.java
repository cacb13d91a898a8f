package me.golemcore.reasoning.domain.knowledge;

import me.golemcore.reasoning.domain.conversation.Conversation;
import me.golemcore.reasoning.domain.executor.ActionExecutor;
import me.golemcore.reasoning.domain.model.ToolDefinition;

import java.util.List;

/**
 * Connects a run to a persistent fact store. The loop calls every hook
 * unconditionally; {@link NoOpKnowledgeBridge} stands in when no store is
 * configured.
 */
public interface KnowledgeBridge {

    String RECALL_TOOL = "recall_knowledge";
    String STORE_TOOL = "store_knowledge";

    /**
     * Refreshes the conversation's knowledge slot before a reasoning call.
     */
    void injectContext(Conversation conversation);

    /**
     * Wraps the executor so reserved knowledge tools are answered by the bridge
     * and every other tool is delegated unchanged.
     */
    ActionExecutor intercept(ActionExecutor delegate);

    /**
     * Extra tools advertised to the model while this bridge is active.
     */
    List<ToolDefinition> toolDefinitions();

    /**
     * Stores what the run learned after it completed.
     */
    void persistLearnings(String agentId, Conversation conversation);

    static boolean isKnowledgeTool(String toolName) {
        return RECALL_TOOL.equals(toolName) || STORE_TOOL.equals(toolName);
    }
}
