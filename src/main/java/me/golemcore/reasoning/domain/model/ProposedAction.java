package me.golemcore.reasoning.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Candidate action emitted by the model in one iteration: either a tool call or
 * a final answer. Discarded once the iteration that produced it is observed.
 *
 * @param kind
 *            tool call or final answer
 * @param id
 *            provider-assigned id (tool_call_id for tool calls)
 * @param toolName
 *            tool to invoke, {@code null} for final answers
 * @param arguments
 *            tool arguments, {@code null} when the provider sent unparsable
 *            arguments
 * @param text
 *            answer text, {@code null} for tool calls
 */
public record ProposedAction(ActionKind kind, String id, String toolName, Map<String, Object> arguments,
        String text) {

    public ProposedAction {
        arguments = arguments == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ProposedAction toolCall(String id, String toolName, Map<String, Object> arguments) {
        return new ProposedAction(ActionKind.TOOL_CALL, id, toolName, arguments, null);
    }

    public static ProposedAction finalAnswer(String id, String text) {
        return new ProposedAction(ActionKind.FINAL_ANSWER, id, null, null, text);
    }

    public boolean isToolCall() {
        return kind == ActionKind.TOOL_CALL;
    }

    public boolean isFinalAnswer() {
        return kind == ActionKind.FINAL_ANSWER;
    }

    public ProposedAction withArguments(Map<String, Object> replacementArguments) {
        return new ProposedAction(kind, id, toolName, replacementArguments, text);
    }

    public Message.ToolCall toToolCall() {
        return Message.ToolCall.builder()
                .id(id)
                .name(toolName)
                .arguments(arguments != null ? arguments : Map.of())
                .build();
    }
}
