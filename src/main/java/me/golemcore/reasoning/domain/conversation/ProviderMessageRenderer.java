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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.model.Message;

import java.util.List;
import java.util.Map;

/**
 * Serializes messages into OpenAI chat-completions or Anthropic messages wire
 * shapes.
 */
@Slf4j
public class ProviderMessageRenderer {

    private static final String ROLE = "role";
    private static final String CONTENT = "content";
    private static final String TYPE = "type";

    private final ObjectMapper objectMapper;

    public ProviderMessageRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RenderedConversation render(List<Message> messages, ProviderFormat format) {
        return switch (format) {
        case OPENAI -> new RenderedConversation(null, renderOpenAi(messages));
        case ANTHROPIC -> renderAnthropic(messages);
        };
    }

    private ArrayNode renderOpenAi(List<Message> messages) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Message message : messages) {
            ObjectNode node = array.addObject();
            node.put(ROLE, message.getRole().wireName());
            if (message.isToolMessage()) {
                node.put("tool_call_id", message.getToolCallId());
                node.put(CONTENT, nullToEmpty(message.getContent()));
                continue;
            }
            if (message.hasToolCalls()) {
                if (message.getContent() == null || message.getContent().isBlank()) {
                    node.putNull(CONTENT);
                } else {
                    node.put(CONTENT, message.getContent());
                }
                ArrayNode toolCalls = node.putArray("tool_calls");
                for (Message.ToolCall toolCall : message.getToolCalls()) {
                    ObjectNode call = toolCalls.addObject();
                    call.put("id", toolCall.getId());
                    call.put(TYPE, "function");
                    ObjectNode function = call.putObject("function");
                    function.put("name", toolCall.getName());
                    function.put("arguments", argumentsAsJson(toolCall.getArguments()));
                }
                continue;
            }
            node.put(CONTENT, nullToEmpty(message.getContent()));
        }
        return array;
    }

    private RenderedConversation renderAnthropic(List<Message> messages) {
        String system = null;
        ArrayNode array = objectMapper.createArrayNode();
        ArrayNode pendingToolResults = null;

        for (Message message : messages) {
            if (message.isSystemMessage()) {
                system = message.getContent();
                continue;
            }
            if (message.isToolMessage()) {
                // consecutive tool results share one user turn
                if (pendingToolResults == null) {
                    ObjectNode userTurn = array.addObject();
                    userTurn.put(ROLE, "user");
                    pendingToolResults = userTurn.putArray(CONTENT);
                }
                ObjectNode block = pendingToolResults.addObject();
                block.put(TYPE, "tool_result");
                block.put("tool_use_id", message.getToolCallId());
                block.put(CONTENT, nullToEmpty(message.getContent()));
                continue;
            }
            pendingToolResults = null;

            ObjectNode node = array.addObject();
            node.put(ROLE, message.isAssistantMessage() ? "assistant" : "user");
            if (!message.hasToolCalls()) {
                node.put(CONTENT, nullToEmpty(message.getContent()));
                continue;
            }
            ArrayNode blocks = node.putArray(CONTENT);
            if (message.getContent() != null && !message.getContent().isBlank()) {
                ObjectNode text = blocks.addObject();
                text.put(TYPE, "text");
                text.put("text", message.getContent());
            }
            for (Message.ToolCall toolCall : message.getToolCalls()) {
                ObjectNode toolUse = blocks.addObject();
                toolUse.put(TYPE, "tool_use");
                toolUse.put("id", toolCall.getId());
                toolUse.put("name", toolCall.getName());
                toolUse.set("input", objectMapper.valueToTree(
                        toolCall.getArguments() != null ? toolCall.getArguments() : Map.of()));
            }
        }
        return new RenderedConversation(system, array);
    }

    private String argumentsAsJson(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            log.warn("[Render] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
