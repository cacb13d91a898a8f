package me.golemcore.reasoning.adapter.outbound.tools;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.component.ToolComponent;
import me.golemcore.reasoning.domain.model.ExecutionErrorKind;
import me.golemcore.reasoning.domain.model.ToolDefinition;
import me.golemcore.reasoning.domain.model.ToolResult;
import me.golemcore.reasoning.port.outbound.ToolInvocationPort;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Invokes registered {@link ToolComponent}s in-process. Unknown and disabled
 * tools complete with a failure result instead of exceptionally.
 */
@Slf4j
public class ToolRegistryInvocationAdapter implements ToolInvocationPort {

    private final Map<String, ToolComponent> toolRegistry = new TreeMap<>();
    private final int maxOutputChars;

    public ToolRegistryInvocationAdapter(List<ToolComponent> tools, int maxOutputChars) {
        this.maxOutputChars = maxOutputChars;
        for (ToolComponent tool : tools) {
            String name = tool.getToolName();
            if (name == null || name.isBlank()) {
                log.warn("[Tools] Skipping tool without a name: {}", tool.getClass().getSimpleName());
                continue;
            }
            toolRegistry.put(name, tool);
        }
        log.info("[Tools] Registered {} tool(s): {}", toolRegistry.size(), toolRegistry.keySet());
    }

    @Override
    public CompletableFuture<ToolResult> invoke(String toolName, Map<String, Object> arguments, Duration timeout) {
        String name = sanitizeToolName(toolName);
        ToolComponent tool = name != null ? toolRegistry.get(name) : null;
        if (tool == null) {
            String available = String.join(", ", toolRegistry.keySet());
            return CompletableFuture.completedFuture(ToolResult.failure(ExecutionErrorKind.TOOL_NOT_FOUND,
                    "Unknown tool: " + name + ". Available tools: " + available));
        }
        if (!tool.isEnabled()) {
            return CompletableFuture.completedFuture(ToolResult.failure(ExecutionErrorKind.TOOL_NOT_FOUND,
                    "Tool is disabled: " + name));
        }

        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(arguments != null ? arguments : Map.of());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            future = future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return future.thenApply(result -> truncate(result, name));
    }

    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>(toolRegistry.size());
        for (ToolComponent tool : toolRegistry.values()) {
            if (tool.isEnabled()) {
                definitions.add(tool.getDefinition());
            }
        }
        return definitions;
    }

    public Set<String> toolNames() {
        return toolRegistry.keySet();
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private ToolResult truncate(ToolResult result, String toolName) {
        if (result == null || !result.isSuccess()) {
            return result;
        }
        String output = truncateToolResult(result.getOutput(), toolName);
        if (output == null || output.equals(result.getOutput())) {
            return result;
        }
        return ToolResult.success(output, result.getData());
    }

    /**
     * Truncate tool output that exceeds the configured max length.
     */
    String truncateToolResult(String content, String toolName) {
        if (content == null || maxOutputChars <= 0 || content.length() <= maxOutputChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxOutputChars + " chars. The full result is too large for the context window."
                + " Try a more specific query, use filtering/pagination, or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxOutputChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }
}
