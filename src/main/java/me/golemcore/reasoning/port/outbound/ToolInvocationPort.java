package me.golemcore.reasoning.port.outbound;

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

import me.golemcore.reasoning.domain.model.ToolResult;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Hand-off point for approved tool calls. Implementations may route through an
 * isolation layer; the loop does not depend on how.
 */
public interface ToolInvocationPort {

    /**
     * Invokes a tool. Unknown tools complete with a
     * {@code TOOL_NOT_FOUND} failure result rather than exceptionally.
     *
     * @param toolName
     *            declared tool name
     * @param arguments
     *            call arguments
     * @param timeout
     *            time the caller is willing to wait
     * @return a future with the tool result
     */
    CompletableFuture<ToolResult> invoke(String toolName, Map<String, Object> arguments, Duration timeout);
}
