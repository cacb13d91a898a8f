package me.golemcore.reasoning.domain.model;

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

import lombok.Builder;

import java.time.Duration;

/**
 * Outcome of one dispatched (or denied) action, appended to the conversation
 * as a tool message before the next reasoning call.
 *
 * @param sourceActionId
 *            id of the proposed action this observation answers
 * @param toolName
 *            tool that was (or would have been) invoked
 * @param success
 *            whether the action produced a payload
 * @param payload
 *            tool output on success
 * @param error
 *            failure description on failure
 * @param errorKind
 *            failure category, {@code null} on success
 * @param retriable
 *            whether the failure may succeed if attempted again
 * @param duration
 *            wall-clock time spent, including recovery
 * @param recovery
 *            recovery strategy that shaped this observation, if any
 * @param recoveryNote
 *            short description of what recovery did
 * @param escalated
 *            flagged for human handling
 * @param escalationQueue
 *            queue the escalation is addressed to
 * @param deadLettered
 *            recorded as permanently failed
 */
@Builder(toBuilder = true)
public record Observation(String sourceActionId, String toolName, boolean success, String payload, String error,
        ExecutionErrorKind errorKind, boolean retriable, Duration duration, RecoveryStrategy.Kind recovery,
        String recoveryNote, boolean escalated, String escalationQueue, boolean deadLettered) {

    public static final String ERROR_PREFIX = "[Error] ";
    public static final String DENIAL_PREFIX = "[Policy Denied] ";

    public static Observation success(ProposedAction action, String payload, Duration duration) {
        return Observation.builder()
                .sourceActionId(action.id())
                .toolName(action.toolName())
                .success(true)
                .payload(payload)
                .duration(duration)
                .build();
    }

    public static Observation failure(ProposedAction action, ExecutionErrorKind kind, String error,
            Duration duration) {
        return Observation.builder()
                .sourceActionId(action.id())
                .toolName(action.toolName())
                .success(false)
                .error(error)
                .errorKind(kind)
                .retriable(kind != null && kind.isRetriable())
                .duration(duration)
                .build();
    }

    /**
     * Synthetic observation for an action the policy gate refused; never
     * executed.
     */
    public static Observation denied(ProposedAction action, String reason) {
        return Observation.builder()
                .sourceActionId(action.id())
                .toolName(action.toolName())
                .success(false)
                .error(reason)
                .errorKind(ExecutionErrorKind.POLICY_DENIED)
                .retriable(false)
                .duration(Duration.ZERO)
                .build();
    }

    public boolean isPolicyDenial() {
        return errorKind == ExecutionErrorKind.POLICY_DENIED;
    }

    /**
     * Text written into the tool message that carries this observation.
     */
    public String toMessageContent() {
        if (success) {
            String body = payload != null ? payload : "";
            return recoveryNote != null ? "[" + recoveryNote + "] " + body : body;
        }
        if (isPolicyDenial()) {
            return DENIAL_PREFIX + error;
        }
        StringBuilder sb = new StringBuilder(ERROR_PREFIX).append(error);
        if (escalated) {
            sb.append("\n[Escalated for human review: ").append(escalationQueue).append(']');
        } else if (deadLettered) {
            sb.append("\n[Dead-lettered: no further automatic attempts will be made]");
        } else if (recovery == RecoveryStrategy.Kind.LLM_RECOVERY) {
            sb.append("\nThe tool call failed. Adjust the arguments or choose a different approach.");
        }
        return sb.toString();
    }
}
