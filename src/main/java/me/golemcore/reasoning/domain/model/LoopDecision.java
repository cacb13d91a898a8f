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

import java.util.Objects;

/**
 * Verdict of the policy gate on one proposed action.
 *
 * @param kind
 *            allow, deny or modify
 * @param replacement
 *            action that proceeds instead of the original, set only for
 *            {@link DecisionKind#MODIFY}
 * @param reason
 *            human readable reason, fed back to the model on denial
 */
public record LoopDecision(DecisionKind kind, ProposedAction replacement, String reason) {

    private static final LoopDecision ALLOW = new LoopDecision(DecisionKind.ALLOW, null, null);

    public static LoopDecision allow() {
        return ALLOW;
    }

    public static LoopDecision deny(String reason) {
        return new LoopDecision(DecisionKind.DENY, null, reason);
    }

    public static LoopDecision modify(ProposedAction replacement, String reason) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        return new LoopDecision(DecisionKind.MODIFY, replacement, reason);
    }

    public boolean isAllowed() {
        return kind == DecisionKind.ALLOW;
    }

    public boolean isDenied() {
        return kind == DecisionKind.DENY;
    }

    public boolean isModified() {
        return kind == DecisionKind.MODIFY;
    }
}
