package me.golemcore.reasoning.domain.loop;

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
import me.golemcore.reasoning.domain.model.LoopEventType;
import me.golemcore.reasoning.domain.model.Observation;
import me.golemcore.reasoning.domain.model.ProposedAction;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Third phase of an iteration. {@link #dispatchTools()} hands the approved tool
 * calls to the executor and yields the {@link ObservingPhase}. Only actions
 * that went through {@link PolicyCheckPhase#checkPolicy()} can get here.
 */
@Slf4j
public final class ToolDispatchingPhase {

    private final LoopRun run;
    private final List<GatedAction> toolCalls;
    private final GatedAction finalAnswer;
    private boolean used;

    ToolDispatchingPhase(LoopRun run, List<GatedAction> toolCalls, GatedAction finalAnswer) {
        this.run = run;
        this.toolCalls = List.copyOf(toolCalls);
        this.finalAnswer = finalAnswer;
    }

    public List<ProposedAction> approvedActions() {
        return toolCalls.stream().filter(GatedAction::approved).map(GatedAction::effective).toList();
    }

    /**
     * Executes approved tool calls and waits for all of them. Observations come
     * back in the order the model proposed the calls, denials included.
     */
    public ObservingPhase dispatchTools() {
        markUsed("dispatched tools");
        List<ProposedAction> approved = approvedActions();
        Instant started = run.getClock().instant();
        List<Observation> executed = approved.isEmpty()
                ? List.of()
                : run.getExecutor().executeActions(approved, run.getConfig(), run.getBreakers(), run.getDeadline());
        Duration duration = Duration.between(started, run.getClock().instant());
        if (executed.size() != approved.size()) {
            throw new IllegalStateException("Executor returned " + executed.size() + " observation(s) for "
                    + approved.size() + " action(s)");
        }

        List<Observation> observations = new ArrayList<>(toolCalls.size());
        Iterator<Observation> results = executed.iterator();
        int errors = 0;
        for (GatedAction gated : toolCalls) {
            if (!gated.approved()) {
                observations.add(Observation.denied(gated.original(), gated.decision().reason()));
                continue;
            }
            Observation observation = results.next();
            if (!observation.success()) {
                errors++;
            }
            if (observation.recovery() != null) {
                recordRecovery(observation);
            }
            observations.add(observation);
        }
        run.getMetrics().recordToolCalls(approved.size(), errors);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("toolCount", approved.size());
        payload.put("errorCount", errors);
        payload.put("durationMs", duration.toMillis());
        run.record(LoopEventType.TOOLS_DISPATCHED, payload);

        return new ObservingPhase(run, observations, finalAnswer);
    }

    private void recordRecovery(Observation observation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("toolName", observation.toolName());
        payload.put("strategy", observation.recovery().name());
        payload.put("success", observation.success());
        if (observation.recoveryNote() != null) {
            payload.put("note", observation.recoveryNote());
        }
        run.record(LoopEventType.RECOVERY_TRIGGERED, payload);
        log.debug("[Executor] Recovery {} for '{}' (success: {})", observation.recovery(), observation.toolName(),
                observation.success());
    }

    private void markUsed(String transition) {
        if (used) {
            throw new IllegalStateException("Phase of run " + run.getRunId() + " already " + transition);
        }
        used = true;
    }
}
