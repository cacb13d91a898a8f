package me.golemcore.reasoning.domain.loop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.conversation.Conversation;
import me.golemcore.reasoning.domain.model.LoopEventType;
import me.golemcore.reasoning.domain.model.Message;
import me.golemcore.reasoning.domain.model.Observation;
import me.golemcore.reasoning.domain.output.OutputValidation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Last phase of an iteration. {@link #observeResults()} merges observations
 * into the conversation and decides whether the run continues.
 *
 * <p>
 * An approved final answer completes the run only if it satisfies the run's
 * response format; otherwise the problems are fed back to the model.
 */
@Slf4j
public final class ObservingPhase {

    static final String INVALID_OUTPUT_PREFIX = "[Invalid Output] ";

    private final LoopRun run;
    private final List<Observation> observations;
    private final GatedAction finalAnswer;
    private boolean used;

    ObservingPhase(LoopRun run, List<Observation> observations, GatedAction finalAnswer) {
        this.run = run;
        this.observations = List.copyOf(observations);
        this.finalAnswer = finalAnswer;
    }

    public List<Observation> observations() {
        return observations;
    }

    public LoopContinuation observeResults() {
        markUsed("observed results");
        Conversation conversation = run.getConversation();
        int failures = 0;
        for (Observation observation : observations) {
            conversation.push(Message.tool(observation.sourceActionId(), observation.toolName(),
                    observation.toMessageContent()));
            if (!observation.success()) {
                failures++;
            }
        }

        boolean approved = finalAnswer != null && finalAnswer.approved();
        if (finalAnswer != null && !approved) {
            conversation.push(Message.user(Observation.DENIAL_PREFIX + finalAnswer.decision().reason()));
        }

        OutputValidation validation = null;
        if (approved) {
            validation = run.getOutputValidator().validate(finalAnswer.effective().text(),
                    run.getInferenceOptions().getResponseFormat());
            if (!validation.valid()) {
                log.warn("[Loop] Run {} rejected final answer: {}", run.getRunId(), validation.violations());
                conversation.push(Message.user(INVALID_OUTPUT_PREFIX + validation.feedback()));
            }
        }
        boolean completed = validation != null && validation.valid();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("observationCount", observations.size());
        payload.put("failureCount", failures);
        payload.put("completed", completed);
        if (validation != null && !validation.valid()) {
            payload.put("outputViolations", validation.violations());
        }
        run.record(LoopEventType.OBSERVATIONS_COLLECTED, payload);

        if (completed) {
            return LoopContinuation.complete(validation.output());
        }
        return LoopContinuation.next(new ReasoningPhase(run));
    }

    private void markUsed(String transition) {
        if (used) {
            throw new IllegalStateException("Phase of run " + run.getRunId() + " already " + transition);
        }
        used = true;
    }
}
