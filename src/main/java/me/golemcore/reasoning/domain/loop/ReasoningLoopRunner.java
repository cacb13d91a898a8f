package me.golemcore.reasoning.domain.loop;

import me.golemcore.reasoning.domain.Sleeper;
import me.golemcore.reasoning.domain.breaker.CircuitBreakerRegistry;
import me.golemcore.reasoning.domain.conversation.ContextBudgeters;
import me.golemcore.reasoning.domain.conversation.Conversation;
import me.golemcore.reasoning.domain.conversation.TokenEstimator;
import me.golemcore.reasoning.domain.executor.ActionExecutor;
import me.golemcore.reasoning.domain.journal.JournalRecorder;
import me.golemcore.reasoning.domain.knowledge.KnowledgeBridge;
import me.golemcore.reasoning.domain.knowledge.NoOpKnowledgeBridge;
import me.golemcore.reasoning.domain.model.InferenceOptions;
import me.golemcore.reasoning.domain.model.LoopConfig;
import me.golemcore.reasoning.domain.model.LoopEventType;
import me.golemcore.reasoning.domain.model.LoopResult;
import me.golemcore.reasoning.domain.model.LoopState;
import me.golemcore.reasoning.domain.model.Message;
import me.golemcore.reasoning.domain.model.TerminationReason;
import me.golemcore.reasoning.domain.model.TokenUsage;
import me.golemcore.reasoning.domain.model.ToolDefinition;
import me.golemcore.reasoning.domain.output.StructuredOutputValidator;
import me.golemcore.reasoning.domain.policy.PolicyGate;
import me.golemcore.reasoning.port.outbound.InferencePort;
import me.golemcore.reasoning.port.outbound.JournalWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for one agent invocation.
 *
 * <p>
 * Drives the phase cycle Reasoning, PolicyCheck, ToolDispatching, Observing
 * until the model gives a final answer or a limit is reached. The cycle is
 * expressed through phase types: each phase exposes a single transition and
 * constructors are package-private, so no phase can be skipped.
 *
 * <p>
 * A runner is stateless between runs apart from the shared breaker registry and
 * metrics, and may serve concurrent runs.
 */
public class ReasoningLoopRunner {

    private static final Logger log = LoggerFactory.getLogger(ReasoningLoopRunner.class);

    private final InferencePort inference;
    private final PolicyGate policyGate;
    private final ActionExecutor executor;
    private final CircuitBreakerRegistry breakers;
    private final KnowledgeBridge knowledgeBridge;
    private final JournalWriter journal;
    private final TokenEstimator estimator;
    private final ReasoningMetrics metrics;
    private final InferenceRetryPolicy retryPolicy;
    private final Clock clock;
    private final Sleeper sleeper;
    private final StructuredOutputValidator outputValidator = new StructuredOutputValidator();

    public ReasoningLoopRunner(InferencePort inference, PolicyGate policyGate, ActionExecutor executor,
            CircuitBreakerRegistry breakers, KnowledgeBridge knowledgeBridge, JournalWriter journal,
            TokenEstimator estimator, ReasoningMetrics metrics, InferenceRetryPolicy retryPolicy, Clock clock,
            Sleeper sleeper) {
        this.inference = inference;
        this.policyGate = policyGate;
        this.executor = executor;
        this.breakers = breakers;
        this.knowledgeBridge = knowledgeBridge != null ? knowledgeBridge : NoOpKnowledgeBridge.INSTANCE;
        this.journal = journal;
        this.estimator = estimator;
        this.metrics = metrics;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Runs the loop to completion. Never throws for budget, policy, tool or
     * inference failures; those are reported through
     * {@link LoopResult#terminationReason()}.
     */
    public LoopResult run(String agentId, List<Message> initialConversation, LoopConfig config) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        JournalRecorder recorder = new JournalRecorder(runId, agentId, journal, clock);
        metrics.recordLoopStarted();

        Conversation conversation;
        try {
            conversation = Conversation.of(initialConversation);
        } catch (IllegalArgumentException e) {
            log.error("[Loop] Rejected initial conversation for agent {}: {}", agentId, e.getMessage());
            recorder.record(0, LoopEventType.STARTED, Map.of("agentId", String.valueOf(agentId), "runId", runId));
            return finish(recorder, runId, agentId, new Conversation(), null, 0, TerminationReason.ERROR, null,
                    "Invalid initial conversation: " + e.getMessage(), startedAt);
        }

        List<ToolDefinition> advertised = new ArrayList<>(config.getTools());
        advertised.addAll(knowledgeBridge.toolDefinitions());
        List<String> advertisedNames = advertised.stream().map(ToolDefinition::getName).toList();
        LoopState state = new LoopState(config, startedAt, breakers, advertisedNames);
        InferenceOptions options = config.getInference().toBuilder()
                .clearTools()
                .tools(advertised)
                .build();

        LoopRun run = LoopRun.builder()
                .runId(runId)
                .agentId(agentId)
                .config(config)
                .conversation(conversation)
                .state(state)
                .deadline(startedAt.plus(config.getTimeout()))
                .inferenceOptions(options)
                .inference(inference)
                .retryPolicy(retryPolicy)
                .policyGate(policyGate)
                .executor(knowledgeBridge.intercept(executor))
                .breakers(breakers)
                .knowledgeBridge(knowledgeBridge)
                .budgeter(ContextBudgeters.forConfig(config, estimator))
                .estimator(estimator)
                .outputValidator(outputValidator)
                .journal(recorder)
                .metrics(metrics)
                .clock(clock)
                .sleeper(sleeper)
                .build();

        log.info("[Loop] Starting run {} for agent {} ({} message(s), {} tool(s), max {} iteration(s))", runId,
                agentId, conversation.size(), advertised.size(), config.getMaxIterations());
        Map<String, Object> startPayload = new LinkedHashMap<>();
        startPayload.put("runId", runId);
        startPayload.put("agentId", String.valueOf(agentId));
        startPayload.put("messageCount", conversation.size());
        startPayload.put("toolCount", advertised.size());
        startPayload.put("maxIterations", config.getMaxIterations());
        recorder.record(0, LoopEventType.STARTED, startPayload);

        String output = null;
        TerminationReason reason;
        String errorMessage = null;
        try {
            ReasoningPhase phase = new ReasoningPhase(run);
            while (true) {
                LoopContinuation continuation = phase
                        .produceOutput()
                        .checkPolicy()
                        .dispatchTools()
                        .observeResults();
                if (continuation.isComplete()) {
                    output = continuation.output();
                    reason = TerminationReason.COMPLETED;
                    break;
                }
                phase = continuation.nextPhase();
            }
        } catch (LoopTerminationException e) {
            reason = e.getReason();
            errorMessage = e.getMessage();
            if (reason == TerminationReason.ERROR) {
                log.error("[Loop] Run {} failed: {}", runId, e.getMessage());
            } else {
                log.warn("[Loop] Run {} stopped: {}", runId, e.getMessage());
            }
        } catch (RuntimeException e) {
            reason = TerminationReason.ERROR;
            errorMessage = "Unexpected failure: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            log.error("[Loop] Run {} failed unexpectedly", runId, e);
        }

        if (reason == TerminationReason.COMPLETED) {
            try {
                knowledgeBridge.persistLearnings(agentId, conversation);
            } catch (RuntimeException e) {
                log.warn("[Knowledge] Failed to persist learnings for run {}: {}", runId, e.getMessage());
            }
        }

        return finish(recorder, runId, agentId, conversation, output, state.getIteration(), reason,
                state.getTotalUsage(), errorMessage, startedAt);
    }

    public ReasoningMetrics getMetrics() {
        return metrics;
    }

    private LoopResult finish(JournalRecorder recorder, String runId, String agentId, Conversation conversation,
            String output, int iterations, TerminationReason reason,
            TokenUsage usage, String errorMessage, Instant startedAt) {
        long tokens = usage != null ? usage.totalTokens() : 0;
        metrics.recordLoopFinished(reason, iterations, tokens);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", reason.name());
        payload.put("iterations", iterations);
        payload.put("totalTokens", tokens);
        if (errorMessage != null) {
            payload.put("message", errorMessage);
        }
        recorder.record(iterations, LoopEventType.TERMINATED, payload);

        Duration elapsed = Duration.between(startedAt, clock.instant());
        log.info("[Loop] Run {} for agent {} finished: {} after {} iteration(s), {} token(s), {}ms", runId, agentId,
                reason, iterations, tokens, elapsed.toMillis());

        return LoopResult.builder()
                .runId(runId)
                .agentId(agentId)
                .output(output)
                .iterations(iterations)
                .usage(usage)
                .terminationReason(reason)
                .errorMessage(errorMessage)
                .elapsed(elapsed)
                .conversation(conversation.messages())
                .build();
    }
}
