package me.golemcore.reasoning.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.reasoning.adapter.outbound.knowledge.InMemoryKnowledgeStoreAdapter;
import me.golemcore.reasoning.domain.breaker.CircuitBreakerConfig;
import me.golemcore.reasoning.domain.breaker.CircuitBreakerRegistry;
import me.golemcore.reasoning.domain.conversation.Conversation;
import me.golemcore.reasoning.domain.conversation.CharacterTokenEstimator;
import me.golemcore.reasoning.domain.executor.ActionExecutor;
import me.golemcore.reasoning.domain.executor.DefaultActionExecutor;
import me.golemcore.reasoning.domain.executor.ToolResultCache;
import me.golemcore.reasoning.domain.journal.BufferedJournal;
import me.golemcore.reasoning.domain.knowledge.KnowledgeBridge;
import me.golemcore.reasoning.domain.knowledge.KnowledgeBridgeSettings;
import me.golemcore.reasoning.domain.knowledge.NoOpKnowledgeBridge;
import me.golemcore.reasoning.domain.knowledge.RelevanceScorer;
import me.golemcore.reasoning.domain.knowledge.StoreBackedKnowledgeBridge;
import me.golemcore.reasoning.domain.model.FinishReason;
import me.golemcore.reasoning.domain.model.InferenceOptions;
import me.golemcore.reasoning.domain.model.InferenceResult;
import me.golemcore.reasoning.domain.model.JournalEntry;
import me.golemcore.reasoning.domain.model.LoopConfig;
import me.golemcore.reasoning.domain.model.LoopDecision;
import me.golemcore.reasoning.domain.model.LoopEventType;
import me.golemcore.reasoning.domain.model.LoopResult;
import me.golemcore.reasoning.domain.model.Message;
import me.golemcore.reasoning.domain.model.ProposedAction;
import me.golemcore.reasoning.domain.model.RecoveryStrategy;
import me.golemcore.reasoning.domain.model.ResponseFormat;
import me.golemcore.reasoning.domain.model.TerminationReason;
import me.golemcore.reasoning.domain.model.TokenUsage;
import me.golemcore.reasoning.domain.model.ToolDefinition;
import me.golemcore.reasoning.domain.model.ToolResult;
import me.golemcore.reasoning.domain.policy.PolicyException;
import me.golemcore.reasoning.domain.policy.PolicyGate;
import me.golemcore.reasoning.domain.policy.RuleBasedPolicyGate;
import me.golemcore.reasoning.port.outbound.InferenceErrorKind;
import me.golemcore.reasoning.port.outbound.InferenceException;
import me.golemcore.reasoning.port.outbound.InferencePort;
import me.golemcore.reasoning.port.outbound.KnowledgeStorePort;
import me.golemcore.reasoning.port.outbound.ToolInvocationPort;
import me.golemcore.reasoning.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReasoningLoopRunnerTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");
    private static final String AGENT_ID = "agent-1";
    private static final String SEARCH = "search";
    private static final String SHELL = "shell";
    private static final Map<String, Object> SEARCH_ARGS = Map.of("q", "java");
    private static final TokenUsage USAGE = TokenUsage.of(100, 10);
    private static final List<Message> CONVERSATION = List.of(
            Message.system("You are a helpful assistant."),
            Message.user("What is 6 x 7?"));

    @Mock
    private InferencePort inference;

    @Mock
    private ToolInvocationPort tools;

    @Captor
    private ArgumentCaptor<List<Message>> messagesCaptor;

    @Captor
    private ArgumentCaptor<InferenceOptions> optionsCaptor;

    private MutableClock clock;
    private ExecutorService workers;
    private List<Duration> sleeps;
    private CircuitBreakerRegistry breakers;
    private BufferedJournal journal;
    private ReasoningMetrics metrics;
    private PolicyGate policyGate;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = new MutableClock(NOW, ZoneId.of("UTC"));
        workers = Executors.newFixedThreadPool(4);
        sleeps = Collections.synchronizedList(new ArrayList<>());
        breakers = new CircuitBreakerRegistry(new CircuitBreakerConfig(2, Duration.ofSeconds(30), 1), clock);
        journal = new BufferedJournal();
        metrics = new ReasoningMetrics();
        policyGate = RuleBasedPolicyGate.withDefaultRules(Set.of(SHELL), Set.of("api_key"));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private ReasoningLoopRunner runner(KnowledgeBridge bridge) {
        DefaultActionExecutor executor = new DefaultActionExecutor(tools, workers,
                new ToolResultCache(new ObjectMapper(), clock), clock, sleeps::add);
        return new ReasoningLoopRunner(inference, policyGate, executor, breakers, bridge, journal,
                new CharacterTokenEstimator(), metrics, new InferenceRetryPolicy(3, Duration.ofMillis(100),
                        Duration.ofSeconds(1)),
                clock, sleeps::add);
    }

    private ReasoningLoopRunner runner() {
        return runner(NoOpKnowledgeBridge.INSTANCE);
    }

    private static LoopConfig.LoopConfigBuilder config() {
        return LoopConfig.builder()
                .tool(ToolDefinition.simple(SEARCH, "Search the web"))
                .tool(ToolDefinition.simple(SHELL, "Run a shell command"))
                .defaultRecovery(RecoveryStrategy.llmRecovery())
                .toolTimeout(Duration.ofSeconds(5));
    }

    private static CompletableFuture<InferenceResult> answer(String text) {
        return CompletableFuture.completedFuture(InferenceResult.builder()
                .text(text)
                .usage(USAGE)
                .finishReason(FinishReason.STOP)
                .build());
    }

    private static CompletableFuture<InferenceResult> toolCall(String id, String toolName, Map<String, Object> args) {
        return CompletableFuture.completedFuture(InferenceResult.builder()
                .actions(List.of(ProposedAction.toolCall(id, toolName, args)))
                .usage(USAGE)
                .finishReason(FinishReason.TOOL_CALLS)
                .build());
    }

    private List<LoopEventType> events() {
        return journal.entries().stream().map(JournalEntry::event).toList();
    }

    private List<Message> inferenceInput(int call, int totalCalls) {
        verify(inference, times(totalCalls)).infer(messagesCaptor.capture(), any());
        return messagesCaptor.getAllValues().get(call);
    }

    // ==== Completion ====

    @Test
    void shouldCompleteWithFinalAnswerInOneIteration() {
        when(inference.infer(anyList(), any())).thenReturn(answer("42"));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().maxIterations(1).build());

        assertEquals(TerminationReason.COMPLETED, result.terminationReason());
        assertTrue(result.isCompleted());
        assertEquals("42", result.output());
        assertEquals(1, result.iterations());
        assertNull(result.errorMessage());
        assertEquals(110, result.usage().totalTokens());
        assertEquals(AGENT_ID, result.agentId());
        assertNotNull(result.runId());
        Message last = result.conversation().get(result.conversation().size() - 1);
        assertTrue(last.isAssistantMessage());
        assertEquals("42", last.getContent());
        verify(tools, never()).invoke(any(), any(), any());
    }

    @Test
    void shouldJournalPhasesInOrder() {
        when(inference.infer(anyList(), any())).thenReturn(toolCall("c1", SEARCH, SEARCH_ARGS), answer("done"));
        when(tools.invoke(eq(SEARCH), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("results")));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        assertEquals(List.of(
                LoopEventType.STARTED,
                LoopEventType.REASONING_COMPLETE,
                LoopEventType.POLICY_EVALUATED,
                LoopEventType.TOOLS_DISPATCHED,
                LoopEventType.OBSERVATIONS_COLLECTED,
                LoopEventType.REASONING_COMPLETE,
                LoopEventType.POLICY_EVALUATED,
                LoopEventType.TOOLS_DISPATCHED,
                LoopEventType.OBSERVATIONS_COLLECTED,
                LoopEventType.TERMINATED), events());

        List<JournalEntry> entries = journal.entries(result.runId());
        for (int i = 0; i < entries.size(); i++) {
            assertEquals(i, entries.get(i).sequence());
            assertEquals(AGENT_ID, entries.get(i).agentId());
        }
        assertEquals(1, entries.get(1).iteration());
        assertEquals(2, entries.get(5).iteration());
        JournalEntry terminated = entries.get(entries.size() - 1);
        assertEquals("COMPLETED", terminated.payload().get("reason"));
        assertEquals(2, terminated.payload().get("iterations"));
    }

    @Test
    void shouldFeedToolResultsIntoNextInference() {
        when(inference.infer(anyList(), any())).thenReturn(toolCall("c1", SEARCH, SEARCH_ARGS), answer("done"));
        when(tools.invoke(eq(SEARCH), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("Java 21 released")));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        assertEquals("done", result.output());
        List<Message> second = inferenceInput(1, 2);
        Message assistant = second.get(second.size() - 2);
        assertTrue(assistant.hasToolCalls());
        assertEquals("c1", assistant.getToolCalls().get(0).getId());
        Message tool = second.get(second.size() - 1);
        assertTrue(tool.isToolMessage());
        assertEquals("c1", tool.getToolCallId());
        assertEquals("Java 21 released", tool.getContent());
    }

    @Test
    void shouldTreatNullAnswerTextAsEmptyOutput() {
        when(inference.infer(anyList(), any())).thenReturn(CompletableFuture.completedFuture(
                InferenceResult.builder().usage(USAGE).build()));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        assertEquals(TerminationReason.COMPLETED, result.terminationReason());
        assertEquals("", result.output());
    }

    // ==== Policy ====

    @Test
    void shouldGateBeforeDispatchAndReturnDenialToModel() {
        when(inference.infer(anyList(), any())).thenReturn(toolCall("c1", SHELL, Map.of("cmd", "rm -rf /")),
                answer("I cannot do that."));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        assertEquals(TerminationReason.COMPLETED, result.terminationReason());
        verify(tools, never()).invoke(any(), any(), any());
        List<Message> second = inferenceInput(1, 2);
        Message denial = second.get(second.size() - 1);
        assertTrue(denial.isToolMessage());
        assertEquals("c1", denial.getToolCallId());
        assertEquals("[Policy Denied] Tool 'shell' is blocked by policy", denial.getContent());
        assertEquals(1, metrics.snapshot().policyDenials());
        JournalEntry policy = journal.entries().stream()
                .filter(entry -> entry.event() == LoopEventType.POLICY_EVALUATED)
                .findFirst()
                .orElseThrow();
        assertEquals(1, policy.payload().get("deniedCount"));
    }

    @Test
    void shouldDispatchRedactedArguments() {
        when(inference.infer(anyList(), any())).thenReturn(
                toolCall("c1", SEARCH, Map.of("q", "java", "api_key", "sk-secret")), answer("done"));
        when(tools.invoke(eq(SEARCH), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("ok")));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        verify(tools).invoke(eq(SEARCH), eq(Map.of("q", "java", "api_key", "[REDACTED]")), any());
        Message assistant = result.conversation().get(2);
        assertEquals("[REDACTED]", assistant.getToolCalls().get(0).getArguments().get("api_key"));
    }

    @Test
    void shouldContinueAfterDeniedFinalAnswer() {
        policyGate = (agentId, action, state) -> action.isFinalAnswer() && action.text().contains("password")
                ? LoopDecision.deny("Answer leaks a credential")
                : LoopDecision.allow();
        when(inference.infer(anyList(), any())).thenReturn(answer("The password is hunter2"), answer("I can't say."));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        assertEquals("I can't say.", result.output());
        assertEquals(2, result.iterations());
        List<Message> second = inferenceInput(1, 2);
        Message feedback = second.get(second.size() - 1);
        assertTrue(feedback.isUserMessage());
        assertEquals("[Policy Denied] Answer leaks a credential", feedback.getContent());
    }

    @Test
    void shouldDenyActionsWhenGateThrows() {
        policyGate = (agentId, action, state) -> {
            if (action.isToolCall()) {
                throw new PolicyException("unreadable");
            }
            return LoopDecision.allow();
        };
        when(inference.infer(anyList(), any())).thenReturn(toolCall("c1", SEARCH, SEARCH_ARGS), answer("done"));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        assertEquals(TerminationReason.COMPLETED, result.terminationReason());
        verify(tools, never()).invoke(any(), any(), any());
        assertEquals("[Policy Denied] Malformed action: unreadable", result.conversation().get(3).getContent());
    }

    // ==== Budgets ====

    @Test
    void shouldStopAtMaxIterations() {
        when(inference.infer(anyList(), any())).thenReturn(toolCall("c1", SEARCH, SEARCH_ARGS));
        when(tools.invoke(eq(SEARCH), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("more")));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().maxIterations(2).build());

        assertEquals(TerminationReason.MAX_ITERATIONS, result.terminationReason());
        assertEquals(2, result.iterations());
        assertNull(result.output());
        assertEquals("Maximum iterations reached (2)", result.errorMessage());
        verify(inference, times(2)).infer(anyList(), any());
    }

    @Test
    void shouldStopWhenTokenBudgetExhausted() {
        CompletableFuture<InferenceResult> expensive = CompletableFuture.completedFuture(InferenceResult.builder()
                .actions(List.of(ProposedAction.toolCall("c1", SEARCH, SEARCH_ARGS)))
                .usage(TokenUsage.of(500, 100))
                .build());
        when(inference.infer(anyList(), any())).thenReturn(expensive);
        when(tools.invoke(eq(SEARCH), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("more")));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().maxTotalTokens(1000).build());

        assertEquals(TerminationReason.MAX_TOKENS, result.terminationReason());
        assertEquals(2, result.iterations());
        assertEquals(1200, result.usage().totalTokens());
    }

    @Test
    void shouldStopWhenWallClockTimeoutElapses() {
        when(inference.infer(anyList(), any())).thenAnswer(invocation -> {
            clock.advance(Duration.ofSeconds(200));
            return toolCall("c1", SEARCH, SEARCH_ARGS);
        });
        when(tools.invoke(eq(SEARCH), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("more")));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().timeout(Duration.ofSeconds(300)).build());

        assertEquals(TerminationReason.TIMEOUT, result.terminationReason());
        assertEquals(2, result.iterations());
        assertEquals(Duration.ofSeconds(400), result.elapsed());
        assertEquals("TIMEOUT", journal.entries().get(journal.size() - 1).payload().get("reason"));
    }

    @Test
    void shouldTimeOutHangingInference() {
        CompletableFuture<InferenceResult> hanging = new CompletableFuture<>();
        when(inference.infer(anyList(), any())).thenReturn(hanging);

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().timeout(Duration.ofMillis(200)).build());

        assertEquals(TerminationReason.TIMEOUT, result.terminationReason());
        assertEquals(0, result.iterations());
        assertTrue(hanging.isCancelled());
    }

    // ==== Tool failures ====

    @Test
    void shouldOpenBreakerAfterRepeatedFailures() {
        when(inference.infer(anyList(), any())).thenReturn(
                toolCall("c1", SEARCH, SEARCH_ARGS),
                toolCall("c2", SEARCH, SEARCH_ARGS),
                toolCall("c3", SEARCH, SEARCH_ARGS),
                answer("giving up on search"));
        when(tools.invoke(eq(SEARCH), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.failure("service unavailable")));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        assertEquals(TerminationReason.COMPLETED, result.terminationReason());
        assertEquals(4, result.iterations());
        verify(tools, times(2)).invoke(eq(SEARCH), anyMap(), any());
        List<Message> fourth = inferenceInput(3, 4);
        String lastToolMessage = fourth.get(fourth.size() - 1).getContent();
        assertTrue(lastToolMessage.startsWith(
                "[Error] Circuit breaker open for tool 'search' after 2 consecutive failure(s)"));
        assertTrue(breakers.stateOf(SEARCH).isOpen());
        assertEquals(3, events().stream().filter(event -> event == LoopEventType.RECOVERY_TRIGGERED).count());
        assertEquals(3, metrics.snapshot().toolErrors());
    }

    // ==== Inference failures ====

    @Test
    void shouldRetryTransientInferenceFailure() {
        when(inference.infer(anyList(), any())).thenReturn(
                CompletableFuture.failedFuture(new InferenceException(InferenceErrorKind.TRANSIENT, "502")),
                answer("42"));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        assertEquals(TerminationReason.COMPLETED, result.terminationReason());
        assertEquals(1, result.iterations());
        assertEquals(List.of(Duration.ofMillis(100)), sleeps);
    }

    @Test
    void shouldFailFastOnUnauthorizedInference() {
        when(inference.infer(anyList(), any())).thenReturn(CompletableFuture.failedFuture(
                new InferenceException(InferenceErrorKind.UNAUTHORIZED, "bad api key")));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        assertEquals(TerminationReason.ERROR, result.terminationReason());
        assertEquals("Inference failed (UNAUTHORIZED): bad api key", result.errorMessage());
        assertTrue(sleeps.isEmpty());
        verify(inference, times(1)).infer(anyList(), any());
    }

    @Test
    void shouldFailAfterExhaustingInferenceRetries() {
        when(inference.infer(anyList(), any())).thenThrow(
                new InferenceException(InferenceErrorKind.RATE_LIMITED, "slow down"));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config().build());

        assertEquals(TerminationReason.ERROR, result.terminationReason());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
        verify(inference, times(3)).infer(anyList(), any());
    }

    @Test
    void shouldRejectInvalidInitialConversation() {
        LoopResult result = runner().run(AGENT_ID, List.of(Message.user("hi"), Message.system("late")),
                config().build());

        assertEquals(TerminationReason.ERROR, result.terminationReason());
        assertTrue(result.errorMessage().startsWith("Invalid initial conversation: "));
        assertEquals(0, result.iterations());
        assertEquals(List.of(LoopEventType.STARTED, LoopEventType.TERMINATED), events());
        verify(inference, never()).infer(anyList(), any());
    }

    // ==== Knowledge ====

    @Test
    void shouldBehaveLikeEmptyBridgeWithoutBridge() {
        when(inference.infer(anyList(), any())).thenReturn(answer("42"));

        LoopResult result = runner(null).run(AGENT_ID, CONVERSATION, config().build());

        assertEquals("42", result.output());
        verify(inference).infer(messagesCaptor.capture(), optionsCaptor.capture());
        assertEquals(List.of(SEARCH, SHELL),
                optionsCaptor.getValue().getTools().stream().map(ToolDefinition::getName).toList());
        assertEquals(2, messagesCaptor.getValue().size());
    }

    @Test
    void shouldProduceSameResultWithoutBridgeAsWithEmptyDelegatingBridge() {
        when(inference.infer(anyList(), any())).thenReturn(
                toolCall("c1", SEARCH, SEARCH_ARGS), answer("Java is a language."),
                toolCall("c1", SEARCH, SEARCH_ARGS), answer("Java is a language."),
                toolCall("c1", SEARCH, SEARCH_ARGS), answer("Java is a language."));
        when(tools.invoke(eq(SEARCH), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("Java: a programming language")));
        KnowledgeStorePort emptyStore = mock(KnowledgeStorePort.class);
        when(emptyStore.query(any(), anyInt())).thenReturn(List.of());

        LoopResult withoutBridge = runner(null).run(AGENT_ID, CONVERSATION, config().build());
        LoopResult withEmptyBridge = runner(new EmptyDelegatingBridge()).run(AGENT_ID, CONVERSATION,
                config().build());
        LoopResult withEmptyStore = runner(new StoreBackedKnowledgeBridge(emptyStore,
                KnowledgeBridgeSettings.defaults(), RelevanceScorer.storeScore()))
                .run(AGENT_ID, CONVERSATION, config().build());

        for (LoopResult bridged : List.of(withEmptyBridge, withEmptyStore)) {
            assertEquals(withoutBridge.output(), bridged.output());
            assertEquals(withoutBridge.iterations(), bridged.iterations());
            assertEquals(withoutBridge.usage(), bridged.usage());
            assertEquals(withoutBridge.terminationReason(), bridged.terminationReason());
            assertEquals(withoutBridge.errorMessage(), bridged.errorMessage());
            assertEquals(withoutBridge.conversation(), bridged.conversation());
        }
        assertEquals(2, withoutBridge.iterations());
        verify(tools, times(3)).invoke(eq(SEARCH), anyMap(), any());
        verify(emptyStore, atLeastOnce()).query(any(), anyInt());
    }

    @Test
    void shouldServeKnowledgeToolsWithoutToolPort() {
        InMemoryKnowledgeStoreAdapter store = new InMemoryKnowledgeStoreAdapter();
        StoreBackedKnowledgeBridge bridge = new StoreBackedKnowledgeBridge(store,
                KnowledgeBridgeSettings.defaults(), RelevanceScorer.storeScore());
        when(inference.infer(anyList(), any())).thenReturn(
                toolCall("c1", KnowledgeBridge.STORE_TOOL,
                        Map.of("subject", "Paris", "predicate", "is capital of", "object", "France")),
                answer("Noted."));

        LoopResult result = runner(bridge).run(AGENT_ID, CONVERSATION, config().build());

        assertEquals(TerminationReason.COMPLETED, result.terminationReason());
        verify(tools, never()).invoke(any(), any(), any());
        assertEquals(2, store.size());
        verify(inference, times(2)).infer(anyList(), optionsCaptor.capture());
        assertTrue(optionsCaptor.getValue().getTools().stream()
                .anyMatch(tool -> KnowledgeBridge.RECALL_TOOL.equals(tool.getName())));
        assertTrue(result.conversation().get(3).getContent().startsWith("Stored fact: Paris is capital of France"));
    }

    // ==== Structured output ====

    @Test
    void shouldFeedSchemaViolationsBackUntilAnswerConforms() {
        ResponseFormat format = ResponseFormat.jsonSchema("answer", Map.of(
                "type", "object",
                "properties", Map.of("answer", Map.of("type", "integer")),
                "required", List.of("answer")));
        LoopConfig config = config()
                .inference(InferenceOptions.builder().responseFormat(format).build())
                .build();
        when(inference.infer(anyList(), any())).thenReturn(answer("{\"answer\": \"forty-two\"}"),
                answer("```json\n{\"answer\": 42}\n```"));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config);

        assertEquals(TerminationReason.COMPLETED, result.terminationReason());
        assertEquals("{\"answer\": 42}", result.output());
        assertEquals(2, result.iterations());
        List<Message> secondInput = inferenceInput(1, 2);
        Message feedback = secondInput.get(secondInput.size() - 1);
        assertTrue(feedback.isUserMessage());
        assertEquals("[Invalid Output] Your JSON response did not match the required schema. "
                + "Issues: $.answer: expected integer but got string. Please fix these and try again.",
                feedback.getContent());
        verify(inference, times(2)).infer(anyList(), optionsCaptor.capture());
        assertEquals(format, optionsCaptor.getValue().getResponseFormat());
        JournalEntry firstObservation = journal.entries().stream()
                .filter(entry -> entry.event() == LoopEventType.OBSERVATIONS_COLLECTED)
                .findFirst()
                .orElseThrow();
        assertEquals(Boolean.FALSE, firstObservation.payload().get("completed"));
        assertEquals(List.of("$.answer: expected integer but got string"),
                firstObservation.payload().get("outputViolations"));
    }

    @Test
    void shouldStopAtIterationLimitWhenAnswerNeverParses() {
        LoopConfig config = config()
                .maxIterations(2)
                .inference(InferenceOptions.builder().responseFormat(ResponseFormat.jsonObject()).build())
                .build();
        when(inference.infer(anyList(), any())).thenReturn(answer("not json at all"));

        LoopResult result = runner().run(AGENT_ID, CONVERSATION, config);

        assertEquals(TerminationReason.MAX_ITERATIONS, result.terminationReason());
        assertNull(result.output());
        assertTrue(result.conversation().get(result.conversation().size() - 1).getContent()
                .startsWith("[Invalid Output] Your response was not valid JSON."));
    }

    // ==== Metrics ====

    @Test
    void shouldAggregateMetricsAcrossRuns() {
        when(inference.infer(anyList(), any())).thenReturn(answer("42"), CompletableFuture.failedFuture(
                new InferenceException(InferenceErrorKind.INVALID_RESPONSE, "garbled")));
        ReasoningLoopRunner runner = runner();

        runner.run(AGENT_ID, CONVERSATION, config().build());
        runner.run(AGENT_ID, CONVERSATION, config().build());

        MetricsSnapshot snapshot = runner.getMetrics().snapshot();
        assertEquals(2, snapshot.loopsStarted());
        assertEquals(1, snapshot.loopsCompleted());
        assertEquals(1, snapshot.loopsFailed());
        assertEquals(0.5, snapshot.successRate(), 1e-9);
        assertEquals(110, snapshot.totalTokens());
    }

    @Test
    void shouldCallInferenceBeforeTools() {
        when(inference.infer(anyList(), any())).thenReturn(toolCall("c1", SEARCH, SEARCH_ARGS), answer("done"));
        when(tools.invoke(eq(SEARCH), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("ok")));

        runner().run(AGENT_ID, CONVERSATION, config().build());

        InOrder order = inOrder(inference, tools);
        order.verify(inference).infer(anyList(), any());
        order.verify(tools).invoke(eq(SEARCH), anyMap(), any());
        order.verify(inference).infer(anyList(), any());
        assertFalse(journal.entries().isEmpty());
    }

    /**
     * Bridge with nothing to contribute: no knowledge, no tools of its own.
     */
    private static final class EmptyDelegatingBridge implements KnowledgeBridge {

        @Override
        public void injectContext(Conversation conversation) {
            conversation.injectKnowledgeContext(null);
        }

        @Override
        public ActionExecutor intercept(ActionExecutor delegate) {
            return (actions, config, breakers, deadline) -> delegate.executeActions(actions, config, breakers,
                    deadline);
        }

        @Override
        public List<ToolDefinition> toolDefinitions() {
            return List.of();
        }

        @Override
        public void persistLearnings(String agentId, Conversation conversation) {
            // nothing to keep
        }
    }
}
