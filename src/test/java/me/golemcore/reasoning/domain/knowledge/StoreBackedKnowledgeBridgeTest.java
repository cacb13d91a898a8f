package me.golemcore.reasoning.domain.knowledge;

import me.golemcore.reasoning.domain.conversation.Conversation;
import me.golemcore.reasoning.domain.executor.ActionExecutor;
import me.golemcore.reasoning.domain.model.KnowledgeItem;
import me.golemcore.reasoning.domain.model.Message;
import me.golemcore.reasoning.domain.model.ToolDefinition;
import me.golemcore.reasoning.port.outbound.KnowledgeStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class StoreBackedKnowledgeBridgeTest {

    private static final String AGENT_ID = "agent-1";
    private static final KnowledgeItem PARIS = new KnowledgeItem("fact-1", "Paris", "is capital of", "France", 0.9,
            0.8);
    private static final KnowledgeItem ROME = new KnowledgeItem("fact-2", "Rome", "is capital of", "Italy", 0.7,
            0.5);
    private static final KnowledgeItem NOISE = new KnowledgeItem("fact-3", "Cats", "like", "boxes", 0.9, 0.1);

    @Mock
    private KnowledgeStorePort store;

    private StoreBackedKnowledgeBridge bridge;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        bridge = new StoreBackedKnowledgeBridge(store, new KnowledgeBridgeSettings(2, 0.3, true),
                RelevanceScorer.storeScore());
    }

    // ==== Context injection ====

    @Test
    void shouldInjectRankedFactsAboveThreshold() {
        when(store.query(anyString(), eq(4))).thenReturn(List.of(ROME, NOISE, PARIS));
        Conversation conversation = Conversation.of(List.of(Message.system("sys"), Message.user("capital cities")));

        bridge.injectContext(conversation);

        String context = conversation.knowledgeContextMessage().orElseThrow().getContent();
        assertEquals(Conversation.KNOWLEDGE_CONTEXT_MARKER + "\nRelevant knowledge:\n"
                + "1. Paris is capital of France (confidence 0.90)\n"
                + "2. Rome is capital of Italy (confidence 0.70)", context);
    }

    @Test
    void shouldClearSlotWhenNothingRelevant() {
        when(store.query(anyString(), anyInt())).thenReturn(List.of(PARIS), List.of(NOISE));
        Conversation conversation = Conversation.of(List.of(Message.user("capital cities")));

        bridge.injectContext(conversation);
        assertTrue(conversation.knowledgeContextMessage().isPresent());

        bridge.injectContext(conversation);
        assertFalse(conversation.knowledgeContextMessage().isPresent());
    }

    @Test
    void shouldSkipQueryWithoutUserText() {
        Conversation conversation = Conversation.of(List.of(Message.system("sys")));

        bridge.injectContext(conversation);

        verifyNoInteractions(store);
        assertFalse(conversation.knowledgeContextMessage().isPresent());
    }

    @Test
    void shouldKeepPreviousContextWhenStoreFails() {
        when(store.query(anyString(), anyInt())).thenReturn(List.of(PARIS))
                .thenThrow(new IllegalStateException("store offline"));
        Conversation conversation = Conversation.of(List.of(Message.user("capital cities")));

        bridge.injectContext(conversation);
        bridge.injectContext(conversation);

        assertTrue(conversation.knowledgeContextMessage().orElseThrow().getContent().contains("Paris"));
    }

    // ==== Tools ====

    @Test
    void shouldAdvertiseRecallAndStoreTools() {
        List<ToolDefinition> tools = bridge.toolDefinitions();

        assertEquals(List.of(KnowledgeBridge.RECALL_TOOL, KnowledgeBridge.STORE_TOOL),
                tools.stream().map(ToolDefinition::getName).toList());
        assertEquals(List.of("query"), tools.get(0).getParameters().get("required"));
    }

    @Test
    void shouldFormatRecallResults() {
        when(store.query("capitals", 3)).thenReturn(List.of(ROME, PARIS));

        assertEquals("Found 2 relevant fact(s):\n1. Paris is capital of France (confidence 0.90)\n"
                + "2. Rome is capital of Italy (confidence 0.70)", bridge.recall("capitals", 3));
    }

    @Test
    void shouldReportEmptyRecall() {
        when(store.query("unknown", 5)).thenReturn(List.of());

        assertEquals("No relevant knowledge found.", bridge.recall("unknown", 5));
    }

    @Test
    void shouldStoreFactAndReportId() {
        when(store.store("Paris", "is capital of", "France", 0.9)).thenReturn("fact-7");

        assertEquals("Stored fact: Paris is capital of France (id: fact-7)",
                bridge.store("Paris", "is capital of", "France", 0.9));
    }

    @Test
    void shouldWrapExecutorWithKnowledgeHandling() {
        assertInstanceOf(KnowledgeAwareActionExecutor.class, bridge.intercept(mock(ActionExecutor.class)));
    }

    // ==== Learnings ====

    @Test
    void shouldPersistAssistantTextAsLearning() {
        Conversation conversation = Conversation.of(List.of(
                Message.user("question"),
                Message.assistant("Paris is the capital."),
                Message.assistant(" "),
                Message.assistant("Population is about two million.")));

        bridge.persistLearnings(AGENT_ID, conversation);

        verify(store).store(AGENT_ID, "learned", "Paris is the capital.\nPopulation is about two million.",
                StoreBackedKnowledgeBridge.LEARNING_CONFIDENCE);
    }

    @Test
    void shouldTruncateLongLearnings() {
        Conversation conversation = Conversation.of(List.of(Message.assistant("x".repeat(5000))));

        bridge.persistLearnings(AGENT_ID, conversation);

        verify(store).store(eq(AGENT_ID), eq("learned"), eq("x".repeat(StoreBackedKnowledgeBridge.MAX_LEARNING_CHARS)),
                anyDouble());
    }

    @Test
    void shouldNotPersistWhenDisabled() {
        StoreBackedKnowledgeBridge quiet = new StoreBackedKnowledgeBridge(store,
                new KnowledgeBridgeSettings(5, 0.3, false), RelevanceScorer.storeScore());

        quiet.persistLearnings(AGENT_ID, Conversation.of(List.of(Message.assistant("fact"))));

        verify(store, never()).store(anyString(), anyString(), anyString(), anyDouble());
    }

    @Test
    void shouldSwallowPersistFailure() {
        when(store.store(anyString(), anyString(), anyString(), anyDouble()))
                .thenThrow(new IllegalStateException("read-only"));

        bridge.persistLearnings(AGENT_ID, Conversation.of(List.of(Message.assistant("fact"))));

        verify(store).store(anyString(), anyString(), anyString(), anyDouble());
    }
}
