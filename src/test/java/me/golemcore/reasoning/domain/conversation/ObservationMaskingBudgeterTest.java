package me.golemcore.reasoning.domain.conversation;

import me.golemcore.reasoning.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObservationMaskingBudgeterTest {

    private static final String BIG_RESULT = "BIG search output";

    private static final TokenEstimator ESTIMATOR = message -> message.getContent() != null
            && message.getContent().startsWith("BIG") ? 100 : 10;

    private Conversation conversation() {
        return Conversation.of(List.of(
                Message.system("sys"),
                Message.user("u1"),
                Message.assistantToolCalls(null, List.of(Message.ToolCall.builder()
                        .id("c1").name("search").arguments(Map.of("q", "java")).build())),
                Message.tool("c1", "search", BIG_RESULT),
                Message.assistant("a2"),
                Message.user("u2")));
    }

    @Test
    void shouldReturnFullConversationUnderBudget() {
        ConversationView view = new ObservationMaskingBudgeter(ESTIMATOR, 1).apply(conversation(), 1000);

        assertEquals(6, view.messages().size());
        assertTrue(view.diagnostics().isEmpty());
        assertEquals(150, view.estimatedTokens());
    }

    @Test
    void shouldMaskOlderToolResultsAndKeepPairing() {
        Conversation conversation = conversation();

        ConversationView view = new ObservationMaskingBudgeter(ESTIMATOR, 1).apply(conversation, 100);

        assertEquals(6, view.messages().size());
        Message masked = view.messages().get(3);
        assertTrue(masked.isToolMessage());
        assertEquals("c1", masked.getToolCallId());
        assertEquals("[Previous search result omitted for context management]", masked.getContent());
        assertEquals(List.of("observation-masking: masked 1 tool result(s)"), view.diagnostics());
        assertEquals(60, view.estimatedTokens());
        assertEquals(BIG_RESULT, conversation.messages().get(3).getContent());
    }

    @Test
    void shouldKeepRecentToolResultsVerbatim() {
        ConversationView view = new ObservationMaskingBudgeter(ESTIMATOR, 3).apply(conversation(), 140);

        assertTrue(view.messages().stream().anyMatch(message -> BIG_RESULT.equals(message.getContent())));
        assertTrue(view.diagnostics().contains("observation-masking: masked 0 tool result(s)"));
    }

    @Test
    void shouldFallBackToSlidingWindowWhenMaskingIsNotEnough() {
        ConversationView view = new ObservationMaskingBudgeter(ESTIMATOR, 1).apply(conversation(), 30);

        assertEquals(List.of("sys", "a2", "u2"), view.messages().stream().map(Message::getContent).toList());
        assertEquals(2, view.diagnostics().size());
    }
}
