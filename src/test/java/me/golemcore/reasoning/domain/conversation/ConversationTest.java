package me.golemcore.reasoning.domain.conversation;

import me.golemcore.reasoning.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationTest {

    private static final String SYSTEM_PROMPT = "You are a careful assistant.";

    @Test
    void shouldStartEmptyFromNullInput() {
        Conversation conversation = Conversation.of(null);

        assertEquals(0, conversation.size());
        assertTrue(conversation.systemMessage().isEmpty());
        assertTrue(conversation.requestMessages().isEmpty());
    }

    @Test
    void shouldRejectSystemMessageAfterFirstPosition() {
        Conversation conversation = Conversation.of(List.of(Message.user("hi")));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> conversation.push(Message.system(SYSTEM_PROMPT)));
        assertTrue(error.getMessage().contains("first message"));
        assertEquals(1, conversation.size());
    }

    @Test
    void shouldRejectSecondSystemMessage() {
        assertThrows(IllegalArgumentException.class,
                () -> Conversation.of(List.of(Message.system("a"), Message.system("b"))));
    }

    @Test
    void shouldRejectMessageWithoutRole() {
        Conversation conversation = new Conversation();

        assertThrows(IllegalArgumentException.class, () -> conversation.push(Message.builder().content("x").build()));
        assertThrows(NullPointerException.class, () -> conversation.push(null));
    }

    @Test
    void shouldExposeReadOnlyMessages() {
        Conversation conversation = Conversation.of(List.of(Message.user("hi")));

        assertThrows(UnsupportedOperationException.class, () -> conversation.messages().add(Message.user("x")));
    }

    @Test
    void shouldProjectKnowledgeSlotAfterSystemMessage() {
        Conversation conversation = Conversation.of(List.of(Message.system(SYSTEM_PROMPT), Message.user("hi")));

        conversation.injectKnowledgeContext("Relevant knowledge:\n1. sky is blue");

        List<Message> request = conversation.requestMessages();
        assertEquals(3, request.size());
        assertTrue(request.get(0).isSystemMessage());
        assertTrue(request.get(1).getContent().startsWith(Conversation.KNOWLEDGE_CONTEXT_MARKER + "\n"));
        assertEquals("hi", request.get(2).getContent());
        assertEquals(2, conversation.size());
    }

    @Test
    void shouldReplaceAndClearKnowledgeSlot() {
        Conversation conversation = Conversation.of(List.of(Message.user("hi")));

        conversation.injectKnowledgeContext("first");
        conversation.injectKnowledgeContext("second");
        assertTrue(conversation.knowledgeContextMessage().orElseThrow().getContent().endsWith("second"));
        assertEquals(2, conversation.requestMessages().size());

        conversation.injectKnowledgeContext("  ");
        assertFalse(conversation.knowledgeContextMessage().isPresent());
        assertEquals(1, conversation.requestMessages().size());
    }

    @Test
    void shouldSeparatePinnedMessagesFromHistory() {
        Conversation conversation = Conversation.of(List.of(
                Message.system(SYSTEM_PROMPT),
                Message.user("question"),
                Message.assistant("answer")));

        assertEquals(1, conversation.pinnedMessages().size());
        assertEquals(2, conversation.historyMessages().size());
        assertEquals("question", conversation.historyMessages().get(0).getContent());
    }
}
