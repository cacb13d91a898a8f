package me.golemcore.reasoning.adapter.outbound.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.reasoning.domain.model.JournalEntry;
import me.golemcore.reasoning.domain.model.LoopEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlJournalStorageAdapterTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");
    private static final String AGENT_ID = "agent-1";

    @TempDir
    Path tempDir;

    private JsonlJournalStorageAdapter storage;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        storage = new JsonlJournalStorageAdapter(tempDir.resolve("journal"), objectMapper);
    }

    private static JournalEntry entry(String agentId, long sequence, LoopEventType event) {
        return JournalEntry.builder()
                .runId("run-1")
                .agentId(agentId)
                .sequence(sequence)
                .timestamp(NOW.plusSeconds(sequence))
                .iteration(1)
                .event(event)
                .payload(Map.of("toolCount", 2, "reason", "COMPLETED"))
                .build();
    }

    @Test
    void shouldCreateDirectoryOnStartup() {
        assertTrue(Files.isDirectory(tempDir.resolve("journal")));
    }

    @Test
    void shouldAppendOneLinePerEntryAndReadBack() throws IOException {
        storage.store(entry(AGENT_ID, 0, LoopEventType.STARTED));
        storage.store(entry(AGENT_ID, 1, LoopEventType.TERMINATED));

        Path file = tempDir.resolve("journal").resolve(AGENT_ID + ".jsonl");
        assertEquals(2, Files.readAllLines(file, StandardCharsets.UTF_8).size());

        List<JournalEntry> entries = storage.readEntries(AGENT_ID);
        assertEquals(2, entries.size());
        JournalEntry first = entries.get(0);
        assertEquals("run-1", first.runId());
        assertEquals(LoopEventType.STARTED, first.event());
        assertEquals(NOW, first.timestamp());
        assertEquals(2, first.payload().get("toolCount"));
        assertEquals("COMPLETED", first.payload().get("reason"));
    }

    @Test
    void shouldKeepAgentsInSeparateFiles() {
        storage.store(entry(AGENT_ID, 0, LoopEventType.STARTED));
        storage.store(entry("agent/../2", 0, LoopEventType.STARTED));

        assertEquals(1, storage.readEntries(AGENT_ID).size());
        assertEquals(1, storage.readEntries("agent/../2").size());
        assertTrue(Files.exists(tempDir.resolve("journal").resolve("agent%2F%2E%2E%2F2.jsonl")));
    }

    @Test
    void shouldNotMixAgentsWhoseIdsDifferOnlyInPunctuation() {
        storage.store(entry("team/a", 0, LoopEventType.STARTED));
        storage.store(entry("team:a", 1, LoopEventType.STARTED));
        storage.store(entry("team_a", 2, LoopEventType.STARTED));

        assertEquals(List.of(0L), storage.readEntries("team/a").stream().map(JournalEntry::sequence).toList());
        assertEquals(List.of(1L), storage.readEntries("team:a").stream().map(JournalEntry::sequence).toList());
        assertEquals(List.of(2L), storage.readEntries("team_a").stream().map(JournalEntry::sequence).toList());

        assertEquals(1, storage.compact("team/a"));
        assertEquals(1, storage.readEntries("team:a").size());
    }

    @Test
    void shouldEncodeAgentIdsIntoDistinctFileNames() {
        assertEquals("agent-1.jsonl", JsonlJournalStorageAdapter.fileNameFor("agent-1"));
        assertEquals("team%2Fa.jsonl", JsonlJournalStorageAdapter.fileNameFor("team/a"));
        assertEquals("team%3Aa.jsonl", JsonlJournalStorageAdapter.fileNameFor("team:a"));
        assertEquals("%25.jsonl", JsonlJournalStorageAdapter.fileNameFor("%"));
        assertEquals("caf%C3%A9.jsonl", JsonlJournalStorageAdapter.fileNameFor("caf\u00e9"));
        assertEquals("%unknown.jsonl", JsonlJournalStorageAdapter.fileNameFor(null));
    }

    @Test
    void shouldSkipEntriesOfAnotherAgentInSameFile() throws IOException {
        storage.store(entry(AGENT_ID, 0, LoopEventType.STARTED));
        storage.store(entry("intruder", 0, LoopEventType.STARTED));
        Path intruderFile = tempDir.resolve("journal").resolve("intruder.jsonl");
        Files.writeString(tempDir.resolve("journal").resolve(AGENT_ID + ".jsonl"),
                Files.readString(intruderFile, StandardCharsets.UTF_8), StandardCharsets.UTF_8,
                StandardOpenOption.APPEND);

        List<JournalEntry> entries = storage.readEntries(AGENT_ID);

        assertEquals(1, entries.size());
        assertEquals(AGENT_ID, entries.get(0).agentId());
    }

    @Test
    void shouldReadFromSequenceAndReportLatest() {
        for (int i = 0; i < 5; i++) {
            storage.store(entry(AGENT_ID, i, LoopEventType.REASONING_COMPLETE));
        }

        assertEquals(List.of(3L, 4L), storage.readFrom(AGENT_ID, 3).stream().map(JournalEntry::sequence).toList());
        assertEquals(4, storage.latestSequence(AGENT_ID));
        assertEquals(-1, storage.latestSequence("nobody"));
    }

    @Test
    void shouldSkipUnreadableLines() throws IOException {
        storage.store(entry(AGENT_ID, 0, LoopEventType.STARTED));
        Path file = tempDir.resolve("journal").resolve(AGENT_ID + ".jsonl");
        Files.writeString(file, "{broken\n\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        storage.store(entry(AGENT_ID, 1, LoopEventType.TERMINATED));

        List<JournalEntry> entries = storage.readEntries(AGENT_ID);

        assertEquals(2, entries.size());
        assertEquals(1, entries.get(1).sequence());
    }

    @Test
    void shouldCompactByDeletingAgentFile() {
        storage.store(entry(AGENT_ID, 0, LoopEventType.STARTED));
        storage.store(entry(AGENT_ID, 1, LoopEventType.TERMINATED));

        assertEquals(2, storage.compact(AGENT_ID));

        assertTrue(storage.readEntries(AGENT_ID).isEmpty());
        assertFalse(Files.exists(tempDir.resolve("journal").resolve(AGENT_ID + ".jsonl")));
        assertEquals(0, storage.compact(AGENT_ID));
    }
}
