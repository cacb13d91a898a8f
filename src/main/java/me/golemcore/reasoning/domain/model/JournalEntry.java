package me.golemcore.reasoning.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only journal record of one phase transition or terminal outcome.
 */
@Builder(toBuilder = true)
public record JournalEntry(String runId, String agentId, long sequence, Instant timestamp, int iteration,
        LoopEventType event, Map<String, Object> payload) {

    public JournalEntry {
        payload = payload == null ? Map.of() : payload;
    }

    public JournalEntry withSequence(long newSequence) {
        return toBuilder().sequence(newSequence).build();
    }
}
