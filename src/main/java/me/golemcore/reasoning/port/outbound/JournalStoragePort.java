package me.golemcore.reasoning.port.outbound;

import me.golemcore.reasoning.domain.model.JournalEntry;

import java.util.List;

/**
 * Durable storage behind the journal, keyed by agent.
 */
public interface JournalStoragePort {

    void store(JournalEntry entry);

    List<JournalEntry> readEntries(String agentId);

    List<JournalEntry> readFrom(String agentId, long fromSequence);

    /**
     * Highest stored sequence for the agent, or {@code -1} when none.
     */
    long latestSequence(String agentId);

    /**
     * Removes all entries of the agent and returns how many were removed.
     */
    long compact(String agentId);
}
