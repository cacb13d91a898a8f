package me.golemcore.reasoning.adapter.outbound.journal;

import me.golemcore.reasoning.domain.model.JournalEntry;
import me.golemcore.reasoning.port.outbound.JournalStoragePort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Journal storage kept in process memory. Lost on restart.
 */
public class InMemoryJournalStorageAdapter implements JournalStoragePort {

    private final Map<String, List<JournalEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public void store(JournalEntry entry) {
        List<JournalEntry> agentEntries = entries.computeIfAbsent(entry.agentId(), id -> new ArrayList<>());
        synchronized (agentEntries) {
            agentEntries.add(entry);
        }
    }

    @Override
    public List<JournalEntry> readEntries(String agentId) {
        List<JournalEntry> agentEntries = entries.get(agentId);
        if (agentEntries == null) {
            return List.of();
        }
        synchronized (agentEntries) {
            return List.copyOf(agentEntries);
        }
    }

    @Override
    public List<JournalEntry> readFrom(String agentId, long fromSequence) {
        return readEntries(agentId).stream()
                .filter(entry -> entry.sequence() >= fromSequence)
                .toList();
    }

    @Override
    public long latestSequence(String agentId) {
        return readEntries(agentId).stream()
                .mapToLong(JournalEntry::sequence)
                .max()
                .orElse(-1);
    }

    @Override
    public long compact(String agentId) {
        List<JournalEntry> removed = entries.remove(agentId);
        if (removed == null) {
            return 0;
        }
        synchronized (removed) {
            return removed.size();
        }
    }
}
