package me.golemcore.reasoning.domain.journal;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.model.JournalEntry;
import me.golemcore.reasoning.port.outbound.JournalStoragePort;
import me.golemcore.reasoning.port.outbound.JournalWriter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Journal sink that persists every entry through a {@link JournalStoragePort}
 * and supports replay per agent.
 *
 * <p>
 * Sequence numbers are assigned per agent and resume from the highest stored
 * sequence, so a restarted process continues where the previous one stopped.
 */
@Slf4j
public class DurableJournal implements JournalWriter {

    private final JournalStoragePort storage;
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    public DurableJournal(JournalStoragePort storage) {
        this.storage = storage;
    }

    /**
     * Loads the stored sequence for an agent. Called lazily on first append,
     * callers may invoke it eagerly.
     */
    public void initialize(String agentId) {
        sequenceFor(agentId);
    }

    @Override
    public void append(JournalEntry entry) {
        AtomicLong sequence = sequenceFor(entry.agentId());
        // storage order must follow sequence order for one agent
        synchronized (sequence) {
            storage.store(entry.withSequence(sequence.getAndIncrement()));
        }
    }

    public List<JournalEntry> replay(String agentId) {
        return storage.readEntries(agentId);
    }

    public List<JournalEntry> replayFrom(String agentId, long fromSequence) {
        return storage.readFrom(agentId, fromSequence);
    }

    /**
     * Removes an agent's history and restarts its sequence at zero.
     */
    public long compact(String agentId) {
        AtomicLong sequence = sequenceFor(agentId);
        synchronized (sequence) {
            long removed = storage.compact(agentId);
            sequence.set(0);
            log.info("[Journal] Compacted {} entr(ies) for agent {}", removed, agentId);
            return removed;
        }
    }

    /**
     * Highest iteration recorded for the agent, or {@code -1} without history.
     */
    public int lastCompletedIteration(String agentId) {
        return storage.readEntries(agentId).stream()
                .mapToInt(JournalEntry::iteration)
                .max()
                .orElse(-1);
    }

    public long nextSequence(String agentId) {
        return sequenceFor(agentId).get();
    }

    private AtomicLong sequenceFor(String agentId) {
        return sequences.computeIfAbsent(agentId, id -> {
            long latest = storage.latestSequence(id);
            log.debug("[Journal] Resuming agent {} at sequence {}", id, latest + 1);
            return new AtomicLong(latest + 1);
        });
    }
}
