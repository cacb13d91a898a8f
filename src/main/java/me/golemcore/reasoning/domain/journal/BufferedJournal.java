package me.golemcore.reasoning.domain.journal;

import me.golemcore.reasoning.domain.model.JournalEntry;
import me.golemcore.reasoning.port.outbound.JournalWriter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * In-memory journal sink backed by a bounded ring buffer. When full, the oldest
 * entry is evicted. Entries keep the sequence numbers they were appended with;
 * draining the buffer does not reset them.
 */
public class BufferedJournal implements JournalWriter {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<JournalEntry> buffer;
    private long evicted;

    public BufferedJournal() {
        this(DEFAULT_CAPACITY);
    }

    public BufferedJournal(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(Math.min(capacity, DEFAULT_CAPACITY));
    }

    @Override
    public synchronized void append(JournalEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (buffer.size() == capacity) {
            buffer.removeFirst();
            evicted++;
        }
        buffer.addLast(entry);
    }

    public synchronized List<JournalEntry> entries() {
        return List.copyOf(buffer);
    }

    /**
     * Entries of a single run, in append order.
     */
    public synchronized List<JournalEntry> entries(String runId) {
        List<JournalEntry> result = new ArrayList<>();
        for (JournalEntry entry : buffer) {
            if (Objects.equals(runId, entry.runId())) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Removes and returns every buffered entry.
     */
    public synchronized List<JournalEntry> drain() {
        List<JournalEntry> drained = List.copyOf(buffer);
        buffer.clear();
        return drained;
    }

    public synchronized int size() {
        return buffer.size();
    }

    public synchronized long evictedCount() {
        return evicted;
    }

    public int capacity() {
        return capacity;
    }
}
