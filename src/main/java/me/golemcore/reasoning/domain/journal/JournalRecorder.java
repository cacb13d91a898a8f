package me.golemcore.reasoning.domain.journal;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.model.JournalEntry;
import me.golemcore.reasoning.domain.model.LoopEventType;
import me.golemcore.reasoning.port.outbound.JournalWriter;

import java.time.Clock;
import java.util.Map;

/**
 * Stamps journal entries for one run and writes them to the sink. Write
 * failures are logged and never reach the loop.
 */
@Slf4j
public class JournalRecorder {

    private final String runId;
    private final String agentId;
    private final JournalWriter writer;
    private final Clock clock;
    private long sequence;

    public JournalRecorder(String runId, String agentId, JournalWriter writer, Clock clock) {
        this.runId = runId;
        this.agentId = agentId;
        this.writer = writer;
        this.clock = clock;
    }

    public void record(int iteration, LoopEventType event, Map<String, Object> payload) {
        JournalEntry entry = JournalEntry.builder()
                .runId(runId)
                .agentId(agentId)
                .sequence(sequence++)
                .timestamp(clock.instant())
                .iteration(iteration)
                .event(event)
                .payload(payload)
                .build();
        try {
            writer.append(entry);
        } catch (RuntimeException e) {
            log.warn("[Journal] Failed to write {} for run {}: {}", event, runId, e.getMessage());
        }
    }

    public long recorded() {
        return sequence;
    }
}
