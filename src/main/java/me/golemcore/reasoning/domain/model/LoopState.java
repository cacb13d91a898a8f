package me.golemcore.reasoning.domain.model;

import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;

/**
 * Running totals carried across iterations of one run. Counters only grow.
 * Mutated by the loop runner between phases; every other collaborator reads
 * it.
 */
@Getter
public class LoopState {

    private final LoopConfig config;
    private final Instant startedAt;
    private final BreakerStateView breakers;
    private final Set<String> advertisedToolNames;

    private int iteration;
    private TokenUsage totalUsage = TokenUsage.zero();

    public LoopState(LoopConfig config, Instant startedAt, BreakerStateView breakers,
            Collection<String> advertisedToolNames) {
        this.config = config;
        this.startedAt = startedAt;
        this.breakers = breakers;
        this.advertisedToolNames = Set.copyOf(advertisedToolNames);
    }

    public void incrementIteration() {
        iteration++;
    }

    public void addUsage(TokenUsage usage) {
        if (usage == null || usage.promptTokens() < 0 || usage.completionTokens() < 0) {
            return;
        }
        totalUsage = totalUsage.plus(usage);
    }

    public long getTotalTokens() {
        return totalUsage.totalTokens();
    }

    public Duration elapsed(Clock clock) {
        return Duration.between(startedAt, clock.instant());
    }

    public boolean isAdvertised(String toolName) {
        return toolName != null && advertisedToolNames.contains(toolName);
    }

    /**
     * Read-only view into per-tool circuit breaker state.
     */
    public interface BreakerStateView {

        CircuitBreakerState stateOf(String toolName);
    }
}
