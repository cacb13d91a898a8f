package me.golemcore.reasoning.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable per-run configuration. Created once by the caller and read-only for
 * the lifetime of the run.
 */
@Value
@Builder(toBuilder = true)
public class LoopConfig {

    @Builder.Default
    int maxIterations = 25;

    @Builder.Default
    long maxTotalTokens = 100_000;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(300);

    @Builder.Default
    Duration toolTimeout = Duration.ofSeconds(30);

    @Builder.Default
    int maxConcurrentTools = 5;

    @Builder.Default
    int contextTokenBudget = 32_000;

    @Builder.Default
    ContextStrategy contextStrategy = ContextStrategy.SLIDING_WINDOW;

    /** Messages kept verbatim by the anchored summary strategy. */
    @Builder.Default
    int anchoredRecentCount = 10;

    /** Messages never masked by the observation masking strategy. */
    @Builder.Default
    int observationKeepRecent = 6;

    @Builder.Default
    RecoveryStrategy defaultRecovery = RecoveryStrategy.defaultStrategy();

    @Singular("toolRecovery")
    Map<String, RecoveryStrategy> toolRecoveryOverrides;

    @Builder.Default
    InferenceOptions inference = InferenceOptions.builder().build();

    @Singular
    List<ToolDefinition> tools;

    public static LoopConfig defaults() {
        return LoopConfig.builder().build();
    }

    /**
     * Recovery strategy for a failed call to the given tool.
     */
    public RecoveryStrategy recoveryFor(String toolName) {
        RecoveryStrategy override = toolName != null ? toolRecoveryOverrides.get(toolName) : null;
        return override != null ? override : defaultRecovery;
    }

    public Set<String> declaredToolNames() {
        return tools.stream().map(ToolDefinition::getName).collect(Collectors.toUnmodifiableSet());
    }
}
