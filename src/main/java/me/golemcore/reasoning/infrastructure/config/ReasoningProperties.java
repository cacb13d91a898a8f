package me.golemcore.reasoning.infrastructure.config;

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

import lombok.Data;
import me.golemcore.reasoning.domain.breaker.CircuitBreakerConfig;
import me.golemcore.reasoning.domain.knowledge.KnowledgeBridgeSettings;
import me.golemcore.reasoning.domain.loop.InferenceRetryPolicy;
import me.golemcore.reasoning.domain.model.ContextStrategy;
import me.golemcore.reasoning.domain.model.InferenceOptions;
import me.golemcore.reasoning.domain.model.LoopConfig;
import me.golemcore.reasoning.domain.model.RecoveryStrategy;
import me.golemcore.reasoning.domain.model.ToolDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime configuration bound from {@code reasoning.*} properties.
 *
 * <p>
 * Nested groups:
 * <ul>
 * <li>{@link LoopProperties} - run limits and context budgeting</li>
 * <li>{@link RecoveryProperties} - default and per-tool recovery</li>
 * <li>{@link BreakerProperties} - circuit breaker thresholds</li>
 * <li>{@link InferenceProperties} - model provider and retry</li>
 * <li>{@link KnowledgeProperties} - knowledge bridge</li>
 * <li>{@link JournalProperties} - journal sink</li>
 * <li>{@link PolicyProperties} - default policy rules</li>
 * <li>{@link ToolsProperties} - tool registry</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "reasoning")
@Data
public class ReasoningProperties {

    private LoopProperties loop = new LoopProperties();
    private RecoveryProperties recovery = new RecoveryProperties();
    private BreakerProperties breaker = new BreakerProperties();
    private InferenceProperties inference = new InferenceProperties();
    private KnowledgeProperties knowledge = new KnowledgeProperties();
    private JournalProperties journal = new JournalProperties();
    private PolicyProperties policy = new PolicyProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class LoopProperties {
        private int maxIterations = 25;
        private long maxTotalTokens = 100_000;
        private Duration timeout = Duration.ofSeconds(300);
        private Duration toolTimeout = Duration.ofSeconds(30);
        private int maxConcurrentTools = 5;
        private int contextTokenBudget = 32_000;
        private ContextStrategy contextStrategy = ContextStrategy.SLIDING_WINDOW;
        private int anchoredRecentCount = 10;
        private int observationKeepRecent = 6;
    }

    @Data
    public static class RecoveryProperties {
        private String defaultStrategy = "RETRY";
        private int retryMaxAttempts = 2;
        private Duration retryBaseDelay = Duration.ofMillis(500);
        private Map<String, String> toolOverrides = new HashMap<>();
        private Map<String, List<String>> fallbacks = new HashMap<>();
        private Duration cacheMaxStaleness = Duration.ofMinutes(5);
        private String escalationQueue = "default";
    }

    @Data
    public static class BreakerProperties {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(30);
        private int halfOpenMaxCalls = 2;
    }

    @Data
    public static class InferenceProperties {
        private String provider = "openai";
        private String model;
        private String apiKey;
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(120);
        private int maxTokens = 4096;
        private double temperature = 0.3;
        private int retryMaxAttempts = 3;
        private Duration retryInitialBackoff = Duration.ofMillis(500);
        private Duration retryMaxBackoff = Duration.ofSeconds(8);
    }

    @Data
    public static class KnowledgeProperties {
        private boolean enabled = false;
        private int maxContextItems = 5;
        private double relevanceThreshold = 0.3;
        private boolean autoPersist = true;
    }

    @Data
    public static class JournalProperties {
        private int bufferCapacity = 1000;
        private boolean durable = false;
        private String directory = "${user.home}/.golemcore/journal";
    }

    @Data
    public static class PolicyProperties {
        private List<String> deniedTools = new ArrayList<>();
        private List<String> redactedArgumentKeys = new ArrayList<>();
    }

    @Data
    public static class ToolsProperties {
        private int maxOutputChars = 100_000;
    }

    /**
     * Builds the run configuration these properties describe.
     */
    public LoopConfig toLoopConfig(List<ToolDefinition> toolDefinitions) {
        LoopConfig.LoopConfigBuilder builder = LoopConfig.builder()
                .maxIterations(loop.getMaxIterations())
                .maxTotalTokens(loop.getMaxTotalTokens())
                .timeout(loop.getTimeout())
                .toolTimeout(loop.getToolTimeout())
                .maxConcurrentTools(loop.getMaxConcurrentTools())
                .contextTokenBudget(loop.getContextTokenBudget())
                .contextStrategy(loop.getContextStrategy())
                .anchoredRecentCount(loop.getAnchoredRecentCount())
                .observationKeepRecent(loop.getObservationKeepRecent())
                .defaultRecovery(recoveryStrategy(recovery.getDefaultStrategy(), null))
                .inference(InferenceOptions.builder()
                        .model(inference.getModel())
                        .maxTokens(inference.getMaxTokens())
                        .temperature(inference.getTemperature())
                        .build());
        recovery.getToolOverrides().forEach(
                (tool, strategy) -> builder.toolRecovery(tool, recoveryStrategy(strategy, tool)));
        if (toolDefinitions != null) {
            builder.tools(toolDefinitions);
        }
        return builder.build();
    }

    /**
     * Resolves a strategy name to a concrete strategy. Fallback alternatives are
     * looked up under {@code recovery.fallbacks.<tool>}.
     */
    public RecoveryStrategy recoveryStrategy(String name, String toolName) {
        return switch (RecoveryStrategy.Kind.parse(name)) {
        case RETRY -> RecoveryStrategy.retry(recovery.getRetryMaxAttempts(), recovery.getRetryBaseDelay());
        case FALLBACK -> RecoveryStrategy.fallback(
                toolName != null ? recovery.getFallbacks().getOrDefault(toolName, List.of()) : List.of());
        case CACHED_RESULT -> RecoveryStrategy.cachedResult(recovery.getCacheMaxStaleness());
        case LLM_RECOVERY -> RecoveryStrategy.llmRecovery();
        case ESCALATE -> RecoveryStrategy.escalate(recovery.getEscalationQueue());
        case DEAD_LETTER -> RecoveryStrategy.deadLetter();
        };
    }

    public CircuitBreakerConfig toBreakerConfig() {
        return new CircuitBreakerConfig(breaker.getFailureThreshold(), breaker.getRecoveryTimeout(),
                breaker.getHalfOpenMaxCalls());
    }

    public InferenceRetryPolicy toRetryPolicy() {
        return new InferenceRetryPolicy(inference.getRetryMaxAttempts(), inference.getRetryInitialBackoff(),
                inference.getRetryMaxBackoff());
    }

    public KnowledgeBridgeSettings toKnowledgeSettings() {
        return new KnowledgeBridgeSettings(knowledge.getMaxContextItems(), knowledge.getRelevanceThreshold(),
                knowledge.isAutoPersist());
    }

    public Set<String> deniedToolNames() {
        return new LinkedHashSet<>(policy.getDeniedTools());
    }

    public Set<String> redactedArgumentKeys() {
        return new LinkedHashSet<>(policy.getRedactedArgumentKeys());
    }
}
