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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.adapter.outbound.journal.JsonlJournalStorageAdapter;
import me.golemcore.reasoning.adapter.outbound.knowledge.InMemoryKnowledgeStoreAdapter;
import me.golemcore.reasoning.adapter.outbound.llm.Langchain4jInferenceAdapter;
import me.golemcore.reasoning.adapter.outbound.tools.ToolRegistryInvocationAdapter;
import me.golemcore.reasoning.domain.Sleeper;
import me.golemcore.reasoning.domain.breaker.CircuitBreakerRegistry;
import me.golemcore.reasoning.domain.component.ToolComponent;
import me.golemcore.reasoning.domain.conversation.CalibratingTokenEstimator;
import me.golemcore.reasoning.domain.conversation.CharacterTokenEstimator;
import me.golemcore.reasoning.domain.conversation.TokenEstimator;
import me.golemcore.reasoning.domain.executor.ActionExecutor;
import me.golemcore.reasoning.domain.executor.DefaultActionExecutor;
import me.golemcore.reasoning.domain.executor.ToolResultCache;
import me.golemcore.reasoning.domain.journal.BufferedJournal;
import me.golemcore.reasoning.domain.journal.DurableJournal;
import me.golemcore.reasoning.domain.knowledge.KnowledgeBridge;
import me.golemcore.reasoning.domain.knowledge.NoOpKnowledgeBridge;
import me.golemcore.reasoning.domain.knowledge.RelevanceScorer;
import me.golemcore.reasoning.domain.knowledge.StoreBackedKnowledgeBridge;
import me.golemcore.reasoning.domain.loop.InferenceRetryPolicy;
import me.golemcore.reasoning.domain.loop.ReasoningLoopRunner;
import me.golemcore.reasoning.domain.loop.ReasoningMetrics;
import me.golemcore.reasoning.domain.model.LoopConfig;
import me.golemcore.reasoning.domain.policy.PolicyGate;
import me.golemcore.reasoning.domain.policy.RuleBasedPolicyGate;
import me.golemcore.reasoning.port.outbound.InferencePort;
import me.golemcore.reasoning.port.outbound.JournalWriter;
import me.golemcore.reasoning.port.outbound.KnowledgeStorePort;
import me.golemcore.reasoning.port.outbound.ToolInvocationPort;
import me.golemcore.reasoning.tools.DateTimeTool;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the reasoning loop from {@link ReasoningProperties}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ReasoningLoopConfiguration {

    private final ReasoningProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public TokenEstimator tokenEstimator() {
        return new CalibratingTokenEstimator(new CharacterTokenEstimator());
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(Clock clock) {
        return new CircuitBreakerRegistry(properties.toBreakerConfig(), clock);
    }

    @Bean
    public ToolResultCache toolResultCache(ObjectMapper objectMapper, Clock clock) {
        return new ToolResultCache(objectMapper, clock);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolWorkers() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "reasoning-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public DateTimeTool dateTimeTool(Clock clock) {
        return new DateTimeTool(clock);
    }

    @Bean
    public ToolRegistryInvocationAdapter toolRegistryInvocationAdapter(List<ToolComponent> tools) {
        return new ToolRegistryInvocationAdapter(tools, properties.getTools().getMaxOutputChars());
    }

    @Bean
    public ActionExecutor actionExecutor(ToolInvocationPort toolInvocationPort, ExecutorService toolWorkers,
            ToolResultCache toolResultCache, Clock clock) {
        return new DefaultActionExecutor(toolInvocationPort, toolWorkers, toolResultCache, clock, Sleeper.THREAD);
    }

    @Bean
    public PolicyGate policyGate() {
        return RuleBasedPolicyGate.withDefaultRules(properties.deniedToolNames(),
                properties.redactedArgumentKeys());
    }

    @Bean
    public KnowledgeBridge knowledgeBridge(ObjectProvider<KnowledgeStorePort> knowledgeStore) {
        if (!properties.getKnowledge().isEnabled()) {
            return NoOpKnowledgeBridge.INSTANCE;
        }
        KnowledgeStorePort store = knowledgeStore.getIfAvailable(InMemoryKnowledgeStoreAdapter::new);
        log.info("[Knowledge] Bridge enabled with store {}", store.getClass().getSimpleName());
        return new StoreBackedKnowledgeBridge(store, properties.toKnowledgeSettings(), RelevanceScorer.storeScore());
    }

    @Bean
    public JournalWriter journalWriter(ObjectMapper objectMapper) {
        ReasoningProperties.JournalProperties journal = properties.getJournal();
        if (journal.isDurable()) {
            Path directory = Paths.get(journal.getDirectory().replace("${user.home}", System.getProperty("user.home")))
                    .toAbsolutePath().normalize();
            return new DurableJournal(new JsonlJournalStorageAdapter(directory, objectMapper));
        }
        return new BufferedJournal(journal.getBufferCapacity());
    }

    @Bean
    public ReasoningMetrics reasoningMetrics() {
        return new ReasoningMetrics();
    }

    @Bean
    public InferenceRetryPolicy inferenceRetryPolicy() {
        return properties.toRetryPolicy();
    }

    @Bean
    public InferencePort inferencePort() {
        return new Langchain4jInferenceAdapter(properties);
    }

    @Bean
    public ReasoningLoopRunner reasoningLoopRunner(InferencePort inferencePort, PolicyGate policyGate,
            ActionExecutor actionExecutor, CircuitBreakerRegistry circuitBreakerRegistry,
            KnowledgeBridge knowledgeBridge, JournalWriter journalWriter, TokenEstimator tokenEstimator,
            ReasoningMetrics reasoningMetrics, InferenceRetryPolicy inferenceRetryPolicy, Clock clock) {
        return new ReasoningLoopRunner(inferencePort, policyGate, actionExecutor, circuitBreakerRegistry,
                knowledgeBridge, journalWriter, tokenEstimator, reasoningMetrics, inferenceRetryPolicy, clock,
                Sleeper.THREAD);
    }

    /**
     * Run configuration built from properties, advertising every registered
     * tool.
     */
    @Bean
    public LoopConfig defaultLoopConfig(ToolRegistryInvocationAdapter toolRegistryInvocationAdapter) {
        return properties.toLoopConfig(toolRegistryInvocationAdapter.definitions());
    }
}
