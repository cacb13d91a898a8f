package me.golemcore.reasoning.domain.knowledge;

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
import me.golemcore.reasoning.domain.conversation.Conversation;
import me.golemcore.reasoning.domain.executor.ActionExecutor;
import me.golemcore.reasoning.domain.model.KnowledgeItem;
import me.golemcore.reasoning.domain.model.Message;
import me.golemcore.reasoning.domain.model.ToolDefinition;
import me.golemcore.reasoning.port.outbound.KnowledgeStorePort;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Knowledge bridge backed by a {@link KnowledgeStorePort}.
 */
@Slf4j
public class StoreBackedKnowledgeBridge implements KnowledgeBridge {

    static final String NO_KNOWLEDGE = "No relevant knowledge found.";
    static final int MAX_LEARNING_CHARS = 2000;
    static final double LEARNING_CONFIDENCE = 0.6;

    private final KnowledgeStorePort store;
    private final KnowledgeBridgeSettings settings;
    private final RelevanceScorer scorer;

    public StoreBackedKnowledgeBridge(KnowledgeStorePort store, KnowledgeBridgeSettings settings,
            RelevanceScorer scorer) {
        this.store = store;
        this.settings = settings;
        this.scorer = scorer;
    }

    @Override
    public void injectContext(Conversation conversation) {
        String query = SearchTermExtractor.extract(conversation);
        if (query.isBlank()) {
            conversation.injectKnowledgeContext(null);
            return;
        }

        List<KnowledgeItem> candidates;
        try {
            candidates = store.query(query, settings.maxContextItems() * 2);
        } catch (RuntimeException e) {
            log.warn("[Knowledge] Context query failed, keeping previous context: {}", e.getMessage());
            return;
        }

        List<ScoredItem> ranked = rank(query, candidates).stream()
                .filter(scored -> scored.score() >= settings.relevanceThreshold())
                .limit(settings.maxContextItems())
                .toList();
        if (ranked.isEmpty()) {
            conversation.injectKnowledgeContext(null);
            return;
        }

        StringBuilder sb = new StringBuilder("Relevant knowledge:");
        for (int i = 0; i < ranked.size(); i++) {
            KnowledgeItem item = ranked.get(i).item();
            sb.append('\n').append(i + 1).append(". ").append(item.asSentence())
                    .append(String.format(Locale.ROOT, " (confidence %.2f)", item.confidence()));
        }
        conversation.injectKnowledgeContext(sb.toString());
        log.debug("[Knowledge] Injected {} item(s) for query of {} chars", ranked.size(), query.length());
    }

    @Override
    public ActionExecutor intercept(ActionExecutor delegate) {
        return new KnowledgeAwareActionExecutor(delegate, this);
    }

    @Override
    public List<ToolDefinition> toolDefinitions() {
        return List.of(
                ToolDefinition.builder()
                        .name(RECALL_TOOL)
                        .description("Search the knowledge store for facts relevant to a query.")
                        .parameters(Map.of(
                                "type", "object",
                                "properties", Map.of(
                                        "query", Map.of("type", "string", "description", "What to look up"),
                                        "limit", Map.of("type", "integer",
                                                "description", "Maximum number of facts (default 5)")),
                                "required", List.of("query")))
                        .build(),
                ToolDefinition.builder()
                        .name(STORE_TOOL)
                        .description("Store a fact as a subject-predicate-object triple.")
                        .parameters(Map.of(
                                "type", "object",
                                "properties", Map.of(
                                        "subject", Map.of("type", "string"),
                                        "predicate", Map.of("type", "string"),
                                        "object", Map.of("type", "string"),
                                        "confidence", Map.of("type", "number",
                                                "description", "Confidence between 0 and 1 (default 0.8)")),
                                "required", List.of("subject", "predicate", "object")))
                        .build());
    }

    @Override
    public void persistLearnings(String agentId, Conversation conversation) {
        if (!settings.autoPersist()) {
            return;
        }
        String summary = conversation.historyMessages().stream()
                .filter(Message::isAssistantMessage)
                .map(Message::getContent)
                .filter(content -> content != null && !content.isBlank())
                .collect(Collectors.joining("\n"));
        if (summary.isBlank()) {
            return;
        }
        if (summary.length() > MAX_LEARNING_CHARS) {
            summary = summary.substring(0, MAX_LEARNING_CHARS);
        }
        try {
            String id = store.store(agentId, "learned", summary, LEARNING_CONFIDENCE);
            log.debug("[Knowledge] Persisted learnings for agent {} as {}", agentId, id);
        } catch (RuntimeException e) {
            log.warn("[Knowledge] Failed to persist learnings for agent {}: {}", agentId, e.getMessage());
        }
    }

    /**
     * Answers {@value KnowledgeBridge#RECALL_TOOL}.
     */
    public String recall(String query, int limit) {
        List<ScoredItem> ranked = rank(query, store.query(query, limit));
        if (ranked.isEmpty()) {
            return NO_KNOWLEDGE;
        }
        StringBuilder sb = new StringBuilder("Found ").append(ranked.size()).append(" relevant fact(s):");
        for (int i = 0; i < ranked.size(); i++) {
            KnowledgeItem item = ranked.get(i).item();
            sb.append('\n').append(i + 1).append(". ").append(item.asSentence())
                    .append(String.format(Locale.ROOT, " (confidence %.2f)", item.confidence()));
        }
        return sb.toString();
    }

    /**
     * Answers {@value KnowledgeBridge#STORE_TOOL}.
     */
    public String store(String subject, String predicate, String object, double confidence) {
        String id = store.store(subject, predicate, object, confidence);
        return "Stored fact: " + subject + " " + predicate + " " + object + " (id: " + id + ")";
    }

    private List<ScoredItem> rank(String query, List<KnowledgeItem> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream()
                .map(item -> new ScoredItem(item, scorer.score(query, item)))
                .sorted(Comparator.comparingDouble(ScoredItem::score).reversed())
                .toList();
    }

    private record ScoredItem(KnowledgeItem item, double score) {
    }
}
