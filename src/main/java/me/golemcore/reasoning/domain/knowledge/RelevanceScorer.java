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

import me.golemcore.reasoning.domain.model.KnowledgeItem;

/**
 * Ranks retrieved knowledge for injection. Higher is more relevant; items below
 * the configured threshold are not injected.
 */
@FunctionalInterface
public interface RelevanceScorer {

    double score(String query, KnowledgeItem item);

    /**
     * Uses the store's similarity score, or the stored confidence when the store
     * reports none.
     */
    static RelevanceScorer storeScore() {
        return (query, item) -> item.score() > 0 ? item.score() : item.confidence();
    }
}
