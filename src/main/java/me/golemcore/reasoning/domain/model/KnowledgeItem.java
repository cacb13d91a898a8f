package me.golemcore.reasoning.domain.model;

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

/**
 * A fact returned by the knowledge store.
 *
 * @param id
 *            store-assigned id
 * @param subject
 *            fact subject
 * @param predicate
 *            fact predicate
 * @param object
 *            fact object
 * @param confidence
 *            confidence recorded when the fact was stored
 * @param score
 *            store-computed similarity to the query, 0 when unknown
 */
public record KnowledgeItem(String id, String subject, String predicate, String object, double confidence,
        double score) {

    public String asSentence() {
        return subject + " " + predicate + " " + object;
    }
}
