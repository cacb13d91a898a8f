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

/**
 * @param maxContextItems
 *            most facts injected before one reasoning call
 * @param relevanceThreshold
 *            minimum relevance score for injection
 * @param autoPersist
 *            store a summary of assistant output after completed runs
 */
public record KnowledgeBridgeSettings(int maxContextItems, double relevanceThreshold, boolean autoPersist) {

    public static KnowledgeBridgeSettings defaults() {
        return new KnowledgeBridgeSettings(5, 0.3, true);
    }
}
