package me.golemcore.reasoning.domain.executor;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last successful output per tool and argument set, served by the
 * cached-result recovery strategy.
 */
@Slf4j
public class ToolResultCache {

    private final ObjectMapper keyMapper;
    private final Clock clock;
    private final Map<String, CachedResult> entries = new ConcurrentHashMap<>();

    public ToolResultCache(ObjectMapper objectMapper, Clock clock) {
        this.keyMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
    }

    public void put(String toolName, Map<String, Object> arguments, String output) {
        entries.put(key(toolName, arguments), new CachedResult(output, clock.instant()));
    }

    /**
     * Returns a cached output no older than {@code maxStaleness}.
     */
    public Optional<CachedResult> lookup(String toolName, Map<String, Object> arguments, Duration maxStaleness) {
        CachedResult cached = entries.get(key(toolName, arguments));
        if (cached == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(cached.storedAt(), clock.instant());
        if (age.compareTo(maxStaleness) > 0) {
            return Optional.empty();
        }
        return Optional.of(cached);
    }

    public int size() {
        return entries.size();
    }

    private String key(String toolName, Map<String, Object> arguments) {
        try {
            return toolName + ":" + keyMapper.writeValueAsString(arguments != null ? arguments : Map.of());
        } catch (JsonProcessingException e) {
            log.debug("[Executor] Arguments of '{}' not serializable for caching: {}", toolName, e.getMessage());
            return toolName + ":" + arguments;
        }
    }

    public record CachedResult(String output, Instant storedAt) {
    }
}
