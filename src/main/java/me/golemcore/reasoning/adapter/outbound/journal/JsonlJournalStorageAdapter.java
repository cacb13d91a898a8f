package me.golemcore.reasoning.adapter.outbound.journal;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.model.JournalEntry;
import me.golemcore.reasoning.port.outbound.JournalStoragePort;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Journal storage writing one JSON object per line, one file per agent:
 * {@code <directory>/<encoded agentId>.jsonl}. Characters outside
 * {@code [A-Za-z0-9_-]} are written as {@code %XX} UTF-8 escapes, so distinct
 * agents never share a file. Unreadable lines and entries of another agent are
 * skipped on read.
 */
@Slf4j
public class JsonlJournalStorageAdapter implements JournalStoragePort {

    private static final String EXTENSION = ".jsonl";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Map<String, Object> fileLocks = new ConcurrentHashMap<>();

    public JsonlJournalStorageAdapter(Path directory, ObjectMapper objectMapper) {
        this.directory = directory.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(this.directory);
            log.info("[Journal] JSONL journal storage at {}", this.directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create journal directory: " + this.directory, e);
        }
    }

    @Override
    public void store(JournalEntry entry) {
        String fileName = fileNameFor(entry.agentId());
        Path file = directory.resolve(fileName);
        String line;
        try {
            line = objectMapper.writeValueAsString(entry) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize journal entry " + entry.sequence(), e);
        }
        synchronized (lockFor(fileName)) {
            try {
                Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append to " + file, e);
            }
        }
    }

    @Override
    public List<JournalEntry> readEntries(String agentId) {
        String fileName = fileNameFor(agentId);
        Path file = directory.resolve(fileName);
        List<String> lines;
        synchronized (lockFor(fileName)) {
            if (!Files.exists(file)) {
                return List.of();
            }
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + file, e);
            }
        }

        List<JournalEntry> entries = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                JournalEntry entry = objectMapper.readValue(line, JournalEntry.class);
                if (Objects.equals(agentId, entry.agentId())) {
                    entries.add(entry);
                }
            } catch (JsonProcessingException e) {
                log.warn("[Journal] Skipping unreadable line in {}: {}", file.getFileName(), e.getOriginalMessage());
            }
        }
        return entries;
    }

    @Override
    public List<JournalEntry> readFrom(String agentId, long fromSequence) {
        return readEntries(agentId).stream()
                .filter(entry -> entry.sequence() >= fromSequence)
                .toList();
    }

    @Override
    public long latestSequence(String agentId) {
        return readEntries(agentId).stream()
                .mapToLong(JournalEntry::sequence)
                .max()
                .orElse(-1);
    }

    @Override
    public long compact(String agentId) {
        String fileName = fileNameFor(agentId);
        synchronized (lockFor(fileName)) {
            long removed = readEntries(agentId).size();
            try {
                Files.deleteIfExists(directory.resolve(fileName));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to compact journal of " + agentId, e);
            }
            return removed;
        }
    }

    private Object lockFor(String fileName) {
        return fileLocks.computeIfAbsent(fileName, name -> new Object());
    }

    static String fileNameFor(String agentId) {
        if (agentId == null) {
            // '%' followed by non-hex never comes out of the encoding below
            return "%unknown" + EXTENSION;
        }
        StringBuilder name = new StringBuilder(agentId.length() + EXTENSION.length());
        for (byte b : agentId.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xFF);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_'
                    || c == '-') {
                name.append(c);
            } else {
                name.append('%').append(String.format("%02X", b & 0xFF));
            }
        }
        return name.append(EXTENSION).toString();
    }
}
