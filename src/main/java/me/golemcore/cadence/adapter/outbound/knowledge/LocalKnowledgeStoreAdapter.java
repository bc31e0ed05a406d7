package me.golemcore.cadence.adapter.outbound.knowledge;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeSuggestion;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.KnowledgeStorePort;
import me.golemcore.cadence.port.outbound.StoragePort;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Knowledge store backed by JSON documents in the workspace.
 *
 * <p>
 * Entries live in {@code knowledge/entries.json} and suggestions in
 * {@code knowledge/suggestions.json}. Every save rewrites the document
 * atomically and only then replaces the in-memory snapshot, so a failed write
 * leaves both unchanged. Records handed out are detached copies. When no
 * entries document exists yet, foundational and cross-site entries are seeded
 * from the classpath resource named by {@code cadence.knowledge.seed-resource}
 * and written to the workspace. A document that cannot be parsed is copied
 * aside as {@code <name>.corrupt-<epochMillis>} before anything replaces it.
 */
@Component
@Slf4j
public class LocalKnowledgeStoreAdapter implements KnowledgeStorePort {

    private static final String KNOWLEDGE_DIR = "knowledge";
    private static final String ENTRIES_FILE = "entries.json";
    private static final String SUGGESTIONS_FILE = "suggestions.json";
    private static final TypeReference<List<KnowledgeEntry>> ENTRY_LIST_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<List<KnowledgeSuggestion>> SUGGESTION_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final CadenceProperties properties;
    private final Clock clock;

    private final AtomicReference<List<KnowledgeEntry>> entriesCache = new AtomicReference<>();
    private final AtomicReference<List<KnowledgeSuggestion>> suggestionsCache = new AtomicReference<>();

    public LocalKnowledgeStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper,
            CadenceProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<KnowledgeEntry> findAllEntries() {
        return getEntries().stream().map(KnowledgeEntry::copy).toList();
    }

    @Override
    public Optional<KnowledgeEntry> findEntry(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return getEntries().stream()
                .filter(entry -> id.equals(entry.getId()))
                .findFirst()
                .map(KnowledgeEntry::copy);
    }

    @Override
    public synchronized KnowledgeEntry saveEntry(KnowledgeEntry entry) {
        validate(entry);
        List<KnowledgeEntry> entries = new ArrayList<>(getEntries());
        replaceOrAdd(entries, entry.copy());
        persistEntries(entries);
        return entry;
    }

    @Override
    public synchronized void saveEntries(List<KnowledgeEntry> updated) {
        if (updated.isEmpty()) {
            return;
        }
        List<KnowledgeEntry> entries = new ArrayList<>(getEntries());
        for (KnowledgeEntry entry : updated) {
            validate(entry);
            replaceOrAdd(entries, entry.copy());
        }
        persistEntries(entries);
    }

    @Override
    public List<KnowledgeSuggestion> findAllSuggestions() {
        return getSuggestions().stream().map(KnowledgeSuggestion::copy).toList();
    }

    @Override
    public Optional<KnowledgeSuggestion> findSuggestion(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return getSuggestions().stream()
                .filter(suggestion -> id.equals(suggestion.getId()))
                .findFirst()
                .map(KnowledgeSuggestion::copy);
    }

    @Override
    public synchronized KnowledgeSuggestion saveSuggestion(KnowledgeSuggestion suggestion) {
        if (suggestion.getId() == null) {
            throw new IllegalArgumentException("Knowledge suggestion requires an id");
        }
        List<KnowledgeSuggestion> suggestions = new ArrayList<>(getSuggestions());
        suggestions.removeIf(existing -> suggestion.getId().equals(existing.getId()));
        suggestions.add(suggestion.copy());
        try {
            String json = objectMapper.writeValueAsString(suggestions);
            storagePort.putTextAtomic(KNOWLEDGE_DIR, SUGGESTIONS_FILE, json, true).join();
            suggestionsCache.set(List.copyOf(suggestions));
        } catch (IOException | RuntimeException e) {
            log.error("[Knowledge] Failed to save suggestions", e);
            throw new IllegalStateException("Failed to persist knowledge suggestions", e);
        }
        return suggestion;
    }

    private synchronized List<KnowledgeEntry> getEntries() {
        List<KnowledgeEntry> cached = entriesCache.get();
        if (cached == null) {
            cached = loadEntries();
            entriesCache.set(cached);
        }
        return cached;
    }

    private synchronized List<KnowledgeSuggestion> getSuggestions() {
        List<KnowledgeSuggestion> cached = suggestionsCache.get();
        if (cached == null) {
            cached = loadSuggestions();
            suggestionsCache.set(cached);
        }
        return cached;
    }

    private void validate(KnowledgeEntry entry) {
        if (entry.getId() == null || entry.getTier() == null) {
            throw new IllegalArgumentException("Knowledge entry requires id and tier");
        }
    }

    private void replaceOrAdd(List<KnowledgeEntry> entries, KnowledgeEntry entry) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getId().equals(entry.getId())) {
                entries.set(i, entry);
                return;
            }
        }
        entries.add(entry);
    }

    private void persistEntries(List<KnowledgeEntry> entries) {
        try {
            String json = objectMapper.writeValueAsString(entries);
            storagePort.putTextAtomic(KNOWLEDGE_DIR, ENTRIES_FILE, json, true).join();
            entriesCache.set(List.copyOf(entries));
        } catch (IOException | RuntimeException e) {
            log.error("[Knowledge] Failed to save entries", e);
            throw new IllegalStateException("Failed to persist knowledge entries", e);
        }
    }

    private List<KnowledgeEntry> loadEntries() {
        String json = readDocument(ENTRIES_FILE);
        if (json == null || json.isBlank()) {
            return seedEntries();
        }
        try {
            List<KnowledgeEntry> entries = objectMapper.readValue(json, ENTRY_LIST_TYPE_REF);
            log.info("[Knowledge] Loaded {} entries from workspace", entries.size());
            return List.copyOf(entries);
        } catch (IOException e) {
            quarantine(ENTRIES_FILE, json, e);
            return seedEntries();
        }
    }

    private List<KnowledgeEntry> seedEntries() {
        String seedResource = properties.getKnowledge().getSeedResource();
        ClassPathResource resource = new ClassPathResource(seedResource);
        if (!resource.exists()) {
            log.warn("[Knowledge] Seed resource {} not found, starting with an empty knowledge base", seedResource);
            return List.of();
        }
        List<KnowledgeEntry> entries;
        try (InputStream is = resource.getInputStream()) {
            entries = new ArrayList<>(objectMapper.readValue(is, ENTRY_LIST_TYPE_REF));
        } catch (IOException e) {
            log.warn("[Knowledge] Failed to read seed resource {}: {}", seedResource, e.getMessage());
            return List.of();
        }
        Instant now = clock.instant();
        for (KnowledgeEntry entry : entries) {
            if (entry.getCreatedAt() == null) {
                entry.setCreatedAt(now);
            }
            if (entry.getLastValidatedAt() == null) {
                entry.setLastValidatedAt(now);
            }
        }
        persistEntries(entries);
        log.info("[Knowledge] Seeded {} entries from {}", entries.size(), seedResource);
        return List.copyOf(entries);
    }

    private List<KnowledgeSuggestion> loadSuggestions() {
        String json = readDocument(SUGGESTIONS_FILE);
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(objectMapper.readValue(json, SUGGESTION_LIST_TYPE_REF));
        } catch (IOException e) {
            quarantine(SUGGESTIONS_FILE, json, e);
            return List.of();
        }
    }

    private String readDocument(String file) {
        try {
            return storagePort.getText(KNOWLEDGE_DIR, file).join();
        } catch (RuntimeException e) {
            log.error("[Knowledge] Cannot read {}/{}", KNOWLEDGE_DIR, file, e);
            throw new IllegalStateException("Cannot read knowledge document " + file, e);
        }
    }

    private void quarantine(String file, String content, IOException cause) {
        String aside = file + ".corrupt-" + clock.millis();
        try {
            storagePort.putTextAtomic(KNOWLEDGE_DIR, aside, content, false).join();
        } catch (RuntimeException e) {
            log.error("[Knowledge] {} is unreadable and could not be copied aside", file, e);
            throw new IllegalStateException("Corrupt knowledge document " + file + " could not be preserved", e);
        }
        log.error("[Knowledge] {} could not be parsed ({}), preserved as {}", file, cause.getMessage(), aside);
    }
}
