package me.golemcore.cadence.port.outbound;

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

import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeSuggestion;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for knowledge entries and pattern suggestions. Each save is
 * atomic for the single record it touches.
 */
public interface KnowledgeStorePort {

    List<KnowledgeEntry> findAllEntries();

    Optional<KnowledgeEntry> findEntry(String id);

    KnowledgeEntry saveEntry(KnowledgeEntry entry);

    /**
     * Persists several entries in one write (used when vectors are backfilled).
     */
    void saveEntries(List<KnowledgeEntry> entries);

    List<KnowledgeSuggestion> findAllSuggestions();

    Optional<KnowledgeSuggestion> findSuggestion(String id);

    KnowledgeSuggestion saveSuggestion(KnowledgeSuggestion suggestion);
}
