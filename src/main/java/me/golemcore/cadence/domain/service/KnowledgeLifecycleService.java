package me.golemcore.cadence.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeStats;
import me.golemcore.cadence.domain.model.KnowledgeStatus;
import me.golemcore.cadence.domain.model.SuggestionStatus;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.KnowledgeStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Validation, archival, reference tracking and staleness of knowledge entries.
 *
 * <p>
 * Staleness is never stored: an active entry whose last validation (or
 * creation) is older than its tier's threshold is reported as
 * {@link KnowledgeStatus#STALE} by {@link #effectiveStatus(KnowledgeEntry)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeLifecycleService {

    private final KnowledgeStorePort knowledgeStore;
    private final CadenceProperties properties;
    private final Clock clock;

    public Optional<KnowledgeEntry> getEntry(String id) {
        return knowledgeStore.findEntry(id);
    }

    /**
     * Marks an entry as freshly reviewed. Also revives archived entries.
     */
    public Optional<KnowledgeEntry> validate(String id) {
        return knowledgeStore.findEntry(id).map(entry -> {
            entry.setStatus(KnowledgeStatus.ACTIVE);
            entry.setLastValidatedAt(clock.instant());
            knowledgeStore.saveEntry(entry);
            log.info("[Knowledge] Validated entry {}", id);
            return entry;
        });
    }

    public Optional<KnowledgeEntry> archive(String id) {
        return knowledgeStore.findEntry(id).map(entry -> {
            entry.setStatus(KnowledgeStatus.ARCHIVED);
            knowledgeStore.saveEntry(entry);
            log.info("[Knowledge] Archived entry {}", id);
            return entry;
        });
    }

    public Optional<KnowledgeEntry> trackReference(String id) {
        List<KnowledgeEntry> updated = trackReferences(List.of(id));
        return updated.isEmpty() ? Optional.empty() : Optional.of(updated.get(0));
    }

    /**
     * Counts one reference for each known id and persists them in a single
     * write. Unknown ids are skipped.
     */
    public List<KnowledgeEntry> trackReferences(Collection<String> ids) {
        Instant now = clock.instant();
        List<KnowledgeEntry> updated = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            knowledgeStore.findEntry(id).ifPresent(entry -> {
                entry.setReferenceCount(entry.getReferenceCount() + 1);
                entry.setLastReferencedAt(now);
                updated.add(entry);
            });
        }
        if (!updated.isEmpty()) {
            knowledgeStore.saveEntries(updated);
            log.debug("[Knowledge] Tracked references for {} entries", updated.size());
        }
        return updated;
    }

    public boolean isStale(KnowledgeEntry entry) {
        if (entry.getStatus() != KnowledgeStatus.ACTIVE && entry.getStatus() != KnowledgeStatus.STALE) {
            return false;
        }
        Instant reference = entry.getLastValidatedAt() != null ? entry.getLastValidatedAt() : entry.getCreatedAt();
        if (reference == null) {
            return true;
        }
        long ageDays = Duration.between(reference, clock.instant()).toDays();
        return ageDays > properties.getKnowledge().staleDaysFor(entry.getTier());
    }

    public KnowledgeStatus effectiveStatus(KnowledgeEntry entry) {
        return isStale(entry) ? KnowledgeStatus.STALE : entry.getStatus();
    }

    /**
     * Stale entries, oldest validation first. A site filter keeps entries scoped
     * to that site plus unscoped ones.
     */
    public List<KnowledgeEntry> getStaleEntries(String siteId) {
        return knowledgeStore.findAllEntries().stream()
                .filter(entry -> siteId == null || entry.getSiteId() == null || siteId.equals(entry.getSiteId()))
                .filter(this::isStale)
                .sorted(Comparator.comparing(this::validationReference,
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                .toList();
    }

    public KnowledgeStats getStats() {
        List<KnowledgeEntry> entries = knowledgeStore.findAllEntries();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        Map<Integer, Long> byTier = new TreeMap<>();
        Map<String, Long> bySite = new TreeMap<>();
        Map<String, Long> byCategory = new TreeMap<>();
        int totalReferences = 0;

        for (KnowledgeEntry entry : entries) {
            byStatus.merge(effectiveStatus(entry).getValue(), 1L, Long::sum);
            byTier.merge(entry.getTier().getLevel(), 1L, Long::sum);
            if (entry.getSiteId() != null) {
                bySite.merge(entry.getSiteId(), 1L, Long::sum);
            }
            if (entry.getCategory() != null) {
                byCategory.merge(entry.getCategory(), 1L, Long::sum);
            }
            totalReferences += entry.getReferenceCount();
        }

        int pending = (int) knowledgeStore.findAllSuggestions().stream()
                .filter(suggestion -> suggestion.getStatus() == SuggestionStatus.DRAFT)
                .count();

        return KnowledgeStats.builder()
                .totalEntries(entries.size())
                .byStatus(byStatus)
                .byTier(byTier)
                .bySite(bySite)
                .byCategory(byCategory)
                .totalReferences(totalReferences)
                .pendingSuggestions(pending)
                .build();
    }

    private Instant validationReference(KnowledgeEntry entry) {
        return entry.getLastValidatedAt() != null ? entry.getLastValidatedAt() : entry.getCreatedAt();
    }
}
