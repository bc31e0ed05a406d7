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

import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeStatus;
import me.golemcore.cadence.domain.model.KnowledgeTier;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.EmbeddingPort;
import me.golemcore.cadence.port.outbound.KnowledgeStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The only path that creates site-specific (Tier 2) knowledge, used both by the
 * {@code add_site_knowledge} action and by suggestion approval.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeWriteService {

    private final KnowledgeStorePort knowledgeStore;
    private final EmbeddingPort embeddingPort;
    private final CadenceProperties properties;
    private final Clock clock;

    public KnowledgeEntry createSiteEntry(SiteEntryDraft draft) {
        if (draft.getSiteId() == null || draft.getSiteId().isBlank()) {
            throw new IllegalArgumentException("Site knowledge requires a site_id");
        }
        if (draft.getContent() == null || draft.getContent().isBlank()) {
            throw new IllegalArgumentException("Site knowledge requires content");
        }
        Instant now = clock.instant();
        KnowledgeEntry entry = KnowledgeEntry.builder()
                .id("kb-" + UUID.randomUUID().toString().substring(0, 8))
                .tier(KnowledgeTier.SITE)
                .siteId(draft.getSiteId())
                .category(draft.getCategory() != null ? draft.getCategory() : "general")
                .content(draft.getContent().trim())
                .tags(draft.getTags() != null ? new ArrayList<>(draft.getTags()) : new ArrayList<>())
                .source(draft.getSource() != null ? draft.getSource() : "coordinator")
                .author(draft.getAuthor())
                .trialId(draft.getTrialId())
                .effectivenessScore(draft.getEffectivenessScore())
                .confidence(draft.getConfidence())
                .evidenceCount(draft.getEvidenceCount())
                .status(KnowledgeStatus.ACTIVE)
                .createdAt(now)
                .lastValidatedAt(now)
                .embedding(embedQuietly(draft.getContent()))
                .build();
        knowledgeStore.saveEntry(entry);
        log.info("[Knowledge] Created site entry {} for {} ({})", entry.getId(), entry.getSiteId(),
                entry.getCategory());
        return entry;
    }

    private float[] embedQuietly(String content) {
        if (!properties.getKnowledge().isVectorSearchEnabled() || !embeddingPort.isAvailable()) {
            return null;
        }
        try {
            return embeddingPort.embed(content)
                    .get(properties.getKnowledge().getEmbeddingTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Knowledge] Interrupted while embedding new entry");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            // Retrieval backfills missing vectors later
            log.warn("[Knowledge] Failed to embed new entry: {}", e.getMessage());
        }
        return null;
    }

    /**
     * Fields supplied by the caller for a new site entry.
     */
    @Value
    @Builder
    public static class SiteEntryDraft {
        String siteId;
        String category;
        String content;
        List<String> tags;
        String source;
        String author;
        String trialId;
        Double effectivenessScore;
        Double confidence;
        int evidenceCount;
    }
}
