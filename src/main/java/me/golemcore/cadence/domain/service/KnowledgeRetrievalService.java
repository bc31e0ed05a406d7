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
import me.golemcore.cadence.domain.model.KnowledgeQuery;
import me.golemcore.cadence.domain.model.KnowledgeStatus;
import me.golemcore.cadence.domain.model.KnowledgeTier;
import me.golemcore.cadence.domain.model.ScoredKnowledgeEntry;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.EmbeddingPort;
import me.golemcore.cadence.port.outbound.KnowledgeStorePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Three-tier weighted knowledge search.
 *
 * <p>
 * Each candidate gets a base relevance in [0, 1] (keyword overlap, or cosine
 * similarity when embeddings are available), multiplied by its tier weight and
 * then boosted for matching site, proven effectiveness and high confidence.
 * A site-scoped query never returns another site's Tier-2 knowledge; an
 * unscoped query sees every site.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeRetrievalService {

    private final KnowledgeStorePort knowledgeStore;
    private final EmbeddingPort embeddingPort;
    private final KnowledgeLifecycleService lifecycleService;
    private final CadenceProperties properties;

    public List<ScoredKnowledgeEntry> search(KnowledgeQuery query) {
        CadenceProperties.KnowledgeProperties config = properties.getKnowledge();
        int limit = query.getLimit() != null && query.getLimit() > 0 ? query.getLimit() : config.getDefaultLimit();
        List<KnowledgeEntry> candidates = knowledgeStore.findAllEntries().stream()
                .filter(entry -> isVisible(entry, query))
                .toList();

        List<ScoredKnowledgeEntry> scored;
        if (query.isBrowse()) {
            scored = candidates.stream().map(entry -> scored(entry, 0.0)).toList();
        } else if (isVectorSearchAvailable()) {
            scored = vectorOrKeyword(query, candidates);
        } else {
            scored = keywordScores(query, candidates);
        }

        List<ScoredKnowledgeEntry> results = scored.stream()
                .sorted(resultOrder())
                .limit(limit)
                .toList();
        log.debug("[Knowledge] Query '{}' (site {}, tier {}) -> {} of {} candidate(s)",
                query.getQuery(), query.getSiteId(), query.getTier(), results.size(), candidates.size());
        return results;
    }

    private boolean isVisible(KnowledgeEntry entry, KnowledgeQuery query) {
        if (entry.getStatus() == KnowledgeStatus.ARCHIVED || entry.getStatus() == KnowledgeStatus.DRAFT) {
            return false;
        }
        if (query.getTier() != null && entry.getTier() != query.getTier()) {
            return false;
        }
        if (query.getCategory() != null && !query.getCategory().equalsIgnoreCase(entry.getCategory())) {
            return false;
        }
        if (query.getSiteId() != null && entry.getTier() == KnowledgeTier.SITE && entry.getSiteId() != null) {
            return entry.getSiteId().equals(query.getSiteId());
        }
        return true;
    }

    private List<ScoredKnowledgeEntry> keywordScores(KnowledgeQuery query, List<KnowledgeEntry> candidates) {
        List<String> tokens = tokenize(query.getQuery());
        if (tokens.isEmpty()) {
            return List.of();
        }
        List<ScoredKnowledgeEntry> results = new ArrayList<>();
        for (KnowledgeEntry entry : candidates) {
            String text = searchableText(entry);
            long hits = tokens.stream().filter(text::contains).count();
            if (hits == 0) {
                continue;
            }
            double base = (double) hits / tokens.size();
            results.add(scored(entry, weigh(entry, base, query.getSiteId())));
        }
        return results;
    }

    private List<ScoredKnowledgeEntry> vectorOrKeyword(KnowledgeQuery query, List<KnowledgeEntry> candidates) {
        try {
            return vectorScores(query, candidates);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Knowledge] Vector search interrupted, using keyword scoring");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Knowledge] Vector search failed, using keyword scoring: {}", e.getMessage());
        }
        return keywordScores(query, candidates);
    }

    private List<ScoredKnowledgeEntry> vectorScores(KnowledgeQuery query, List<KnowledgeEntry> candidates)
            throws InterruptedException, ExecutionException, TimeoutException {
        CadenceProperties.KnowledgeProperties config = properties.getKnowledge();
        long timeout = config.getEmbeddingTimeoutSeconds();
        float[] queryVector = embeddingPort.embed(query.getQuery()).get(timeout, TimeUnit.SECONDS);

        List<KnowledgeEntry> missing = candidates.stream()
                .filter(entry -> entry.getEmbedding() == null || entry.getEmbedding().length != queryVector.length)
                .toList();
        if (!missing.isEmpty()) {
            List<String> texts = missing.stream().map(KnowledgeEntry::getContent).toList();
            List<float[]> vectors = embeddingPort.embedBatch(texts).get(timeout, TimeUnit.SECONDS);
            if (vectors.size() != missing.size()) {
                throw new IllegalStateException("Embedding batch returned " + vectors.size()
                        + " vectors for " + missing.size() + " entries");
            }
            for (int i = 0; i < missing.size(); i++) {
                missing.get(i).setEmbedding(vectors.get(i));
            }
            knowledgeStore.saveEntries(missing);
            log.info("[Knowledge] Backfilled embeddings for {} entries", missing.size());
        }

        List<ScoredKnowledgeEntry> results = new ArrayList<>();
        for (KnowledgeEntry entry : candidates) {
            double similarity = Math.max(0.0, embeddingPort.cosineSimilarity(queryVector, entry.getEmbedding()));
            if (similarity <= config.getMinSimilarity()) {
                continue;
            }
            results.add(scored(entry, weigh(entry, similarity, query.getSiteId())));
        }
        return results;
    }

    private double weigh(KnowledgeEntry entry, double base, String siteId) {
        CadenceProperties.KnowledgeProperties config = properties.getKnowledge();
        double score = base * config.weightFor(entry.getTier());
        if (siteId != null && siteId.equals(entry.getSiteId())) {
            score += config.getSiteBoost();
        }
        if (entry.getEffectivenessScore() != null
                && entry.getEffectivenessScore() > config.getEffectivenessThreshold()) {
            score += config.getEffectivenessBoost();
        }
        if (entry.getConfidence() != null && entry.getConfidence() > config.getConfidenceThreshold()) {
            score += config.getConfidenceBoost();
        }
        return Math.round(score * 1000.0) / 1000.0;
    }

    private ScoredKnowledgeEntry scored(KnowledgeEntry entry, double score) {
        return ScoredKnowledgeEntry.builder()
                .entry(entry)
                .relevanceScore(score)
                .stale(lifecycleService.isStale(entry))
                .build();
    }

    private Comparator<ScoredKnowledgeEntry> resultOrder() {
        CadenceProperties.KnowledgeProperties config = properties.getKnowledge();
        return Comparator.comparingDouble(ScoredKnowledgeEntry::getRelevanceScore).reversed()
                .thenComparing(Comparator.comparingDouble(
                        (ScoredKnowledgeEntry scored) -> config.weightFor(scored.getEntry().getTier())).reversed())
                .thenComparing(scored -> scored.getEntry().getId(), Comparator.nullsLast(Comparator.<String>naturalOrder()));
    }

    private boolean isVectorSearchAvailable() {
        return properties.getKnowledge().isVectorSearchEnabled() && embeddingPort.isAvailable();
    }

    static List<String> tokenize(String query) {
        if (query == null) {
            return List.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    static String searchableText(KnowledgeEntry entry) {
        Stream<String> tags = entry.getTags() != null ? entry.getTags().stream() : Stream.empty();
        return Stream.concat(
                Stream.of(entry.getContent(), entry.getCategory(), entry.getSubcategory(),
                        entry.getTherapeuticArea(), entry.getSource()),
                tags)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
    }
}
