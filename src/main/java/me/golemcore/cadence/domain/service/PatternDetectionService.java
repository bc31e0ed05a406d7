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
import me.golemcore.cadence.domain.model.InterventionPattern;
import me.golemcore.cadence.domain.model.InterventionRecord;
import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeSuggestion;
import me.golemcore.cadence.domain.model.SuggestionStatus;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.InterventionRecordPort;
import me.golemcore.cadence.port.outbound.KnowledgeStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Mines intervention outcomes for site-level patterns and manages the draft
 * suggestions they produce.
 *
 * <p>
 * Suggestions move {@code draft -> approved} or {@code draft -> dismissed} and
 * never leave a terminal state. Approval creates an active site entry through
 * {@link KnowledgeWriteService}. Detection, approval and dismissal are
 * serialized so a suggestion is resolved at most once across sessions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternDetectionService {

    private static final String PATTERN_CATEGORY = "intervention_pattern";
    private static final String PATTERN_SOURCE = "pattern_detection";

    private final InterventionRecordPort interventionRecords;
    private final KnowledgeStorePort knowledgeStore;
    private final KnowledgeWriteService knowledgeWriteService;
    private final CadenceProperties properties;
    private final Clock clock;

    /**
     * Groups all intervention records by site and type. Groups smaller than the
     * configured minimum sample size are omitted. Sorted by success rate,
     * highest first.
     */
    public List<InterventionPattern> analyzePatterns() {
        Map<String, List<InterventionRecord>> groups = new LinkedHashMap<>();
        for (InterventionRecord record : interventionRecords.findInterventions(null)) {
            if (record.getSiteId() == null || record.getType() == null) {
                continue;
            }
            groups.computeIfAbsent(record.getSiteId() + "|" + record.getType(), key -> new ArrayList<>())
                    .add(record);
        }

        int minSample = properties.getPatterns().getMinSampleSize();
        List<InterventionPattern> patterns = new ArrayList<>();
        for (List<InterventionRecord> group : groups.values()) {
            if (group.size() < minSample) {
                continue;
            }
            int positive = (int) group.stream().filter(InterventionRecord::isPositive).count();
            InterventionRecord first = group.get(0);
            patterns.add(InterventionPattern.builder()
                    .siteId(first.getSiteId())
                    .interventionType(first.getType())
                    .sampleSize(group.size())
                    .positiveCount(positive)
                    .successRate(Math.round((double) positive / group.size() * 100.0) / 100.0)
                    .build());
        }
        patterns.sort(Comparator.comparingDouble(InterventionPattern::getSuccessRate).reversed());
        return patterns;
    }

    /**
     * Turns strong patterns into new draft suggestions. A pattern that already
     * produced a suggestion, in any state, is skipped.
     *
     * @return suggestions created by this run
     */
    public synchronized List<KnowledgeSuggestion> detectPatterns() {
        Set<String> knownKeys = knowledgeStore.findAllSuggestions().stream()
                .map(KnowledgeSuggestion::getPatternKey)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(HashSet::new));

        double minRate = properties.getPatterns().getMinSuccessRate();
        List<KnowledgeSuggestion> created = new ArrayList<>();
        for (InterventionPattern pattern : analyzePatterns()) {
            if (pattern.getSuccessRate() < minRate || knownKeys.contains(pattern.getPatternKey())) {
                continue;
            }
            KnowledgeSuggestion suggestion = knowledgeStore.saveSuggestion(toSuggestion(pattern));
            knownKeys.add(pattern.getPatternKey());
            created.add(suggestion);
        }
        if (!created.isEmpty()) {
            log.info("[Patterns] Created {} new suggestion(s)", created.size());
        }
        return created;
    }

    /**
     * Draft suggestions, highest confidence first. A null site returns every
     * site's drafts.
     */
    public List<KnowledgeSuggestion> getSuggestions(String siteId) {
        return knowledgeStore.findAllSuggestions().stream()
                .filter(suggestion -> suggestion.getStatus() == SuggestionStatus.DRAFT)
                .filter(suggestion -> siteId == null || siteId.equals(suggestion.getSiteId()))
                .sorted(Comparator.comparingDouble(KnowledgeSuggestion::getConfidence).reversed())
                .toList();
    }

    /**
     * Promotes a draft suggestion to active site knowledge. Approving an
     * already approved suggestion returns the entry created the first time;
     * a dismissed or unknown suggestion yields empty.
     */
    public synchronized Optional<KnowledgeEntry> approve(String suggestionId) {
        Optional<KnowledgeSuggestion> found = knowledgeStore.findSuggestion(suggestionId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        KnowledgeSuggestion suggestion = found.get();
        if (suggestion.getStatus() == SuggestionStatus.APPROVED) {
            return knowledgeStore.findEntry(suggestion.getApprovedEntryId());
        }
        if (suggestion.getStatus().isTerminal()) {
            return Optional.empty();
        }

        KnowledgeEntry entry = knowledgeWriteService.createSiteEntry(KnowledgeWriteService.SiteEntryDraft.builder()
                .siteId(suggestion.getSiteId())
                .category(suggestion.getCategory())
                .content(suggestion.getContent())
                .tags(suggestion.getTags())
                .source(suggestion.getSource())
                .trialId(suggestion.getTrialId())
                .confidence(suggestion.getConfidence())
                .evidenceCount(suggestion.getEvidenceCount())
                .build());

        suggestion.setStatus(SuggestionStatus.APPROVED);
        suggestion.setResolvedAt(clock.instant());
        suggestion.setApprovedEntryId(entry.getId());
        knowledgeStore.saveSuggestion(suggestion);
        log.info("[Patterns] Approved suggestion {} as entry {}", suggestionId, entry.getId());
        return Optional.of(entry);
    }

    public synchronized Optional<KnowledgeSuggestion> dismiss(String suggestionId) {
        return knowledgeStore.findSuggestion(suggestionId).map(suggestion -> {
            if (suggestion.getStatus().isTerminal()) {
                return suggestion;
            }
            suggestion.setStatus(SuggestionStatus.DISMISSED);
            suggestion.setResolvedAt(clock.instant());
            knowledgeStore.saveSuggestion(suggestion);
            log.info("[Patterns] Dismissed suggestion {}", suggestionId);
            return suggestion;
        });
    }

    private KnowledgeSuggestion toSuggestion(InterventionPattern pattern) {
        String type = pattern.getInterventionType().replace('_', ' ');
        String content = String.format(Locale.ROOT,
                "At %s, %s interventions had a positive outcome in %d of %d logged attempts (%.0f%%). "
                        + "Consider making %s a default response for this site.",
                pattern.getSiteId(), type, pattern.getPositiveCount(), pattern.getSampleSize(),
                pattern.getSuccessRate() * 100, type);
        return KnowledgeSuggestion.builder()
                .id("suggest-" + UUID.randomUUID().toString().substring(0, 8))
                .siteId(pattern.getSiteId())
                .category(PATTERN_CATEGORY)
                .content(content)
                .source(PATTERN_SOURCE)
                .sourceDetail("Intervention outcome analysis")
                .tags(new ArrayList<>(List.of(pattern.getInterventionType())))
                .evidenceCount(pattern.getSampleSize())
                .confidence(pattern.getSuccessRate())
                .status(SuggestionStatus.DRAFT)
                .createdAt(clock.instant())
                .patternKey(pattern.getPatternKey())
                .build();
    }
}
