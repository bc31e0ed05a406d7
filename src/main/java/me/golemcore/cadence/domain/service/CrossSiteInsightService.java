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
import me.golemcore.cadence.domain.model.InterventionRecord;
import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeStatus;
import me.golemcore.cadence.domain.model.KnowledgeTier;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.InterventionRecordPort;
import me.golemcore.cadence.port.outbound.KnowledgeStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Derives the live cross-site benchmark (Tier 3) from intervention outcomes
 * of every site.
 *
 * <p>
 * Each intervention type with at least {@code cadence.patterns.min-sample-size}
 * records gets a positive-outcome rate; the rates are written as a single
 * searchable entry with a fixed id, replaced on every refresh.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrossSiteInsightService {

    public static final String BENCHMARK_ENTRY_ID = "xsite_dynamic_001";

    private static final String BENCHMARK_CATEGORY = "benchmark";
    private static final String BENCHMARK_SOURCE = "intervention_outcomes";

    private final InterventionRecordPort interventionRecords;
    private final KnowledgeStorePort knowledgeStore;
    private final CadenceProperties properties;
    private final Clock clock;

    /**
     * Positive-outcome percentage per intervention type, highest first. Types
     * below the minimum sample size are left out.
     */
    public Map<String, Double> computeEffectiveness() {
        return effectiveness(interventionRecords.findInterventions(null));
    }

    private Map<String, Double> effectiveness(List<InterventionRecord> records) {
        Map<String, int[]> outcomes = new LinkedHashMap<>();
        for (InterventionRecord record : records) {
            if (record.getType() == null) {
                continue;
            }
            int[] counts = outcomes.computeIfAbsent(record.getType(), type -> new int[2]);
            counts[0]++;
            if (record.isPositive()) {
                counts[1]++;
            }
        }

        int minSample = properties.getPatterns().getMinSampleSize();
        return outcomes.entrySet().stream()
                .filter(entry -> entry.getValue()[0] >= minSample)
                .sorted((left, right) -> Double.compare(rate(right.getValue()), rate(left.getValue())))
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> rate(entry.getValue()),
                        (left, right) -> left, LinkedHashMap::new));
    }

    /**
     * Recomputes the benchmark entry and stores it. Returns empty, leaving any
     * earlier benchmark in place, when no type has enough records.
     */
    public synchronized Optional<KnowledgeEntry> refreshBenchmark() {
        List<InterventionRecord> records = interventionRecords.findInterventions(null);
        Map<String, Double> effectiveness = effectiveness(records);
        if (effectiveness.isEmpty()) {
            log.debug("[Knowledge] Not enough intervention outcomes for a cross-site benchmark");
            return Optional.empty();
        }

        Map.Entry<String, Double> best = effectiveness.entrySet().iterator().next();
        String rates = effectiveness.entrySet().stream()
                .map(entry -> String.format(Locale.ROOT, "%s: %.1f%%", entry.getKey(), entry.getValue()))
                .collect(Collectors.joining(", "));
        String content = String.format(Locale.ROOT, "Live intervention effectiveness: %s. Most effective: %s (%.1f%%).",
                rates, best.getKey(), best.getValue());
        TreeSet<String> sites = records.stream()
                .map(InterventionRecord::getSiteId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
        int evidence = (int) records.stream().filter(record -> record.getType() != null).count();

        Instant now = clock.instant();
        Optional<KnowledgeEntry> previous = knowledgeStore.findEntry(BENCHMARK_ENTRY_ID);
        KnowledgeEntry entry = KnowledgeEntry.builder()
                .id(BENCHMARK_ENTRY_ID)
                .tier(KnowledgeTier.CROSS_SITE)
                .category(BENCHMARK_CATEGORY)
                .therapeuticArea("General")
                .content(content)
                .tags(new ArrayList<>(sites))
                .source(BENCHMARK_SOURCE)
                .confidence(properties.getPatterns().getBenchmarkConfidence())
                .evidenceCount(evidence)
                .status(KnowledgeStatus.ACTIVE)
                .createdAt(previous.map(KnowledgeEntry::getCreatedAt).orElse(now))
                .lastValidatedAt(now)
                .referenceCount(previous.map(KnowledgeEntry::getReferenceCount).orElse(0))
                .lastReferencedAt(previous.map(KnowledgeEntry::getLastReferencedAt).orElse(null))
                .build();
        knowledgeStore.saveEntry(entry);
        log.info("[Knowledge] Refreshed cross-site benchmark: {} type(s), best {}", effectiveness.size(),
                best.getKey());
        return Optional.of(entry);
    }

    private static double rate(int[] counts) {
        return Math.round((double) counts[1] / counts[0] * 1000.0) / 10.0;
    }
}
