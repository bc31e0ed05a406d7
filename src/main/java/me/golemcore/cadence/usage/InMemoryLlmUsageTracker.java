package me.golemcore.cadence.usage;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.LlmUsage;
import me.golemcore.cadence.domain.model.UsageSummary;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Default implementation of {@link LlmUsageTracker} keeping a bounded window of
 * recent calls in memory.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class InMemoryLlmUsageTracker implements LlmUsageTracker {

    private static final String LOG_PREFIX = "[Usage]";
    private static final String UNKNOWN = "unknown";
    private static final int MAX_RECORDS = 10_000;

    private final Deque<LlmUsage> records = new ConcurrentLinkedDeque<>();

    @Override
    public void recordUsage(LlmUsage usage) {
        if (usage == null) {
            return;
        }
        records.addLast(usage);
        while (records.size() > MAX_RECORDS) {
            records.pollFirst();
        }
        log.debug("{} {} in={} out={} cost=${}", LOG_PREFIX,
                usage.getModel() != null ? usage.getModel() : UNKNOWN,
                usage.getInputTokens(), usage.getOutputTokens(), String.format("%.6f", usage.getCostUsd()));
    }

    @Override
    public UsageSummary getSummary() {
        List<LlmUsage> snapshot = new ArrayList<>(records);
        long input = 0;
        long output = 0;
        double cost = 0;
        long latencyTotal = 0;
        long latencyCount = 0;
        Map<String, Long> byPurpose = new LinkedHashMap<>();

        for (LlmUsage usage : snapshot) {
            input += usage.getInputTokens();
            output += usage.getOutputTokens();
            cost += usage.getCostUsd();
            Duration latency = usage.getLatency();
            if (latency != null) {
                latencyTotal += latency.toMillis();
                latencyCount++;
            }
            String purpose = usage.getPurpose() != null ? usage.getPurpose() : UNKNOWN;
            byPurpose.merge(purpose, 1L, Long::sum);
        }

        return UsageSummary.builder()
                .totalRequests(snapshot.size())
                .totalInputTokens(input)
                .totalOutputTokens(output)
                .totalCostUsd(Math.round(cost * 1_000_000.0) / 1_000_000.0)
                .avgLatencyMs(latencyCount > 0 ? latencyTotal / latencyCount : 0L)
                .requestsByPurpose(byPurpose)
                .build();
    }

    @Override
    public List<LlmUsage> getRecentUsage(int limit) {
        List<LlmUsage> snapshot = new ArrayList<>(records);
        int from = Math.max(0, snapshot.size() - Math.max(0, limit));
        return List.copyOf(snapshot.subList(from, snapshot.size()));
    }
}
