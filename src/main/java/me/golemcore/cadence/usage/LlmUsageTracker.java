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

import me.golemcore.cadence.domain.model.LlmUsage;
import me.golemcore.cadence.domain.model.UsageSummary;

import java.util.List;

/**
 * Records token usage, cost and latency of every language-model call and
 * aggregates them on request.
 *
 * @since 1.0
 * @see InMemoryLlmUsageTracker
 */
public interface LlmUsageTracker {

    void recordUsage(LlmUsage usage);

    UsageSummary getSummary();

    List<LlmUsage> getRecentUsage(int limit);
}
