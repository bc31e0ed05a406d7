package me.golemcore.cadence.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Knowledge base counts by effective status, tier, site and category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeStats {

    private int totalEntries;

    @Builder.Default
    private Map<String, Long> byStatus = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, Long> byTier = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> bySite = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> byCategory = new LinkedHashMap<>();

    private int totalReferences;
    private int pendingSuggestions;
}
