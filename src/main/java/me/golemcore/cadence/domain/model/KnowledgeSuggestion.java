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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Draft Tier-2 knowledge proposed by pattern detection, awaiting coordinator
 * review. {@code patternKey} identifies the site and intervention type the
 * suggestion was derived from.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeSuggestion {

    private String id;
    private String siteId;
    private String category;
    private String content;
    private String source;
    private String sourceDetail;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String trialId;
    private int evidenceCount;
    private double confidence;

    @Builder.Default
    private SuggestionStatus status = SuggestionStatus.DRAFT;

    private Instant createdAt;
    private Instant resolvedAt;
    private String approvedEntryId;
    private String patternKey;

    public KnowledgeSuggestion copy() {
        return toBuilder()
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .build();
    }
}
