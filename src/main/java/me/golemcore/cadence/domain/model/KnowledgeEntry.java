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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A unit of institutional knowledge.
 *
 * <p>
 * Identity and tier are fixed at creation. Tier-2 entries carry the site they
 * belong to in {@code siteId}; other tiers are usually unscoped. The optional
 * {@code embedding} is filled lazily by the vector retrieval path.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KnowledgeEntry {

    @Setter(AccessLevel.NONE)
    private String id;

    @Setter(AccessLevel.NONE)
    private KnowledgeTier tier;

    private String siteId;
    private String category;
    private String subcategory;
    private String therapeuticArea;
    private String content;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String source;
    private String author;
    private String trialId;
    private Double effectivenessScore;
    private Double confidence;
    private int evidenceCount;

    @Builder.Default
    private KnowledgeStatus status = KnowledgeStatus.ACTIVE;

    private Instant createdAt;
    private Instant lastValidatedAt;
    private int referenceCount;
    private Instant lastReferencedAt;
    private float[] embedding;

    /**
     * Detached copy with its own tag list and vector.
     */
    public KnowledgeEntry copy() {
        return toBuilder()
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .embedding(embedding != null ? embedding.clone() : null)
                .build();
    }
}
