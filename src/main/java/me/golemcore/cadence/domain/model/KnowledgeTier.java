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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Knowledge provenance tier. Serialized as its numeric level.
 */
public enum KnowledgeTier {

    /** Foundational, published clinical knowledge. */
    FOUNDATIONAL(1),

    /** Site-specific institutional knowledge, scoped to one site. */
    SITE(2),

    /** Insights derived from anonymized cross-site patterns. */
    CROSS_SITE(3);

    private final int level;

    KnowledgeTier(int level) {
        this.level = level;
    }

    @JsonValue
    public int getLevel() {
        return level;
    }

    @JsonCreator
    public static KnowledgeTier fromLevel(int level) {
        for (KnowledgeTier tier : values()) {
            if (tier.level == level) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Knowledge tier must be 1, 2 or 3: " + level);
    }
}
