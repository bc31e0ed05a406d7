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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Result of resolving a natural-language patient reference: match kind, up to
 * five candidates and a confidence in [0, 1].
 */
@Value
@Builder
public class ResolutionResult {

    MatchKind match;

    @Builder.Default
    List<Patient> candidates = List.of();

    double confidence;

    public static ResolutionResult none() {
        return ResolutionResult.builder()
                .match(MatchKind.NONE)
                .confidence(0.0)
                .build();
    }

    public boolean isResolved() {
        return match.isResolved() && !candidates.isEmpty();
    }

    /**
     * The identified patient for exact and single matches.
     */
    @JsonIgnore
    public Optional<Patient> getPatient() {
        return isResolved() ? Optional.of(candidates.get(0)) : Optional.empty();
    }
}
