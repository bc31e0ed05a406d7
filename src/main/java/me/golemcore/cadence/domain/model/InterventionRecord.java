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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A logged retention intervention and its outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterventionRecord {

    public static final String OUTCOME_POSITIVE = "positive";
    public static final String OUTCOME_PENDING = "pending";
    public static final String TRIGGER_MANUAL = "manual";
    public static final String TRIGGER_SYSTEM = "system_recommendation";

    private String id;
    private String patientId;
    private String siteId;
    private String trialId;
    private String type;
    private LocalDate date;

    @Builder.Default
    private String outcome = OUTCOME_PENDING;

    private String notes;

    @Builder.Default
    private String triggeredBy = TRIGGER_MANUAL;

    @JsonIgnore
    public boolean isPositive() {
        return OUTCOME_POSITIVE.equals(outcome);
    }
}
