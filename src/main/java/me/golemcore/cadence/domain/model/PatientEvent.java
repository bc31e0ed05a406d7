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

import java.time.LocalDate;

/**
 * Timeline event of a patient (visit, missed visit, adverse event report).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientEvent {

    public static final String TYPE_MISSED_VISIT = "missed_visit";
    public static final String TYPE_ADVERSE_EVENT = "adverse_event_reported";

    private String id;
    private String type;
    private LocalDate date;
    private String note;
}
