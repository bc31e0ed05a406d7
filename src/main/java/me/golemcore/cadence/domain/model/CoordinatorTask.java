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
 * Coordinator to-do item, optionally tied to a patient or trial.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoordinatorTask {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_COMPLETED = "completed";

    private String id;
    private String title;
    private String description;
    private String patientId;
    private String trialId;
    private String siteId;
    private LocalDate dueDate;
    private String scheduledTime;
    private Integer estimatedDurationMinutes;

    @Builder.Default
    private String priority = "normal";

    @Builder.Default
    private String status = STATUS_PENDING;

    private String category;

    @Builder.Default
    private String createdBy = "agent";

    private String assignedTo;
    private LocalDate completedDate;
}
