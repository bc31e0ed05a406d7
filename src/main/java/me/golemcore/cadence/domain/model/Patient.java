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
import java.util.ArrayList;
import java.util.List;

/**
 * Enrolled trial participant as exposed by the patient directory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Patient {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_AT_RISK = "at_risk";
    public static final String STATUS_WITHDRAWN = "withdrawn";
    public static final String STATUS_COMPLETED = "completed";

    private String patientId;
    private String name;
    private String siteId;
    private String trialId;
    private int age;
    private String sex;

    @Builder.Default
    private String status = STATUS_ACTIVE;

    private LocalDate enrollmentDate;
    private int weeksEnrolled;
    private double dropoutRiskScore;

    @Builder.Default
    private List<String> riskFactors = new ArrayList<>();

    @Builder.Default
    private List<String> recommendedActions = new ArrayList<>();

    private LocalDate nextVisitDate;
    private int visitsCompleted;
    private int visitsMissed;
    private LocalDate lastContactDate;
    private String phone;
    private String primaryCrcId;

    @Builder.Default
    private List<PatientEvent> events = new ArrayList<>();

    /**
     * Active and at-risk patients are the population name matching runs over.
     */
    @JsonIgnore
    public boolean isInActiveCare() {
        return STATUS_ACTIVE.equals(status) || STATUS_AT_RISK.equals(status);
    }
}
