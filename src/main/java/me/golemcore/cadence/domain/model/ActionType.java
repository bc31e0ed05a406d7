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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static me.golemcore.cadence.domain.model.ActionParameter.ParameterType.BOOLEAN;
import static me.golemcore.cadence.domain.model.ActionParameter.ParameterType.INTEGER;
import static me.golemcore.cadence.domain.model.ActionParameter.ParameterType.STRING;
import static me.golemcore.cadence.domain.model.ActionParameter.ParameterType.STRING_LIST;
import static me.golemcore.cadence.domain.model.ActionParameter.optional;
import static me.golemcore.cadence.domain.model.ActionParameter.required;

/**
 * Closed catalogue of operations the planner may request.
 *
 * <p>
 * Each kind carries its wire name (as produced by the language model), a short
 * description used in the planner prompt, and its declared parameters. Write
 * kinds always require coordinator approval before they run.
 */
public enum ActionType {

    QUERY_PATIENTS("query_patients",
            "Find patients by site, trial, risk level, status or overdue visits",
            false,
            optional("site_id", STRING), optional("trial_id", STRING), optional("risk_level", STRING),
            optional("status", STRING), optional("overdue_only", BOOLEAN), optional("limit", INTEGER)),

    GET_RISK_SCORES("get_risk_scores",
            "Dropout risk scores with factors and recommended actions",
            false,
            optional("site_id", STRING), optional("patient_id", STRING)),

    GET_PATIENT_TIMELINE("get_patient_timeline",
            "Chronological events for one patient",
            false,
            required("patient_id", STRING)),

    GET_PATIENT_SUMMARY("get_patient_summary",
            "Patient record with pending tasks and recent interventions",
            false,
            required("patient_id", STRING)),

    RESOLVE_PATIENT("resolve_patient",
            "Turn a name, partial id or description into a patient id",
            false,
            required("query", STRING), optional("site_id", STRING)),

    SCHEDULE_VISIT("schedule_visit",
            "Schedule a study visit for a patient",
            true,
            required("patient_id", STRING), required("visit_date", STRING), optional("visit_type", STRING)),

    LOG_INTERVENTION("log_intervention",
            "Record a retention intervention and its outcome",
            true,
            required("patient_id", STRING), required("type", STRING), optional("outcome", STRING),
            optional("notes", STRING), optional("triggered_by", STRING)),

    SEND_REMINDER("send_reminder",
            "Send a visit reminder to a patient",
            true,
            required("patient_id", STRING), optional("channel", STRING), optional("visit_date", STRING)),

    CREATE_TASK("create_task",
            "Create a coordinator task or reminder",
            false,
            required("title", STRING), required("category", STRING), required("due_date", STRING),
            optional("patient_id", STRING), optional("trial_id", STRING), optional("scheduled_time", STRING),
            optional("estimated_duration_minutes", INTEGER), optional("priority", STRING),
            optional("notes", STRING), optional("site_id", STRING)),

    LIST_TASKS("list_tasks",
            "List tasks in a date range with optional status and category filters",
            false,
            optional("site_id", STRING), optional("start_date", STRING), optional("end_date", STRING),
            optional("status", STRING), optional("category", STRING)),

    GET_TODAY_TASKS("get_today_tasks",
            "Today's tasks plus overdue count",
            false,
            optional("site_id", STRING)),

    COMPLETE_TASK("complete_task",
            "Mark a task as completed",
            false,
            required("task_id", STRING)),

    SEARCH_KNOWLEDGE("search_knowledge",
            "Search the knowledge base across all tiers",
            false,
            required("query", STRING), optional("site_id", STRING)),

    SEARCH_KNOWLEDGE_GRAPH("search_knowledge_graph",
            "Tier-aware knowledge search with tier and category filters",
            false,
            optional("query", STRING), optional("site_id", STRING), optional("tier", INTEGER),
            optional("category", STRING), optional("limit", INTEGER)),

    ADD_SITE_KNOWLEDGE("add_site_knowledge",
            "Add a site-specific knowledge entry",
            false,
            required("content", STRING), required("category", STRING), required("source", STRING),
            optional("site_id", STRING), optional("author", STRING), optional("trial_id", STRING),
            optional("tags", STRING_LIST)),

    GET_KNOWLEDGE_SUGGESTIONS("get_knowledge_suggestions",
            "Draft knowledge suggestions awaiting review",
            false,
            optional("site_id", STRING)),

    GET_INTERVENTION_STATS("get_intervention_stats",
            "Intervention counts by outcome and type",
            false,
            optional("site_id", STRING)),

    GET_SITE_ANALYTICS("get_site_analytics",
            "Retention, risk distribution and intervention volume for a site",
            false,
            optional("site_id", STRING)),

    GET_TRIAL_INFO("get_trial_info",
            "Trial details with site enrollment",
            false,
            required("trial_id", STRING)),

    GET_STAFF_WORKLOAD("get_staff_workload",
            "Patient and task load per coordinator",
            false,
            optional("site_id", STRING)),

    REASSIGN_PATIENT("reassign_patient",
            "Move a patient to another coordinator",
            true,
            required("patient_id", STRING), required("staff_id", STRING));

    private static final Map<String, ActionType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ActionType::getWireName, Function.identity()));

    private final String wireName;
    private final String description;
    private final boolean write;
    private final List<ActionParameter> parameters;

    ActionType(String wireName, String description, boolean write, ActionParameter... parameters) {
        this.wireName = wireName;
        this.description = description;
        this.write = write;
        this.parameters = List.of(parameters);
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDescription() {
        return description;
    }

    public boolean isWrite() {
        return write;
    }

    public List<ActionParameter> getParameters() {
        return parameters;
    }

    public Optional<ActionParameter> findParameter(String name) {
        return parameters.stream()
                .filter(parameter -> parameter.getName().equals(name))
                .findFirst();
    }

    public static Optional<ActionType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName.trim().toLowerCase(Locale.ROOT)));
    }

    @JsonCreator
    public static ActionType fromJson(String wireName) {
        return fromWireName(wireName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown action type: " + wireName));
    }
}
