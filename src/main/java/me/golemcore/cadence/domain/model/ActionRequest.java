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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single validated operation requested by the planner.
 *
 * <p>
 * Requests are immutable once built. Parameter accessors throw
 * {@link IllegalArgumentException} when a required value is missing or has the
 * wrong shape, which the router reports as an invalid-parameters failure.
 */
@Value
public class ActionRequest {

    @NonNull
    ActionType actionType;
    Map<String, Object> parameters;
    String description;
    boolean requiresApproval;

    @Builder(toBuilder = true)
    public ActionRequest(@NonNull ActionType actionType, Map<String, Object> parameters, String description,
            boolean requiresApproval) {
        this.actionType = actionType;
        this.parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.description = description != null ? description : actionType.getWireName();
        this.requiresApproval = requiresApproval;
    }

    /**
     * Returns a copy with one parameter added or replaced.
     */
    public ActionRequest withParameter(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(parameters);
        copy.put(name, value);
        return toBuilder().parameters(copy).build();
    }

    public boolean hasParameter(String name) {
        Object value = parameters.get(name);
        return value != null && !(value instanceof String text && text.isBlank());
    }

    public Optional<String> optionalString(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public String requireString(String name) {
        return optionalString(name)
                .orElseThrow(() -> new IllegalArgumentException("Missing required parameter: " + name));
    }

    public Integer optionalInteger(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be an integer", e);
        }
    }

    public int intParameter(String name, int defaultValue) {
        Integer value = optionalInteger(name);
        return value != null ? value : defaultValue;
    }

    public boolean booleanParameter(String name, boolean defaultValue) {
        Object value = parameters.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    public List<String> stringListParameter(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        throw new IllegalArgumentException("Parameter " + name + " must be a list of strings");
    }
}
