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
import lombok.Value;

/**
 * Outcome of executing one {@link ActionRequest}: success flag, structured
 * payload, error text and a human-readable summary.
 */
@Value
@Builder
public class ActionResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    boolean success;
    Object payload;
    String error;
    ActionFailureKind failureKind;
    String summary;

    public static ActionResult success(String summary, Object payload) {
        return ActionResult.builder()
                .success(true)
                .summary(summary)
                .payload(payload)
                .build();
    }

    public static ActionResult failure(ActionFailureKind kind, String error) {
        return ActionResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .summary("Action failed: " + error)
                .build();
    }
}
