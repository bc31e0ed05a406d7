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

/**
 * Classification of a failed action.
 */
public enum ActionFailureKind {

    /**
     * No provider handles the requested kind.
     */
    UNSUPPORTED_ACTION,

    /**
     * A parameter was missing or could not be interpreted.
     */
    INVALID_PARAMETERS,

    /**
     * The referenced patient, task, trial or entry does not exist.
     */
    NOT_FOUND,

    /**
     * The handler failed at runtime (store error, timeout, exception).
     */
    EXECUTION_FAILED
}
