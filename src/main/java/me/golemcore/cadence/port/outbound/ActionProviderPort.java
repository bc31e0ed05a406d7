package me.golemcore.cadence.port.outbound;

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

import me.golemcore.cadence.domain.model.ActionRequest;
import me.golemcore.cadence.domain.model.ActionResult;
import me.golemcore.cadence.domain.model.ActionType;

/**
 * Backend that carries out validated action requests.
 *
 * <p>
 * Implementations never throw from {@link #execute(ActionRequest)}: unsupported
 * kinds, bad parameters and handler failures all come back as a failed
 * {@link ActionResult} with a summary.
 */
public interface ActionProviderPort {

    ActionResult execute(ActionRequest request);

    boolean canExecute(ActionType type);

    boolean healthCheck();
}
