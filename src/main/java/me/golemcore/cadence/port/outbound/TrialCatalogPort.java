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

import me.golemcore.cadence.domain.model.StaffMember;
import me.golemcore.cadence.domain.model.Trial;

import java.util.List;
import java.util.Optional;

/**
 * Reference data: trials and site staff.
 */
public interface TrialCatalogPort {

    Optional<Trial> findTrial(String trialId);

    List<Trial> findTrials();

    List<StaffMember> findStaff(String siteId);

    Optional<StaffMember> findStaffMember(String staffId);
}
