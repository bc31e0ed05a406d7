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

import me.golemcore.cadence.domain.model.Patient;

import java.util.List;
import java.util.Optional;

/**
 * Read and update access to enrolled patients.
 */
public interface PatientDirectoryPort {

    /**
     * Patients of one site, or all patients when {@code siteId} is null.
     */
    List<Patient> findPatients(String siteId);

    Optional<Patient> findPatient(String patientId);

    Patient savePatient(Patient patient);
}
