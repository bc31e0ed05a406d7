package me.golemcore.cadence.adapter.outbound.clinical;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.cadence.domain.model.CoordinatorTask;
import me.golemcore.cadence.domain.model.InterventionRecord;
import me.golemcore.cadence.domain.model.Patient;
import me.golemcore.cadence.domain.model.StaffMember;
import me.golemcore.cadence.domain.model.Trial;
import me.golemcore.cadence.port.outbound.InterventionRecordPort;
import me.golemcore.cadence.port.outbound.PatientDirectoryPort;
import me.golemcore.cadence.port.outbound.StoragePort;
import me.golemcore.cadence.port.outbound.TaskPort;
import me.golemcore.cadence.port.outbound.TrialCatalogPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Clinical trial data read from JSON documents under {@code clinical/} in the
 * workspace: {@code patients.json}, {@code interventions.json},
 * {@code tasks.json}, {@code trials.json} and {@code staff.json}.
 *
 * <p>
 * Stands in for the trial-management database; swap it for a repository-backed
 * adapter without touching the domain.
 */
@Component
public class LocalClinicalDataAdapter
        implements PatientDirectoryPort, InterventionRecordPort, TaskPort, TrialCatalogPort {

    private static final String CLINICAL_DIR = "clinical";

    private final JsonListDocument<Patient> patients;
    private final JsonListDocument<InterventionRecord> interventions;
    private final JsonListDocument<CoordinatorTask> tasks;
    private final JsonListDocument<Trial> trials;
    private final JsonListDocument<StaffMember> staff;

    public LocalClinicalDataAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.patients = new JsonListDocument<>(storagePort, objectMapper, CLINICAL_DIR, "patients.json",
                new TypeReference<List<Patient>>() {
                }, Patient::getPatientId);
        this.interventions = new JsonListDocument<>(storagePort, objectMapper, CLINICAL_DIR, "interventions.json",
                new TypeReference<List<InterventionRecord>>() {
                }, InterventionRecord::getId);
        this.tasks = new JsonListDocument<>(storagePort, objectMapper, CLINICAL_DIR, "tasks.json",
                new TypeReference<List<CoordinatorTask>>() {
                }, CoordinatorTask::getId);
        this.trials = new JsonListDocument<>(storagePort, objectMapper, CLINICAL_DIR, "trials.json",
                new TypeReference<List<Trial>>() {
                }, Trial::getTrialId);
        this.staff = new JsonListDocument<>(storagePort, objectMapper, CLINICAL_DIR, "staff.json",
                new TypeReference<List<StaffMember>>() {
                }, StaffMember::getId);
    }

    @Override
    public List<Patient> findPatients(String siteId) {
        return patients.all().stream()
                .filter(patient -> siteId == null || siteId.equals(patient.getSiteId()))
                .toList();
    }

    @Override
    public Optional<Patient> findPatient(String patientId) {
        return patients.all().stream()
                .filter(patient -> Objects.equals(patientId, patient.getPatientId()))
                .findFirst();
    }

    @Override
    public Patient savePatient(Patient patient) {
        return patients.upsert(patient);
    }

    @Override
    public List<InterventionRecord> findInterventions(String siteId) {
        return interventions.all().stream()
                .filter(record -> siteId == null || siteId.equals(record.getSiteId()))
                .toList();
    }

    @Override
    public List<InterventionRecord> findInterventionsForPatient(String patientId) {
        return interventions.all().stream()
                .filter(record -> Objects.equals(patientId, record.getPatientId()))
                .toList();
    }

    @Override
    public InterventionRecord appendIntervention(InterventionRecord record) {
        return interventions.upsert(record);
    }

    @Override
    public List<CoordinatorTask> findTasks(String siteId) {
        return tasks.all().stream()
                .filter(task -> siteId == null || siteId.equals(task.getSiteId()))
                .toList();
    }

    @Override
    public Optional<CoordinatorTask> findTask(String taskId) {
        return tasks.all().stream()
                .filter(task -> Objects.equals(taskId, task.getId()))
                .findFirst();
    }

    @Override
    public CoordinatorTask saveTask(CoordinatorTask task) {
        return tasks.upsert(task);
    }

    @Override
    public Optional<Trial> findTrial(String trialId) {
        return trials.all().stream()
                .filter(trial -> Objects.equals(trialId, trial.getTrialId()))
                .findFirst();
    }

    @Override
    public List<Trial> findTrials() {
        return trials.all();
    }

    @Override
    public List<StaffMember> findStaff(String siteId) {
        return staff.all().stream()
                .filter(member -> siteId == null || siteId.equals(member.getSiteId()))
                .toList();
    }

    @Override
    public Optional<StaffMember> findStaffMember(String staffId) {
        return staff.all().stream()
                .filter(member -> Objects.equals(staffId, member.getId()))
                .findFirst();
    }
}
