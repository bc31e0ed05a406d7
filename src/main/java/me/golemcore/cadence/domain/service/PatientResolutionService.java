package me.golemcore.cadence.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.MatchKind;
import me.golemcore.cadence.domain.model.Patient;
import me.golemcore.cadence.domain.model.PatientEvent;
import me.golemcore.cadence.domain.model.ResolutionResult;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.PatientDirectoryPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Resolves natural-language patient references ("Maria", "007", "the NASH
 * patient who missed a visit") to patient records.
 *
 * <p>
 * Stages run in order and the first one that produces an answer wins:
 * <ol>
 * <li>exact patient id, any status</li>
 * <li>partial patient id, any status</li>
 * <li>name matching over active and at-risk patients</li>
 * <li>contextual keywords (trial, risk, missed visits, symptoms)</li>
 * </ol>
 * All confidences, caps and keyword maps come from
 * {@code cadence.resolver.*}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatientResolutionService {

    private static final Set<String> HONORIFICS = Set.of("mr", "mr.", "mrs", "mrs.", "ms", "ms.", "dr", "dr.");

    private final PatientDirectoryPort patientDirectory;
    private final CadenceProperties properties;

    public ResolutionResult resolve(String query, String siteId) {
        if (query == null || query.isBlank()) {
            return ResolutionResult.none();
        }
        String trimmed = query.trim();
        List<Patient> allPatients = patientDirectory.findPatients(siteId);
        List<Patient> activePatients = allPatients.stream()
                .filter(Patient::isInActiveCare)
                .toList();

        ResolutionResult result = matchExactId(trimmed, allPatients)
                .or(() -> matchPartialId(trimmed, allPatients))
                .or(() -> matchName(trimmed, activePatients))
                .or(() -> matchContext(trimmed, activePatients))
                .orElseGet(ResolutionResult::none);

        log.debug("[Resolver] '{}' (site {}) -> {} with {} candidate(s), confidence {}",
                trimmed, siteId, result.getMatch(), result.getCandidates().size(), result.getConfidence());
        return result;
    }

    private Optional<ResolutionResult> matchExactId(String query, List<Patient> patients) {
        return patients.stream()
                .filter(patient -> query.equalsIgnoreCase(patient.getPatientId()))
                .findFirst()
                .map(patient -> result(MatchKind.EXACT, List.of(patient), config().getExactIdConfidence()));
    }

    private Optional<ResolutionResult> matchPartialId(String query, List<Patient> patients) {
        String needle = query.toUpperCase(Locale.ROOT);
        List<Patient> matches = patients.stream()
                .filter(patient -> patient.getPatientId() != null
                        && patient.getPatientId().toUpperCase(Locale.ROOT).contains(needle))
                .toList();
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        if (matches.size() == 1) {
            return Optional.of(result(MatchKind.SINGLE, matches, config().getPartialIdSingleConfidence()));
        }
        return Optional.of(result(MatchKind.MULTIPLE, cap(matches), config().getPartialIdMultipleConfidence()));
    }

    private Optional<ResolutionResult> matchName(String query, List<Patient> patients) {
        List<String> tokens = nameTokens(query);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        CadenceProperties.ResolverProperties config = config();
        NameMatch match = tokens.size() >= 2
                ? matchFullName(tokens, patients, config)
                : matchSingleName(tokens.get(0), patients, config);
        if (match == null) {
            return Optional.empty();
        }
        if (match.patients().size() == 1 && match.confidence() >= config.getSingleNameMinConfidence()) {
            return Optional.of(result(MatchKind.SINGLE, match.patients(), match.confidence()));
        }
        if (match.patients().size() <= config.getMaxCandidates()) {
            return Optional.of(result(MatchKind.MULTIPLE, match.patients(), match.confidence()));
        }
        // Too many name hits: let contextual keywords narrow the population
        return Optional.empty();
    }

    private NameMatch matchFullName(List<String> tokens, List<Patient> patients,
            CadenceProperties.ResolverProperties config) {
        String joined = String.join(" ", tokens);
        List<Patient> full = filter(patients, patient -> joined.equals(String.join(" ", nameTokens(patient.getName()))));
        if (!full.isEmpty()) {
            return new NameMatch(full, config.getFullNameConfidence());
        }
        String first = tokens.get(0);
        String last = tokens.get(tokens.size() - 1);
        List<Patient> partial = filter(patients, patient -> {
            List<String> parts = nameTokens(patient.getName());
            return !parts.isEmpty() && parts.get(0).contains(first) && parts.get(parts.size() - 1).contains(last);
        });
        if (!partial.isEmpty()) {
            return new NameMatch(partial, config.getFirstLastConfidence());
        }
        return null;
    }

    private NameMatch matchSingleName(String token, List<Patient> patients,
            CadenceProperties.ResolverProperties config) {
        List<Patient> lastName = filter(patients, patient -> {
            List<String> parts = nameTokens(patient.getName());
            return !parts.isEmpty() && token.equals(parts.get(parts.size() - 1));
        });
        if (!lastName.isEmpty()) {
            return new NameMatch(lastName, config.getLastNameConfidence());
        }
        List<Patient> firstName = filter(patients, patient -> {
            List<String> parts = nameTokens(patient.getName());
            return !parts.isEmpty() && token.equals(parts.get(0));
        });
        if (!firstName.isEmpty()) {
            return new NameMatch(firstName, config.getFirstNameConfidence());
        }
        List<Patient> prefix = filter(patients,
                patient -> nameTokens(patient.getName()).stream().anyMatch(part -> part.startsWith(token)));
        if (!prefix.isEmpty()) {
            return new NameMatch(prefix, config.getPrefixConfidence());
        }
        return null;
    }

    private Optional<ResolutionResult> matchContext(String query, List<Patient> patients) {
        CadenceProperties.ResolverProperties config = config();
        String text = query.toLowerCase(Locale.ROOT);
        List<Patient> narrowed = new ArrayList<>(patients);

        for (Map.Entry<String, String> keyword : config.getTrialKeywords().entrySet()) {
            if (text.contains(keyword.getKey().toLowerCase(Locale.ROOT))) {
                String trialId = keyword.getValue();
                narrowed.removeIf(patient -> !trialId.equals(patient.getTrialId()));
                break;
            }
        }

        if (text.contains("high risk") || text.contains("high-risk")) {
            narrowed.removeIf(patient -> patient.getDropoutRiskScore() < config.getHighRiskThreshold());
        } else if (text.contains("at risk") || text.contains("at_risk")) {
            narrowed.removeIf(patient -> !Patient.STATUS_AT_RISK.equals(patient.getStatus()));
        }

        if (text.contains("missed") && text.contains("visit")) {
            narrowed.removeIf(patient -> !hasEvent(patient, PatientEvent.TYPE_MISSED_VISIT));
        } else if (text.contains("missed")) {
            narrowed.removeIf(patient -> patient.getVisitsMissed() <= 0);
        }

        List<String> symptoms = config.getSymptomKeywords().stream()
                .map(symptom -> symptom.toLowerCase(Locale.ROOT))
                .filter(text::contains)
                .toList();
        if (!symptoms.isEmpty()) {
            narrowed.removeIf(patient -> !hasSymptom(patient, config.getSymptomKeywords())
                    && !hasEvent(patient, PatientEvent.TYPE_ADVERSE_EVENT));
        }

        if (narrowed.isEmpty() || narrowed.size() >= patients.size()) {
            return Optional.empty();
        }
        double confidence = narrowed.size() <= config.getContextNarrowMaxCandidates()
                ? config.getContextNarrowConfidence()
                : config.getContextBroadConfidence();
        if (narrowed.size() == 1 && confidence >= config.getContextSingleMinConfidence()) {
            return Optional.of(result(MatchKind.SINGLE, narrowed, confidence));
        }
        return Optional.of(result(MatchKind.MULTIPLE, cap(narrowed), confidence));
    }

    private boolean hasEvent(Patient patient, String type) {
        return patient.getEvents() != null
                && patient.getEvents().stream().anyMatch(event -> type.equals(event.getType()));
    }

    private boolean hasSymptom(Patient patient, List<String> symptomKeywords) {
        if (patient.getRiskFactors() == null) {
            return false;
        }
        return patient.getRiskFactors().stream()
                .map(factor -> factor.toLowerCase(Locale.ROOT))
                .anyMatch(factor -> symptomKeywords.stream()
                        .anyMatch(symptom -> factor.contains(symptom.toLowerCase(Locale.ROOT))));
    }

    private List<Patient> filter(List<Patient> patients, Predicate<Patient> predicate) {
        return patients.stream().filter(predicate).toList();
    }

    private List<Patient> cap(List<Patient> patients) {
        return List.copyOf(patients.subList(0, Math.min(patients.size(), config().getMaxCandidates())));
    }

    private ResolutionResult result(MatchKind kind, List<Patient> patients, double confidence) {
        return ResolutionResult.builder()
                .match(kind)
                .candidates(List.copyOf(patients))
                .confidence(confidence)
                .build();
    }

    private CadenceProperties.ResolverProperties config() {
        return properties.getResolver();
    }

    static List<String> nameTokens(String name) {
        if (name == null) {
            return List.of();
        }
        return Arrays.stream(name.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(token -> !token.isEmpty())
                .filter(token -> !HONORIFICS.contains(token))
                .toList();
    }

    private record NameMatch(List<Patient> patients, double confidence) {
    }
}
