package me.golemcore.cadence.domain.service;

import me.golemcore.cadence.domain.model.MatchKind;
import me.golemcore.cadence.domain.model.Patient;
import me.golemcore.cadence.domain.model.PatientEvent;
import me.golemcore.cadence.domain.model.ResolutionResult;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.PatientDirectoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PatientResolutionServiceTest {

    private static final String GLP1_TRIAL = "NCT06789012";
    private static final String NASH_TRIAL = "NCT05891234";

    private PatientDirectoryPort patientDirectory;
    private PatientResolutionService service;
    private List<Patient> patients;

    @BeforeEach
    void setUp() {
        patientDirectory = mock(PatientDirectoryPort.class);
        patients = new ArrayList<>();
        when(patientDirectory.findPatients(any())).thenAnswer(invocation -> List.copyOf(patients));
        service = new PatientResolutionService(patientDirectory, new CadenceProperties());
    }

    @Test
    void shouldResolveExactIdWithFullConfidence() {
        patients.add(patient("PT-123", "John Smith", NASH_TRIAL));
        patients.add(patient("PT-1234", "Jane Doe", NASH_TRIAL));

        ResolutionResult result = service.resolve("PT-123", null);

        assertEquals(MatchKind.EXACT, result.getMatch());
        assertEquals(1.0, result.getConfidence());
        assertEquals("PT-123", result.getPatient().orElseThrow().getPatientId());
    }

    @Test
    void shouldMatchExactIdRegardlessOfStatusAndCase() {
        Patient withdrawn = patient("PT-COL-0001", "Ann Lee", NASH_TRIAL);
        withdrawn.setStatus(Patient.STATUS_WITHDRAWN);
        patients.add(withdrawn);

        ResolutionResult result = service.resolve("pt-col-0001", null);

        assertEquals(MatchKind.EXACT, result.getMatch());
    }

    @Test
    void shouldReturnNoneForBlankQueryWithoutLookingUpPatients() {
        ResolutionResult result = service.resolve("  ", null);

        assertEquals(MatchKind.NONE, result.getMatch());
        assertEquals(0.0, result.getConfidence());
        assertTrue(result.getCandidates().isEmpty());
        assertEquals(MatchKind.NONE, service.resolve(null, null).getMatch());
        verify(patientDirectory, never()).findPatients(any());
    }

    @Test
    void shouldResolveUniquePartialIdAsSingle() {
        patients.add(patient("PT-SIN-0042", "Maria Lopez", GLP1_TRIAL));
        patients.add(patient("PT-SIN-0043", "Rosa Diaz", GLP1_TRIAL));

        ResolutionResult result = service.resolve("0042", null);

        assertEquals(MatchKind.SINGLE, result.getMatch());
        assertEquals(0.95, result.getConfidence());
    }

    @Test
    void shouldCapAmbiguousPartialIdMatches() {
        for (int i = 1; i <= 7; i++) {
            patients.add(patient("PT-SIN-000" + i, "Patient " + i, GLP1_TRIAL));
        }

        ResolutionResult result = service.resolve("PT-SIN", null);

        assertEquals(MatchKind.MULTIPLE, result.getMatch());
        assertEquals(0.90, result.getConfidence());
        assertEquals(5, result.getCandidates().size());
    }

    @Test
    void shouldResolveFirstNameOnlyAsSingleAtFirstNameConfidence() {
        patients.add(patient("PT-SIN-0042", "Maria Lopez", GLP1_TRIAL));
        patients.add(patient("PT-SIN-0043", "Rosa Diaz", GLP1_TRIAL));

        ResolutionResult result = service.resolve("Maria", null);

        assertEquals(MatchKind.SINGLE, result.getMatch());
        assertEquals(0.75, result.getConfidence());
        assertEquals("PT-SIN-0042", result.getPatient().orElseThrow().getPatientId());
    }

    @Test
    void shouldPreferLastNameOverFirstName() {
        patients.add(patient("PT-1", "Lopez Garcia", GLP1_TRIAL));
        patients.add(patient("PT-2", "Maria Lopez", GLP1_TRIAL));

        ResolutionResult result = service.resolve("Lopez", null);

        assertEquals(MatchKind.SINGLE, result.getMatch());
        assertEquals(0.85, result.getConfidence());
        assertEquals("PT-2", result.getPatient().orElseThrow().getPatientId());
    }

    @Test
    void shouldMatchFullNameIgnoringHonorific() {
        patients.add(patient("PT-1", "Robert Chen", NASH_TRIAL));
        patients.add(patient("PT-2", "Robert Chen Jr", NASH_TRIAL));

        ResolutionResult result = service.resolve("Mr. Robert Chen", null);

        assertEquals(MatchKind.SINGLE, result.getMatch());
        assertEquals(0.95, result.getConfidence());
        assertEquals("PT-1", result.getPatient().orElseThrow().getPatientId());
    }

    @Test
    void shouldReportSameNamePatientsAsMultiple() {
        patients.add(patient("PT-1", "Maria Lopez", GLP1_TRIAL));
        patients.add(patient("PT-2", "Maria Santos", NASH_TRIAL));

        ResolutionResult result = service.resolve("Maria", null);

        assertEquals(MatchKind.MULTIPLE, result.getMatch());
        assertEquals(2, result.getCandidates().size());
        assertFalse(result.isResolved());
    }

    @Test
    void shouldNotPromotePrefixMatchToSingle() {
        patients.add(patient("PT-1", "Margaret Hill", NASH_TRIAL));

        ResolutionResult result = service.resolve("Marg", null);

        assertEquals(MatchKind.MULTIPLE, result.getMatch());
        assertEquals(0.65, result.getConfidence());
    }

    @Test
    void shouldIgnoreWithdrawnPatientsWhenMatchingNames() {
        Patient withdrawn = patient("PT-1", "Maria Lopez", GLP1_TRIAL);
        withdrawn.setStatus(Patient.STATUS_WITHDRAWN);
        patients.add(withdrawn);

        assertEquals(MatchKind.NONE, service.resolve("Maria", null).getMatch());
    }

    @Test
    void shouldNarrowByTrialAndSymptomKeywords() {
        Patient nauseous = patient("PT-1", "Maria Lopez", GLP1_TRIAL);
        nauseous.setRiskFactors(new ArrayList<>(List.of("Nausea during titration")));
        patients.add(nauseous);
        patients.add(patient("PT-2", "Rosa Diaz", GLP1_TRIAL));
        patients.add(patient("PT-3", "John Smith", NASH_TRIAL));

        ResolutionResult result = service.resolve("the GLP-1 patient with nausea", null);

        assertEquals(MatchKind.SINGLE, result.getMatch());
        assertEquals(0.70, result.getConfidence());
        assertEquals("PT-1", result.getPatient().orElseThrow().getPatientId());
    }

    @Test
    void shouldNarrowByMissedVisitEvents() {
        Patient missed = patient("PT-1", "Maria Lopez", NASH_TRIAL);
        missed.setEvents(new ArrayList<>(List.of(PatientEvent.builder()
                .id("ev-1")
                .type(PatientEvent.TYPE_MISSED_VISIT)
                .date(LocalDate.of(2026, 2, 1))
                .build())));
        patients.add(missed);
        patients.add(patient("PT-2", "Rosa Diaz", NASH_TRIAL));

        ResolutionResult result = service.resolve("who missed a visit", null);

        assertEquals(MatchKind.SINGLE, result.getMatch());
        assertEquals("PT-1", result.getPatient().orElseThrow().getPatientId());
    }

    @Test
    void shouldNotReturnContextMatchWhenNothingWasNarrowed() {
        patients.add(patient("PT-1", "Maria Lopez", GLP1_TRIAL));
        patients.add(patient("PT-2", "Rosa Diaz", GLP1_TRIAL));

        ResolutionResult result = service.resolve("glp-1 patients", null);

        assertEquals(MatchKind.NONE, result.getMatch());
    }

    @Test
    void shouldUseBroadConfidenceForLargeNarrowedSets() {
        for (int i = 1; i <= 4; i++) {
            Patient high = patient("PT-H" + i, "High Risk" + i, NASH_TRIAL);
            high.setDropoutRiskScore(0.8);
            patients.add(high);
        }
        patients.add(patient("PT-L1", "Low Risk", NASH_TRIAL));

        ResolutionResult result = service.resolve("high risk patients", null);

        assertEquals(MatchKind.MULTIPLE, result.getMatch());
        assertEquals(0.55, result.getConfidence());
        assertEquals(4, result.getCandidates().size());
    }

    private static Patient patient(String id, String name, String trialId) {
        return Patient.builder()
                .patientId(id)
                .name(name)
                .siteId("site_sinai")
                .trialId(trialId)
                .status(Patient.STATUS_ACTIVE)
                .dropoutRiskScore(0.3)
                .build();
    }
}
