package me.golemcore.cadence.domain.service;

import me.golemcore.cadence.domain.model.InterventionPattern;
import me.golemcore.cadence.domain.model.InterventionRecord;
import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeStatus;
import me.golemcore.cadence.domain.model.KnowledgeSuggestion;
import me.golemcore.cadence.domain.model.KnowledgeTier;
import me.golemcore.cadence.domain.model.SuggestionStatus;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.EmbeddingPort;
import me.golemcore.cadence.port.outbound.InterventionRecordPort;
import me.golemcore.cadence.port.outbound.KnowledgeStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PatternDetectionServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String SINAI = "site_sinai";

    private InterventionRecordPort interventionRecords;
    private KnowledgeStorePort knowledgeStore;
    private PatternDetectionService service;
    private List<InterventionRecord> records;
    private List<KnowledgeEntry> entries;
    private List<KnowledgeSuggestion> suggestions;

    @BeforeEach
    void setUp() {
        interventionRecords = mock(InterventionRecordPort.class);
        knowledgeStore = mock(KnowledgeStorePort.class);
        EmbeddingPort embeddingPort = mock(EmbeddingPort.class);
        records = new ArrayList<>();
        entries = new ArrayList<>();
        suggestions = new ArrayList<>();

        when(interventionRecords.findInterventions(null)).thenAnswer(invocation -> List.copyOf(records));
        when(knowledgeStore.findAllSuggestions()).thenAnswer(invocation -> List.copyOf(suggestions));
        when(knowledgeStore.findSuggestion(anyString())).thenAnswer(invocation -> suggestions.stream()
                .filter(suggestion -> suggestion.getId().equals(invocation.getArgument(0)))
                .findFirst());
        when(knowledgeStore.saveSuggestion(any(KnowledgeSuggestion.class))).thenAnswer(invocation -> {
            KnowledgeSuggestion suggestion = invocation.getArgument(0);
            if (!suggestions.contains(suggestion)) {
                suggestions.add(suggestion);
            }
            return suggestion;
        });
        when(knowledgeStore.findEntry(anyString())).thenAnswer(invocation -> entries.stream()
                .filter(entry -> entry.getId().equals(invocation.getArgument(0)))
                .findFirst());
        when(knowledgeStore.saveEntry(any(KnowledgeEntry.class))).thenAnswer(invocation -> {
            entries.add(invocation.getArgument(0));
            return invocation.getArgument(0);
        });
        when(embeddingPort.isAvailable()).thenReturn(false);

        CadenceProperties properties = new CadenceProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        KnowledgeWriteService writeService = new KnowledgeWriteService(knowledgeStore, embeddingPort, properties,
                clock);
        service = new PatternDetectionService(interventionRecords, knowledgeStore, writeService, properties, clock);
    }

    @Test
    void shouldGroupBySiteAndTypeAndSkipSmallSamples() {
        addRecords(SINAI, "transport_arranged", 4, 1);
        addRecords(SINAI, "sms_reminder", 1, 1);
        addRecords("site_columbia", "phone_call", 3, 1);

        List<InterventionPattern> patterns = service.analyzePatterns();

        assertEquals(2, patterns.size());
        assertEquals("site_sinai|transport_arranged", patterns.get(0).getPatternKey());
        assertEquals(0.8, patterns.get(0).getSuccessRate());
        assertEquals("site_columbia|phone_call", patterns.get(1).getPatternKey());
        assertEquals(0.75, patterns.get(1).getSuccessRate());
        assertTrue(patterns.stream().noneMatch(pattern -> "sms_reminder".equals(pattern.getInterventionType())));
    }

    @Test
    void shouldKeepGroupThatReachesMinimumSampleSize() {
        addRecords(SINAI, "sms_reminder", 2, 1);

        List<InterventionPattern> patterns = service.analyzePatterns();

        assertEquals(1, patterns.size());
        assertEquals(3, patterns.get(0).getSampleSize());
        assertEquals(0.67, patterns.get(0).getSuccessRate());
    }

    @Test
    void shouldCreateDraftSuggestionsOnlyForStrongNewPatterns() {
        addRecords(SINAI, "transport_arranged", 4, 1);
        addRecords(SINAI, "email", 1, 3);

        List<KnowledgeSuggestion> created = service.detectPatterns();

        assertEquals(1, created.size());
        KnowledgeSuggestion suggestion = created.get(0);
        assertEquals(SuggestionStatus.DRAFT, suggestion.getStatus());
        assertEquals(SINAI, suggestion.getSiteId());
        assertEquals(0.8, suggestion.getConfidence());
        assertEquals(5, suggestion.getEvidenceCount());
        assertEquals("site_sinai|transport_arranged", suggestion.getPatternKey());

        assertTrue(service.detectPatterns().isEmpty());
    }

    @Test
    void shouldListDraftsByConfidence() {
        suggestions.add(suggestion("s-low", 0.72, SuggestionStatus.DRAFT));
        suggestions.add(suggestion("s-high", 0.91, SuggestionStatus.DRAFT));
        suggestions.add(suggestion("s-done", 0.99, SuggestionStatus.DISMISSED));

        List<KnowledgeSuggestion> drafts = service.getSuggestions(SINAI);

        assertEquals(List.of("s-high", "s-low"), drafts.stream().map(KnowledgeSuggestion::getId).toList());
        assertTrue(service.getSuggestions("site_columbia").isEmpty());
    }

    @Test
    void shouldApproveIntoActiveSiteEntryExactlyOnce() {
        suggestions.add(suggestion("s-1", 0.8, SuggestionStatus.DRAFT));

        KnowledgeEntry first = service.approve("s-1").orElseThrow();
        Optional<KnowledgeEntry> second = service.approve("s-1");

        assertEquals(KnowledgeTier.SITE, first.getTier());
        assertEquals(KnowledgeStatus.ACTIVE, first.getStatus());
        assertEquals(SINAI, first.getSiteId());
        assertEquals(0.8, first.getConfidence());
        assertEquals(first.getId(), second.orElseThrow().getId());
        assertEquals(1, entries.size());
        verify(knowledgeStore, times(1)).saveEntry(any(KnowledgeEntry.class));

        KnowledgeSuggestion stored = suggestions.get(0);
        assertEquals(SuggestionStatus.APPROVED, stored.getStatus());
        assertEquals(first.getId(), stored.getApprovedEntryId());
        assertEquals(NOW, stored.getResolvedAt());
    }

    @Test
    void shouldCreateOneEntryWhenSameDraftIsApprovedConcurrently() throws Exception {
        suggestions.add(suggestion("s-1", 0.8, SuggestionStatus.DRAFT));
        AtomicInteger writes = new AtomicInteger();
        doAnswer(invocation -> {
            writes.incrementAndGet();
            Thread.sleep(100);
            entries.add(invocation.getArgument(0));
            return invocation.getArgument(0);
        }).when(knowledgeStore).saveEntry(any(KnowledgeEntry.class));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Optional<KnowledgeEntry>> first = executor.submit(() -> {
                start.await();
                return service.approve("s-1");
            });
            Future<Optional<KnowledgeEntry>> second = executor.submit(() -> {
                start.await();
                return service.approve("s-1");
            });
            start.countDown();

            String firstId = first.get(5, TimeUnit.SECONDS).orElseThrow().getId();
            String secondId = second.get(5, TimeUnit.SECONDS).orElseThrow().getId();

            assertEquals(1, writes.get());
            assertEquals(1, entries.size());
            assertEquals(firstId, secondId);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldNotApproveDismissedSuggestion() {
        suggestions.add(suggestion("s-1", 0.8, SuggestionStatus.DRAFT));

        service.dismiss("s-1");
        service.dismiss("s-1");

        assertTrue(service.approve("s-1").isEmpty());
        assertEquals(SuggestionStatus.DISMISSED, suggestions.get(0).getStatus());
        assertTrue(entries.isEmpty());
        verify(knowledgeStore, times(1)).saveSuggestion(any(KnowledgeSuggestion.class));
    }

    @Test
    void shouldReturnEmptyForUnknownSuggestion() {
        assertTrue(service.approve("missing").isEmpty());
        assertTrue(service.dismiss("missing").isEmpty());
    }

    private void addRecords(String siteId, String type, int positive, int negative) {
        for (int i = 0; i < positive + negative; i++) {
            records.add(InterventionRecord.builder()
                    .id(type + "-" + i)
                    .patientId("PT-" + i)
                    .siteId(siteId)
                    .type(type)
                    .date(LocalDate.of(2026, 1, 10))
                    .outcome(i < positive ? InterventionRecord.OUTCOME_POSITIVE : "negative")
                    .build());
        }
    }

    private static KnowledgeSuggestion suggestion(String id, double confidence, SuggestionStatus status) {
        return KnowledgeSuggestion.builder()
                .id(id)
                .siteId(SINAI)
                .category("intervention_pattern")
                .content("Transport arranged works well at Sinai")
                .source("pattern_detection")
                .confidence(confidence)
                .evidenceCount(5)
                .status(status)
                .build();
    }
}
