package me.golemcore.cadence.domain.service;

import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeQuery;
import me.golemcore.cadence.domain.model.KnowledgeStatus;
import me.golemcore.cadence.domain.model.KnowledgeTier;
import me.golemcore.cadence.domain.model.ScoredKnowledgeEntry;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.EmbeddingPort;
import me.golemcore.cadence.port.outbound.KnowledgeStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KnowledgeRetrievalServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String SINAI = "site_sinai";

    private KnowledgeStorePort knowledgeStore;
    private EmbeddingPort embeddingPort;
    private CadenceProperties properties;
    private KnowledgeLifecycleService lifecycleService;
    private KnowledgeRetrievalService service;
    private List<KnowledgeEntry> entries;

    @BeforeEach
    void setUp() {
        knowledgeStore = mock(KnowledgeStorePort.class);
        embeddingPort = mock(EmbeddingPort.class);
        properties = new CadenceProperties();
        entries = new ArrayList<>();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        when(knowledgeStore.findAllEntries()).thenAnswer(invocation -> List.copyOf(entries));
        when(knowledgeStore.findEntry(anyString())).thenAnswer(invocation -> entries.stream()
                .filter(entry -> entry.getId().equals(invocation.getArgument(0)))
                .findFirst());
        when(knowledgeStore.saveEntry(any(KnowledgeEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(embeddingPort.isAvailable()).thenReturn(false);

        lifecycleService = new KnowledgeLifecycleService(knowledgeStore, properties, clock);
        service = new KnowledgeRetrievalService(knowledgeStore, embeddingPort, lifecycleService, properties);
    }

    @Test
    void shouldRankSiteNauseaKitAboveGenericEntryWithEqualOverlap() {
        entries.add(entry("kb-generic", KnowledgeTier.FOUNDATIONAL, null,
                "Nausea management education at enrollment reduces early dropout."));
        entries.add(entry("kb-sinai", KnowledgeTier.SITE, SINAI,
                "Our nausea management kit with a nurse call on day 3 keeps GLP-1 patients enrolled."));

        List<ScoredKnowledgeEntry> results = service.search(query("nausea management", SINAI));

        assertEquals(2, results.size());
        assertEquals("kb-sinai", results.get(0).getEntry().getId());
        assertEquals(1.8, results.get(0).getRelevanceScore(), 1e-9);
        assertEquals("kb-generic", results.get(1).getEntry().getId());
        assertEquals(1.0, results.get(1).getRelevanceScore(), 1e-9);
    }

    @Test
    void shouldScoreTierTwoStrictlyAboveTierOneWithoutScopeBoost() {
        entries.add(entry("kb-t1", KnowledgeTier.FOUNDATIONAL, null, "transport vouchers help"));
        entries.add(entry("kb-t2", KnowledgeTier.SITE, null, "transport vouchers help"));

        List<ScoredKnowledgeEntry> results = service.search(query("transport vouchers", null));

        assertEquals("kb-t2", results.get(0).getEntry().getId());
        assertTrue(results.get(0).getRelevanceScore() > results.get(1).getRelevanceScore());
    }

    @Test
    void shouldNotDecreaseScoreWhenMoreQueryTermsMatch() {
        entries.add(entry("kb-one", KnowledgeTier.FOUNDATIONAL, null, "call the caregiver"));
        entries.add(entry("kb-two", KnowledgeTier.FOUNDATIONAL, null, "call the caregiver about transport"));

        List<ScoredKnowledgeEntry> results = service.search(query("caregiver transport", null));

        assertEquals("kb-two", results.get(0).getEntry().getId());
        assertEquals(1.0, results.get(0).getRelevanceScore(), 1e-9);
        assertEquals(0.5, results.get(1).getRelevanceScore(), 1e-9);
    }

    @Test
    void shouldExcludeEntriesWithoutOverlap() {
        entries.add(entry("kb-1", KnowledgeTier.FOUNDATIONAL, null, "fasting window reminders"));

        assertTrue(service.search(query("caregiver", null)).isEmpty());
    }

    @Test
    void shouldApplyConfidenceAndEffectivenessBoosts() {
        KnowledgeEntry boosted = entry("xsite-1", KnowledgeTier.CROSS_SITE, null, "sms reminders outperform email");
        boosted.setConfidence(0.95);
        boosted.setEffectivenessScore(0.8);
        entries.add(boosted);

        List<ScoredKnowledgeEntry> results = service.search(query("sms", null));

        assertEquals(1.5, results.get(0).getRelevanceScore(), 1e-9);
    }

    @Test
    void shouldHideOtherSitesEntriesAndArchivedEntries() {
        entries.add(entry("kb-columbia", KnowledgeTier.SITE, "site_columbia", "parking validation tip"));
        KnowledgeEntry archived = entry("kb-archived", KnowledgeTier.FOUNDATIONAL, null, "parking is free");
        archived.setStatus(KnowledgeStatus.ARCHIVED);
        entries.add(archived);

        assertTrue(service.search(query("parking", SINAI)).isEmpty());
    }

    @Test
    void shouldReturnSiteEntriesFromEverySiteWhenQueryIsUnscoped() {
        entries.add(entry("kb-sinai", KnowledgeTier.SITE, SINAI, "nausea management kit"));
        entries.add(entry("kb-columbia", KnowledgeTier.SITE, "site_columbia", "nausea hotline"));

        List<ScoredKnowledgeEntry> results = service.search(query("nausea", null));

        assertEquals(2, results.size());
        assertEquals(1.5, results.get(0).getRelevanceScore(), 1e-9);
    }

    @Test
    void shouldBrowseSiteEntriesWhenUnscoped() {
        entries.add(entry("kb-sinai", KnowledgeTier.SITE, SINAI, "nausea management kit"));

        List<ScoredKnowledgeEntry> results = service.search(KnowledgeQuery.builder()
                .tier(KnowledgeTier.SITE)
                .build());

        assertEquals(1, results.size());
        assertEquals("kb-sinai", results.get(0).getEntry().getId());
    }

    @Test
    void shouldBrowseOnlyOwnAndUnscopedSiteEntriesWhenScoped() {
        entries.add(entry("kb-sinai", KnowledgeTier.SITE, SINAI, "nausea management kit"));
        entries.add(entry("kb-columbia", KnowledgeTier.SITE, "site_columbia", "nausea hotline"));
        entries.add(entry("kb-shared", KnowledgeTier.SITE, null, "shared parking note"));

        List<String> ids = service.search(KnowledgeQuery.builder().siteId(SINAI).build()).stream()
                .map(scored -> scored.getEntry().getId())
                .toList();

        assertEquals(List.of("kb-shared", "kb-sinai"), ids);
    }

    @Test
    void shouldHideArchivedEntryUntilValidatedAgain() {
        entries.add(entry("kb-1", KnowledgeTier.FOUNDATIONAL, null, "parking validation tip"));

        lifecycleService.archive("kb-1");
        assertTrue(service.search(query("parking", null)).isEmpty());

        lifecycleService.validate("kb-1");
        List<ScoredKnowledgeEntry> results = service.search(query("parking", null));
        assertEquals(1, results.size());
        assertEquals(KnowledgeStatus.ACTIVE, results.get(0).getEntry().getStatus());
    }

    @Test
    void shouldBrowseWithZeroScoresWhenQueryIsBlank() {
        entries.add(entry("kb-a", KnowledgeTier.FOUNDATIONAL, null, "first"));
        entries.add(entry("kb-b", KnowledgeTier.CROSS_SITE, null, "second"));

        List<ScoredKnowledgeEntry> results = service.search(KnowledgeQuery.builder()
                .tier(KnowledgeTier.CROSS_SITE)
                .build());

        assertEquals(1, results.size());
        assertEquals("kb-b", results.get(0).getEntry().getId());
        assertEquals(0.0, results.get(0).getRelevanceScore());
    }

    @Test
    void shouldTruncateToLimit() {
        for (int i = 0; i < 5; i++) {
            entries.add(entry("kb-" + i, KnowledgeTier.FOUNDATIONAL, null, "visit reminder " + i));
        }

        List<ScoredKnowledgeEntry> results = service.search(KnowledgeQuery.builder()
                .query("reminder")
                .limit(3)
                .build());

        assertEquals(3, results.size());
        assertEquals("kb-0", results.get(0).getEntry().getId());
    }

    @Test
    void shouldFlagStaleEntries() {
        KnowledgeEntry old = entry("kb-old", KnowledgeTier.SITE, null, "old parking tip");
        old.setLastValidatedAt(NOW.minusSeconds(100L * 24 * 3600));
        entries.add(old);

        List<ScoredKnowledgeEntry> results = service.search(query("parking", null));

        assertTrue(results.get(0).isStale());
    }

    @Test
    void shouldUseCosineSimilarityWhenEmbeddingsAreAvailable() {
        KnowledgeEntry near = entry("kb-near", KnowledgeTier.FOUNDATIONAL, null, "alpha");
        near.setEmbedding(new float[] { 1f, 0f });
        KnowledgeEntry far = entry("kb-far", KnowledgeTier.FOUNDATIONAL, null, "beta");
        far.setEmbedding(new float[] { 0f, 1f });
        entries.add(near);
        entries.add(far);
        when(embeddingPort.isAvailable()).thenReturn(true);
        when(embeddingPort.embed("unrelated words")).thenReturn(CompletableFuture.completedFuture(new float[] { 1f, 0f }));
        when(embeddingPort.cosineSimilarity(any(), any())).thenCallRealMethod();

        List<ScoredKnowledgeEntry> results = service.search(query("unrelated words", null));

        assertEquals(1, results.size());
        assertEquals("kb-near", results.get(0).getEntry().getId());
        assertEquals(1.0, results.get(0).getRelevanceScore(), 1e-9);
        verify(embeddingPort, never()).embedBatch(anyList());
    }

    @Test
    void shouldBackfillMissingVectors() {
        entries.add(entry("kb-1", KnowledgeTier.FOUNDATIONAL, null, "alpha"));
        when(embeddingPort.isAvailable()).thenReturn(true);
        when(embeddingPort.embed(anyString())).thenReturn(CompletableFuture.completedFuture(new float[] { 1f, 0f }));
        when(embeddingPort.embedBatch(anyList()))
                .thenReturn(CompletableFuture.completedFuture(List.of(new float[] { 1f, 0f })));
        when(embeddingPort.cosineSimilarity(any(), any())).thenCallRealMethod();

        List<ScoredKnowledgeEntry> results = service.search(query("anything", null));

        assertEquals(1, results.size());
        verify(knowledgeStore).saveEntries(anyList());
    }

    @Test
    void shouldFallBackToKeywordsWhenEmbeddingFails() {
        entries.add(entry("kb-1", KnowledgeTier.FOUNDATIONAL, null, "nausea tips"));
        when(embeddingPort.isAvailable()).thenReturn(true);
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("provider down")));

        List<ScoredKnowledgeEntry> results = service.search(query("nausea", null));

        assertEquals(1, results.size());
        assertEquals(1.0, results.get(0).getRelevanceScore(), 1e-9);
        assertFalse(results.get(0).isStale());
    }

    @Test
    void shouldReturnEmptyForUnknownEntryLookup() {
        assertEquals(Optional.empty(), lifecycleService.getEntry("missing"));
    }

    private static KnowledgeQuery query(String text, String siteId) {
        return KnowledgeQuery.builder().query(text).siteId(siteId).build();
    }

    private static KnowledgeEntry entry(String id, KnowledgeTier tier, String siteId, String content) {
        return KnowledgeEntry.builder()
                .id(id)
                .tier(tier)
                .siteId(siteId)
                .category("tip")
                .content(content)
                .status(KnowledgeStatus.ACTIVE)
                .createdAt(NOW)
                .lastValidatedAt(NOW)
                .build();
    }
}
