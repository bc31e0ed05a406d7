package me.golemcore.cadence.domain.service;

import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeStats;
import me.golemcore.cadence.domain.model.KnowledgeStatus;
import me.golemcore.cadence.domain.model.KnowledgeSuggestion;
import me.golemcore.cadence.domain.model.KnowledgeTier;
import me.golemcore.cadence.domain.model.SuggestionStatus;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.KnowledgeStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KnowledgeLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private KnowledgeStorePort knowledgeStore;
    private KnowledgeLifecycleService service;
    private List<KnowledgeEntry> entries;

    @BeforeEach
    void setUp() {
        knowledgeStore = mock(KnowledgeStorePort.class);
        entries = new ArrayList<>();
        when(knowledgeStore.findAllEntries()).thenAnswer(invocation -> List.copyOf(entries));
        when(knowledgeStore.findEntry(anyString())).thenAnswer(invocation -> entries.stream()
                .filter(entry -> entry.getId().equals(invocation.getArgument(0)))
                .findFirst());
        when(knowledgeStore.saveEntry(any(KnowledgeEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(knowledgeStore.findAllSuggestions()).thenReturn(List.of());

        service = new KnowledgeLifecycleService(knowledgeStore, new CadenceProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldDeriveStalenessFromTierThreshold() {
        KnowledgeEntry site = entry("kb-site", KnowledgeTier.SITE, NOW.minus(Duration.ofDays(91)));
        KnowledgeEntry foundational = entry("kb-base", KnowledgeTier.FOUNDATIONAL, NOW.minus(Duration.ofDays(91)));
        KnowledgeEntry crossSite = entry("kb-x", KnowledgeTier.CROSS_SITE, NOW.minus(Duration.ofDays(181)));

        assertTrue(service.isStale(site));
        assertFalse(service.isStale(foundational));
        assertTrue(service.isStale(crossSite));
        assertEquals(KnowledgeStatus.STALE, service.effectiveStatus(site));
        assertEquals(KnowledgeStatus.ACTIVE, site.getStatus());
    }

    @Test
    void shouldNotTreatEntryAtThresholdAsStale() {
        assertFalse(service.isStale(entry("kb-site", KnowledgeTier.SITE, NOW.minus(Duration.ofDays(90)))));
    }

    @Test
    void shouldFallBackToCreationTimeWhenNeverValidated() {
        KnowledgeEntry entry = entry("kb-site", KnowledgeTier.SITE, null);
        entry.setCreatedAt(NOW.minus(Duration.ofDays(200)));

        assertTrue(service.isStale(entry));
    }

    @Test
    void shouldNeverReportArchivedEntriesAsStale() {
        KnowledgeEntry entry = entry("kb-site", KnowledgeTier.SITE, NOW.minus(Duration.ofDays(400)));
        entry.setStatus(KnowledgeStatus.ARCHIVED);

        assertFalse(service.isStale(entry));
        assertEquals(KnowledgeStatus.ARCHIVED, service.effectiveStatus(entry));
    }

    @Test
    void shouldValidateEntryAndResetTimestamp() {
        KnowledgeEntry entry = entry("kb-1", KnowledgeTier.SITE, NOW.minus(Duration.ofDays(120)));
        entry.setStatus(KnowledgeStatus.ARCHIVED);
        entries.add(entry);

        Optional<KnowledgeEntry> validated = service.validate("kb-1");

        assertTrue(validated.isPresent());
        assertEquals(KnowledgeStatus.ACTIVE, validated.get().getStatus());
        assertEquals(NOW, validated.get().getLastValidatedAt());
        assertFalse(service.isStale(validated.get()));
        verify(knowledgeStore).saveEntry(entry);
    }

    @Test
    void shouldArchiveEntry() {
        entries.add(entry("kb-1", KnowledgeTier.FOUNDATIONAL, NOW));

        assertEquals(KnowledgeStatus.ARCHIVED, service.archive("kb-1").orElseThrow().getStatus());
    }

    @Test
    void shouldReturnEmptyForUnknownIds() {
        assertTrue(service.validate("missing").isEmpty());
        assertTrue(service.archive("missing").isEmpty());
        assertTrue(service.trackReference("missing").isEmpty());
        verify(knowledgeStore, never()).saveEntry(any());
        verify(knowledgeStore, never()).saveEntries(anyList());
    }

    @Test
    void shouldPersistTrackedReferencesInOneWrite() {
        entries.add(entry("kb-1", KnowledgeTier.FOUNDATIONAL, NOW));
        entries.add(entry("kb-2", KnowledgeTier.CROSS_SITE, NOW));

        List<KnowledgeEntry> updated = service.trackReferences(List.of("kb-1", "missing", "kb-2", "kb-1"));

        assertEquals(List.of("kb-1", "kb-2"), updated.stream().map(KnowledgeEntry::getId).toList());
        assertEquals(1, updated.get(0).getReferenceCount());
        verify(knowledgeStore, times(1)).saveEntries(updated);
        verify(knowledgeStore, never()).saveEntry(any());
    }

    @Test
    void shouldTrackReferencesWithoutChangingStatus() {
        entries.add(entry("kb-1", KnowledgeTier.FOUNDATIONAL, NOW));

        service.trackReference("kb-1");
        KnowledgeEntry entry = service.trackReference("kb-1").orElseThrow();

        assertEquals(2, entry.getReferenceCount());
        assertEquals(NOW, entry.getLastReferencedAt());
        assertEquals(KnowledgeStatus.ACTIVE, entry.getStatus());
    }

    @Test
    void shouldListStaleEntriesOldestFirst() {
        entries.add(entry("kb-fresh", KnowledgeTier.SITE, NOW));
        entries.add(entry("kb-older", KnowledgeTier.SITE, NOW.minus(Duration.ofDays(150))));
        entries.add(entry("kb-old", KnowledgeTier.SITE, NOW.minus(Duration.ofDays(100))));

        List<KnowledgeEntry> stale = service.getStaleEntries(null);

        assertEquals(List.of("kb-older", "kb-old"), stale.stream().map(KnowledgeEntry::getId).toList());
    }

    @Test
    void shouldCountEntriesBySuggestionsAndEffectiveStatus() {
        entries.add(entry("kb-1", KnowledgeTier.FOUNDATIONAL, NOW));
        KnowledgeEntry stale = entry("kb-2", KnowledgeTier.SITE, NOW.minus(Duration.ofDays(100)));
        stale.setSiteId("site_sinai");
        stale.setReferenceCount(3);
        entries.add(stale);
        when(knowledgeStore.findAllSuggestions()).thenReturn(List.of(
                KnowledgeSuggestion.builder().id("s-1").status(SuggestionStatus.DRAFT).build(),
                KnowledgeSuggestion.builder().id("s-2").status(SuggestionStatus.APPROVED).build()));

        KnowledgeStats stats = service.getStats();

        assertEquals(2, stats.getTotalEntries());
        assertEquals(1L, stats.getByStatus().get("active"));
        assertEquals(1L, stats.getByStatus().get("stale"));
        assertEquals(1L, stats.getByTier().get(1));
        assertEquals(1L, stats.getBySite().get("site_sinai"));
        assertEquals(3, stats.getTotalReferences());
        assertEquals(1, stats.getPendingSuggestions());
    }

    private static KnowledgeEntry entry(String id, KnowledgeTier tier, Instant validatedAt) {
        return KnowledgeEntry.builder()
                .id(id)
                .tier(tier)
                .category("tip")
                .content("content of " + id)
                .status(KnowledgeStatus.ACTIVE)
                .createdAt(validatedAt)
                .lastValidatedAt(validatedAt)
                .build();
    }
}
