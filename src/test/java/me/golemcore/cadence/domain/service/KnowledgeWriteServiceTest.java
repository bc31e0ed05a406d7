package me.golemcore.cadence.domain.service;

import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeStatus;
import me.golemcore.cadence.domain.model.KnowledgeTier;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.EmbeddingPort;
import me.golemcore.cadence.port.outbound.KnowledgeStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KnowledgeWriteServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private KnowledgeStorePort knowledgeStore;
    private EmbeddingPort embeddingPort;
    private CadenceProperties properties;
    private KnowledgeWriteService service;

    @BeforeEach
    void setUp() {
        knowledgeStore = mock(KnowledgeStorePort.class);
        embeddingPort = mock(EmbeddingPort.class);
        properties = new CadenceProperties();
        when(knowledgeStore.saveEntry(any(KnowledgeEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));
        service = new KnowledgeWriteService(knowledgeStore, embeddingPort, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreateActiveSiteEntryWithEmbedding() {
        when(embeddingPort.isAvailable()).thenReturn(true);
        when(embeddingPort.embed(anyString())).thenReturn(CompletableFuture.completedFuture(new float[] { 0.5f }));

        KnowledgeEntry entry = service.createSiteEntry(draft("site-sinai", "  Nurse call on day 3  "));

        assertTrue(entry.getId().startsWith("kb-"));
        assertEquals(KnowledgeTier.SITE, entry.getTier());
        assertEquals(KnowledgeStatus.ACTIVE, entry.getStatus());
        assertEquals("Nurse call on day 3", entry.getContent());
        assertEquals(NOW, entry.getCreatedAt());
        assertEquals(NOW, entry.getLastValidatedAt());
        assertEquals(List.of("glp1"), entry.getTags());
        assertArrayEquals(new float[] { 0.5f }, entry.getEmbedding());
        verify(knowledgeStore).saveEntry(entry);
    }

    @Test
    void shouldSaveWithoutVectorWhenEmbeddingFails() {
        when(embeddingPort.isAvailable()).thenReturn(true);
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));

        KnowledgeEntry entry = service.createSiteEntry(draft("site-sinai", "Evening slots help"));

        assertNull(entry.getEmbedding());
        verify(knowledgeStore).saveEntry(entry);
    }

    @Test
    void shouldSkipEmbeddingWhenVectorSearchDisabled() {
        properties.getKnowledge().setVectorSearchEnabled(false);

        KnowledgeEntry entry = service.createSiteEntry(draft("site-sinai", "Evening slots help"));

        assertNull(entry.getEmbedding());
        verify(embeddingPort, never()).embed(anyString());
    }

    @Test
    void shouldRequireSiteAndContent() {
        assertThrows(IllegalArgumentException.class, () -> service.createSiteEntry(draft(" ", "content")));
        assertThrows(IllegalArgumentException.class, () -> service.createSiteEntry(draft("site-sinai", "")));
        verify(knowledgeStore, never()).saveEntry(any());
    }

    private static KnowledgeWriteService.SiteEntryDraft draft(String siteId, String content) {
        return KnowledgeWriteService.SiteEntryDraft.builder()
                .siteId(siteId)
                .category("retention_strategy")
                .content(content)
                .source("CRC Angela Torres")
                .tags(List.of("glp1"))
                .build();
    }
}
