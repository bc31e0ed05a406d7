package me.golemcore.cadence.adapter.outbound.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.ActionRequest;
import me.golemcore.cadence.domain.model.ActionResult;
import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.KnowledgeQuery;
import me.golemcore.cadence.domain.model.KnowledgeSuggestion;
import me.golemcore.cadence.domain.model.KnowledgeTier;
import me.golemcore.cadence.domain.model.ScoredKnowledgeEntry;
import me.golemcore.cadence.domain.service.CrossSiteInsightService;
import me.golemcore.cadence.domain.service.KnowledgeLifecycleService;
import me.golemcore.cadence.domain.service.KnowledgeRetrievalService;
import me.golemcore.cadence.domain.service.KnowledgeWriteService;
import me.golemcore.cadence.domain.service.PatternDetectionService;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Knowledge base actions. Every entry returned by a search counts as a
 * reference for lifecycle tracking. Listing suggestions first re-runs pattern
 * detection and refreshes the cross-site benchmark.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class KnowledgeActions {

    private static final int SEARCH_LIMIT = 8;

    private final KnowledgeRetrievalService retrievalService;
    private final KnowledgeLifecycleService lifecycleService;
    private final KnowledgeWriteService writeService;
    private final PatternDetectionService patternDetectionService;
    private final CrossSiteInsightService crossSiteInsightService;

    ActionResult searchKnowledge(ActionRequest request) {
        KnowledgeQuery query = KnowledgeQuery.builder()
                .query(request.requireString("query"))
                .siteId(request.optionalString("site_id").orElse(null))
                .limit(SEARCH_LIMIT)
                .build();
        return searchResult(query);
    }

    ActionResult searchKnowledgeGraph(ActionRequest request) {
        Integer tier = request.optionalInteger("tier");
        KnowledgeQuery query = KnowledgeQuery.builder()
                .query(request.optionalString("query").orElse(null))
                .siteId(request.optionalString("site_id").orElse(null))
                .tier(tier != null ? KnowledgeTier.fromLevel(tier) : null)
                .category(request.optionalString("category").orElse(null))
                .limit(request.optionalInteger("limit"))
                .build();
        return searchResult(query);
    }

    private ActionResult searchResult(KnowledgeQuery query) {
        List<ScoredKnowledgeEntry> results = retrievalService.search(query);
        lifecycleService.trackReferences(results.stream().map(result -> result.getEntry().getId()).toList());
        String summary = query.isBrowse()
                ? "Listed " + results.size() + " knowledge entries."
                : "Found " + results.size() + " knowledge entries for '" + query.getQuery() + "'.";
        return ActionResult.success(summary, results);
    }

    ActionResult addSiteKnowledge(ActionRequest request) {
        KnowledgeEntry entry = writeService.createSiteEntry(KnowledgeWriteService.SiteEntryDraft.builder()
                .siteId(request.requireString("site_id"))
                .category(request.requireString("category"))
                .content(request.requireString("content"))
                .source(request.requireString("source"))
                .author(request.optionalString("author").orElse(null))
                .trialId(request.optionalString("trial_id").orElse(null))
                .tags(request.stringListParameter("tags"))
                .build());
        log.info("[Actions] Added site knowledge {} for {}", entry.getId(), entry.getSiteId());
        return ActionResult.success("Saved site knowledge (" + entry.getCategory() + ") for "
                + entry.getSiteId() + ".", entry);
    }

    ActionResult getKnowledgeSuggestions(ActionRequest request) {
        List<KnowledgeSuggestion> detected = patternDetectionService.detectPatterns();
        crossSiteInsightService.refreshBenchmark();
        if (!detected.isEmpty()) {
            log.info("[Actions] Pattern detection produced {} new suggestion(s)", detected.size());
        }
        List<KnowledgeSuggestion> suggestions = patternDetectionService.getSuggestions(
                request.optionalString("site_id").orElse(null));
        return ActionResult.success(suggestions.size() + " knowledge suggestion(s) awaiting review.", suggestions);
    }
}
