package me.golemcore.cadence.infrastructure.config;

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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.cadence.domain.model.KnowledgeTier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the coordinator assistant, bound
 * from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code cadence.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model providers, timeouts, retry and pricing</li>
 * <li>{@link PlannerProperties} - planning call and history bounds</li>
 * <li>{@link ResponseProperties} - reply synthesis</li>
 * <li>{@link KnowledgeProperties} - tier weights, boosts and staleness</li>
 * <li>{@link ResolverProperties} - patient matching confidences and
 * keywords</li>
 * <li>{@link PatternProperties} - suggestion thresholds</li>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link EmbeddingProperties} - embedding model</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "cadence")
@Data
public class CadenceProperties {

    private LlmProperties llm = new LlmProperties();
    private PlannerProperties planner = new PlannerProperties();
    private SessionProperties sessions = new SessionProperties();
    private ResponseProperties response = new ResponseProperties();
    private KnowledgeProperties knowledge = new KnowledgeProperties();
    private ResolverProperties resolver = new ResolverProperties();
    private PatternProperties patterns = new PatternProperties();
    private StorageProperties storage = new StorageProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();

    @Data
    public static class LlmProperties {
        private String model = "openai/gpt-4o";
        private long timeoutMs = 60_000;
        private int maxRetries = 5;
        private long initialBackoffMs = 5_000;
        private double backoffMultiplier = 2.0;
        private Map<String, ProviderProperties> providers = new HashMap<>();
        private Map<String, ModelPricing> pricing = defaultPricing();

        private static Map<String, ModelPricing> defaultPricing() {
            Map<String, ModelPricing> pricing = new LinkedHashMap<>();
            pricing.put("gpt-4o", new ModelPricing(2.50, 10.00));
            pricing.put("gpt-4o-mini", new ModelPricing(0.15, 0.60));
            pricing.put("claude-sonnet-4-20250514", new ModelPricing(3.00, 15.00));
            pricing.put("claude-3-5-haiku-20241022", new ModelPricing(0.80, 4.00));
            return pricing;
        }
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    /**
     * USD per one million tokens.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelPricing {
        private double inputPerMillion;
        private double outputPerMillion;
    }

    @Data
    public static class PlannerProperties {
        private int historyLimit = 40;
        private double temperature = 0.2;
        private int maxTokens = 2048;
        private long timeoutSeconds = 90;
        private String promptResource = "prompts/planner-system.md";
        private List<String> trials = new ArrayList<>();
        private List<String> sites = new ArrayList<>();
    }

    @Data
    public static class SessionProperties {
        private long idleTimeoutMinutes = 120;
        private long evictionIntervalMinutes = 10;
    }

    @Data
    public static class ResponseProperties {
        private double temperature = 0.3;
        private int maxTokens = 1024;
        private long timeoutSeconds = 60;
        private int summaryItemLimit = 5;
        private int listDisplayLimit = 10;
    }

    @Data
    public static class KnowledgeProperties {
        private double tier1Weight = 1.0;
        private double tier2Weight = 1.5;
        private double tier3Weight = 1.3;
        private double siteBoost = 0.3;
        private double effectivenessThreshold = 0.7;
        private double effectivenessBoost = 0.1;
        private double confidenceThreshold = 0.85;
        private double confidenceBoost = 0.1;
        private int defaultLimit = 10;
        private int tier1StaleDays = 365;
        private int tier2StaleDays = 90;
        private int tier3StaleDays = 180;
        private boolean vectorSearchEnabled = true;
        private double minSimilarity = 0.0;
        private long embeddingTimeoutSeconds = 30;
        private String seedResource = "knowledge/seed-entries.json";

        public double weightFor(KnowledgeTier tier) {
            return switch (tier) {
            case FOUNDATIONAL -> tier1Weight;
            case SITE -> tier2Weight;
            case CROSS_SITE -> tier3Weight;
            };
        }

        public int staleDaysFor(KnowledgeTier tier) {
            return switch (tier) {
            case FOUNDATIONAL -> tier1StaleDays;
            case SITE -> tier2StaleDays;
            case CROSS_SITE -> tier3StaleDays;
            };
        }
    }

    @Data
    public static class ResolverProperties {
        private int maxCandidates = 5;
        private double exactIdConfidence = 1.0;
        private double partialIdSingleConfidence = 0.95;
        private double partialIdMultipleConfidence = 0.90;
        private double fullNameConfidence = 0.95;
        private double firstLastConfidence = 0.90;
        private double lastNameConfidence = 0.85;
        private double firstNameConfidence = 0.75;
        private double prefixConfidence = 0.65;
        private double singleNameMinConfidence = 0.70;
        private double highRiskThreshold = 0.7;
        private int contextNarrowMaxCandidates = 3;
        private double contextNarrowConfidence = 0.70;
        private double contextBroadConfidence = 0.55;
        private double contextSingleMinConfidence = 0.60;
        private Map<String, String> trialKeywords = defaultTrialKeywords();
        private List<String> symptomKeywords = new ArrayList<>(List.of("nausea", "side effect"));

        private static Map<String, String> defaultTrialKeywords() {
            Map<String, String> keywords = new LinkedHashMap<>();
            keywords.put("nash", "NCT05891234");
            keywords.put("alzheimer", "NCT06234567");
            keywords.put("alzheimers", "NCT06234567");
            keywords.put("beacon", "NCT06234567");
            keywords.put("glp1", "NCT06789012");
            keywords.put("glp-1", "NCT06789012");
            keywords.put("cardio", "NCT06789012");
            keywords.put("heart failure", "NCT06789012");
            keywords.put("obesity", "NCT06789012");
            return keywords;
        }
    }

    @Data
    public static class PatternProperties {
        private int minSampleSize = 3;
        private double minSuccessRate = 0.7;
        private double benchmarkConfidence = 0.9;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.cadence/workspace";
    }

    @Data
    public static class EmbeddingProperties {
        private boolean enabled = true;
        private String provider = "openai";
        private String model = "text-embedding-3-small";
        private int dimension = 1536;
        private int batchSize = 100;
    }
}
