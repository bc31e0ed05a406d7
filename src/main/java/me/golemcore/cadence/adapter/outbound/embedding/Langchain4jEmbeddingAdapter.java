package me.golemcore.cadence.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Embedding adapter using langchain4j and OpenAI.
 *
 * <p>
 * Default model: text-embedding-3-small (1536 dimensions). Vectors are cached
 * by content hash so repeated texts are embedded once; batch requests are
 * split into chunks of {@code cadence.embedding.batch-size}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code cadence.llm.providers.openai.api-key} - OpenAI API key
 * <li>{@code cadence.embedding.model} - Embedding model name
 * </ul>
 *
 * @see me.golemcore.cadence.port.outbound.EmbeddingPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final int MAX_CACHE_ENTRIES = 5_000;

    private final CadenceProperties properties;

    private final Map<String, float[]> cache = new ConcurrentHashMap<>();
    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        CadenceProperties.EmbeddingProperties config = properties.getEmbedding();
        if (!config.isEnabled()) {
            log.info("[Embedding] Disabled by configuration");
            initialized = true;
            return;
        }

        var providerConfig = properties.getLlm().getProviders().get(config.getProvider());
        String apiKey = providerConfig != null ? providerConfig.getApiKey() : null;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Embedding] API key for provider '{}' not configured, embedding service unavailable",
                    config.getProvider());
            initialized = true;
            return;
        }

        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(config.getModel());
            if (providerConfig.getBaseUrl() != null) {
                builder.baseUrl(providerConfig.getBaseUrl());
            }
            embeddingModel = builder.build();
            log.info("[Embedding] Model initialized: {}", config.getModel());
        } catch (RuntimeException e) {
            log.error("[Embedding] Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            String key = cacheKey(text);
            float[] cached = cache.get(key);
            if (cached != null) {
                return cached;
            }
            EmbeddingModel model = requireModel();
            Response<Embedding> response = model.embed(text);
            float[] vector = response.content().vector();
            remember(key, vector);
            return vector;
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            float[][] vectors = new float[texts.size()][];
            List<Integer> missing = new ArrayList<>();
            for (int i = 0; i < texts.size(); i++) {
                float[] cached = cache.get(cacheKey(texts.get(i)));
                if (cached != null) {
                    vectors[i] = cached;
                } else {
                    missing.add(i);
                }
            }

            if (!missing.isEmpty()) {
                EmbeddingModel model = requireModel();
                int batchSize = Math.max(1, properties.getEmbedding().getBatchSize());
                for (int start = 0; start < missing.size(); start += batchSize) {
                    List<Integer> chunk = missing.subList(start, Math.min(start + batchSize, missing.size()));
                    List<TextSegment> segments = chunk.stream()
                            .map(index -> TextSegment.from(texts.get(index)))
                            .toList();
                    Response<List<Embedding>> response = model.embedAll(segments);
                    List<Embedding> embeddings = response.content();
                    for (int j = 0; j < chunk.size(); j++) {
                        int index = chunk.get(j);
                        float[] vector = embeddings.get(j).vector();
                        vectors[index] = vector;
                        remember(cacheKey(texts.get(index)), vector);
                    }
                }
                log.debug("[Embedding] Embedded {} texts ({} from cache)", missing.size(),
                        texts.size() - missing.size());
            }
            return List.of(vectors);
        });
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimension();
    }

    @Override
    public String getModel() {
        return properties.getEmbedding().getModel();
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        if (embeddingModel == null) {
            throw new IllegalStateException("Embedding model not available");
        }
        return embeddingModel;
    }

    private void remember(String key, float[] vector) {
        if (cache.size() >= MAX_CACHE_ENTRIES) {
            cache.clear();
        }
        cache.put(key, vector);
    }

    private static String cacheKey(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
