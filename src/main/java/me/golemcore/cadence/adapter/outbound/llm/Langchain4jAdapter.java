package me.golemcore.cadence.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.ConversationTurn;
import me.golemcore.cadence.domain.model.LlmRequest;
import me.golemcore.cadence.domain.model.LlmResponse;
import me.golemcore.cadence.domain.model.LlmUsage;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.LlmPort;
import me.golemcore.cadence.usage.LlmUsageTracker;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Language-model adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible endpoint
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * Models are addressed as {@code provider/model} (for example
 * {@code anthropic/claude-sonnet-4-20250514}); a bare model name uses the
 * OpenAI provider. Rate-limit errors are retried with bounded exponential
 * backoff; every other failure completes the future exceptionally. Each
 * completed call is priced from {@code cadence.llm.pricing} and recorded with
 * the usage tracker.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";

    private final CadenceProperties properties;
    private final LlmUsageTracker usageTracker;
    private final Clock clock;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null ? request.getModel() : getCurrentModel();
            ChatModel chatModel = models.computeIfAbsent(model, this::createModel);
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request))
                    .temperature(request.getTemperature())
                    .maxOutputTokens(request.getMaxTokens())
                    .build();

            CadenceProperties.LlmProperties llm = properties.getLlm();
            int maxRetries = llm.getMaxRetries();
            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                Instant started = clock.instant();
                try {
                    ChatResponse response = chatModel.chat(chatRequest);
                    Duration latency = Duration.between(started, clock.instant());
                    return convertResponse(response, model, latency, request);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = (long) (llm.getInitialBackoffMs()
                                * Math.pow(llm.getBackoffMultiplier(), attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms",
                                attempt + 1, maxRetries, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed for model {}: {}", model, e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        CadenceProperties.ProviderProperties config = properties.getLlm().getProviders()
                .get(getProvider(getCurrentModel()));
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    /**
     * Estimated USD cost of a call from the configured per-million-token
     * pricing. Unknown models cost zero.
     */
    double estimateCost(String model, int inputTokens, int outputTokens) {
        CadenceProperties.ModelPricing pricing = properties.getLlm().getPricing().get(stripProviderPrefix(model));
        if (pricing == null) {
            return 0.0;
        }
        return (inputTokens * pricing.getInputPerMillion() + outputTokens * pricing.getOutputPerMillion())
                / 1_000_000.0;
    }

    private ChatModel createModel(String model) {
        String provider = getProvider(model);
        CadenceProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add cadence.llm.providers." + provider + ".api-key");
        }
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            log.info("[LLM] Created Anthropic model: {}", modelName);
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        log.info("[LLM] Created OpenAI-compatible model: {} ({})", modelName, provider);
        return builder.build();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (ConversationTurn turn : request.getMessages()) {
            if (turn.isUser()) {
                messages.add(UserMessage.from(turn.getContent()));
            } else {
                messages.add(AiMessage.from(turn.getContent()));
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String model, Duration latency,
            LlmRequest request) {
        TokenUsage tokenUsage = response.tokenUsage();
        int inputTokens = tokenUsage != null && tokenUsage.inputTokenCount() != null
                ? tokenUsage.inputTokenCount()
                : 0;
        int outputTokens = tokenUsage != null && tokenUsage.outputTokenCount() != null
                ? tokenUsage.outputTokenCount()
                : 0;

        LlmUsage usage = LlmUsage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(inputTokens + outputTokens)
                .latency(latency)
                .costUsd(estimateCost(model, inputTokens, outputTokens))
                .timestamp(clock.instant())
                .sessionId(request.getSessionId())
                .model(model)
                .purpose(request.getPurpose())
                .build();
        usageTracker.recordUsage(usage);

        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .usage(usage)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                .build();
    }

    private String getProvider(String model) {
        return model.contains("/") ? model.substring(0, model.indexOf('/')) : PROVIDER_OPENAI;
    }

    private String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }
}
