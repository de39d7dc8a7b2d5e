package me.golemcore.glassbox.adapter.outbound.llm;

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

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ToolChoice;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.model.LlmRequest;
import me.golemcore.glassbox.domain.model.LlmResponse;
import me.golemcore.glassbox.domain.model.LlmUsage;
import me.golemcore.glassbox.domain.model.Message;
import me.golemcore.glassbox.domain.model.ToolDefinition;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM gateway backed by langchain4j. The model id's {@code provider/} prefix
 * selects the client: {@code anthropic} uses the Anthropic API, every other
 * provider (and an unprefixed id) goes through the OpenAI-compatible client.
 *
 * <p>
 * Credentials come from the request (org config) first and fall back to
 * {@code glassbox.llm.providers.<provider>.*}. Clients are cached per
 * provider, model, key and base URL, least recently used first out once
 * {@value #MAX_CACHED_MODELS} are held.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ANTHROPIC = "anthropic";
    static final String PROVIDER_OPENAI = "openai";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final double BACKOFF_MULTIPLIER = 2.0;
    static final int MAX_CACHED_MODELS = 32;

    private final AgentProperties properties;

    // Org configs bring their own keys, so the key space is open-ended.
    private final Map<ModelKey, ChatModel> models = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<ModelKey, ChatModel> eldest) {
                    return size() > MAX_CACHED_MODELS;
                }
            });

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ModelKey key = resolveModelKey(request);
            ChatModel chatModel = chatModelFor(key);

            ChatRequest.Builder chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request.getMessages()));
            List<ToolSpecification> tools = convertTools(request.getTools());
            if (!tools.isEmpty()) {
                chatRequest.toolSpecifications(tools);
                if (request.getToolChoice() == LlmRequest.ToolChoiceMode.REQUIRED) {
                    chatRequest.toolChoice(ToolChoice.REQUIRED);
                }
            }
            ChatRequest built = chatRequest.build();

            int maxRetries = Math.max(0, properties.getLlm().getRateLimitRetries());
            for (int attempt = 0;; attempt++) {
                long started = System.nanoTime();
                try {
                    log.trace("[LLM] Calling {} with {} messages, {} tools", request.getModel(),
                            built.messages().size(), tools.size());
                    ChatResponse response = chatModel.chat(built);
                    return convertResponse(response, request.getModel(),
                            Duration.ofNanos(System.nanoTime() - started));
                } catch (RuntimeException e) { // NOSONAR
                    if (!isRateLimitError(e) || attempt >= maxRetries) {
                        log.error("[LLM] Chat failed for model {}: {}", request.getModel(), e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                    long backoffMs = (long) (properties.getLlm().getRateLimitBackoffMs()
                            * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms", attempt + 1, maxRetries,
                            backoffMs);
                    sleepBeforeRetry(backoffMs);
                }
            }
        });
    }

    @Override
    public List<String> getSupportedProviders() {
        List<String> providers = new ArrayList<>(properties.getLlm().getProviders().keySet());
        providers.sort(String::compareTo);
        return providers;
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }

    // ==================== Model resolution ====================

    ModelKey resolveModelKey(LlmRequest request) {
        String model = request.getModel() != null && !request.getModel().isBlank()
                ? request.getModel()
                : properties.getLlm().getDefaultModel();
        String provider = providerOf(model);
        AgentProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);

        String apiKey = firstNonBlank(request.getApiKey(), config != null ? config.getApiKey() : null);
        if (apiKey == null) {
            throw new IllegalStateException("No API key for provider: " + provider
                    + ". Add glassbox.llm.providers." + provider + ".api-key or set it in the org config");
        }
        String baseUrl = firstNonBlank(request.getApiBase(), config != null ? config.getBaseUrl() : null);
        int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : properties.getLlm().getMaxTokens();
        return new ModelKey(provider, stripProviderPrefix(model), apiKey, baseUrl, maxTokens,
                request.getTemperature());
    }

    static String providerOf(String model) {
        int slash = model.indexOf('/');
        return slash > 0 ? model.substring(0, slash) : PROVIDER_OPENAI;
    }

    private static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }

    ChatModel chatModelFor(ModelKey key) {
        return models.computeIfAbsent(key, this::createChatModel);
    }

    int cachedModelCount() {
        return models.size();
    }

    ChatModel createChatModel(ModelKey key) {
        Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());
        log.debug("[LLM] Creating {} client for model {}", key.provider(), key.modelName());
        if (PROVIDER_ANTHROPIC.equals(key.provider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(key.apiKey())
                    .modelName(key.modelName())
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(key.maxTokens())
                    .timeout(timeout);
            if (key.baseUrl() != null) {
                builder.baseUrl(key.baseUrl());
            }
            if (key.temperature() != null) {
                builder.temperature(key.temperature());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(key.apiKey())
                .modelName(key.modelName())
                .maxRetries(0)
                .maxTokens(key.maxTokens())
                .timeout(timeout);
        if (key.baseUrl() != null) {
            builder.baseUrl(key.baseUrl());
        }
        if (key.temperature() != null) {
            builder.temperature(key.temperature());
        }
        return builder.build();
    }

    // ==================== Conversion ====================

    List<ChatMessage> convertMessages(List<Message> transcript) {
        List<ChatMessage> messages = new ArrayList<>();
        if (transcript == null) {
            return messages;
        }
        for (Message msg : transcript) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case SYSTEM -> messages.add(SystemMessage.from(content));
            case USER -> messages.add(UserMessage.from(content));
            case ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(tc.getArguments() == null || tc.getArguments().isBlank()
                                            ? "{}"
                                            : tc.getArguments())
                                    .build())
                            .toList();
                    messages.add(content.isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    content));
            default -> log.warn("[LLM] Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return List.of();
        }
        return tools.stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> props = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (props != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : props.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");
        boolean described = description != null && !description.isBlank();

        // Enum values take priority
        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        return switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            yield builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            yield builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            yield builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> {
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            yield builder.build();
        }
        };
    }

    LlmResponse convertResponse(ChatResponse response, String model, Duration latency) {
        AiMessage aiMessage = response.aiMessage();

        // Raw argument strings are kept; decoding happens at dispatch
        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(ter.arguments())
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        TokenUsage tokenUsage = response.tokenUsage();
        int in = tokenUsage != null && tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0;
        int out = tokenUsage != null && tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0;
        LlmUsage usage = LlmUsage.builder()
                .inputTokens(in)
                .outputTokens(out)
                .totalTokens(in + out)
                .latency(latency)
                .model(model)
                .build();

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    // ==================== Retry ====================

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException
            if (current instanceof RateLimitException) {
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

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    record ModelKey(String provider, String modelName, String apiKey, String baseUrl, int maxTokens,
            Double temperature) {

        @Override
        public String toString() {
            return provider + "/" + modelName;
        }
    }
}
