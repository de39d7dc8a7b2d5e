package me.golemcore.glassbox.adapter.outbound.llm;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ToolChoice;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.glassbox.domain.model.LlmRequest;
import me.golemcore.glassbox.domain.model.LlmResponse;
import me.golemcore.glassbox.domain.model.Message;
import me.golemcore.glassbox.domain.model.ToolDefinition;
import me.golemcore.glassbox.domain.tool.ToolSchemas;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String OPENAI_MODEL = "openai/gpt-4o";
    private static final String CONFIG_KEY = "sk-config";

    private AgentProperties properties;
    private ChatModel chatModel;
    private List<Langchain4jAdapter.ModelKey> createdKeys;
    private List<Long> backoffs;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getLlm().setDefaultModel(OPENAI_MODEL);
        properties.getLlm().setRateLimitBackoffMs(100);
        AgentProperties.ProviderProperties openai = new AgentProperties.ProviderProperties();
        openai.setApiKey(CONFIG_KEY);
        properties.getLlm().getProviders().put("openai", openai);

        chatModel = mock(ChatModel.class);
        createdKeys = new ArrayList<>();
        backoffs = new ArrayList<>();
        adapter = new Langchain4jAdapter(properties) {
            @Override
            ChatModel createChatModel(ModelKey key) {
                createdKeys.add(key);
                return chatModel;
            }

            @Override
            protected void sleepBeforeRetry(long backoffMs) {
                backoffs.add(backoffMs);
            }
        };
    }

    // ===== Provider info =====

    @Test
    void shouldReportProviderIdAndConfiguredProviders() {
        AgentProperties.ProviderProperties anthropic = new AgentProperties.ProviderProperties();
        properties.getLlm().getProviders().put("anthropic", anthropic);

        assertEquals("langchain4j", adapter.getProviderId());
        assertEquals(List.of("anthropic", "openai"), adapter.getSupportedProviders());
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldBeUnavailableWithoutAnyKey() {
        properties.getLlm().getProviders().clear();

        assertFalse(adapter.isAvailable());
    }

    // ===== Model resolution =====

    @Test
    void shouldSplitProviderPrefix() {
        Langchain4jAdapter.ModelKey key = adapter.resolveModelKey(request("openai/gpt-4o-mini"));

        assertEquals("openai", key.provider());
        assertEquals("gpt-4o-mini", key.modelName());
        assertEquals(CONFIG_KEY, key.apiKey());
        assertEquals(4096, key.maxTokens());
    }

    @Test
    void shouldTreatUnprefixedModelAsOpenAi() {
        assertEquals("openai", Langchain4jAdapter.providerOf("gpt-4o"));
        assertEquals("anthropic", Langchain4jAdapter.providerOf("anthropic/claude-sonnet-4-20250514"));
    }

    @Test
    void shouldFallBackToDefaultModel() {
        assertEquals("gpt-4o", adapter.resolveModelKey(request(null)).modelName());
    }

    @Test
    void shouldPreferRequestCredentials() {
        LlmRequest request = LlmRequest.builder()
                .model("anthropic/claude-3-5-haiku")
                .apiKey("sk-org")
                .apiBase("https://gateway.example.com")
                .maxTokens(1024)
                .temperature(0.2)
                .build();

        Langchain4jAdapter.ModelKey key = adapter.resolveModelKey(request);

        assertEquals("anthropic", key.provider());
        assertEquals("sk-org", key.apiKey());
        assertEquals("https://gateway.example.com", key.baseUrl());
        assertEquals(1024, key.maxTokens());
        assertEquals(0.2, key.temperature());
        assertEquals("anthropic/claude-3-5-haiku", key.toString());
    }

    @Test
    void shouldFailWithoutApiKey() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> adapter.resolveModelKey(request("anthropic/claude-3-5-haiku")));

        assertTrue(error.getMessage().startsWith("No API key for provider: anthropic"));
    }

    // ===== Chat =====

    @Test
    void shouldConvertTextResponse() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Hello back!"))
                .tokenUsage(new TokenUsage(10, 5))
                .finishReason(FinishReason.STOP)
                .build());

        LlmResponse response = adapter.chat(request(OPENAI_MODEL)).get();

        assertEquals("Hello back!", response.getContent());
        assertFalse(response.hasToolCalls());
        assertEquals("STOP", response.getFinishReason());
        assertEquals(10, response.getUsage().getInputTokens());
        assertEquals(5, response.getUsage().getOutputTokens());
        assertEquals(15, response.getUsage().getTotalTokens());
        assertEquals(OPENAI_MODEL, response.getModel());
    }

    @Test
    void shouldCacheClientPerModelKey() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build());

        adapter.chat(request(OPENAI_MODEL)).get();
        adapter.chat(request(OPENAI_MODEL)).get();
        adapter.chat(request("openai/gpt-4o-mini")).get();

        assertEquals(2, createdKeys.size());
    }

    @Test
    void shouldEvictLeastRecentlyUsedClientsBeyondCacheLimit() {
        Langchain4jAdapter.ModelKey first = orgKey(0);
        adapter.chatModelFor(first);
        for (int i = 1; i < 100; i++) {
            adapter.chatModelFor(orgKey(i));
            adapter.chatModelFor(first);
        }

        assertEquals(Langchain4jAdapter.MAX_CACHED_MODELS, adapter.cachedModelCount());
        assertEquals(100, createdKeys.size());

        // still cached because it was touched on every round
        adapter.chatModelFor(first);
        assertEquals(100, createdKeys.size());

        // pushed out long ago
        adapter.chatModelFor(orgKey(1));
        assertEquals(101, createdKeys.size());
    }

    @Test
    void shouldSendToolsWithoutForcingChoiceByDefault() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build());
        LlmRequest request = LlmRequest.builder()
                .model(OPENAI_MODEL)
                .messages(List.of(Message.user("Hi")))
                .tools(List.of(markCompleteDefinition()))
                .build();

        adapter.chat(request).get();

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(1, captor.getValue().toolSpecifications().size());
        assertNull(captor.getValue().toolChoice());
    }

    @Test
    void shouldForceToolChoiceWhenRequired() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build());
        LlmRequest request = LlmRequest.builder()
                .model(OPENAI_MODEL)
                .messages(List.of(Message.user("Hi")))
                .tools(List.of(markCompleteDefinition()))
                .toolChoice(LlmRequest.ToolChoiceMode.REQUIRED)
                .build();

        adapter.chat(request).get();

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(ToolChoice.REQUIRED, captor.getValue().toolChoice());
    }

    @Test
    void shouldRetryRateLimitWithExponentialBackoff() throws Exception {
        properties.getLlm().setRateLimitRetries(2);
        when(chatModel.chat(any(ChatRequest.class)))
                .thenThrow(new RateLimitException("slow down"))
                .thenThrow(new RuntimeException("HTTP 429 Too Many Requests"))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("finally")).build());

        LlmResponse response = adapter.chat(request(OPENAI_MODEL)).get();

        assertEquals("finally", response.getContent());
        assertEquals(List.of(100L, 200L), backoffs);
        verify(chatModel, times(3)).chat(any(ChatRequest.class));
    }

    @Test
    void shouldGiveUpAfterRetryBudget() {
        properties.getLlm().setRateLimitRetries(1);
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RateLimitException("slow down"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(request(OPENAI_MODEL)).get());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(1, backoffs.size());
    }

    @Test
    void shouldNotRetryOtherErrors() {
        properties.getLlm().setRateLimitRetries(3);
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("Connection refused"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(request(OPENAI_MODEL)).get());

        assertEquals("LLM chat failed: Connection refused", error.getCause().getMessage());
        assertTrue(backoffs.isEmpty());
    }

    @Test
    void shouldDetectRateLimitInCauseChain() {
        assertTrue(Langchain4jAdapter.isRateLimitError(new RuntimeException("wrapped",
                new RuntimeException("rate_limit_exceeded"))));
        assertFalse(Langchain4jAdapter.isRateLimitError(new RuntimeException((String) null)));
    }

    // ===== Conversion =====

    @Test
    void shouldConvertTranscript() {
        List<Message> transcript = List.of(
                Message.system("sys"),
                Message.user("go"),
                Message.assistant("thinking", List.of(Message.ToolCall.builder()
                        .id("call_1").name("mark_complete").arguments("{\"summary\":\"x\"}").build())),
                Message.toolResult("call_1", "mark_complete", "ok"));

        List<ChatMessage> messages = adapter.convertMessages(transcript);

        assertEquals(4, messages.size());
        assertEquals("sys", ((SystemMessage) messages.get(0)).text());
        assertEquals("go", ((UserMessage) messages.get(1)).singleText());
        AiMessage assistant = (AiMessage) messages.get(2);
        assertEquals("thinking", assistant.text());
        assertEquals("call_1", assistant.toolExecutionRequests().get(0).id());
        ToolExecutionResultMessage toolResult = (ToolExecutionResultMessage) messages.get(3);
        assertEquals("call_1", toolResult.id());
        assertEquals("mark_complete", toolResult.toolName());
        assertEquals("ok", toolResult.text());
    }

    @Test
    void shouldSendEmptyObjectForBlankArguments() {
        List<ChatMessage> messages = adapter.convertMessages(List.of(Message.assistant(null, List.of(
                Message.ToolCall.builder().id("call_1").name("mark_complete").arguments("").build()))));

        AiMessage assistant = (AiMessage) messages.get(0);
        assertNull(assistant.text());
        assertEquals("{}", assistant.toolExecutionRequests().get(0).arguments());
    }

    @Test
    void shouldConvertSchemaTypes() {
        ToolDefinition definition = ToolDefinition.builder()
                .name("request_human_input")
                .description("Ask")
                .inputSchema(ToolSchemas.object(ToolSchemas.properties(
                        "question", ToolSchemas.string("The question"),
                        "mode", ToolSchemas.enumString(List.of("a", "b"), "Mode"),
                        "options", ToolSchemas.stringArray("Options")), List.of("question")))
                .build();

        ToolSpecification specification = adapter.convertToolDefinition(definition);

        JsonObjectSchema parameters = specification.parameters();
        assertEquals("request_human_input", specification.name());
        assertEquals(List.of("question"), parameters.required());
        assertInstanceOf(JsonStringSchema.class, parameters.properties().get("question"));
        assertEquals(List.of("a", "b"), ((JsonEnumSchema) parameters.properties().get("mode")).enumValues());
        JsonArraySchema options = (JsonArraySchema) parameters.properties().get("options");
        assertInstanceOf(JsonStringSchema.class, options.items());
    }

    @Test
    void shouldKeepRawToolArgumentsAndTolerateMissingUsage() {
        ChatResponse response = ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call_1").name("add_output").arguments("{\"type\": \"te").build())))
                .build();

        LlmResponse converted = adapter.convertResponse(response, OPENAI_MODEL, Duration.ofMillis(42));

        assertTrue(converted.hasToolCalls());
        assertEquals("{\"type\": \"te", converted.getToolCalls().get(0).getArguments());
        assertEquals(0, converted.getUsage().getInputTokens());
        assertEquals(Duration.ofMillis(42), converted.getUsage().getLatency());
        assertEquals("stop", converted.getFinishReason());
    }

    private static LlmRequest request(String model) {
        return LlmRequest.builder()
                .model(model)
                .messages(List.of(Message.user("Hi")))
                .build();
    }

    private static Langchain4jAdapter.ModelKey orgKey(int org) {
        return new Langchain4jAdapter.ModelKey("openai", "gpt-4o", "sk-org-" + org, null, 4096, null);
    }

    private static ToolDefinition markCompleteDefinition() {
        return ToolDefinition.builder()
                .name("mark_complete")
                .description("Mark this node as complete")
                .inputSchema(ToolSchemas.object(ToolSchemas.properties(
                        "summary", ToolSchemas.string("Summary")), List.of("summary")))
                .build();
    }
}
