package me.golemcore.runtime.adapter.outbound.llm;

import me.golemcore.runtime.domain.model.ImageBlock;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ProviderRequest;
import me.golemcore.runtime.domain.model.StopReason;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.domain.model.ToolDescriptor;
import me.golemcore.runtime.domain.model.ToolResultBlock;
import me.golemcore.runtime.domain.model.ToolUseBlock;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleBackendTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer mockServer;
    private OpenAiCompatibleBackend backend;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        RuntimeProperties.ProviderProperties provider = new RuntimeProperties.ProviderProperties();
        provider.setType(ProviderAdapterFactory.OPENAI_COMPATIBLE);
        provider.setModel("gpt-4o-mini");
        provider.setApiKey("test-key");
        provider.setMaxTokens(1024);
        String baseUrl = mockServer.url("/v1").toString();
        provider.setBaseUrl(baseUrl);

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(1, TimeUnit.SECONDS)
                .build();
        backend = new OpenAiCompatibleBackend(provider, new RuntimeProperties.HttpProperties(),
                new FeignClientFactory(client, objectMapper), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void shouldParseTextReplyWithCachedUsage() {
        mockServer.enqueue(json("{\"id\":\"c1\",\"model\":\"gpt-4o-mini-2024\",\"choices\":[{\"index\":0,"
                + "\"message\":{\"role\":\"assistant\",\"content\":\"Done.\"},\"finish_reason\":\"stop\"}],"
                + "\"usage\":{\"prompt_tokens\":100,\"completion_tokens\":20,\"total_tokens\":120,"
                + "\"prompt_tokens_details\":{\"cached_tokens\":40}}}"));

        ProviderResult<ProviderBackend.Reply> result = backend.send(simpleRequest(), TIMEOUT);

        assertTrue(result.isSuccess());
        ProviderBackend.Reply reply = result.getValue();
        assertEquals("Done.", reply.text());
        assertEquals("stop", reply.finishReason());
        assertEquals(60, reply.inputTokens());
        assertEquals(20, reply.outputTokens());
        assertEquals(40, reply.cachedTokens());
        assertEquals("gpt-4o-mini-2024", reply.model());
        assertTrue(reply.toolCalls().isEmpty());
    }

    @Test
    void shouldSendChatCompletionsEnvelope() throws Exception {
        mockServer.enqueue(json("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"ok\"},"
                + "\"finish_reason\":\"stop\"}]}"));

        ProviderRequest request = ProviderRequest.builder()
                .systemPrompt("You are terse.")
                .message(Message.user("List the files"))
                .message(Message.assistant(List.of(new ToolUseBlock("call_1", "bash", Map.of("command", "ls"))),
                        null, StopReason.TOOL_USE))
                .message(Message.toolResult(ToolResultBlock.text("call_1", "a.txt\nb.txt", false)))
                .tool(ToolDescriptor.builder()
                        .name("bash")
                        .description("Run a shell command")
                        .inputSchema(Map.of("type", "object"))
                        .build())
                .build();

        assertTrue(backend.send(request, TIMEOUT).isSuccess());

        RecordedRequest recorded = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("POST", recorded.getMethod());
        assertEquals("/v1/chat/completions", recorded.getPath());
        assertEquals("Bearer test-key", recorded.getHeader("Authorization"));

        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertEquals("gpt-4o-mini", body.get("model").asText());
        assertEquals(1024, body.get("max_tokens").asInt());
        JsonNode messages = body.get("messages");
        assertEquals(4, messages.size());
        assertEquals("system", messages.get(0).get("role").asText());
        assertEquals("user", messages.get(1).get("role").asText());
        assertEquals("List the files", messages.get(1).get("content").asText());
        assertEquals("assistant", messages.get(2).get("role").asText());
        assertFalse(messages.get(2).has("content"));
        JsonNode call = messages.get(2).get("tool_calls").get(0);
        assertEquals("call_1", call.get("id").asText());
        assertEquals("{\"command\":\"ls\"}", call.get("function").get("arguments").asText());
        assertEquals("tool", messages.get(3).get("role").asText());
        assertEquals("call_1", messages.get(3).get("tool_call_id").asText());
        assertEquals("a.txt\nb.txt", messages.get(3).get("content").asText());
        assertEquals("bash", body.get("tools").get(0).get("function").get("name").asText());
        assertEquals("function", body.get("tools").get(0).get("type").asText());
    }

    @Test
    void shouldReturnRawToolArgumentsInBothShapes() {
        mockServer.enqueue(json("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":null,"
                + "\"tool_calls\":["
                + "{\"id\":\"call_a\",\"type\":\"function\",\"function\":{\"name\":\"bash\","
                + "\"arguments\":\"{\\\"command\\\": \\\"ls\\\"}\"}},"
                + "{\"id\":\"call_b\",\"type\":\"function\",\"function\":{\"name\":\"glob\","
                + "\"arguments\":{\"pattern\":\"*.java\"}}}]},"
                + "\"finish_reason\":\"tool_calls\"}]}"));

        ProviderBackend.Reply reply = backend.send(simpleRequest(), TIMEOUT).getValue();

        assertNull(reply.text());
        assertEquals(2, reply.toolCalls().size());
        assertEquals("{\"command\": \"ls\"}", reply.toolCalls().get(0).arguments());
        assertEquals("{\"pattern\":\"*.java\"}", reply.toolCalls().get(1).arguments());
        assertEquals("glob", reply.toolCalls().get(1).name());
        assertEquals("tool_calls", reply.finishReason());
    }

    @Test
    void shouldSendImagesAsContentParts() throws Exception {
        mockServer.enqueue(json("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"a cat\"}}]}"));
        ProviderRequest request = ProviderRequest.builder()
                .message(Message.user(List.of(new TextBlock("What is this?"),
                        new ImageBlock("image/png", "iVBORw0KGgo="))))
                .build();

        backend.send(request, TIMEOUT);

        JsonNode body = objectMapper.readTree(mockServer.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8());
        JsonNode parts = body.get("messages").get(0).get("content");
        assertTrue(parts.isArray());
        assertEquals("text", parts.get(0).get("type").asText());
        assertEquals("data:image/png;base64,iVBORw0KGgo=", parts.get(1).get("image_url").get("url").asText());
    }

    @Test
    void shouldClassifyRateLimitWithRetryAfter() {
        mockServer.enqueue(new MockResponse()
                .setResponseCode(429)
                .addHeader("Retry-After", "2")
                .addHeader(CONTENT_TYPE, APPLICATION_JSON)
                .setBody("{\"error\":{\"message\":\"Rate limit reached\"}}"));

        ProviderResult<ProviderBackend.Reply> result = backend.send(simpleRequest(), TIMEOUT);

        assertFalse(result.isSuccess());
        assertEquals(ProviderErrorClassifier.RATE_LIMIT, result.getError().code());
        assertTrue(result.getError().isTransient());
        assertEquals(2000L, result.getError().retryAfterMs());
    }

    @Test
    void shouldClassifyAuthenticationFailureAsPermanent() {
        mockServer.enqueue(new MockResponse()
                .setResponseCode(401)
                .setBody("{\"error\":{\"message\":\"Incorrect API key provided\"}}"));

        ProviderResult<ProviderBackend.Reply> result = backend.send(simpleRequest(), TIMEOUT);

        assertEquals(ProviderErrorClassifier.AUTHENTICATION, result.getError().code());
        assertFalse(result.getError().isTransient());
    }

    @Test
    void shouldClassifyContextOverflow() {
        mockServer.enqueue(new MockResponse()
                .setResponseCode(400)
                .setBody("{\"error\":{\"code\":\"context_length_exceeded\","
                        + "\"message\":\"This model's maximum context length is 128000 tokens.\"}}"));

        ProviderResult<ProviderBackend.Reply> result = backend.send(simpleRequest(), TIMEOUT);

        assertEquals(ProviderErrorClassifier.CONTEXT_LENGTH_EXCEEDED, result.getError().code());
    }

    @Test
    void shouldTreatEmptyChoicesAsMalformed() {
        mockServer.enqueue(json("{\"choices\":[]}"));

        ProviderResult<ProviderBackend.Reply> result = backend.send(simpleRequest(), TIMEOUT);

        assertEquals(ProviderErrorClassifier.MALFORMED_RESPONSE, result.getError().code());
        assertTrue(result.getError().isTransient());
    }

    @Test
    void shouldApplyPerAttemptTimeout() {
        mockServer.enqueue(json("{\"choices\":[{\"message\":{\"content\":\"late\"}}]}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        ProviderResult<ProviderBackend.Reply> result = backend.send(simpleRequest(), Duration.ofMillis(200));

        assertFalse(result.isSuccess());
        assertEquals(ProviderErrorClassifier.TIMEOUT, result.getError().code());
        assertTrue(result.getError().isTransient());
    }

    private static ProviderRequest simpleRequest() {
        return ProviderRequest.builder()
                .message(Message.user("hello"))
                .build();
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .addHeader(CONTENT_TYPE, APPLICATION_JSON)
                .setBody(body);
    }
}
