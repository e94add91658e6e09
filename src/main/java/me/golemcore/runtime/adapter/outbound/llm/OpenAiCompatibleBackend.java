package me.golemcore.runtime.adapter.outbound.llm;

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

import me.golemcore.runtime.domain.model.ContentBlock;
import me.golemcore.runtime.domain.model.DocumentBlock;
import me.golemcore.runtime.domain.model.ImageBlock;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ProviderError;
import me.golemcore.runtime.domain.model.ProviderRequest;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.domain.model.ToolDescriptor;
import me.golemcore.runtime.domain.model.ToolResultBlock;
import me.golemcore.runtime.domain.model.ToolUseBlock;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Headers;
import feign.Param;
import feign.Request;
import feign.RequestLine;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI-style {@code /chat/completions} backend over Feign and OkHttp.
 *
 * <p>
 * Works with any server that speaks the chat completions dialect. Tool results
 * become {@code tool} role messages, images become {@code image_url} parts
 * with a data URL. Cached prompt tokens are read from
 * {@code usage.prompt_tokens_details.cached_tokens} when the server reports
 * them.
 */
@Slf4j
public class OpenAiCompatibleBackend implements ProviderBackend {

    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private final RuntimeProperties.ProviderProperties properties;
    private final RuntimeProperties.HttpProperties httpProperties;
    private final FeignClientFactory feignClientFactory;
    private final ObjectMapper objectMapper;

    private volatile ChatCompletionsApi client;

    public OpenAiCompatibleBackend(RuntimeProperties.ProviderProperties properties,
            RuntimeProperties.HttpProperties httpProperties, FeignClientFactory feignClientFactory,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpProperties = httpProperties;
        this.feignClientFactory = feignClientFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getBackendId() {
        return ProviderAdapterFactory.OPENAI_COMPATIBLE;
    }

    @Override
    public String getModel() {
        return properties.getModel();
    }

    @Override
    public ProviderResult<Reply> send(ProviderRequest request, Duration timeout) {
        try {
            Request.Options options = new Request.Options(
                    httpProperties.getConnectTimeout(), TimeUnit.MILLISECONDS,
                    timeout.toMillis(), TimeUnit.MILLISECONDS, true);
            ChatCompletionResponse response = client().chatCompletion(properties.getApiKey(),
                    buildRequest(request), options);
            return toReply(response);
        } catch (RuntimeException e) {
            ProviderError error = ProviderErrorClassifier.classify(e);
            log.debug("[OpenAiCompatible] Call failed: {}", error.describe());
            return ProviderResult.failure(error);
        }
    }

    private ChatCompletionsApi client() {
        ChatCompletionsApi current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    String baseUrl = properties.getBaseUrl() != null && !properties.getBaseUrl().isBlank()
                            ? properties.getBaseUrl()
                            : DEFAULT_BASE_URL;
                    current = feignClientFactory.create(ChatCompletionsApi.class, baseUrl);
                    client = current;
                    log.info("[OpenAiCompatible] Client initialized with URL: {}", baseUrl);
                }
            }
        }
        return current;
    }

    // ==================== REQUEST ====================

    ChatCompletionRequest buildRequest(ProviderRequest request) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(properties.getModel());
        apiRequest.setMaxTokens(request.getMaxTokens() != null ? request.getMaxTokens() : properties.getMaxTokens());
        apiRequest.setTemperature(request.getTemperature() != null ? request.getTemperature()
                : properties.getTemperature());

        List<ApiMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(ApiMessage.of("system", request.getSystemPrompt()));
        }
        for (Message message : request.getMessages()) {
            if (message.isAssistant()) {
                messages.add(toAssistantMessage(message));
            } else {
                addUserMessages(message, messages);
            }
        }
        apiRequest.setMessages(messages);

        if (!request.getTools().isEmpty()) {
            List<ApiTool> tools = new ArrayList<>();
            for (ToolDescriptor descriptor : request.getTools()) {
                ApiToolFunction function = new ApiToolFunction();
                function.setName(descriptor.getName());
                function.setDescription(descriptor.getDescription());
                function.setParameters(descriptor.getInputSchema());
                ApiTool tool = new ApiTool();
                tool.setType("function");
                tool.setFunction(function);
                tools.add(tool);
            }
            apiRequest.setTools(tools);
        }
        return apiRequest;
    }

    private ApiMessage toAssistantMessage(Message message) {
        String text = message.text();
        ApiMessage apiMessage = ApiMessage.of("assistant", text.isEmpty() ? null : text);
        List<ToolUseBlock> uses = message.toolUses();
        if (!uses.isEmpty()) {
            List<ApiToolCall> calls = new ArrayList<>();
            for (ToolUseBlock use : uses) {
                ApiFunction function = new ApiFunction();
                function.setName(use.name());
                function.setArguments(objectMapper.getNodeFactory().textNode(toJson(use.input())));
                ApiToolCall call = new ApiToolCall();
                call.setId(use.id());
                call.setType("function");
                call.setFunction(function);
                calls.add(call);
            }
            apiMessage.setToolCalls(calls);
        }
        return apiMessage;
    }

    private void addUserMessages(Message message, List<ApiMessage> out) {
        List<Map<String, Object>> parts = new ArrayList<>();
        boolean multimodal = false;
        for (ContentBlock block : message.getContent()) {
            if (block instanceof ToolResultBlock result) {
                ApiMessage toolMessage = ApiMessage.of("tool", result.textContent());
                toolMessage.setToolCallId(result.toolUseId());
                out.add(toolMessage);
            } else if (block instanceof TextBlock text) {
                parts.add(textPart(text.text()));
            } else if (block instanceof ImageBlock image) {
                multimodal = true;
                Map<String, Object> part = new LinkedHashMap<>();
                part.put("type", "image_url");
                part.put("image_url", Map.of("url", "data:" + image.mediaType() + ";base64," + image.base64Data()));
                parts.add(part);
            } else if (block instanceof DocumentBlock document) {
                parts.add(textPart(document.promptText()));
            }
        }
        if (parts.isEmpty()) {
            return;
        }
        if (multimodal) {
            out.add(ApiMessage.of("user", parts));
            return;
        }
        StringBuilder text = new StringBuilder();
        for (Map<String, Object> part : parts) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(part.get("text"));
        }
        out.add(ApiMessage.of("user", text.toString()));
    }

    private static Map<String, Object> textPart(String text) {
        Map<String, Object> part = new LinkedHashMap<>();
        part.put("type", "text");
        part.put("text", text);
        return part;
    }

    // ==================== RESPONSE ====================

    private ProviderResult<Reply> toReply(ChatCompletionResponse response) {
        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()) {
            return ProviderResult.failure(ProviderError.transientError(
                    ProviderErrorClassifier.MALFORMED_RESPONSE, null, "response has no choices"));
        }
        ChatChoice choice = response.getChoices().get(0);
        ApiMessage message = choice.getMessage();
        List<RawToolCall> toolCalls = new ArrayList<>();
        String text = null;
        if (message != null) {
            text = message.getContent() instanceof String content ? content : null;
            if (message.getToolCalls() != null) {
                for (ApiToolCall call : message.getToolCalls()) {
                    ApiFunction function = call.getFunction();
                    if (function == null) {
                        continue;
                    }
                    toolCalls.add(new RawToolCall(call.getId(), function.getName(),
                            argumentsText(function.getArguments())));
                }
            }
        }

        long input = 0;
        long output = 0;
        long cached = 0;
        ApiUsage usage = response.getUsage();
        if (usage != null) {
            input = usage.getPromptTokens();
            output = usage.getCompletionTokens();
            if (usage.getPromptTokensDetails() != null) {
                cached = usage.getPromptTokensDetails().getCachedTokens();
                // OpenAI counts cached tokens inside prompt_tokens
                input = Math.max(0, input - cached);
            }
        }
        String model = response.getModel() != null ? response.getModel() : properties.getModel();
        return ProviderResult.success(new Reply(text, toolCalls, choice.getFinishReason(), input, output, cached,
                model));
    }

    private String toJson(Map<String, Object> input) {
        try {
            return objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            log.warn("[OpenAiCompatible] Failed to serialize tool input: {}", e.getMessage());
            return "{}";
        }
    }

    private String argumentsText(JsonNode arguments) {
        if (arguments == null || arguments.isNull()) {
            return null;
        }
        if (arguments.isTextual()) {
            return arguments.asText();
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            return arguments.toString();
        }
    }

    // ==================== WIRE ====================

    public interface ChatCompletionsApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request,
                Request.Options options);
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiMessage {
        private String role;
        /** Plain string, or a list of content parts for multimodal user turns. */
        private Object content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;

        static ApiMessage of(String role, Object content) {
            ApiMessage message = new ApiMessage();
            message.setRole(role);
            message.setContent(content);
            return message;
        }
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    /**
     * {@code arguments} is a JSON string on the wire; some servers send an
     * object instead, so both are accepted.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiFunction {
        private String name;
        private JsonNode arguments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private long promptTokens;
        @JsonProperty("completion_tokens")
        private long completionTokens;
        @JsonProperty("total_tokens")
        private long totalTokens;
        @JsonProperty("prompt_tokens_details")
        private PromptTokensDetails promptTokensDetails;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PromptTokensDetails {
        @JsonProperty("cached_tokens")
        private long cachedTokens;
    }
}
