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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicTokenUsage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
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
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Anthropic Messages API through langchain4j.
 *
 * <p>
 * langchain4j's own retries are disabled; {@link ProviderAdapter} owns the
 * retry schedule. One model instance is kept per attempt timeout since the
 * timeout is fixed at build time.
 */
@Slf4j
public class AnthropicBackend implements ProviderBackend {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    private final RuntimeProperties.ProviderProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<Duration, ChatModel> modelsByTimeout = new ConcurrentHashMap<>();

    public AnthropicBackend(RuntimeProperties.ProviderProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getBackendId() {
        return ProviderAdapterFactory.ANTHROPIC;
    }

    @Override
    public String getModel() {
        return properties.getModel();
    }

    @Override
    public ProviderResult<Reply> send(ProviderRequest request, Duration timeout) {
        try {
            ChatModel model = modelsByTimeout.computeIfAbsent(timeout, this::createModel);
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(toChatMessages(request))
                    .toolSpecifications(toToolSpecifications(request.getTools()))
                    .maxOutputTokens(request.getMaxTokens() != null ? request.getMaxTokens()
                            : properties.getMaxTokens())
                    .temperature(request.getTemperature() != null ? request.getTemperature()
                            : properties.getTemperature())
                    .build();
            ChatResponse response = model.chat(chatRequest);
            return ProviderResult.success(toReply(response));
        } catch (RuntimeException e) {
            ProviderError error = ProviderErrorClassifier.classify(e);
            log.debug("[Anthropic] Call failed: {}", error.describe());
            return ProviderResult.failure(error);
        }
    }

    private ChatModel createModel(Duration timeout) {
        var builder = AnthropicChatModel.builder()
                .apiKey(properties.getApiKey())
                .modelName(properties.getModel())
                .maxRetries(0)
                .maxTokens(properties.getMaxTokens())
                .timeout(timeout);
        if (properties.getBaseUrl() != null && !properties.getBaseUrl().isBlank()) {
            builder.baseUrl(properties.getBaseUrl());
        }
        log.debug("[Anthropic] Created model {} with timeout {}", properties.getModel(), timeout);
        return builder.build();
    }

    // ==================== REQUEST ====================

    List<ChatMessage> toChatMessages(ProviderRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        Map<String, String> toolNames = new HashMap<>();
        for (Message message : request.getMessages()) {
            if (message.isAssistant()) {
                messages.add(toAiMessage(message, toolNames));
                continue;
            }
            List<Content> contents = new ArrayList<>();
            for (ContentBlock block : message.getContent()) {
                if (block instanceof ToolResultBlock result) {
                    messages.add(ToolExecutionResultMessage.from(result.toolUseId(),
                            toolNames.getOrDefault(result.toolUseId(), "tool"), result.textContent()));
                } else if (block instanceof TextBlock text) {
                    contents.add(TextContent.from(text.text()));
                } else if (block instanceof ImageBlock image) {
                    contents.add(ImageContent.from(image.base64Data(), image.mediaType()));
                } else if (block instanceof DocumentBlock document) {
                    contents.add(TextContent.from(document.promptText()));
                }
            }
            if (!contents.isEmpty()) {
                messages.add(UserMessage.from(contents));
            }
        }
        return messages;
    }

    private AiMessage toAiMessage(Message message, Map<String, String> toolNames) {
        List<ToolExecutionRequest> toolRequests = new ArrayList<>();
        for (ToolUseBlock use : message.toolUses()) {
            toolNames.put(use.id(), use.name());
            toolRequests.add(ToolExecutionRequest.builder()
                    .id(use.id())
                    .name(use.name())
                    .arguments(toJson(use.input()))
                    .build());
        }
        String text = message.text();
        if (toolRequests.isEmpty()) {
            return AiMessage.from(text);
        }
        return text.isBlank() ? AiMessage.from(toolRequests) : AiMessage.from(text, toolRequests);
    }

    private String toJson(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            log.warn("[Anthropic] Failed to serialize tool input: {}", e.getMessage());
            return "{}";
        }
    }

    private List<ToolSpecification> toToolSpecifications(List<ToolDescriptor> tools) {
        List<ToolSpecification> specifications = new ArrayList<>(tools.size());
        for (ToolDescriptor tool : tools) {
            specifications.add(toToolSpecification(tool));
        }
        return specifications;
    }

    @SuppressWarnings("unchecked")
    ToolSpecification toToolSpecification(ToolDescriptor tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                schemaBuilder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                schemaBuilder.required((List<String>) required);
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> schema) {
        String type = schema.get("type") instanceof String value ? value : "string";
        String description = schema.get("description") instanceof String value && !value.isBlank() ? value : null;

        if (schema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            List<String> values = new ArrayList<>();
            enumValues.forEach(value -> values.add(String.valueOf(value)));
            return JsonEnumSchema.builder().enumValues(values).description(description).build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (schema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    // ==================== RESPONSE ====================

    private Reply toReply(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        List<RawToolCall> toolCalls = new ArrayList<>();
        if (aiMessage.hasToolExecutionRequests()) {
            for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
                toolCalls.add(new RawToolCall(request.id(), request.name(), request.arguments()));
            }
        }

        long input = 0;
        long output = 0;
        long cached = 0;
        TokenUsage usage = response.tokenUsage();
        if (usage != null) {
            input = usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
            output = usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
            if (usage instanceof AnthropicTokenUsage anthropicUsage
                    && anthropicUsage.cacheReadInputTokens() != null) {
                cached = anthropicUsage.cacheReadInputTokens();
            }
        }

        String finishReason = response.finishReason() != null ? response.finishReason().name() : null;
        String model = response.modelName() != null ? response.modelName() : properties.getModel();
        return new Reply(aiMessage.text(), toolCalls, finishReason, input, output, cached, model);
    }
}
