package me.golemcore.reasoning.adapter.outbound.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.model.FinishReason;
import me.golemcore.reasoning.domain.model.InferenceOptions;
import me.golemcore.reasoning.domain.model.InferenceResult;
import me.golemcore.reasoning.domain.model.Message;
import me.golemcore.reasoning.domain.model.ProposedAction;
import me.golemcore.reasoning.domain.model.ResponseFormat;
import me.golemcore.reasoning.domain.model.TokenUsage;
import me.golemcore.reasoning.domain.model.ToolDefinition;
import me.golemcore.reasoning.infrastructure.config.ReasoningProperties;
import me.golemcore.reasoning.port.outbound.InferenceErrorKind;
import me.golemcore.reasoning.port.outbound.InferenceException;
import me.golemcore.reasoning.port.outbound.InferencePort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Inference through LangChain4j chat models (OpenAI-compatible or Anthropic).
 *
 * <p>
 * The model is created lazily on first use. Provider-side retries are disabled
 * ({@code maxRetries(0)}); the loop owns retry decisions based on the
 * {@link InferenceErrorKind} this adapter reports.
 */
@Slf4j
public class Langchain4jInferenceAdapter implements InferencePort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ReasoningProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Executor executor;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public Langchain4jInferenceAdapter(ReasoningProperties properties) {
        this(properties, null, ForkJoinPool.commonPool());
    }

    // Visible for testing
    Langchain4jInferenceAdapter(ReasoningProperties properties, ChatModel chatModel, Executor executor) {
        this.properties = properties;
        this.executor = executor;
        if (chatModel != null) {
            this.chatModel = chatModel;
            this.initialized = true;
        }
    }

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        ReasoningProperties.InferenceProperties config = properties.getInference();
        this.chatModel = createModel(config);
        initialized = true;
        log.info("[Inference] LangChain4j adapter initialized with provider: {}, model: {}", config.getProvider(),
                config.getModel());
    }

    @Override
    public String getProviderId() {
        return properties.getInference().getProvider();
    }

    @Override
    public CompletableFuture<InferenceResult> infer(List<Message> messages, InferenceOptions options) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = ensureInitialized();
            ChatRequest.Builder request = ChatRequest.builder()
                    .messages(convertMessages(messages))
                    .maxOutputTokens(options.getMaxTokens())
                    .temperature(options.getTemperature());
            List<ToolSpecification> tools = convertTools(options.getTools());
            if (!tools.isEmpty()) {
                request.toolSpecifications(tools);
            }
            if (options.getModel() != null && !options.getModel().isBlank()) {
                request.modelName(options.getModel());
            }
            dev.langchain4j.model.chat.request.ResponseFormat responseFormat = convertResponseFormat(
                    options.getResponseFormat());
            if (responseFormat != null) {
                request.responseFormat(responseFormat);
            }

            ChatResponse response;
            try {
                log.trace("[Inference] Calling model with {} message(s) and {} tool(s)", messages.size(),
                        tools.size());
                response = model.chat(request.build());
            } catch (RuntimeException e) {
                InferenceException failure = InferenceErrorClassifier.toInferenceException(e);
                log.warn("[Inference] Call failed ({}): {}", failure.getKind(), failure.getMessage());
                throw failure;
            }
            return convertResponse(response, options);
        }, executor);
    }

    private ChatModel ensureInitialized() {
        if (!initialized) {
            try {
                initialize();
            } catch (RuntimeException e) {
                throw new InferenceException(InferenceErrorKind.UNAUTHORIZED,
                        "Inference provider is not configured: " + e.getMessage(), e);
            }
        }
        return chatModel;
    }

    private ChatModel createModel(ReasoningProperties.InferenceProperties config) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Missing reasoning.inference.api-key");
        }
        if (PROVIDER_ANTHROPIC.equals(config.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .maxRetries(0)
                    .maxTokens(config.getMaxTokens())
                    .temperature(config.getTemperature())
                    .timeout(config.getTimeout());
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        // everything else speaks the OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .temperature(config.getTemperature())
                .timeout(config.getTimeout());
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(List<Message> messages) {
        List<ChatMessage> converted = new ArrayList<>(messages.size());
        for (Message msg : messages) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case SYSTEM -> converted.add(SystemMessage.from(content));
            case USER -> converted.add(UserMessage.from(content));
            case ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    converted.add(content.isBlank() ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    converted.add(AiMessage.from(content));
                }
            }
            case TOOL -> converted.add(ToolExecutionResultMessage.from(msg.getToolCallId(), msg.getToolName(),
                    content));
            default -> log.warn("[Inference] Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return converted;
    }

    /**
     * Maps the requested format onto the provider request. Anthropic models have
     * no native JSON mode, so for them the format is enforced only by checking
     * the final answer.
     */
    dev.langchain4j.model.chat.request.ResponseFormat convertResponseFormat(ResponseFormat format) {
        if (format == null || !format.isStructured()) {
            return null;
        }
        if (PROVIDER_ANTHROPIC.equals(getProviderId())) {
            log.debug("[Inference] Provider has no native JSON mode, relying on answer validation");
            return null;
        }
        if (format.type() == ResponseFormat.Type.JSON_OBJECT) {
            return dev.langchain4j.model.chat.request.ResponseFormat.JSON;
        }
        return dev.langchain4j.model.chat.request.ResponseFormat.builder()
                .type(ResponseFormatType.JSON)
                .jsonSchema(JsonSchema.builder()
                        .name(format.name())
                        .rootElement(toJsonSchemaElement(format.schema()))
                        .build())
                .build();
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream().map(this::convertToolDefinition).toList();
    }

    @SuppressWarnings("unchecked")
    ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getParameters() != null) {
            Map<String, Object> schema = tool.getParameters();
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
        boolean described = description != null && !description.isBlank();
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            List<String> required = (List<String>) paramSchema.get("required");
            if (required != null && !required.isEmpty()) {
                builder.required(required);
            }
            return builder.build();
        }
        default -> {
            // strings and unknown types
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    InferenceResult convertResponse(ChatResponse response, InferenceOptions options) {
        if (response == null || response.aiMessage() == null) {
            throw new InferenceException(InferenceErrorKind.INVALID_RESPONSE,
                    InferenceErrorClassifier.withCode(InferenceErrorClassifier.INVALID_RESPONSE,
                            "Provider returned no assistant message"));
        }
        AiMessage aiMessage = response.aiMessage();

        List<ProposedAction> actions = new ArrayList<>();
        if (aiMessage.hasToolExecutionRequests()) {
            for (ToolExecutionRequest ter : aiMessage.toolExecutionRequests()) {
                actions.add(ProposedAction.toolCall(ter.id(), ter.name(), parseJsonArgs(ter.arguments())));
            }
            log.trace("[Inference] Parsed {} tool call(s) from response", actions.size());
        } else {
            actions.add(ProposedAction.finalAnswer(null, aiMessage.text() != null ? aiMessage.text() : ""));
        }

        TokenUsage usage = TokenUsage.zero();
        if (response.tokenUsage() != null) {
            Integer input = response.tokenUsage().inputTokenCount();
            Integer output = response.tokenUsage().outputTokenCount();
            usage = TokenUsage.of(input != null ? input : 0, output != null ? output : 0);
        }

        return InferenceResult.builder()
                .actions(actions)
                .text(aiMessage.text())
                .usage(usage)
                .finishReason(convertFinishReason(response.finishReason()))
                .model(options.getModel() != null ? options.getModel() : properties.getInference().getModel())
                .build();
    }

    private static FinishReason convertFinishReason(dev.langchain4j.model.output.FinishReason reason) {
        if (reason == null) {
            return FinishReason.STOP;
        }
        return switch (reason) {
        case STOP -> FinishReason.STOP;
        case TOOL_EXECUTION -> FinishReason.TOOL_CALLS;
        case LENGTH -> FinishReason.LENGTH;
        case CONTENT_FILTER -> FinishReason.CONTENT_FILTER;
        default -> FinishReason.OTHER;
        };
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[Inference] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    /**
     * Parses tool-call arguments. Returns {@code null} for unparsable input so
     * the policy gate can reject the action as malformed.
     */
    Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[Inference] Failed to parse tool arguments: {}", e.getMessage());
            return null;
        }
    }
}
