package me.golemcore.reasoning.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Per-call inference parameters. Tool definitions are advertised to the model
 * exactly as declared.
 */
@Value
@Builder(toBuilder = true)
public class InferenceOptions {

    String model;

    @Builder.Default
    int maxTokens = 4096;

    @Builder.Default
    double temperature = 0.3;

    @Singular
    List<ToolDefinition> tools;

    @Builder.Default
    ResponseFormat responseFormat = ResponseFormat.text();
}
