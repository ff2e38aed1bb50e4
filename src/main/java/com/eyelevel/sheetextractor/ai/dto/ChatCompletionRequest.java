package com.eyelevel.sheetextractor.ai.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Body of an OpenAI-compatible {@code /chat/completions} call in JSON mode.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatCompletionRequest(String model, List<ChatMessage> messages, Double temperature,
                                    @JsonProperty("max_tokens") Integer maxTokens,
                                    @JsonProperty("response_format") Map<String, String> responseFormat) {

    public static final Map<String, String> JSON_OBJECT = Map.of("type", "json_object");
}
