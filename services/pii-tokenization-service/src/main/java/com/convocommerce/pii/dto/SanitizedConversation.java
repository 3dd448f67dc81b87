package com.convocommerce.pii.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SanitizedConversation {

    @JsonProperty("user_message")
    String userMessage;

    @JsonProperty("assistant_response")
    String assistantResponse;

    @JsonProperty("context")
    JsonNode context;

    @JsonProperty("metadata")
    JsonNode metadata;

    @JsonProperty("redaction_applied")
    boolean redactionApplied;

    @JsonProperty("redaction_timestamp")
    Instant redactionTimestamp;
}
