package com.convocommerce.pii.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One conversation turn as handed over for sanitization before it is logged.
 */
@Value
@Builder
@Jacksonized
public class ConversationLog {

    @JsonProperty("user_message")
    String userMessage;

    @JsonProperty("assistant_response")
    String assistantResponse;

    @JsonProperty("context")
    JsonNode context;

    @JsonProperty("metadata")
    JsonNode metadata;
}
