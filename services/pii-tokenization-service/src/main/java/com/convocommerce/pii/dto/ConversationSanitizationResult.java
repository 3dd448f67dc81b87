package com.convocommerce.pii.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ConversationSanitizationResult {

    @JsonProperty("sanitized_conversation")
    SanitizedConversation sanitizedConversation;

    @JsonProperty("redaction_summary")
    RedactionSummary redactionSummary;
}
