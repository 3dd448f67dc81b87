package com.convocommerce.pii.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RedactionSummary {

    @Singular("fieldRedacted")
    @JsonProperty("fields_redacted")
    List<String> fieldsRedacted;

    @JsonProperty("tokens_created")
    int tokensCreated;

    @JsonProperty("pii_patterns_found")
    int piiPatternsFound;
}
