package com.convocommerce.pii.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PaymentTokenizationResult {

    @JsonProperty("tokenized_data")
    ObjectNode tokenizedData;

    @Singular
    @JsonProperty("token_mappings")
    List<TokenMapping> tokenMappings;
}
