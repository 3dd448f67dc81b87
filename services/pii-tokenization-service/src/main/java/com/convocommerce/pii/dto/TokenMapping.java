package com.convocommerce.pii.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TokenMapping {

    public static final String PAYMENT_CLASSIFICATION = "payment";

    @JsonProperty("field")
    String field;

    @JsonProperty("token_id")
    String tokenId;

    @JsonProperty("data_classification")
    String dataClassification;
}
