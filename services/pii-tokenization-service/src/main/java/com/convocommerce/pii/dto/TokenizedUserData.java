package com.convocommerce.pii.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.Map;

/**
 * Copy of a user record with sensitive leaves swapped for {@code [USER_TOKEN_xxxxxxxx]}
 * placeholders, and the placeholder to original value map.
 */
@Value
public class TokenizedUserData {
    JsonNode tokenizedData;
    Map<String, String> tokenMap;
}
