package com.convocommerce.pii.redaction;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Redacted text plus the placeholder to original value map. Owned by the caller and
 * never persisted here.
 */
@Value
public class RedactionResult {

    String sanitizedText;
    Map<String, String> tokens;

    public RedactionResult(String sanitizedText, Map<String, String> tokens) {
        this.sanitizedText = sanitizedText;
        this.tokens = Collections.unmodifiableMap(new LinkedHashMap<>(tokens));
    }

    public static RedactionResult unchanged(String text) {
        return new RedactionResult(text, Collections.emptyMap());
    }

    public boolean hasRedactions() {
        return !tokens.isEmpty();
    }
}
