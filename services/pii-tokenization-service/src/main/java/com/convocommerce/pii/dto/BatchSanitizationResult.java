package com.convocommerce.pii.dto;

import lombok.Value;

import java.util.List;

/**
 * Per-entry results of a batch, in input order. Entries that failed are replaced by a
 * fully redacted fallback and listed in {@code errors}.
 */
@Value
public class BatchSanitizationResult {

    List<ConversationSanitizationResult> sanitized;
    List<EntryError> errors;

    @Value
    public static class EntryError {
        int index;
        String error;
    }
}
