package com.convocommerce.pii.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Callback used by {@link StructuralTokenizer} for the leaves it visits.
 */
public interface LeafTransformer {

    /**
     * Replacement for a non-empty scalar stored under a sensitive key.
     */
    JsonNode sensitiveLeaf(String field, String value);

    /**
     * Replacement for any other value under a sensitive key: an object, array, boolean,
     * null or empty string. Returning {@code null} lets the walk treat it as an ordinary value.
     */
    default JsonNode sensitiveValue(String field, JsonNode value) {
        return null;
    }

    /**
     * Replacement for a string stored under any other key, or inside an array. Returning
     * {@code value} itself keeps the leaf untouched.
     */
    default String textLeaf(String field, String value) {
        return value;
    }
}
