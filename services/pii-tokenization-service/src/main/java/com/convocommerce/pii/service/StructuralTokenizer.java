package com.convocommerce.pii.service;

import com.convocommerce.pii.config.PiiTokenizationProperties;
import com.convocommerce.pii.dto.TokenizedUserData;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Walks a JSON record and replaces the scalar values of sensitive keys.
 *
 * <p>Objects are descended property by property and arrays element by element; anything
 * that is neither a sensitive scalar nor a container is copied as is. The input is never
 * modified, the walk works on a deep copy. Records are data trees, so there is no cycle check.
 */
@Slf4j
@Service
public class StructuralTokenizer {

    private static final String USER_TOKEN_FORMAT = "[USER_TOKEN_%s]";

    private final SensitiveFieldMatcher userDataFields;

    @Autowired
    public StructuralTokenizer(PiiTokenizationProperties properties) {
        this(SensitiveFieldMatcher.exact(properties.getStructural().getSensitiveFields()));
    }

    public StructuralTokenizer(SensitiveFieldMatcher userDataFields) {
        this.userDataFields = userDataFields;
    }

    /**
     * Swaps every sensitive leaf for an in-memory placeholder. Nothing is persisted; the
     * returned map is the only way back to the original values.
     */
    public TokenizedUserData tokenizeUserData(JsonNode record) {
        Map<String, String> tokenMap = new LinkedHashMap<>();
        JsonNode tokenized = tokenize(record, userDataFields, (field, value) -> {
            String placeholder = newUserPlaceholder();
            while (tokenMap.containsKey(placeholder)) {
                placeholder = newUserPlaceholder();
            }
            tokenMap.put(placeholder, value);
            return TextNode.valueOf(placeholder);
        });

        log.debug("Tokenized {} sensitive user fields", tokenMap.size());
        return new TokenizedUserData(tokenized, tokenMap);
    }

    /**
     * Generic walk: returns a transformed deep copy of {@code record}.
     */
    public JsonNode tokenize(JsonNode record, Predicate<String> isSensitive, LeafTransformer transformer) {
        if (record == null || record.isNull() || record.isMissingNode()) {
            return record;
        }
        JsonNode copy = record.deepCopy();
        if (copy.isObject()) {
            walkObject((ObjectNode) copy, isSensitive, transformer);
        } else if (copy.isArray()) {
            walkArray(null, (ArrayNode) copy, isSensitive, transformer);
        }
        return copy;
    }

    private void walkObject(ObjectNode node, Predicate<String> isSensitive, LeafTransformer transformer) {
        List<String> keys = new ArrayList<>();
        node.fieldNames().forEachRemaining(keys::add);

        for (String key : keys) {
            JsonNode value = node.get(key);
            if (isSensitive.test(key)) {
                JsonNode replacement = isNonEmptyScalar(value)
                        ? transformer.sensitiveLeaf(key, value.asText())
                        : transformer.sensitiveValue(key, value);
                if (replacement != null) {
                    node.set(key, replacement);
                    continue;
                }
            }
            if (value.isObject()) {
                walkObject((ObjectNode) value, isSensitive, transformer);
            } else if (value.isArray()) {
                walkArray(key, (ArrayNode) value, isSensitive, transformer);
            } else if (value.isTextual()) {
                String text = value.textValue();
                String replaced = transformer.textLeaf(key, text);
                if (!text.equals(replaced)) {
                    node.put(key, replaced);
                }
            }
        }
    }

    private void walkArray(String field, ArrayNode array, Predicate<String> isSensitive, LeafTransformer transformer) {
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            if (element.isObject()) {
                walkObject((ObjectNode) element, isSensitive, transformer);
            } else if (element.isArray()) {
                walkArray(field, (ArrayNode) element, isSensitive, transformer);
            } else if (element.isTextual()) {
                String text = element.textValue();
                String replaced = transformer.textLeaf(field, text);
                if (!text.equals(replaced)) {
                    array.set(i, TextNode.valueOf(replaced));
                }
            }
        }
    }

    private static boolean isNonEmptyScalar(JsonNode value) {
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        return value.isNumber();
    }

    private static String newUserPlaceholder() {
        return String.format(USER_TOKEN_FORMAT, UUID.randomUUID().toString().substring(0, 8));
    }
}
