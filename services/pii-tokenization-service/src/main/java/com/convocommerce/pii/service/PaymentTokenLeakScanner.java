package com.convocommerce.pii.service;

import com.convocommerce.pii.dto.LeakScanResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last line of defence before a record reaches a log: finds payment processor tokens
 * and card numbers anywhere in the tree and, if there are any, returns a scrubbed copy.
 */
@Slf4j
@Component
public class PaymentTokenLeakScanner {

    static final String PAYMENT_TOKEN_REDACTED = "[PAYMENT_TOKEN_REDACTED]";
    static final String CARD_NUMBER_REDACTED = "[CARD_NUMBER_REDACTED]";

    private static final Pattern PROCESSOR_TOKEN =
            Pattern.compile("\\b(?:tok|card|pm|pi|src|adyen)_[A-Za-z0-9]{10,}\\b");
    private static final Pattern CARD_NUMBER =
            Pattern.compile("\\b\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}\\b");

    public LeakScanResult scan(JsonNode record) {
        if (record == null || record.isNull()) {
            return new LeakScanResult(true, Collections.emptyList(), record);
        }

        List<String> violations = new ArrayList<>();
        collect(record, "", violations);
        if (violations.isEmpty()) {
            return new LeakScanResult(true, Collections.emptyList(), record);
        }

        log.warn("Payment tokens detected in record: {}", violations);
        return new LeakScanResult(false, List.copyOf(violations), scrub(record.deepCopy()));
    }

    private void collect(JsonNode node, String path, List<String> violations) {
        if (node.isTextual()) {
            int matches = count(PROCESSOR_TOKEN, node.textValue()) + count(CARD_NUMBER, node.textValue());
            if (matches > 0) {
                violations.add((path.isEmpty() ? "$" : path) + ": " + matches + " matches");
            }
        } else if (node.isObject()) {
            node.fields().forEachRemaining(entry ->
                    collect(entry.getValue(), path.isEmpty() ? entry.getKey() : path + "." + entry.getKey(), violations));
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                collect(node.get(i), path + "[" + i + "]", violations);
            }
        }
    }

    private JsonNode scrub(JsonNode node) {
        if (node.isTextual()) {
            return TextNode.valueOf(scrubText(node.textValue()));
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> keys = new ArrayList<>();
            object.fieldNames().forEachRemaining(keys::add);
            for (String key : keys) {
                object.set(key, scrub(object.get(key)));
            }
        } else if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, scrub(array.get(i)));
            }
        }
        return node;
    }

    private static String scrubText(String text) {
        String scrubbed = PROCESSOR_TOKEN.matcher(text).replaceAll(PAYMENT_TOKEN_REDACTED);
        return CARD_NUMBER.matcher(scrubbed).replaceAll(CARD_NUMBER_REDACTED);
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
