package com.convocommerce.pii.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Table of payment fields that must be tokenized, each flagged critical or not.
 * A critical field failing aborts the whole request; a non-critical one is absorbed.
 */
public final class PaymentFieldPolicy {

    private final Map<String, Boolean> criticalByField;

    private PaymentFieldPolicy(Map<String, Boolean> criticalByField) {
        this.criticalByField = Collections.unmodifiableMap(criticalByField);
    }

    public static PaymentFieldPolicy of(Collection<String> criticalFields, Collection<String> nonCriticalFields) {
        Map<String, Boolean> table = new LinkedHashMap<>();
        nonCriticalFields.forEach(field -> table.put(field, Boolean.FALSE));
        // a field listed in both is treated as critical
        criticalFields.forEach(field -> table.put(field, Boolean.TRUE));
        return new PaymentFieldPolicy(table);
    }

    public boolean isTarget(String field) {
        return criticalByField.containsKey(field);
    }

    public boolean isCritical(String field) {
        return Boolean.TRUE.equals(criticalByField.get(field));
    }

    public Set<String> fields() {
        return criticalByField.keySet();
    }
}
