package com.convocommerce.pii.service;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Case-insensitive test of a record key against an allow-list of sensitive field names.
 */
public final class SensitiveFieldMatcher implements Predicate<String> {

    private final Set<String> fieldNames;
    private final boolean matchFragments;

    private SensitiveFieldMatcher(Collection<String> fieldNames, boolean matchFragments) {
        this.fieldNames = fieldNames.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.matchFragments = matchFragments;
    }

    /** Key must equal one of the names, ignoring case. */
    public static SensitiveFieldMatcher exact(Collection<String> fieldNames) {
        return new SensitiveFieldMatcher(fieldNames, false);
    }

    /** Key must contain one of the names, ignoring case ({@code user_email} matches {@code email}). */
    public static SensitiveFieldMatcher containing(Collection<String> fieldNames) {
        return new SensitiveFieldMatcher(fieldNames, true);
    }

    @Override
    public boolean test(String key) {
        if (key == null) {
            return false;
        }
        String normalized = key.toLowerCase(Locale.ROOT);
        if (!matchFragments) {
            return fieldNames.contains(normalized);
        }
        for (String name : fieldNames) {
            if (normalized.contains(name)) {
                return true;
            }
        }
        return false;
    }
}
