package com.convocommerce.pii.detection;

import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Known PII shapes and the expressions that find them. Each expression is matched
 * independently; {@link PatternDetector} merges the results.
 */
@Getter
public enum PiiType {

    // local part anchored to the start of its run, matched possessively
    EMAIL(Pattern.compile("(?<![A-Za-z0-9._%+-])[A-Za-z0-9._%+-]++@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b")),

    PHONE(Pattern.compile("(?:\\b\\d{3}[-.]\\d{3}[-.]\\d{4}|\\(\\d{3}\\)\\s?\\d{3}[-.]\\d{4})\\b")),

    SSN(Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b")),

    // 4-4-4-(1..7) or Amex 4-6-5, one separator style throughout
    CREDIT_CARD(Pattern.compile(
            "\\b(?:\\d{4}([ -]?)\\d{4}\\1\\d{4}\\1\\d{1,7}|\\d{4}([ -]?)\\d{6}\\2\\d{5})\\b")),

    PAYMENT_TOKEN(Pattern.compile("\\b(?:tok|card|pm|pi|src)_[A-Za-z0-9]{10,}\\b")),

    STREET_ADDRESS(Pattern.compile(
            "\\b\\d{1,6}\\s+(?:[A-Za-z]+\\s+){1,4}(?:Street|St|Avenue|Ave|Road|Rd|Drive|Dr|Lane|Ln|Boulevard|Blvd)\\b",
            Pattern.CASE_INSENSITIVE));

    private final Pattern pattern;

    PiiType(Pattern pattern) {
        this.pattern = pattern;
    }
}
