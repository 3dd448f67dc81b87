package com.convocommerce.pii.detection;

import lombok.Value;

/**
 * One detected occurrence. {@code endIndex} is exclusive.
 */
@Value
public class PiiMatch {

    PiiType type;
    int startIndex;
    int endIndex;
    String matchedText;

    public int length() {
        return endIndex - startIndex;
    }

    public boolean overlaps(PiiMatch other) {
        return startIndex < other.endIndex && other.startIndex < endIndex;
    }
}
