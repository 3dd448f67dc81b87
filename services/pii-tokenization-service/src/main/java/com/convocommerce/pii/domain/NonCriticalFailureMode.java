package com.convocommerce.pii.domain;

/**
 * What happens to a non-critical payment field whose tokenization failed.
 */
public enum NonCriticalFailureMode {
    /** Value replaced by {@code [REDACTED]}. */
    REDACT,
    /** Field dropped from the tokenized record. */
    OMIT,
    /** Original value kept as-is. */
    PASS_THROUGH
}
