package com.convocommerce.pii.exception;

import lombok.Getter;

/**
 * A payment field marked critical could not be tokenized, so the whole request is rejected.
 */
@Getter
public class CriticalFieldTokenizationException extends PiiProtectionException {

    private final String field;

    public CriticalFieldTokenizationException(String field, Throwable cause) {
        super(ErrorCode.CRITICAL_FIELD_TOKENIZATION_FAILED,
                "Critical payment field tokenization failed: " + field, cause, true);
        this.field = field;
    }
}
