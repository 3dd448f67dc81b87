package com.convocommerce.pii.exception;

import lombok.Getter;

/**
 * Base exception for failures surfaced by the PII protection layer.
 */
@Getter
public class PiiProtectionException extends RuntimeException {

    private final ErrorCode errorCode;
    private final boolean securityCritical;

    public PiiProtectionException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, false);
    }

    public PiiProtectionException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, false);
    }

    public PiiProtectionException(ErrorCode errorCode, String message, Throwable cause, boolean securityCritical) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode;
        this.securityCritical = securityCritical;
    }
}
