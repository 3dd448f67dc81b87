package com.convocommerce.pii.exception;

/**
 * Token store unavailable or rejected a write/read/delete.
 */
public class TokenPersistenceException extends PiiProtectionException {

    public TokenPersistenceException(String message, Throwable cause) {
        super(ErrorCode.TOKEN_PERSISTENCE_FAILED, message, cause);
    }

    protected TokenPersistenceException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
