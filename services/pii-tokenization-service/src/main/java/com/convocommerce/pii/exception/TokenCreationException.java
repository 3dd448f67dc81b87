package com.convocommerce.pii.exception;

/**
 * Wraps any failure that aborted {@code createSecureToken}.
 */
public class TokenCreationException extends PiiProtectionException {

    public TokenCreationException(String reason, Throwable cause) {
        super(ErrorCode.TOKEN_CREATION_FAILED, "Token creation failed: " + reason, cause, true);
    }
}
