package com.convocommerce.pii.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes raised by the PII protection layer.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Reserved: malformed input degrades to "no match" and never raises
    DETECTION_FAILED("PII_DETECTION_FAILED", "PII detection failed"),

    ENCRYPTION_FAILED("PII_ENCRYPTION_FAILED", "Key service rejected the encryption request"),
    DECRYPTION_FAILED("PII_DECRYPTION_FAILED", "Key service rejected the decryption request"),
    TOKEN_CREATION_FAILED("PII_TOKEN_CREATION_FAILED", "Token creation failed"),
    TOKEN_PERSISTENCE_FAILED("PII_TOKEN_PERSISTENCE_FAILED", "Token store unavailable"),
    TOKEN_ID_COLLISION("PII_TOKEN_ID_COLLISION", "Token identifier already exists"),
    TOKEN_RECORD_UNREADABLE("PII_TOKEN_RECORD_UNREADABLE", "Stored token record is malformed"),
    CRITICAL_FIELD_TOKENIZATION_FAILED("PII_CRITICAL_FIELD_FAILED", "Critical payment field tokenization failed");

    private final String code;
    private final String defaultMessage;
}
