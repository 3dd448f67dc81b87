package com.convocommerce.pii.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classification of the plaintext behind a secure token. The wire value prefixes
 * the token id and is bound into the encryption context.
 */
public enum DataType {
    PERSONAL,
    PAYMENT,
    ADDRESS,
    CONTACT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DataType fromWireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Data type must not be null");
        }
        return DataType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
