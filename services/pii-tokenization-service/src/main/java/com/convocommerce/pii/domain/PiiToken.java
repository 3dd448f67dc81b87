package com.convocommerce.pii.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Persisted token record. The plaintext only ever exists as {@code encryptedValue},
 * a ciphertext bound to (tokenId, merchantId, dataType).
 */
@Value
@Builder(toBuilder = true)
public class PiiToken {

    String tokenId;
    String merchantId;
    DataType dataType;
    byte[] encryptedValue;
    Instant createdAt;
    Instant expiresAt;
    String ownerId;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
