package com.convocommerce.pii.repository;

import com.convocommerce.pii.domain.PiiToken;
import com.convocommerce.pii.exception.TokenIdCollisionException;
import com.convocommerce.pii.exception.TokenPersistenceException;
import com.convocommerce.pii.exception.UnreadableTokenRecordException;

import java.util.Optional;

/**
 * Durable store for token records, keyed by (tokenId, merchantId).
 *
 * <p>A lookup with the right tokenId under another merchant returns empty, exactly
 * as a token that never existed.
 */
public interface TokenStore {

    /**
     * @throws TokenIdCollisionException if a record already exists under the token id
     * @throws TokenPersistenceException if the store is unavailable
     */
    void put(PiiToken token);

    /**
     * @throws UnreadableTokenRecordException if a record exists but is malformed
     * @throws TokenPersistenceException if the store is unavailable
     */
    Optional<PiiToken> get(String tokenId, String merchantId);

    /**
     * No-op when nothing is stored under the key.
     *
     * @throws TokenPersistenceException if the store is unavailable
     */
    void delete(String tokenId, String merchantId);
}
