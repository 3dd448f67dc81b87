package com.convocommerce.pii.service;

import com.convocommerce.pii.config.PiiTokenizationProperties;
import com.convocommerce.pii.domain.DataType;
import com.convocommerce.pii.domain.PiiToken;
import com.convocommerce.pii.encryption.EncryptionContext;
import com.convocommerce.pii.encryption.KeyManagementGateway;
import com.convocommerce.pii.exception.EncryptionException;
import com.convocommerce.pii.exception.TokenCreationException;
import com.convocommerce.pii.exception.TokenIdCollisionException;
import com.convocommerce.pii.exception.TokenPersistenceException;
import com.convocommerce.pii.exception.UnreadableTokenRecordException;
import com.convocommerce.pii.repository.TokenStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Mints and redeems reversible tokens.
 *
 * <p>Minting encrypts the plaintext under the context (tokenId, merchantId, dataType)
 * and stores the ciphertext under the composite key (tokenId, merchantId). Redemption
 * always uses the caller's merchantId, never anything read from the token itself, so a
 * token presented by another tenant is simply not found. Every way a redemption can fail
 * to produce plaintext (missing, expired, wrong tenant, corrupt record or ciphertext) returns
 * {@code null}; only an unavailable store is raised.
 *
 * @see KeyManagementGateway
 * @see TokenStore
 */
@Slf4j
@Service
public class SecureTokenService {

    private final KeyManagementGateway keyManagementGateway;
    private final TokenStore tokenStore;
    private final Clock clock;
    private final int maxMintAttempts;

    private final Counter tokensCreated;
    private final Counter tokenCreationFailures;
    private final Counter tokensRetrieved;
    private final Counter tokensNotFound;
    private final Counter tokensExpired;
    private final Counter decryptFailures;
    private final Counter tokensDeleted;

    public SecureTokenService(KeyManagementGateway keyManagementGateway,
                              TokenStore tokenStore,
                              Clock clock,
                              MeterRegistry meterRegistry,
                              PiiTokenizationProperties properties) {
        this.keyManagementGateway = keyManagementGateway;
        this.tokenStore = tokenStore;
        this.clock = clock;
        this.maxMintAttempts = properties.getTokens().getMaxMintAttempts();

        this.tokensCreated = operationCounter(meterRegistry, "create", "success");
        this.tokenCreationFailures = operationCounter(meterRegistry, "create", "failure");
        this.tokensRetrieved = operationCounter(meterRegistry, "retrieve", "success");
        this.tokensNotFound = operationCounter(meterRegistry, "retrieve", "not_found");
        this.tokensExpired = operationCounter(meterRegistry, "retrieve", "expired");
        this.decryptFailures = operationCounter(meterRegistry, "retrieve", "decrypt_failure");
        this.tokensDeleted = operationCounter(meterRegistry, "delete", "success");
    }

    public String createSecureToken(String plaintext, DataType dataType, String merchantId) {
        return createSecureToken(plaintext, dataType, merchantId, null, null);
    }

    /**
     * Encrypts {@code plaintext} and persists it under a fresh token id.
     *
     * @param ownerId  end user the value belongs to, stored for retention jobs; may be null
     * @param ttlHours lifetime of the token; null means it never expires
     * @return token id of the form {@code <dataType>_<32 hex>}
     * @throws TokenCreationException if encryption or persistence failed
     */
    public String createSecureToken(String plaintext, DataType dataType, String merchantId,
                                    String ownerId, Integer ttlHours) {
        Assert.notNull(plaintext, "plaintext must not be null");
        Assert.notNull(dataType, "dataType must not be null");
        Assert.hasText(merchantId, "merchantId must not be blank");
        Assert.isTrue(ttlHours == null || ttlHours > 0, "ttlHours must be positive");

        for (int attempt = 1; ; attempt++) {
            String tokenId = newTokenId(dataType);
            try {
                mint(tokenId, plaintext, dataType, merchantId, ownerId, ttlHours);
                tokensCreated.increment();
                log.info("Created secure token {} for {} data, merchant {}", tokenId, dataType.wireValue(), merchantId);
                return tokenId;

            } catch (TokenIdCollisionException e) {
                if (attempt >= maxMintAttempts) {
                    tokenCreationFailures.increment();
                    log.error("Giving up on token creation for merchant {} after {} id collisions", merchantId, attempt);
                    throw new TokenCreationException("token id collided " + attempt + " times", e);
                }
                log.warn("Token id {} already taken, minting a new one (attempt {}/{})", tokenId, attempt, maxMintAttempts);
            } catch (EncryptionException | TokenPersistenceException e) {
                tokenCreationFailures.increment();
                log.error("Failed to create secure token for merchant {}: {}", merchantId, e.getMessage());
                throw new TokenCreationException(e.getMessage(), e);
            }
        }
    }

    /**
     * @return the plaintext, or {@code null} if the token does not exist for this merchant,
     *         has expired (the record is deleted), is malformed, or cannot be decrypted
     * @throws TokenPersistenceException if the store cannot be read
     */
    public String retrieveFromToken(String tokenId, String merchantId) {
        if (tokenId == null || tokenId.isBlank() || merchantId == null || merchantId.isBlank()) {
            tokensNotFound.increment();
            return null;
        }

        Optional<PiiToken> stored;
        try {
            stored = tokenStore.get(tokenId, merchantId);
        } catch (UnreadableTokenRecordException e) {
            decryptFailures.increment();
            log.warn("Token {} for merchant {} has an unreadable record: {}", tokenId, merchantId, e.getMessage());
            return null;
        }
        if (stored.isEmpty()) {
            tokensNotFound.increment();
            log.warn("Token {} not found for merchant {}", tokenId, merchantId);
            return null;
        }

        PiiToken token = stored.get();
        if (token.isExpiredAt(clock.instant())) {
            tokensExpired.increment();
            log.warn("Token {} expired at {}, deleting", tokenId, token.getExpiresAt());
            deleteExpired(tokenId, merchantId);
            return null;
        }

        try {
            String plaintext = keyManagementGateway.decrypt(
                    token.getEncryptedValue(),
                    new EncryptionContext(tokenId, merchantId, token.getDataType()));
            tokensRetrieved.increment();
            return plaintext;

        } catch (EncryptionException e) {
            decryptFailures.increment();
            log.warn("Failed to decrypt token {} for merchant {}: {}", tokenId, merchantId, e.getMessage());
            return null;
        }
    }

    /**
     * Removes a token under the caller's tenant key. Deleting an unknown token is a no-op.
     *
     * @throws TokenPersistenceException if the store is unavailable
     */
    public void deleteToken(String tokenId, String merchantId) {
        Assert.hasText(tokenId, "tokenId must not be blank");
        Assert.hasText(merchantId, "merchantId must not be blank");

        tokenStore.delete(tokenId, merchantId);
        tokensDeleted.increment();
        log.info("Deleted token {} for merchant {}", tokenId, merchantId);
    }

    private void mint(String tokenId, String plaintext, DataType dataType, String merchantId,
                      String ownerId, Integer ttlHours) {
        byte[] ciphertext = keyManagementGateway.encrypt(
                plaintext, new EncryptionContext(tokenId, merchantId, dataType));

        Instant now = clock.instant();
        tokenStore.put(PiiToken.builder()
                .tokenId(tokenId)
                .merchantId(merchantId)
                .dataType(dataType)
                .encryptedValue(ciphertext)
                .createdAt(now)
                .expiresAt(ttlHours != null ? now.plus(Duration.ofHours(ttlHours)) : null)
                .ownerId(ownerId)
                .build());
    }

    private void deleteExpired(String tokenId, String merchantId) {
        try {
            tokenStore.delete(tokenId, merchantId);
        } catch (TokenPersistenceException e) {
            // the stale value is still never returned; native TTL or retention will purge it
            log.warn("Could not delete expired token {}: {}", tokenId, e.getMessage());
        }
    }

    static String newTokenId(DataType dataType) {
        return dataType.wireValue() + "_" + UUID.randomUUID().toString().replace("-", "");
    }

    private static Counter operationCounter(MeterRegistry registry, String operation, String outcome) {
        return Counter.builder("pii_token_operations")
                .description("Secure token operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry);
    }
}
