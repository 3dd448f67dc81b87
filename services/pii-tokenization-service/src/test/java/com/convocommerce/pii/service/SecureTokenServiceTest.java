package com.convocommerce.pii.service;

import com.convocommerce.pii.config.PiiTokenizationProperties;
import com.convocommerce.pii.domain.DataType;
import com.convocommerce.pii.domain.PiiToken;
import com.convocommerce.pii.exception.ErrorCode;
import com.convocommerce.pii.exception.TokenCreationException;
import com.convocommerce.pii.exception.TokenIdCollisionException;
import com.convocommerce.pii.exception.TokenPersistenceException;
import com.convocommerce.pii.exception.UnreadableTokenRecordException;
import com.convocommerce.pii.repository.TokenStore;
import com.convocommerce.pii.support.FakeKeyManagementGateway;
import com.convocommerce.pii.support.InMemoryTokenStore;
import com.convocommerce.pii.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SecureTokenService Unit Tests")
class SecureTokenServiceTest {

    private static final String MERCHANT = "merchant_123";
    private static final String OTHER_MERCHANT = "merchant_456";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private FakeKeyManagementGateway keyManagement;
    private InMemoryTokenStore tokenStore;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private PiiTokenizationProperties properties;
    private SecureTokenService secureTokenService;

    @BeforeEach
    void setUp() {
        keyManagement = new FakeKeyManagementGateway();
        tokenStore = new InMemoryTokenStore();
        clock = new MutableClock(NOW);
        meterRegistry = new SimpleMeterRegistry();
        properties = new PiiTokenizationProperties();
        secureTokenService = new SecureTokenService(keyManagement, tokenStore, clock, meterRegistry, properties);
    }

    @Nested
    @DisplayName("Token creation")
    class Create {

        @Test
        @DisplayName("Should mint a prefixed token and persist only ciphertext")
        void shouldMintPrefixedToken() {
            // When
            String tokenId = secureTokenService.createSecureToken("john@example.com", DataType.PERSONAL, MERCHANT);

            // Then
            assertThat(tokenId).matches("personal_[a-f0-9]{32}");
            assertThat(tokenStore.contains(tokenId, MERCHANT)).isTrue();
            assertThat(tokenStore.get(tokenId, MERCHANT))
                    .get()
                    .satisfies(token -> {
                        assertThat(token.getDataType()).isEqualTo(DataType.PERSONAL);
                        assertThat(token.getCreatedAt()).isEqualTo(NOW);
                        assertThat(token.getExpiresAt()).isNull();
                        assertThat(new String(token.getEncryptedValue(), StandardCharsets.UTF_8))
                                .doesNotContain("john@example.com");
                    });
        }

        @Test
        @DisplayName("Should stamp expiry and owner when given")
        void shouldRecordTtlAndOwner() {
            String tokenId = secureTokenService.createSecureToken(
                    "4111111111111111", DataType.PAYMENT, MERCHANT, "customer_9", 24);

            PiiToken token = tokenStore.get(tokenId, MERCHANT).orElseThrow();
            assertThat(tokenId).startsWith("payment_");
            assertThat(token.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(24)));
            assertThat(token.getOwnerId()).isEqualTo("customer_9");
        }

        @Test
        @DisplayName("Should mint a distinct id for every call with the same input")
        void shouldMintDistinctIds() {
            Set<String> ids = new HashSet<>();
            for (int i = 0; i < 50; i++) {
                ids.add(secureTokenService.createSecureToken("same value", DataType.CONTACT, MERCHANT));
            }

            assertThat(ids).hasSize(50);
            assertThat(tokenStore.size()).isEqualTo(50);
        }

        @Test
        @DisplayName("Should fail token creation when the key service rejects encryption")
        void shouldWrapEncryptionFailure() {
            keyManagement.rejectAll();

            assertThatThrownBy(() -> secureTokenService.createSecureToken("x", DataType.PERSONAL, MERCHANT))
                    .isInstanceOf(TokenCreationException.class)
                    .hasMessageContaining("KMS error")
                    .satisfies(e -> assertThat(((TokenCreationException) e).getErrorCode())
                            .isEqualTo(ErrorCode.TOKEN_CREATION_FAILED));
            assertThat(tokenStore.size()).isZero();
        }

        @Test
        @DisplayName("Should fail token creation when the store is unavailable")
        void shouldWrapPersistenceFailure() {
            tokenStore.setUnavailable(true);

            assertThatThrownBy(() -> secureTokenService.createSecureToken("x", DataType.PERSONAL, MERCHANT))
                    .isInstanceOf(TokenCreationException.class)
                    .hasCauseInstanceOf(TokenPersistenceException.class);
            assertThat(counter("create", "failure")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject missing arguments")
        void shouldValidateArguments() {
            assertThatThrownBy(() -> secureTokenService.createSecureToken(null, DataType.PERSONAL, MERCHANT))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> secureTokenService.createSecureToken("x", null, MERCHANT))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> secureTokenService.createSecureToken("x", DataType.PERSONAL, " "))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> secureTokenService.createSecureToken("x", DataType.PERSONAL, MERCHANT, null, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Token id collisions")
    class Collisions {

        private TokenStore collidingStore;

        @BeforeEach
        void setUp() {
            collidingStore = mock(TokenStore.class);
            secureTokenService = new SecureTokenService(keyManagement, collidingStore, clock, meterRegistry, properties);
        }

        @Test
        @DisplayName("Should mint a fresh id after a collision")
        void shouldRetryWithFreshId() {
            doThrow(new TokenIdCollisionException("personal_taken", null))
                    .doNothing()
                    .when(collidingStore).put(any(PiiToken.class));

            String tokenId = secureTokenService.createSecureToken("x", DataType.PERSONAL, MERCHANT);

            assertThat(tokenId).matches("personal_[a-f0-9]{32}");
            verify(collidingStore, times(2)).put(any(PiiToken.class));
        }

        @Test
        @DisplayName("Should give up after the configured number of attempts")
        void shouldGiveUpAfterMaxAttempts() {
            doThrow(new TokenIdCollisionException("personal_taken", null))
                    .when(collidingStore).put(any(PiiToken.class));

            assertThatThrownBy(() -> secureTokenService.createSecureToken("x", DataType.PERSONAL, MERCHANT))
                    .isInstanceOf(TokenCreationException.class)
                    .hasMessageContaining("collided 3 times");
            verify(collidingStore, times(3)).put(any(PiiToken.class));
        }
    }

    @Nested
    @DisplayName("Token retrieval")
    class Retrieve {

        @Test
        @DisplayName("Should return the plaintext to the owning merchant")
        void shouldRoundTrip() {
            String tokenId = secureTokenService.createSecureToken("555-123-4567", DataType.CONTACT, MERCHANT);

            assertThat(secureTokenService.retrieveFromToken(tokenId, MERCHANT)).isEqualTo("555-123-4567");
            assertThat(counter("retrieve", "success")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should return null to any other merchant")
        void shouldIsolateTenants() {
            String tokenId = secureTokenService.createSecureToken("secret", DataType.PERSONAL, MERCHANT);

            assertThat(secureTokenService.retrieveFromToken(tokenId, OTHER_MERCHANT)).isNull();
            assertThat(secureTokenService.retrieveFromToken(tokenId, MERCHANT)).isEqualTo("secret");
        }

        @Test
        @DisplayName("Should return null for unknown, null and blank token ids")
        void shouldReturnNullForUnknownTokens() {
            assertThat(secureTokenService.retrieveFromToken("personal_00000000000000000000000000000000", MERCHANT)).isNull();
            assertThat(secureTokenService.retrieveFromToken(null, MERCHANT)).isNull();
            assertThat(secureTokenService.retrieveFromToken("", MERCHANT)).isNull();
            assertThat(secureTokenService.retrieveFromToken("personal_abc", null)).isNull();
        }

        @Test
        @DisplayName("Should serve a token until its expiry instant and delete it from then on")
        void shouldExpireTokens() {
            String tokenId = secureTokenService.createSecureToken("x", DataType.PAYMENT, MERCHANT, null, 1);

            clock.advance(Duration.ofMinutes(59));
            assertThat(secureTokenService.retrieveFromToken(tokenId, MERCHANT)).isEqualTo("x");

            clock.advance(Duration.ofMinutes(1));
            assertThat(secureTokenService.retrieveFromToken(tokenId, MERCHANT)).isNull();
            assertThat(tokenStore.contains(tokenId, MERCHANT)).isFalse();
            assertThat(counter("retrieve", "expired")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should still return null when deleting an expired token fails")
        void shouldTolerateFailedExpiryDelete() {
            TokenStore store = mock(TokenStore.class);
            PiiToken expired = PiiToken.builder()
                    .tokenId("personal_abc")
                    .merchantId(MERCHANT)
                    .dataType(DataType.PERSONAL)
                    .encryptedValue(new byte[]{1})
                    .createdAt(NOW.minus(Duration.ofHours(2)))
                    .expiresAt(NOW.minus(Duration.ofHours(1)))
                    .build();
            when(store.get("personal_abc", MERCHANT)).thenReturn(Optional.of(expired));
            doThrow(new TokenPersistenceException("throttled", null)).when(store).delete(anyString(), anyString());
            SecureTokenService service = new SecureTokenService(keyManagement, store, clock, meterRegistry, properties);

            assertThat(service.retrieveFromToken("personal_abc", MERCHANT)).isNull();
        }

        @Test
        @DisplayName("Should return null when the ciphertext does not decrypt")
        void shouldReturnNullOnDecryptFailure() {
            TokenStore store = mock(TokenStore.class);
            when(store.get("personal_abc", MERCHANT)).thenReturn(Optional.of(PiiToken.builder()
                    .tokenId("personal_abc")
                    .merchantId(MERCHANT)
                    .dataType(DataType.PERSONAL)
                    .encryptedValue("garbage".getBytes(StandardCharsets.UTF_8))
                    .createdAt(NOW)
                    .build()));
            SecureTokenService service = new SecureTokenService(keyManagement, store, clock, meterRegistry, properties);

            assertThat(service.retrieveFromToken("personal_abc", MERCHANT)).isNull();
            assertThat(counter("retrieve", "decrypt_failure")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should return null when the stored record is unreadable")
        void shouldReturnNullOnUnreadableRecord() {
            TokenStore store = mock(TokenStore.class);
            when(store.get("personal_abc", MERCHANT))
                    .thenThrow(new UnreadableTokenRecordException("personal_abc", "unknown data type", null));
            SecureTokenService service = new SecureTokenService(keyManagement, store, clock, meterRegistry, properties);

            assertThat(service.retrieveFromToken("personal_abc", MERCHANT)).isNull();
            assertThat(counter("retrieve", "decrypt_failure")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should refuse a record copied under another merchant")
        void shouldRejectRecordMovedAcrossTenants() {
            String tokenId = secureTokenService.createSecureToken("secret", DataType.PERSONAL, MERCHANT);
            PiiToken original = tokenStore.get(tokenId, MERCHANT).orElseThrow();

            TokenStore tampered = mock(TokenStore.class);
            when(tampered.get(tokenId, OTHER_MERCHANT))
                    .thenReturn(Optional.of(original.toBuilder().merchantId(OTHER_MERCHANT).build()));
            SecureTokenService service = new SecureTokenService(keyManagement, tampered, clock, meterRegistry, properties);

            assertThat(service.retrieveFromToken(tokenId, OTHER_MERCHANT)).isNull();
        }

        @Test
        @DisplayName("Should propagate a store outage on read")
        void shouldPropagateReadOutage() {
            String tokenId = secureTokenService.createSecureToken("x", DataType.PERSONAL, MERCHANT);
            tokenStore.setUnavailable(true);

            assertThatThrownBy(() -> secureTokenService.retrieveFromToken(tokenId, MERCHANT))
                    .isInstanceOf(TokenPersistenceException.class);
        }
    }

    @Nested
    @DisplayName("Token deletion")
    class Delete {

        @Test
        @DisplayName("Should remove the token for its merchant only")
        void shouldDeleteToken() {
            String tokenId = secureTokenService.createSecureToken("x", DataType.ADDRESS, MERCHANT);

            secureTokenService.deleteToken(tokenId, OTHER_MERCHANT);
            assertThat(tokenStore.contains(tokenId, MERCHANT)).isTrue();

            secureTokenService.deleteToken(tokenId, MERCHANT);
            assertThat(tokenStore.contains(tokenId, MERCHANT)).isFalse();
            assertThat(secureTokenService.retrieveFromToken(tokenId, MERCHANT)).isNull();
        }

        @Test
        @DisplayName("Should propagate a store outage on delete")
        void shouldPropagateDeleteOutage() {
            TokenStore store = mock(TokenStore.class);
            doThrow(new TokenPersistenceException("down", null)).when(store).delete("address_x", MERCHANT);
            SecureTokenService service = new SecureTokenService(keyManagement, store, clock, meterRegistry, properties);

            assertThatThrownBy(() -> service.deleteToken("address_x", MERCHANT))
                    .isInstanceOf(TokenPersistenceException.class);
        }
    }

    private double counter(String operation, String outcome) {
        return meterRegistry.get("pii_token_operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .counter()
                .count();
    }
}
