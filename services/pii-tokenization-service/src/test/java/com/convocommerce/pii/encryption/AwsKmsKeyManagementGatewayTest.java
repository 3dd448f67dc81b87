package com.convocommerce.pii.encryption;

import com.convocommerce.pii.config.PiiTokenizationProperties;
import com.convocommerce.pii.domain.DataType;
import com.convocommerce.pii.exception.EncryptionException;
import com.convocommerce.pii.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.DecryptResponse;
import software.amazon.awssdk.services.kms.model.EncryptRequest;
import software.amazon.awssdk.services.kms.model.EncryptResponse;
import software.amazon.awssdk.services.kms.model.InvalidCiphertextException;
import software.amazon.awssdk.services.kms.model.KmsException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AwsKmsKeyManagementGateway Unit Tests")
class AwsKmsKeyManagementGatewayTest {

    private static final EncryptionContext CONTEXT =
            new EncryptionContext("payment_0123456789abcdef0123456789abcdef", "merchant_123", DataType.PAYMENT);

    @Mock
    private KmsClient kmsClient;

    private AwsKmsKeyManagementGateway gateway;

    @BeforeEach
    void setUp() {
        PiiTokenizationProperties properties = new PiiTokenizationProperties();
        properties.getKms().setKeyId("alias/test-key");
        gateway = new AwsKmsKeyManagementGateway(kmsClient, properties);
    }

    @Test
    @DisplayName("Should encrypt under the configured key and the full context")
    void shouldSendKeyAndContextOnEncrypt() {
        // Given
        when(kmsClient.encrypt(any(EncryptRequest.class))).thenReturn(EncryptResponse.builder()
                .ciphertextBlob(SdkBytes.fromByteArray(new byte[]{9, 8, 7}))
                .build());

        // When
        byte[] ciphertext = gateway.encrypt("4111111111111111", CONTEXT);

        // Then
        ArgumentCaptor<EncryptRequest> request = ArgumentCaptor.forClass(EncryptRequest.class);
        verify(kmsClient).encrypt(request.capture());
        assertThat(ciphertext).containsExactly(9, 8, 7);
        assertThat(request.getValue().keyId()).isEqualTo("alias/test-key");
        assertThat(request.getValue().plaintext().asUtf8String()).isEqualTo("4111111111111111");
        assertThat(request.getValue().encryptionContext()).containsExactlyInAnyOrderEntriesOf(Map.of(
                "token_id", "payment_0123456789abcdef0123456789abcdef",
                "merchant_id", "merchant_123",
                "data_type", "payment"));
    }

    @Test
    @DisplayName("Should decrypt with the same context")
    void shouldSendContextOnDecrypt() {
        when(kmsClient.decrypt(any(DecryptRequest.class))).thenReturn(DecryptResponse.builder()
                .plaintext(SdkBytes.fromUtf8String("4111111111111111"))
                .build());

        String plaintext = gateway.decrypt(new byte[]{9, 8, 7}, CONTEXT);

        ArgumentCaptor<DecryptRequest> request = ArgumentCaptor.forClass(DecryptRequest.class);
        verify(kmsClient).decrypt(request.capture());
        assertThat(plaintext).isEqualTo("4111111111111111");
        assertThat(request.getValue().encryptionContext()).isEqualTo(CONTEXT.asMap());
        assertThat(request.getValue().ciphertextBlob().asByteArray()).containsExactly(9, 8, 7);
    }

    @Test
    @DisplayName("Should map a KMS encrypt error to an encryption failure")
    void shouldWrapEncryptError() {
        when(kmsClient.encrypt(any(EncryptRequest.class)))
                .thenThrow(KmsException.builder().message("AccessDenied").build());

        assertThatThrownBy(() -> gateway.encrypt("x", CONTEXT))
                .isInstanceOf(EncryptionException.class)
                .hasMessageContaining("AccessDenied")
                .satisfies(e -> assertThat(((EncryptionException) e).getErrorCode())
                        .isEqualTo(ErrorCode.ENCRYPTION_FAILED));
    }

    @Test
    @DisplayName("Should map a context mismatch to a decryption failure")
    void shouldWrapDecryptError() {
        when(kmsClient.decrypt(any(DecryptRequest.class)))
                .thenThrow(InvalidCiphertextException.builder().message("InvalidCiphertext").build());

        assertThatThrownBy(() -> gateway.decrypt(new byte[]{1}, CONTEXT))
                .isInstanceOf(EncryptionException.class)
                .satisfies(e -> assertThat(((EncryptionException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DECRYPTION_FAILED));
    }

    @Test
    @DisplayName("Should fail when KMS returns no ciphertext")
    void shouldRejectEmptyEncryptResponse() {
        when(kmsClient.encrypt(any(EncryptRequest.class))).thenReturn(EncryptResponse.builder().build());

        assertThatThrownBy(() -> gateway.encrypt("x", CONTEXT))
                .isInstanceOf(EncryptionException.class)
                .hasMessageContaining("no ciphertext");
    }
}
