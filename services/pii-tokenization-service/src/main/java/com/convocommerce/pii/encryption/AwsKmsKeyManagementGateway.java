package com.convocommerce.pii.encryption;

import com.convocommerce.pii.config.PiiTokenizationProperties;
import com.convocommerce.pii.exception.EncryptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.DecryptResponse;
import software.amazon.awssdk.services.kms.model.EncryptRequest;
import software.amazon.awssdk.services.kms.model.EncryptResponse;

/**
 * {@link KeyManagementGateway} backed by AWS KMS. The encryption context is passed
 * through unchanged, so KMS itself rejects a decrypt under a different tenant.
 */
@Slf4j
@Component
public class AwsKmsKeyManagementGateway implements KeyManagementGateway {

    private final KmsClient kmsClient;
    private final String keyId;

    public AwsKmsKeyManagementGateway(KmsClient kmsClient, PiiTokenizationProperties properties) {
        this.kmsClient = kmsClient;
        this.keyId = properties.getKms().getKeyId();
    }

    @Override
    public byte[] encrypt(String plaintext, EncryptionContext context) {
        try {
            EncryptResponse response = kmsClient.encrypt(EncryptRequest.builder()
                    .keyId(keyId)
                    .plaintext(SdkBytes.fromUtf8String(plaintext))
                    .encryptionContext(context.asMap())
                    .build());

            if (response.ciphertextBlob() == null) {
                throw EncryptionException.encryptFailed("KMS returned no ciphertext for token " + context.getTokenId(), null);
            }
            return response.ciphertextBlob().asByteArray();

        } catch (SdkException e) {
            log.error("KMS encrypt failed for token {} merchant {}: {}",
                    context.getTokenId(), context.getMerchantId(), e.getMessage());
            throw EncryptionException.encryptFailed("KMS encryption failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String decrypt(byte[] ciphertext, EncryptionContext context) {
        try {
            DecryptResponse response = kmsClient.decrypt(DecryptRequest.builder()
                    .keyId(keyId)
                    .ciphertextBlob(SdkBytes.fromByteArray(ciphertext))
                    .encryptionContext(context.asMap())
                    .build());

            if (response.plaintext() == null) {
                throw EncryptionException.decryptFailed("KMS returned no plaintext for token " + context.getTokenId(), null);
            }
            return response.plaintext().asUtf8String();

        } catch (SdkException e) {
            // InvalidCiphertextException lands here when the context does not match
            log.debug("KMS decrypt failed for token {}: {}", context.getTokenId(), e.getMessage());
            throw EncryptionException.decryptFailed("KMS decryption failed: " + e.getMessage(), e);
        }
    }
}
