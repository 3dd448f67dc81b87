package com.convocommerce.pii.encryption;

import com.convocommerce.pii.exception.EncryptionException;

/**
 * Envelope-encryption key service, narrowed to what token minting needs.
 */
public interface KeyManagementGateway {

    /**
     * @throws EncryptionException if the key service is unreachable or refuses the request
     */
    byte[] encrypt(String plaintext, EncryptionContext context);

    /**
     * @throws EncryptionException if the key service is unreachable, refuses the request,
     *         or {@code context} is not the one the ciphertext was produced under
     */
    String decrypt(byte[] ciphertext, EncryptionContext context);
}
