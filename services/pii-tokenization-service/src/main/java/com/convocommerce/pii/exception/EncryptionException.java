package com.convocommerce.pii.exception;

/**
 * Raised when the key service is unreachable or refuses an encrypt/decrypt request,
 * including a decrypt attempted under a context that does not match the ciphertext.
 */
public class EncryptionException extends PiiProtectionException {

    public EncryptionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause, true);
    }

    public static EncryptionException encryptFailed(String message, Throwable cause) {
        return new EncryptionException(ErrorCode.ENCRYPTION_FAILED, message, cause);
    }

    public static EncryptionException decryptFailed(String message, Throwable cause) {
        return new EncryptionException(ErrorCode.DECRYPTION_FAILED, message, cause);
    }
}
