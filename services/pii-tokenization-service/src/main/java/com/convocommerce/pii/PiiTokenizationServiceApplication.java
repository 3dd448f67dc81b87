package com.convocommerce.pii;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PII Tokenization Service Application
 *
 * Protects personal and payment data flowing through merchant conversations.
 *
 * Features:
 * - Regex detection of emails, phones, SSNs, card numbers, addresses and processor tokens
 * - Placeholder redaction of free text and structured records
 * - Reversible secure tokens encrypted with AWS KMS under a per-merchant context
 * - Token persistence in DynamoDB keyed by (token id, merchant id), with expiry
 * - Critical/non-critical failure policy for payment fields
 *
 * Security:
 * - Plaintext is never persisted or logged
 * - A token presented by another merchant is indistinguishable from a missing one
 * - Token ids carry 128 random bits
 */
@SpringBootApplication
public class PiiTokenizationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PiiTokenizationServiceApplication.class, args);
    }
}
