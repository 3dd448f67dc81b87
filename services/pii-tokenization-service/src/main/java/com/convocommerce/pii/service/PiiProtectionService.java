package com.convocommerce.pii.service;

import com.convocommerce.pii.domain.DataType;
import com.convocommerce.pii.dto.BatchSanitizationResult;
import com.convocommerce.pii.dto.ConversationLog;
import com.convocommerce.pii.dto.ConversationSanitizationResult;
import com.convocommerce.pii.dto.LeakScanResult;
import com.convocommerce.pii.dto.PaymentTokenizationResult;
import com.convocommerce.pii.dto.TokenizedUserData;
import com.convocommerce.pii.redaction.RedactionResult;
import com.convocommerce.pii.redaction.TextRedactor;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point for the chat, ingestion and billing layers. Every call is a short,
 * stateless request; the only suspension points are the key service and the token table.
 */
@Service
@RequiredArgsConstructor
public class PiiProtectionService {

    private final TextRedactor textRedactor;
    private final StructuralTokenizer structuralTokenizer;
    private final SecureTokenService secureTokenService;
    private final PaymentTokenizer paymentTokenizer;
    private final ConversationSanitizer conversationSanitizer;
    private final PaymentTokenLeakScanner leakScanner;

    public RedactionResult redactQuery(String text) {
        return textRedactor.redactQuery(text);
    }

    public String sanitizeResponse(String text) {
        return textRedactor.sanitizeResponse(text);
    }

    public String detokenize(String sanitizedText, Map<String, String> tokens) {
        return textRedactor.detokenize(sanitizedText, tokens);
    }

    public TokenizedUserData tokenizeUserData(JsonNode userData) {
        return structuralTokenizer.tokenizeUserData(userData);
    }

    public String createSecureToken(String plaintext, DataType dataType, String merchantId,
                                    String ownerId, Integer ttlHours) {
        return secureTokenService.createSecureToken(plaintext, dataType, merchantId, ownerId, ttlHours);
    }

    public String retrieveFromToken(String tokenId, String merchantId) {
        return secureTokenService.retrieveFromToken(tokenId, merchantId);
    }

    public void deleteToken(String tokenId, String merchantId) {
        secureTokenService.deleteToken(tokenId, merchantId);
    }

    public PaymentTokenizationResult tokenizePaymentData(JsonNode paymentData, String merchantId, String ownerId) {
        return paymentTokenizer.tokenizePaymentData(paymentData, merchantId, ownerId);
    }

    public ConversationSanitizationResult sanitizeConversationLog(ConversationLog conversation, String merchantId) {
        return conversationSanitizer.sanitizeConversationLog(conversation, merchantId);
    }

    public BatchSanitizationResult sanitizeConversationLogs(List<ConversationLog> conversations, String merchantId) {
        return conversationSanitizer.sanitizeBatch(conversations, merchantId);
    }

    public LeakScanResult validateNoPaymentTokens(JsonNode record) {
        return leakScanner.scan(record);
    }
}
