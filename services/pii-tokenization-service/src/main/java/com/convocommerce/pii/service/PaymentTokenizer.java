package com.convocommerce.pii.service;

import com.convocommerce.pii.config.PiiTokenizationProperties;
import com.convocommerce.pii.domain.DataType;
import com.convocommerce.pii.domain.NonCriticalFailureMode;
import com.convocommerce.pii.domain.PaymentFieldPolicy;
import com.convocommerce.pii.dto.PaymentTokenizationResult;
import com.convocommerce.pii.dto.TokenMapping;
import com.convocommerce.pii.exception.CriticalFieldTokenizationException;
import com.convocommerce.pii.exception.PiiProtectionException;
import com.convocommerce.pii.redaction.TextRedactor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Replaces the payment fields named in the {@link PaymentFieldPolicy} with persisted
 * {@code payment_<32 hex>} tokens.
 *
 * <p>A critical field that cannot be tokenized fails the whole call with
 * {@link CriticalFieldTokenizationException}; nothing partially tokenized is returned.
 * A non-critical failure is absorbed according to the {@link NonCriticalFailureMode}.
 */
@Slf4j
@Service
public class PaymentTokenizer {

    private final SecureTokenService secureTokenService;
    private final PaymentFieldPolicy fieldPolicy;
    private final ObjectMapper objectMapper;
    private final int tokenTtlHours;
    private final NonCriticalFailureMode defaultFailureMode;

    private final Counter criticalFailures;
    private final Counter nonCriticalFailures;

    public PaymentTokenizer(SecureTokenService secureTokenService,
                            PaymentFieldPolicy fieldPolicy,
                            ObjectMapper objectMapper,
                            MeterRegistry meterRegistry,
                            PiiTokenizationProperties properties) {
        this.secureTokenService = secureTokenService;
        this.fieldPolicy = fieldPolicy;
        this.objectMapper = objectMapper;
        this.tokenTtlHours = properties.getPayment().getTokenTtlHours();
        this.defaultFailureMode = properties.getPayment().getNonCriticalFailureMode();

        this.criticalFailures = Counter.builder("pii_payment_field_failures")
                .description("Payment fields that could not be tokenized")
                .tag("criticality", "critical")
                .register(meterRegistry);
        this.nonCriticalFailures = Counter.builder("pii_payment_field_failures")
                .description("Payment fields that could not be tokenized")
                .tag("criticality", "non_critical")
                .register(meterRegistry);
    }

    public PaymentTokenizationResult tokenizePaymentData(JsonNode paymentData, String merchantId, String ownerId) {
        return tokenizePaymentData(paymentData, merchantId, ownerId, defaultFailureMode);
    }

    /**
     * @param failureMode what to do with a non-critical field whose tokenization fails
     * @throws CriticalFieldTokenizationException naming the first critical field that failed
     */
    public PaymentTokenizationResult tokenizePaymentData(JsonNode paymentData, String merchantId, String ownerId,
                                                         NonCriticalFailureMode failureMode) {
        Assert.notNull(paymentData, "paymentData must not be null");
        Assert.isTrue(paymentData.isObject(), "paymentData must be a JSON object");
        Assert.hasText(merchantId, "merchantId must not be blank");

        ObjectNode tokenized = objectMapper.createObjectNode();
        List<TokenMapping> mappings = new ArrayList<>();

        Iterator<Map.Entry<String, JsonNode>> fields = paymentData.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String field = entry.getKey();
            JsonNode value = entry.getValue();

            if (!fieldPolicy.isTarget(field) || isEmpty(value)) {
                tokenized.set(field, value.deepCopy());
                continue;
            }

            try {
                String tokenId = secureTokenService.createSecureToken(
                        plaintextOf(value), DataType.PAYMENT, merchantId, ownerId, tokenTtlHours);
                tokenized.put(field, tokenId);
                mappings.add(TokenMapping.builder()
                        .field(field)
                        .tokenId(tokenId)
                        .dataClassification(TokenMapping.PAYMENT_CLASSIFICATION)
                        .build());

            } catch (PiiProtectionException e) {
                if (fieldPolicy.isCritical(field)) {
                    criticalFailures.increment();
                    log.error("Critical payment field {} could not be tokenized for merchant {}", field, merchantId);
                    discardMinted(mappings, merchantId);
                    throw new CriticalFieldTokenizationException(field, e);
                }
                nonCriticalFailures.increment();
                log.warn("Non-critical payment field {} could not be tokenized for merchant {}, applying {}",
                        field, merchantId, failureMode);
                applyFailureMode(tokenized, field, value, failureMode);
            }
        }

        log.info("Tokenized {} payment fields for merchant {}", mappings.size(), merchantId);
        return PaymentTokenizationResult.builder()
                .tokenizedData(tokenized)
                .tokenMappings(mappings)
                .build();
    }

    private void discardMinted(List<TokenMapping> mappings, String merchantId) {
        for (TokenMapping mapping : mappings) {
            try {
                secureTokenService.deleteToken(mapping.getTokenId(), merchantId);
            } catch (PiiProtectionException e) {
                log.warn("Could not discard token {} minted before the critical failure: {}",
                        mapping.getTokenId(), e.getMessage());
            }
        }
    }

    private void applyFailureMode(ObjectNode tokenized, String field, JsonNode value, NonCriticalFailureMode mode) {
        switch (mode) {
            case REDACT -> tokenized.put(field, TextRedactor.REDACTED_MARKER);
            case PASS_THROUGH -> tokenized.set(field, value.deepCopy());
            case OMIT -> tokenized.remove(field);
        }
    }

    private String plaintextOf(JsonNode value) {
        if (value.isValueNode()) {
            return value.asText();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize payment field", e);
        }
    }

    private static boolean isEmpty(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return true;
        }
        if (value.isTextual()) {
            return value.textValue().isEmpty();
        }
        return value.isContainerNode() && value.isEmpty();
    }
}
