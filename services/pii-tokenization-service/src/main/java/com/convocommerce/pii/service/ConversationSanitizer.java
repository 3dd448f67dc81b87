package com.convocommerce.pii.service;

import com.convocommerce.pii.config.PiiTokenizationProperties;
import com.convocommerce.pii.detection.PatternDetector;
import com.convocommerce.pii.detection.PiiMatch;
import com.convocommerce.pii.domain.DataType;
import com.convocommerce.pii.dto.BatchSanitizationResult;
import com.convocommerce.pii.dto.ConversationLog;
import com.convocommerce.pii.dto.ConversationSanitizationResult;
import com.convocommerce.pii.dto.RedactionSummary;
import com.convocommerce.pii.dto.SanitizedConversation;
import com.convocommerce.pii.exception.PiiProtectionException;
import com.convocommerce.pii.redaction.RedactionResult;
import com.convocommerce.pii.redaction.TextRedactor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Strips PII from a conversation turn before it is written to the conversation log.
 *
 * <ul>
 *   <li>{@code user_message}: placeholder redaction, see {@link TextRedactor#redactQuery(String)}</li>
 *   <li>{@code assistant_response}: {@code [REDACTED]} markers</li>
 *   <li>{@code context} and {@code metadata}: sensitive-keyed scalars become persisted
 *       {@code personal_...} tokens, any other non-null value under a sensitive key becomes
 *       {@code [REDACTED]}, other strings get {@code [REDACTED]} markers</li>
 * </ul>
 *
 * Fields without PII come back untouched.
 */
@Slf4j
@Service
public class ConversationSanitizer {

    static final String USER_MESSAGE = "user_message";
    static final String ASSISTANT_RESPONSE = "assistant_response";
    static final String CONTEXT = "context";
    static final String METADATA = "metadata";

    static final String FALLBACK_TEXT = "[REDACTED - SANITIZATION_FAILED]";

    private final TextRedactor textRedactor;
    private final PatternDetector patternDetector;
    private final StructuralTokenizer structuralTokenizer;
    private final SecureTokenService secureTokenService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SensitiveFieldMatcher sensitiveFields;
    private final int tokenTtlHours;

    public ConversationSanitizer(TextRedactor textRedactor,
                                 PatternDetector patternDetector,
                                 StructuralTokenizer structuralTokenizer,
                                 SecureTokenService secureTokenService,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 PiiTokenizationProperties properties) {
        this.textRedactor = textRedactor;
        this.patternDetector = patternDetector;
        this.structuralTokenizer = structuralTokenizer;
        this.secureTokenService = secureTokenService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sensitiveFields = SensitiveFieldMatcher.containing(properties.getConversation().getSensitiveFields());
        this.tokenTtlHours = properties.getConversation().getTokenTtlHours();
    }

    public ConversationSanitizationResult sanitizeConversationLog(ConversationLog conversation, String merchantId) {
        Assert.notNull(conversation, "conversation must not be null");
        Assert.hasText(merchantId, "merchantId must not be blank");

        List<String> fieldsRedacted = new ArrayList<>();
        int patternsFound = 0;

        String userMessage = conversation.getUserMessage();
        if (userMessage != null) {
            RedactionResult redacted = textRedactor.redactQuery(userMessage);
            if (redacted.hasRedactions()) {
                fieldsRedacted.add(USER_MESSAGE);
                patternsFound += redacted.getTokens().size();
                userMessage = redacted.getSanitizedText();
            }
        }

        String assistantResponse = conversation.getAssistantResponse();
        if (assistantResponse != null) {
            List<PiiMatch> matches = patternDetector.detect(assistantResponse);
            if (!matches.isEmpty()) {
                fieldsRedacted.add(ASSISTANT_RESPONSE);
                patternsFound += matches.size();
                assistantResponse = textRedactor.replaceMatches(assistantResponse, matches, TextRedactor.REDACTED_MARKER);
            }
        }

        StructuredPass context = sanitizeStructured(conversation.getContext(), merchantId);
        if (context.changed()) {
            fieldsRedacted.add(CONTEXT);
            patternsFound += context.leavesRedacted;
        }

        StructuredPass metadata = sanitizeStructured(conversation.getMetadata(), merchantId);
        if (metadata.changed()) {
            fieldsRedacted.add(METADATA);
            patternsFound += metadata.leavesRedacted;
        }

        SanitizedConversation sanitized = SanitizedConversation.builder()
                .userMessage(userMessage)
                .assistantResponse(assistantResponse)
                .context(context.result)
                .metadata(metadata.result)
                .redactionApplied(!fieldsRedacted.isEmpty())
                .redactionTimestamp(clock.instant())
                .build();

        RedactionSummary summary = RedactionSummary.builder()
                .fieldsRedacted(fieldsRedacted)
                .tokensCreated(context.tokensCreated + metadata.tokensCreated)
                .piiPatternsFound(patternsFound)
                .build();

        log.info("Sanitized conversation for merchant {}: fields_redacted={}, pii_patterns_found={}",
                merchantId, fieldsRedacted, patternsFound);
        return new ConversationSanitizationResult(sanitized, summary);
    }

    /**
     * Sanitizes each entry on its own. An entry that throws is replaced by a fully
     * redacted fallback and reported in the errors list; the rest of the batch carries on.
     */
    public BatchSanitizationResult sanitizeBatch(List<ConversationLog> conversations, String merchantId) {
        Assert.notNull(conversations, "conversations must not be null");
        log.info("Batch sanitizing {} conversation entries for merchant {}", conversations.size(), merchantId);

        List<ConversationSanitizationResult> sanitized = new ArrayList<>(conversations.size());
        List<BatchSanitizationResult.EntryError> errors = new ArrayList<>();
        for (int i = 0; i < conversations.size(); i++) {
            try {
                sanitized.add(sanitizeConversationLog(conversations.get(i), merchantId));
            } catch (RuntimeException e) {
                log.error("Failed to sanitize conversation entry {} for merchant {}: {}", i, merchantId, e.getMessage());
                errors.add(new BatchSanitizationResult.EntryError(i, e.getMessage()));
                sanitized.add(fallback());
            }
        }

        log.info("Batch sanitization completed: {} processed, {} errors", sanitized.size(), errors.size());
        return new BatchSanitizationResult(sanitized, errors);
    }

    ConversationSanitizationResult fallback() {
        ObjectNode context = objectMapper.createObjectNode()
                .put("redacted", true)
                .put("reason", "sanitization_failure");
        ObjectNode metadata = objectMapper.createObjectNode()
                .put("sanitization_failed", true);

        SanitizedConversation sanitized = SanitizedConversation.builder()
                .userMessage(FALLBACK_TEXT)
                .assistantResponse(FALLBACK_TEXT)
                .context(context)
                .metadata(metadata)
                .redactionApplied(true)
                .redactionTimestamp(clock.instant())
                .build();
        RedactionSummary summary = RedactionSummary.builder()
                .fieldRedacted(USER_MESSAGE)
                .fieldRedacted(ASSISTANT_RESPONSE)
                .fieldRedacted(CONTEXT)
                .tokensCreated(0)
                .piiPatternsFound(0)
                .build();
        return new ConversationSanitizationResult(sanitized, summary);
    }

    private StructuredPass sanitizeStructured(JsonNode record, String merchantId) {
        StructuredPass pass = new StructuredPass();
        if (record == null || !record.isContainerNode()) {
            pass.result = record;
            return pass;
        }

        JsonNode walked = structuralTokenizer.tokenize(record, sensitiveFields, new LeafTransformer() {
            @Override
            public JsonNode sensitiveLeaf(String field, String value) {
                pass.leavesRedacted++;
                try {
                    String tokenId = secureTokenService.createSecureToken(
                            value, DataType.PERSONAL, merchantId, null, tokenTtlHours);
                    pass.tokensCreated++;
                    return TextNode.valueOf(tokenId);
                } catch (PiiProtectionException e) {
                    log.warn("Could not tokenize conversation field {} for merchant {}, redacting: {}",
                            field, merchantId, e.getMessage());
                    return TextNode.valueOf(TextRedactor.REDACTED_MARKER);
                }
            }

            @Override
            public JsonNode sensitiveValue(String field, JsonNode value) {
                if (value.isNull()) {
                    return null;
                }
                pass.leavesRedacted++;
                return TextNode.valueOf(TextRedactor.REDACTED_MARKER);
            }

            @Override
            public String textLeaf(String field, String value) {
                List<PiiMatch> matches = patternDetector.detect(value);
                if (matches.isEmpty()) {
                    return value;
                }
                pass.leavesRedacted += matches.size();
                return textRedactor.replaceMatches(value, matches, TextRedactor.REDACTED_MARKER);
            }
        });

        // untouched records are handed back as the caller's own instance
        pass.result = pass.leavesRedacted > 0 ? walked : record;
        return pass;
    }

    private static final class StructuredPass {
        JsonNode result;
        int leavesRedacted;
        int tokensCreated;

        boolean changed() {
            return leavesRedacted > 0;
        }
    }
}
