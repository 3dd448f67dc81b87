package com.convocommerce.pii.redaction;

import com.convocommerce.pii.detection.PatternDetector;
import com.convocommerce.pii.detection.PiiMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Free-text redaction on top of {@link PatternDetector}.
 *
 * <p>{@link #redactQuery(String)} swaps each match for a per-call placeholder
 * {@code [PII_TOKEN_<seq>_<8 hex>]} and hands the mapping back to the caller;
 * {@link #sanitizeResponse(String)} swaps matches for {@code [REDACTED]} and keeps nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TextRedactor {

    public static final String REDACTED_MARKER = "[REDACTED]";

    private static final String PLACEHOLDER_FORMAT = "[PII_TOKEN_%d_%s]";

    private final PatternDetector patternDetector;

    public RedactionResult redactQuery(String text) {
        List<PiiMatch> matches = patternDetector.detect(text);
        if (matches.isEmpty()) {
            return RedactionResult.unchanged(text);
        }

        Map<String, String> tokens = new LinkedHashMap<>();
        StringBuilder sanitized = new StringBuilder(text.length() + matches.size() * 24);
        int cursor = 0;
        int sequence = 0;
        for (PiiMatch match : matches) {
            String placeholder = String.format(PLACEHOLDER_FORMAT, sequence++, shortHex());
            sanitized.append(text, cursor, match.getStartIndex()).append(placeholder);
            tokens.put(placeholder, match.getMatchedText());
            cursor = match.getEndIndex();
        }
        sanitized.append(text, cursor, text.length());

        log.debug("Redacted {} PII matches from query", tokens.size());
        return new RedactionResult(sanitized.toString(), tokens);
    }

    public String sanitizeResponse(String text) {
        return replaceMatches(text, patternDetector.detect(text), REDACTED_MARKER);
    }

    /**
     * Puts original values back in place of the placeholders a previous
     * {@link #redactQuery(String)} produced. Placeholders not in the map stay as they are.
     */
    public String detokenize(String sanitizedText, Map<String, String> tokens) {
        if (sanitizedText == null || tokens == null || tokens.isEmpty()) {
            return sanitizedText;
        }
        String result = sanitizedText;
        for (Map.Entry<String, String> entry : tokens.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Replaces every match with {@code replacement}. {@code matches} must come from
     * {@link PatternDetector#detect(String)} on the same text.
     */
    public String replaceMatches(String text, List<PiiMatch> matches, String replacement) {
        if (matches.isEmpty()) {
            return text;
        }
        StringBuilder sanitized = new StringBuilder(text.length());
        int cursor = 0;
        for (PiiMatch match : matches) {
            sanitized.append(text, cursor, match.getStartIndex()).append(replacement);
            cursor = match.getEndIndex();
        }
        sanitized.append(text, cursor, text.length());
        return sanitized.toString();
    }

    private static String shortHex() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
