package com.convocommerce.pii.detection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Regex scanner for the PII shapes in {@link PiiType}.
 *
 * <p>Every type is scanned over the whole input on its own, then the hits are merged
 * left to right: the earliest-starting match wins, ties go to the longest, and any
 * later match overlapping an accepted one is dropped. Near-misses simply do not match.
 */
@Slf4j
@Component
public class PatternDetector {

    private static final Comparator<PiiMatch> EARLIEST_THEN_LONGEST = Comparator
            .comparingInt(PiiMatch::getStartIndex)
            .thenComparing(Comparator.comparingInt(PiiMatch::length).reversed())
            .thenComparingInt(match -> match.getType().ordinal());

    private final Set<PiiType> enabledTypes;

    public PatternDetector() {
        this(EnumSet.allOf(PiiType.class));
    }

    public PatternDetector(Set<PiiType> enabledTypes) {
        this.enabledTypes = EnumSet.copyOf(enabledTypes);
    }

    /**
     * @return non-overlapping matches ordered by start index; empty for null or blank text
     */
    public List<PiiMatch> detect(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }

        List<PiiMatch> candidates = new ArrayList<>();
        for (PiiType type : enabledTypes) {
            Matcher matcher = type.getPattern().matcher(text);
            while (matcher.find()) {
                candidates.add(new PiiMatch(type, matcher.start(), matcher.end(), matcher.group()));
            }
        }
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }

        candidates.sort(EARLIEST_THEN_LONGEST);
        List<PiiMatch> accepted = new ArrayList<>(candidates.size());
        PiiMatch last = null;
        for (PiiMatch candidate : candidates) {
            // accepted matches are sorted and disjoint, so only the last one can overlap
            if (last == null || !candidate.overlaps(last)) {
                accepted.add(candidate);
                last = candidate;
            }
        }

        log.debug("Detected {} PII matches ({} candidates) in {} chars", accepted.size(), candidates.size(), text.length());
        return accepted;
    }
}
