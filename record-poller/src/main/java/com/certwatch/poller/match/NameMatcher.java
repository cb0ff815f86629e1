package com.certwatch.poller.match;

import com.certwatch.poller.model.DeathRecord;
import com.certwatch.poller.model.HighlightSpan;
import com.certwatch.poller.model.MatchKind;
import com.certwatch.poller.model.MatchedField;
import com.certwatch.poller.model.RecordMatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a target name appears in a record and what to highlight.
 *
 * Two passes per field, tried in {@link MatchedField} order:
 *  1. exact substring of the normalized texts, scored 100, highlighted as one
 *     window of {@code target length + 5} original characters;
 *  2. word overlap, unscored, each overlapping word highlighted on its own.
 *
 * Pure and deterministic. Never throws for any input.
 */
@Component
public class NameMatcher {

    static final int EXACT_SCORE = 100;

    /** Trailing characters kept in an exact highlight, for suffixes such as honorific fragments. */
    static final int HIGHLIGHT_SLACK = 5;

    private static final Pattern WORD = Pattern.compile("[^\\s.]+");

    /** Matches of every target name against one record, in target-name order. */
    public List<RecordMatch> matchAll(DeathRecord record, List<String> targetNames) {
        List<RecordMatch> matches = new ArrayList<>();
        for (String targetName : targetNames) {
            match(record, targetName).ifPresent(matches::add);
        }
        return matches;
    }

    /** First field of the record matching the target name, if any. */
    public Optional<RecordMatch> match(DeathRecord record, String targetName) {
        if (record == null || targetName == null || targetName.isBlank()) {
            return Optional.empty();
        }
        for (MatchedField field : MatchedField.values()) {
            Optional<FieldMatch> fieldMatch = matchField(field.valueOf(record), targetName);
            if (fieldMatch.isPresent()) {
                FieldMatch m = fieldMatch.get();
                return Optional.of(new RecordMatch(record, targetName, field, m.kind(), m.score(), m.highlights()));
            }
        }
        return Optional.empty();
    }

    /**
     * Matches one field value against one target name.
     */
    public Optional<FieldMatch> matchField(String value, String targetName) {
        if (value == null || value.isBlank() || targetName == null || targetName.isBlank()) {
            return Optional.empty();
        }
        String target = targetName.trim();
        NormalizedText field = NormalizedText.of(value);
        String normalizedTarget = NormalizedText.of(target).text().trim();
        if (normalizedTarget.isEmpty()) {
            return Optional.empty();
        }

        Optional<FieldMatch> exact = exactSubstring(field, normalizedTarget, target.length());
        if (exact.isPresent()) {
            return exact;
        }
        return wordOverlap(value, target);
    }

    private Optional<FieldMatch> exactSubstring(NormalizedText field, String target, int targetLength) {
        int index = field.text().indexOf(target);
        if (index < 0 && target.indexOf(' ') >= 0 && field.original().indexOf('.') >= 0) {
            // "JOHN.SMITH" normalizes to "johnsmith"; let "john smith" find it
            index = field.text().indexOf(target.replace(" ", ""));
        }
        if (index < 0) {
            return Optional.empty();
        }
        int start = field.toOriginalOffset(index);
        int end = Math.min(field.original().length(), start + targetLength + HIGHLIGHT_SLACK);
        return Optional.of(new FieldMatch(MatchKind.EXACT_SUBSTRING, EXACT_SCORE, List.of(new HighlightSpan(start, end))));
    }

    private Optional<FieldMatch> wordOverlap(String value, String target) {
        List<String> targetWords = Arrays.stream(target.toLowerCase(Locale.ROOT).split("[\\s.]+"))
                .filter(w -> !w.isEmpty())
                .toList();
        if (targetWords.isEmpty()) {
            return Optional.empty();
        }

        List<HighlightSpan> spans = new ArrayList<>();
        Matcher words = WORD.matcher(value);
        while (words.find()) {
            String word = words.group().toLowerCase(Locale.ROOT);
            boolean overlaps = targetWords.stream()
                    .anyMatch(tw -> word.contains(tw) || tw.contains(word));
            if (overlaps) {
                spans.add(new HighlightSpan(words.start(), words.end()));
            }
        }
        if (spans.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new FieldMatch(MatchKind.WORD_OVERLAP, null, spans));
    }

    /**
     * Result of matching a single field.
     *
     * @param score 100 for exact matches, null for word overlap
     */
    public record FieldMatch(MatchKind kind, Integer score, List<HighlightSpan> highlights) {
        public FieldMatch {
            highlights = List.copyOf(highlights);
        }
    }
}
