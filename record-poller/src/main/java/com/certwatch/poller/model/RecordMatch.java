package com.certwatch.poller.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A target name located in one field of a record.
 *
 * @param score null for word-overlap matches; such matches are not comparable to scored ones
 */
public record RecordMatch(
        DeathRecord record,
        String targetName,
        MatchedField field,
        MatchKind kind,
        Integer score,
        List<HighlightSpan> highlights
) {

    public RecordMatch {
        highlights = List.copyOf(highlights);
    }

    /** The highlighted text of the matched field, spans joined by a space. */
    public String matchedPart() {
        String value = field.valueOf(record);
        return highlights.stream()
                .map(span -> span.textOf(value))
                .collect(Collectors.joining(" "));
    }
}
