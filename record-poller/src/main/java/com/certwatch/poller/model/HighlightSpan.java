package com.certwatch.poller.model;

/**
 * Half-open {@code [start, end)} range in a field's original text.
 */
public record HighlightSpan(int start, int end) {

    public HighlightSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public String textOf(String value) {
        return value.substring(start, end);
    }
}
