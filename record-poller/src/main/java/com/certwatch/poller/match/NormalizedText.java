package com.certwatch.poller.match;

/**
 * A name normalized for comparison, with a map back to the original string.
 *
 * Normalization lowercases, strips {@code .} characters and collapses whitespace
 * runs to one space. Every normalized character remembers the offset of the
 * original character it came from, so a match found in the normalized text can
 * be highlighted in the text the user actually sees.
 */
public final class NormalizedText {

    private final String original;
    private final String text;
    private final int[] originalOffsets;

    private NormalizedText(String original, String text, int[] originalOffsets) {
        this.original = original;
        this.text = text;
        this.originalOffsets = originalOffsets;
    }

    public static NormalizedText of(String original) {
        String source = original == null ? "" : original;
        StringBuilder normalized = new StringBuilder(source.length());
        int[] offsets = new int[source.length()];

        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '.') {
                continue;
            }
            if (Character.isWhitespace(c)) {
                // dots are dropped first, so "a . b" still collapses to "a b"
                if (normalized.length() > 0 && normalized.charAt(normalized.length() - 1) == ' ') {
                    continue;
                }
                c = ' ';
            } else {
                c = Character.toLowerCase(c);
            }
            offsets[normalized.length()] = i;
            normalized.append(c);
        }

        int[] trimmed = new int[normalized.length()];
        System.arraycopy(offsets, 0, trimmed, 0, normalized.length());
        return new NormalizedText(source, normalized.toString(), trimmed);
    }

    public String original() {
        return original;
    }

    public String text() {
        return text;
    }

    /**
     * Maps an offset in the normalized text to the matching offset in the original.
     * The offset one past the last normalized character maps to the end of the original.
     */
    public int toOriginalOffset(int normalizedOffset) {
        if (normalizedOffset < 0 || normalizedOffset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + normalizedOffset + " outside [0, " + text.length() + "]");
        }
        if (normalizedOffset == text.length()) {
            return original.length();
        }
        return originalOffsets[normalizedOffset];
    }

    @Override
    public String toString() {
        return text;
    }
}
