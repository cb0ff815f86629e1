package com.certwatch.poller.model;

public enum MatchKind {
    /** Target found as a contiguous run of the normalized field; scored 100. */
    EXACT_SUBSTRING,
    /** At least one word contained in the other side; carries no score. */
    WORD_OVERLAP
}
