package com.alert.triage.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a duplicate-window check.
 */
@Value
@Builder
public class DuplicateResult {

    private static final DuplicateResult FIRST_SEEN = DuplicateResult.builder().duplicate(false).priorCount(0).build();

    boolean duplicate;
    /** Earliest prior occurrence inside the window; null when not a duplicate. */
    Instant matchedAt;
    /** Prior occurrences of the same key inside the window. */
    int priorCount;

    public static DuplicateResult notDuplicate() {
        return FIRST_SEEN;
    }
}
