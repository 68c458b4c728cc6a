package com.alert.triage.domain;

public enum Verdict {
    /** Surface the alert to operators. */
    KEEP,
    /** Treat the alert as noise. */
    SUPPRESS
}
