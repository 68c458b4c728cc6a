package com.alert.triage.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a raw alert cannot be normalized (missing id or timestamp, bad timestamp,
 * unknown severity). The alert is rejected before any state changes, so nothing is audited.
 * Handler returns HTTP 400 with the per-field messages.
 */
public class AlertValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public AlertValidationException(Map<String, String> fieldErrors) {
        super("Invalid alert: " + fieldErrors);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
