package com.alert.triage.scoring;

/**
 * The suppression predictor could not produce a score (transport error, timeout, open circuit,
 * unusable response). The engine absorbs this and decides without a score.
 */
public class ScoringUnavailableException extends RuntimeException {

    public ScoringUnavailableException(String message) {
        super(message);
    }

    public ScoringUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
