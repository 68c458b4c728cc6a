package com.alert.triage.api;

/**
 * Thrown when engine settings are out of range or contradict the never-suppress-critical rule.
 */
public class InvalidEngineConfigurationException extends RuntimeException {

    public InvalidEngineConfigurationException(String message) {
        super(message);
    }
}
