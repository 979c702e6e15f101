package com.microsoft.costanalytics.anomaly;

/**
 * Raised when a detection threshold update carries an unusable value.
 * The previously active thresholds stay in effect.
 */
public class InvalidThresholdException extends IllegalArgumentException {

    public InvalidThresholdException(String message) {
        super(message);
    }

    public InvalidThresholdException(String message, Throwable cause) {
        super(message, cause);
    }
}
