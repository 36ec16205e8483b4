package com.starscape.borderframe.common.exception;

/**
 * Raised when a batch configuration violates an invariant.
 * Always thrown before the first job of a batch is submitted.
 */
public class InvalidSettingsException extends IllegalArgumentException {

    public InvalidSettingsException(String message) {
        super(message);
    }

    public InvalidSettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
