package io.github.manjago.arbor.core;

/**
 * Out-of-range run parameter or inconsistent symbol declaration.
 */
public class InvalidConfigurationException extends GpException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
