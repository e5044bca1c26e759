package io.github.manjago.arbor.core;

/**
 * Base of all errors raised by the GP engine.
 *
 * None of these are recovered from: they abort the search and surface to the caller.
 */
public class GpException extends RuntimeException {

    public GpException(String message) {
        super(message);
    }

    public GpException(String message, Throwable cause) {
        super(message, cause);
    }
}
