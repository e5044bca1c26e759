package io.github.manjago.arbor.core;

/**
 * A terminal (or a data cell) that should be a number but is not.
 */
public class MalformedConstantException extends GpException {

    public MalformedConstantException(String message) {
        super(message);
    }

    public MalformedConstantException(String message, Throwable cause) {
        super(message, cause);
    }
}
