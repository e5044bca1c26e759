package io.github.manjago.arbor.core;

/**
 * Fitness requested against zero cases.
 */
public class EmptyFitnessCaseSetException extends GpException {

    public EmptyFitnessCaseSetException(String message) {
        super(message);
    }
}
