package io.github.manjago.arbor.core;

/**
 * A node whose child count differs from its symbol's arity.
 */
public class MalformedTreeException extends GpException {

    public MalformedTreeException(String symbol, int expectedArity, int actualChildren) {
        super(String.format("Symbol '%s' needs %d children but has %d",
                symbol, expectedArity, actualChildren));
    }
}
