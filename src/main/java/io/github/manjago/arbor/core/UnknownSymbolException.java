package io.github.manjago.arbor.core;

/**
 * Symbol lookup miss in a {@link SymbolTable}.
 */
public class UnknownSymbolException extends GpException {

    private final String symbol;

    public UnknownSymbolException(String symbol) {
        super("Unknown symbol: '" + symbol + "'");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
