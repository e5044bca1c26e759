package io.github.manjago.arbor.core;

/**
 * Recursive interpreter for expression trees.
 *
 * Node kinds:
 * - {@link Operator} symbol: operator applied to its two evaluated children
 * - prefix + index ({@code x3}): component 3 of the input vector
 * - anything else: a floating-point literal
 *
 * Pure: same tree and same input always give the same bits.
 */
public final class Evaluator {

    private final String variablePrefix;

    public Evaluator(String variablePrefix) {
        this.variablePrefix = variablePrefix;
    }

    public Evaluator(SymbolTable symbols) {
        this(symbols.variablePrefix());
    }

    /**
     * @throws IndexOutOfRangeException if a variable index exceeds the input vector
     * @throws MalformedConstantException if a terminal is neither a variable nor a number
     */
    public double evaluate(Node node, double[] input) {
        String symbol = node.getSymbol();
        Operator op = Operator.fromSymbol(symbol);
        if (op != null) {
            double a = evaluate(node.getChild(0), input);
            double b = evaluate(node.getChild(1), input);
            return op.apply(a, b);
        }
        int variable = variableIndex(symbol);
        if (variable >= 0) {
            if (variable >= input.length) {
                throw new IndexOutOfRangeException("Variable '" + symbol + "'", variable, input.length);
            }
            return input[variable];
        }
        return parseConstant(symbol);
    }

    /**
     * @return input index encoded in the symbol, or -1 if it is not a variable
     */
    int variableIndex(String symbol) {
        if (!symbol.startsWith(variablePrefix) || symbol.length() == variablePrefix.length()) {
            return -1;
        }
        for (int i = variablePrefix.length(); i < symbol.length(); i++) {
            if (!Character.isDigit(symbol.charAt(i))) {
                return -1;
            }
        }
        try {
            return Integer.parseInt(symbol.substring(variablePrefix.length()));
        } catch (NumberFormatException e) {
            // Too many digits for an int: no input vector is that long
            return Integer.MAX_VALUE;
        }
    }

    static double parseConstant(String symbol) {
        try {
            return Double.parseDouble(symbol);
        } catch (NumberFormatException e) {
            throw new MalformedConstantException("Terminal '" + symbol + "' is not a number", e);
        }
    }
}
