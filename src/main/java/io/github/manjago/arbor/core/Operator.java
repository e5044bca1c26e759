package io.github.manjago.arbor.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Function symbols the {@link Evaluator} knows how to apply.
 *
 * <pre>
 * Symbol | Arity | Meaning
 * -------+-------+------------------------------------------
 *   +    |   2   | a + b
 *   -    |   2   | a - b
 *   *    |   2   | a * b
 *   /    |   2   | a / b, or a when |b| &lt; 1e-5 (protected)
 * </pre>
 */
public enum Operator {

    ADD("+", 2) {
        @Override
        public double apply(double a, double b) {
            return a + b;
        }
    },

    SUB("-", 2) {
        @Override
        public double apply(double a, double b) {
            return a - b;
        }
    },

    MUL("*", 2) {
        @Override
        public double apply(double a, double b) {
            return a * b;
        }
    },

    /** Protected division: near-zero denominators are replaced by 1.0. */
    DIV("/", 2) {
        @Override
        public double apply(double a, double b) {
            if (Math.abs(b) < PROTECTED_DIVISION_THRESHOLD) {
                b = 1.0;
            }
            return a / b;
        }
    };

    /** Denominators with smaller magnitude are treated as 1.0 */
    public static final double PROTECTED_DIVISION_THRESHOLD = 1e-5;

    private final String symbol;
    private final int arity;

    Operator(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getArity() {
        return arity;
    }

    /**
     * Apply to already evaluated operands.
     */
    public abstract double apply(double a, double b);

    // ========== Lookup ==========

    private static final Map<String, Operator> BY_SYMBOL = new HashMap<>();

    static {
        for (Operator op : values()) {
            BY_SYMBOL.put(op.symbol, op);
        }
    }

    /**
     * @return operator for the symbol, or null if it is not a function symbol
     */
    @Contract(pure = true)
    public static @Nullable Operator fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }
}
