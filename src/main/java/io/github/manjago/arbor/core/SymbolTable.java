package io.github.manjago.arbor.core;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared symbols and their arities.
 *
 * Terminals (arity 0) are variables, named by the variable prefix followed by
 * an input index ({@code x0}, {@code x1}, ...), or numeric constants. Functions
 * (arity &gt; 0) must be {@link Operator}s declared with the operator's arity.
 *
 * Terminals and functions keep declaration order; uniform choice over them
 * depends on that order, so it is part of a run's reproducibility.
 */
public final class SymbolTable {

    public static final String DEFAULT_VARIABLE_PREFIX = "x";

    private final Map<String, Integer> arities;
    private final List<String> terminals;
    private final List<String> functions;
    private final String variablePrefix;

    private SymbolTable(Map<String, Integer> arities, String variablePrefix) {
        if (variablePrefix == null || variablePrefix.isEmpty()) {
            throw new InvalidConfigurationException("Variable prefix must not be empty");
        }
        List<String> t = new ArrayList<>();
        List<String> f = new ArrayList<>();
        for (Map.Entry<String, Integer> e : arities.entrySet()) {
            String name = e.getKey();
            int arity = e.getValue();
            if (arity < 0) {
                throw new InvalidConfigurationException("Negative arity for symbol '" + name + "'");
            }
            Operator op = Operator.fromSymbol(name);
            if (arity == 0) {
                if (op != null) {
                    throw new InvalidConfigurationException("Operator '" + name + "' declared as a terminal");
                }
                t.add(name);
            } else {
                if (op == null) {
                    throw new InvalidConfigurationException("No operator for function symbol '" + name + "'");
                }
                if (op.getArity() != arity) {
                    throw new InvalidConfigurationException(String.format(
                            "Operator '%s' has arity %d, declared %d", name, op.getArity(), arity));
                }
                f.add(name);
            }
        }
        if (t.isEmpty()) {
            throw new InvalidConfigurationException("Symbol table declares no terminals");
        }
        if (f.isEmpty()) {
            throw new InvalidConfigurationException("Symbol table declares no functions");
        }
        this.arities = Collections.unmodifiableMap(new LinkedHashMap<>(arities));
        this.terminals = List.copyOf(t);
        this.functions = List.copyOf(f);
        this.variablePrefix = variablePrefix;
    }

    /**
     * Default symbols: constant {@code 1}, variables {@code x0 x1}, functions {@code + - * /}.
     */
    public static SymbolTable defaults() {
        return builder()
                .terminal("1")
                .terminal("x0")
                .terminal("x1")
                .function("+", 2)
                .function("-", 2)
                .function("*", 2)
                .function("/", 2)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Lookup ==========

    /**
     * @throws UnknownSymbolException if the symbol is not declared
     */
    public int arity(String symbol) {
        Integer arity = arities.get(symbol);
        if (arity == null) {
            throw new UnknownSymbolException(symbol);
        }
        return arity;
    }

    public boolean contains(String symbol) {
        return arities.containsKey(symbol);
    }

    public boolean isTerminal(String symbol) {
        return arity(symbol) == 0;
    }

    public boolean isFunction(String symbol) {
        return arity(symbol) > 0;
    }

    public List<String> terminals() {
        return terminals;
    }

    public List<String> functions() {
        return functions;
    }

    public Map<String, Integer> arities() {
        return arities;
    }

    public String variablePrefix() {
        return variablePrefix;
    }

    // ========== Tree construction & checking ==========

    /**
     * Build a node, checking the child count against the symbol's arity.
     */
    public @NotNull Node node(String symbol, Node... children) {
        int arity = arity(symbol);
        if (children.length != arity) {
            throw new MalformedTreeException(symbol, arity, children.length);
        }
        return new Node(symbol, List.of(children));
    }

    /**
     * Check every node of the tree.
     *
     * @throws UnknownSymbolException if a symbol is not declared
     * @throws MalformedTreeException at the first node with the wrong child count
     */
    public void validate(Node tree) {
        int arity = arity(tree.getSymbol());
        if (tree.childCount() != arity) {
            throw new MalformedTreeException(tree.getSymbol(), arity, tree.childCount());
        }
        for (Node child : tree.getChildren()) {
            validate(child);
        }
    }

    public boolean isWellFormed(Node tree) {
        try {
            validate(tree);
            return true;
        } catch (UnknownSymbolException | MalformedTreeException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return String.format("SymbolTable[terminals=%s, functions=%s, variablePrefix=%s]",
                terminals, functions, variablePrefix);
    }

    public static final class Builder {
        private final Map<String, Integer> arities = new LinkedHashMap<>();
        private String variablePrefix = DEFAULT_VARIABLE_PREFIX;

        private Builder() {}

        public Builder declare(String symbol, int arity) {
            if (arities.putIfAbsent(symbol, arity) != null) {
                throw new InvalidConfigurationException("Symbol '" + symbol + "' declared twice");
            }
            return this;
        }

        public Builder terminal(String symbol) { return declare(symbol, 0); }
        public Builder function(String symbol, int arity) { return declare(symbol, arity); }
        public Builder variablePrefix(String prefix) { this.variablePrefix = prefix; return this; }

        public SymbolTable build() {
            return new SymbolTable(arities, variablePrefix);
        }
    }
}
