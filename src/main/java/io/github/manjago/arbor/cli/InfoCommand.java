package io.github.manjago.arbor.cli;

import io.github.manjago.arbor.config.RunConfig;
import io.github.manjago.arbor.core.SymbolTable;
import picocli.CommandLine.Command;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Show information about Arbor.
 */
@Command(
    name = "info",
    description = "Show version, default configuration and symbol table",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        RunConfig config = RunConfig.defaults();
        SymbolTable symbols = config.symbols();

        System.out.println();
        System.out.println("Arbor 1.0.0 - symbolic regression by genetic programming");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(config);

        System.out.println("Symbols:");
        for (Map.Entry<String, Integer> e : symbols.arities().entrySet()) {
            String kind = e.getValue() == 0 ? terminalKind(e.getKey(), symbols.variablePrefix()) : "function";
            System.out.printf("  %-6s arity %d  (%s)%n", e.getKey(), e.getValue(), kind);
        }
        System.out.println();

        return 0;
    }

    private static String terminalKind(String symbol, String prefix) {
        return symbol.startsWith(prefix) ? "variable" : "constant";
    }
}
