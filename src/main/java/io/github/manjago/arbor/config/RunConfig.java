package io.github.manjago.arbor.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.arbor.core.InvalidConfigurationException;
import io.github.manjago.arbor.core.SymbolTable;

import java.nio.file.Path;

/**
 * Parameters of one GP run.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record RunConfig(
    // Population
    int populationSize,
    int maxDepth,
    int generations,

    // Selection & replacement
    int tournamentSize,
    int eliteSize,

    // Variation
    double crossoverProbability,
    double mutationProbability,

    // Reproducibility
    long seed,                // 0 = fresh seed per run

    // Data
    double testTrainSplit,    // fraction of rows used for training
    Path fitnessCases,

    SymbolTable symbols
) {

    /**
     * Load default configuration.
     */
    public static RunConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static RunConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     *
     * @throws InvalidConfigurationException if a key is missing or has the wrong type
     */
    public static RunConfig fromConfig(Config config) {
        try {
            Config c = config.getConfig("arbor");

            SymbolTable.Builder symbols = SymbolTable.builder()
                    .variablePrefix(c.getString("variable-prefix"));
            for (Config s : c.getConfigList("symbols")) {
                symbols.declare(s.getString("name"), s.getInt("arity"));
            }

            return new RunConfig(
                c.getInt("population-size"),
                c.getInt("max-depth"),
                c.getInt("generations"),
                c.getInt("tournament-size"),
                c.getInt("elite-size"),
                c.getDouble("crossover-probability"),
                c.getDouble("mutation-probability"),
                c.getLong("seed"),
                c.getDouble("test-train-split"),
                Path.of(c.getString("fitness-cases")),
                symbols.build()
            );
        } catch (ConfigException e) {
            throw new InvalidConfigurationException("Bad configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Seed to actually use: the configured one, or a fresh one when it is 0.
     */
    public long effectiveSeed() {
        return seed != 0 ? seed : System.nanoTime();
    }

    /**
     * Check every range a run depends on.
     *
     * @return this, for chaining
     * @throws InvalidConfigurationException naming the first bad key
     */
    public RunConfig validate() {
        if (populationSize < 1) {
            throw invalid("population-size", "must be > 0", populationSize);
        }
        if (maxDepth < 1) {
            throw invalid("max-depth", "must be >= 1", maxDepth);
        }
        if (generations < 0) {
            throw invalid("generations", "must be >= 0", generations);
        }
        if (tournamentSize < 1 || tournamentSize > populationSize) {
            throw invalid("tournament-size", "must be in [1, population-size]", tournamentSize);
        }
        if (eliteSize < 0 || eliteSize > populationSize) {
            throw invalid("elite-size", "must be in [0, population-size]", eliteSize);
        }
        if (!(crossoverProbability >= 0.0 && crossoverProbability <= 1.0)) {
            throw invalid("crossover-probability", "must be in [0, 1]", crossoverProbability);
        }
        if (!(mutationProbability >= 0.0 && mutationProbability <= 1.0)) {
            throw invalid("mutation-probability", "must be in [0, 1]", mutationProbability);
        }
        if (!(testTrainSplit > 0.0 && testTrainSplit < 1.0)) {
            throw invalid("test-train-split", "must be in (0, 1)", testTrainSplit);
        }
        if (symbols == null) {
            throw new InvalidConfigurationException("symbols: no symbol table");
        }
        return this;
    }

    private static InvalidConfigurationException invalid(String key, String rule, Object value) {
        return new InvalidConfigurationException(key + " " + rule + ", got " + value);
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .populationSize(populationSize)
                .maxDepth(maxDepth)
                .generations(generations)
                .tournamentSize(tournamentSize)
                .eliteSize(eliteSize)
                .crossoverProbability(crossoverProbability)
                .mutationProbability(mutationProbability)
                .seed(seed)
                .testTrainSplit(testTrainSplit)
                .fitnessCases(fitnessCases)
                .symbols(symbols);
    }

    public static class Builder {
        private int populationSize = 20;
        private int maxDepth = 3;
        private int generations = 10;
        private int tournamentSize = 2;
        private int eliteSize = 0;
        private double crossoverProbability = 1.0;
        private double mutationProbability = 1.0;
        private long seed = 0;
        private double testTrainSplit = 0.7;
        private Path fitnessCases = Path.of("fitness_cases.csv");
        private SymbolTable symbols = SymbolTable.defaults();

        public Builder populationSize(int size) { this.populationSize = size; return this; }
        public Builder maxDepth(int depth) { this.maxDepth = depth; return this; }
        public Builder generations(int count) { this.generations = count; return this; }
        public Builder tournamentSize(int size) { this.tournamentSize = size; return this; }
        public Builder eliteSize(int size) { this.eliteSize = size; return this; }
        public Builder crossoverProbability(double p) { this.crossoverProbability = p; return this; }
        public Builder mutationProbability(double p) { this.mutationProbability = p; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder testTrainSplit(double split) { this.testTrainSplit = split; return this; }
        public Builder fitnessCases(Path file) { this.fitnessCases = file; return this; }
        public Builder symbols(SymbolTable table) { this.symbols = table; return this; }

        public RunConfig build() {
            return new RunConfig(
                populationSize, maxDepth, generations, tournamentSize, eliteSize,
                crossoverProbability, mutationProbability, seed, testTrainSplit,
                fitnessCases, symbols
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            RunConfig:
              population-size:        %d
              max-depth:              %d
              generations:            %d
              tournament-size:        %d
              elite-size:             %d
              crossover-probability:  %.2f
              mutation-probability:   %.2f
              seed:                   %s
              test-train-split:       %.2f
              fitness-cases:          %s
              terminals:              %s
              functions:              %s
            """,
            populationSize,
            maxDepth,
            generations,
            tournamentSize,
            eliteSize,
            crossoverProbability,
            mutationProbability,
            seed == 0 ? "fresh" : String.valueOf(seed),
            testTrainSplit,
            fitnessCases,
            symbols.terminals(),
            symbols.functions()
        );
    }
}
