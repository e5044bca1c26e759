package io.github.manjago.arbor.cli;

import io.github.manjago.arbor.config.RunConfig;
import io.github.manjago.arbor.core.GpException;
import io.github.manjago.arbor.core.Individual;
import io.github.manjago.arbor.core.Population;
import io.github.manjago.arbor.fitness.DataSplit;
import io.github.manjago.arbor.fitness.ExemplarLoader;
import io.github.manjago.arbor.fitness.FitnessCases;
import io.github.manjago.arbor.search.GenerationStats;
import io.github.manjago.arbor.search.SearchListener;
import io.github.manjago.arbor.search.SearchLoop;
import io.github.manjago.arbor.search.SearchResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Run a search command.
 *
 * Examples:
 *   arbor run                                 # Run with defaults
 *   arbor run -g 50 -p 200 -e 2               # 50 generations, 200 individuals, 2 elites
 *   arbor run --config my.conf                # Use custom config
 *   arbor run --fitness-cases data.csv -s 42  # Other data, fixed seed
 */
@Command(
    name = "run",
    description = "Evolve an expression that fits the fitness cases",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-p", "--population-size"}, description = "Population size")
    private Integer populationSize;

    @Option(names = {"-m", "--max-depth"}, description = "Max depth of tree")
    private Integer maxDepth;

    @Option(names = {"-e", "--elite-size"}, description = "Elite size")
    private Integer eliteSize;

    @Option(names = {"-g", "--generations"}, description = "Number of generations")
    private Integer generations;

    @Option(names = {"--tournament-size"}, description = "Tournament size")
    private Integer tournamentSize;

    @Option(names = {"-s", "--seed"}, description = "Random seed (0 = fresh)")
    private Long seed;

    @Option(names = {"--crossover-probability"}, description = "Crossover probability (0.0-1.0)")
    private Double crossoverProbability;

    @Option(names = {"--mutation-probability"}, description = "Mutation probability (0.0-1.0)")
    private Double mutationProbability;

    @Option(names = {"--fitness-cases"}, description = "Fitness case file (CSV with header)")
    private Path fitnessCases;

    @Option(names = {"--test-train-split"}, description = "Fraction of cases used for training")
    private Double testTrainSplit;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (only the final result)")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            RunConfig config;
            try {
                config = buildConfig().validate();
            } catch (IOException e) {
                System.err.println("Cannot read configuration: " + e.getMessage());
                return 2;
            }
            if (!quiet) {
                System.out.println(config);
            }

            FitnessCases cases = new ExemplarLoader().load(config.fitnessCases());
            DataSplit split = cases.split(config.testTrainSplit());

            SearchLoop search = new SearchLoop(config, split.train());
            if (!quiet) {
                search.setListener(new ConsoleStatsListener());
            }
            SearchResult result = search.run();

            printResult(search, result, split.test());
            return 0;
        } catch (IOException e) {
            System.err.println("Cannot read fitness cases: " + e.getMessage());
            return 2;
        } catch (GpException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private RunConfig buildConfig() throws IOException {
        if (configFile != null && !Files.isRegularFile(configFile)) {
            // typesafe-config treats a missing file as empty
            throw new NoSuchFileException(configFile.toString());
        }
        RunConfig.Builder builder = configFile != null
                ? RunConfig.fromFile(configFile).toBuilder()
                : RunConfig.defaults().toBuilder();

        // Override from CLI options
        if (populationSize != null) builder.populationSize(populationSize);
        if (maxDepth != null) builder.maxDepth(maxDepth);
        if (eliteSize != null) builder.eliteSize(eliteSize);
        if (generations != null) builder.generations(generations);
        if (tournamentSize != null) builder.tournamentSize(tournamentSize);
        if (seed != null) builder.seed(seed);
        if (crossoverProbability != null) builder.crossoverProbability(crossoverProbability);
        if (mutationProbability != null) builder.mutationProbability(mutationProbability);
        if (fitnessCases != null) builder.fitnessCases(fitnessCases);
        if (testTrainSplit != null) builder.testTrainSplit(testTrainSplit);

        return builder.build();
    }

    private void printResult(SearchLoop search, SearchResult result, FitnessCases test) {
        Individual best = result.best();
        System.out.println();
        System.out.println("Seed: " + result.seed());
        System.out.println("Best train: " + best);
        System.out.println("Expression: " + best.getGenome().toInfix());
        if (test.isEmpty()) {
            System.out.println("Best test: no held-out cases");
        } else {
            Individual tested = search.getFitnessEvaluator().evaluateCopy(best, test);
            System.out.println("Best test: " + tested);
        }
    }

    /**
     * One statistics line per generation.
     */
    private static class ConsoleStatsListener implements SearchListener {

        @Override
        public void onInitialized(GenerationStats stats) {
            System.out.println(stats);
        }

        @Override
        public void onGeneration(GenerationStats stats, Population ranked) {
            System.out.println(stats);
        }
    }
}
