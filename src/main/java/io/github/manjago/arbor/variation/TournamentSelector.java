package io.github.manjago.arbor.variation;

import io.github.manjago.arbor.core.GpRng;
import io.github.manjago.arbor.core.Individual;
import io.github.manjago.arbor.core.InvalidTournamentSizeException;
import io.github.manjago.arbor.core.Population;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tournament selection.
 *
 * Each tournament draws {@code tournamentSize} distinct individuals uniformly
 * from the whole population and keeps the fittest; ties go to the competitor
 * drawn first. Tournaments are independent, so an individual can win many.
 * A tournament of one is plain uniform choice.
 */
public class TournamentSelector implements Selector {

    private static final Logger log = LoggerFactory.getLogger(TournamentSelector.class);

    private final int tournamentSize;
    private final GpRng rng;

    public TournamentSelector(int tournamentSize, GpRng rng) {
        if (tournamentSize < 1) {
            throw new InvalidTournamentSizeException(tournamentSize);
        }
        this.tournamentSize = tournamentSize;
        this.rng = rng;
    }

    public int getTournamentSize() {
        return tournamentSize;
    }

    @Override
    public List<Individual> select(Population population, int count) {
        int n = population.size();
        if (tournamentSize > n) {
            throw new InvalidTournamentSizeException(tournamentSize, n);
        }
        int[] positions = new int[n];
        for (int i = 0; i < n; i++) {
            positions[i] = i;
        }
        int[] swaps = new int[tournamentSize];
        List<Individual> winners = new ArrayList<>(count);
        for (int t = 0; t < count; t++) {
            winners.add(tournament(population, positions, swaps));
        }
        return winners;
    }

    /**
     * One tournament: partial Fisher-Yates over {@code positions}, one draw per
     * competitor. The swaps are undone afterwards, so {@code positions} is the
     * identity again for the next tournament.
     */
    private Individual tournament(Population population, int[] positions, int[] swaps) {
        int n = positions.length;
        Individual winner = null;
        for (int j = 0; j < tournamentSize; j++) {
            int r = j + rng.nextInt(n - j);
            swap(positions, j, r);
            swaps[j] = r;

            Individual competitor = population.get(positions[j]);
            if (winner == null || competitor.getFitness() > winner.getFitness()) {
                winner = competitor;
            }
        }
        for (int j = tournamentSize - 1; j >= 0; j--) {
            swap(positions, j, swaps[j]);
        }
        log.debug("Tournament winner: fitness {}", winner.getFitness());
        return winner;
    }

    private static void swap(int[] a, int i, int j) {
        int tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }
}
