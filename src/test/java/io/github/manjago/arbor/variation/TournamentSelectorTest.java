package io.github.manjago.arbor.variation;

import io.github.manjago.arbor.core.GpRng;
import io.github.manjago.arbor.core.Individual;
import io.github.manjago.arbor.core.InvalidTournamentSizeException;
import io.github.manjago.arbor.core.Node;
import io.github.manjago.arbor.core.Population;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TournamentSelectorTest {

    private static Population population(double... fitness) {
        List<Individual> list = new ArrayList<>();
        for (double f : fitness) {
            Individual ind = new Individual(Node.leaf("1"));
            ind.assignFitness(f);
            list.add(ind);
        }
        return new Population(list);
    }

    @Test
    @DisplayName("Returns the requested number of winners from the population")
    void count() {
        Population pop = population(-5, -4, -3, -2, -1);
        List<Individual> winners = new TournamentSelector(2, new GpRng(1)).select(pop, 12);

        assertEquals(12, winners.size());
        for (Individual w : winners) {
            assertTrue(pop.individuals().contains(w));
        }
    }

    @Test
    @DisplayName("Tournament over the whole population always picks the best")
    void fullTournament() {
        Population pop = population(-5, -1, -3, -2, -4);
        for (Individual w : new TournamentSelector(5, new GpRng(7)).select(pop, 20)) {
            assertSame(pop.get(1), w);
        }
    }

    @Test
    @DisplayName("Tournament of two never picks the worst")
    void neverWorst() {
        Population pop = population(-5, -1, -3, -2, -4);
        for (Individual w : new TournamentSelector(2, new GpRng(3)).select(pop, 200)) {
            assertNotSame(pop.get(0), w);
        }
    }

    @Test
    @DisplayName("Tournament of one is uniform")
    void sizeOne() {
        Population pop = population(-3, -2, -1);
        int[] hits = new int[3];
        for (Individual w : new TournamentSelector(1, new GpRng(11)).select(pop, 3000)) {
            hits[pop.individuals().indexOf(w)]++;
        }
        for (int h : hits) {
            assertTrue(h > 800, "hits: " + h);
        }
    }

    @Test
    @DisplayName("First drawn competitor wins ties")
    void ties() {
        Population pop = population(-1, -1, -1);
        // all equal: every winner must still be a population member, and all positions reachable
        int[] hits = new int[3];
        for (Individual w : new TournamentSelector(2, new GpRng(5)).select(pop, 600)) {
            hits[pop.individuals().indexOf(w)]++;
        }
        for (int h : hits) {
            assertTrue(h > 0);
        }
    }

    @Test
    @DisplayName("Same seed, same winners")
    void deterministic() {
        Population pop = population(-5, -4, -3, -2, -1, -6, -7);
        List<Individual> a = new TournamentSelector(3, new GpRng(42)).select(pop, 10);
        List<Individual> b = new TournamentSelector(3, new GpRng(42)).select(pop, 10);
        for (int i = 0; i < a.size(); i++) {
            assertSame(a.get(i), b.get(i));
        }
    }

    @Test
    @DisplayName("Every tournament draws distinct competitors, one random draw each")
    void drawsMatchFreshShuffle() {
        Population pop = population(-5, -4, -3, -2, -1, -6, -7, -8, -9);
        int size = 4;
        List<Individual> winners = new TournamentSelector(size, new GpRng(77)).select(pop, 50);

        // same stream, fresh position array per tournament
        GpRng replay = new GpRng(77);
        int n = pop.size();
        for (Individual actual : winners) {
            int[] positions = new int[n];
            for (int i = 0; i < n; i++) {
                positions[i] = i;
            }
            Individual expected = null;
            for (int j = 0; j < size; j++) {
                int r = j + replay.nextInt(n - j);
                int picked = positions[r];
                positions[r] = positions[j];
                positions[j] = picked;
                Individual competitor = pop.get(picked);
                if (expected == null || competitor.getFitness() > expected.getFitness()) {
                    expected = competitor;
                }
            }
            assertSame(expected, actual);
        }
    }

    @Test
    @DisplayName("Invalid tournament sizes")
    void invalidSize() {
        assertThrows(InvalidTournamentSizeException.class, () -> new TournamentSelector(0, new GpRng(1)));
        TournamentSelector tooBig = new TournamentSelector(4, new GpRng(1));
        assertThrows(InvalidTournamentSizeException.class, () -> tooBig.select(population(-1, -2, -3), 1));
    }
}
