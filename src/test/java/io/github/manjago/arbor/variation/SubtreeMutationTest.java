package io.github.manjago.arbor.variation;

import io.github.manjago.arbor.core.GpRng;
import io.github.manjago.arbor.core.GrowthMethod;
import io.github.manjago.arbor.core.Individual;
import io.github.manjago.arbor.core.InvalidConfigurationException;
import io.github.manjago.arbor.core.Node;
import io.github.manjago.arbor.core.SymbolTable;
import io.github.manjago.arbor.core.TreeGrower;
import io.github.manjago.arbor.core.TreeIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubtreeMutationTest {

    private final SymbolTable table = SymbolTable.defaults();

    private SubtreeMutation mutation(double p, int maxDepth, long seed) {
        GpRng rng = new GpRng(seed);
        return new SubtreeMutation(p, maxDepth, new TreeGrower(table, rng), rng);
    }

    @Test
    @DisplayName("Mutants stay well-formed and within the depth limit")
    void withinLimit() {
        TreeGrower source = new TreeGrower(table, new GpRng(100));
        SubtreeMutation mutation = mutation(1.0, 4, 101);
        for (int i = 0; i < 200; i++) {
            Individual parent = new Individual(source.grow("+", 0, 4, GrowthMethod.GROW));
            Individual mutant = mutation.mutate(parent);

            assertTrue(table.isWellFormed(mutant.getGenome()));
            assertTrue(TreeIndex.maxDepth(mutant.getGenome()) <= 4);
        }
    }

    @Test
    @DisplayName("Original is left untouched and the mutant is unevaluated")
    void originalUntouched() {
        SubtreeMutation mutation = mutation(1.0, 3, 5);
        Individual parent = new Individual(table.node("+", table.node("x0"), table.node("1")));
        parent.assignFitness(-4.0);
        Node before = parent.getGenome().deepCopy();

        Individual mutant = mutation.mutate(parent);

        assertEquals(before, parent.getGenome());
        assertEquals(-4.0, parent.getFitness());
        assertFalse(mutant.isEvaluated());
        assertNotSame(parent.getGenome(), mutant.getGenome());
    }

    @Test
    @DisplayName("Probability 0 yields an unchanged copy")
    void neverFires() {
        SubtreeMutation mutation = mutation(0.0, 3, 5);
        Individual parent = new Individual(table.node("*", table.node("x1"), table.node("x0")));
        assertEquals(parent.getGenome(), mutation.mutate(parent).getGenome());
    }

    @Test
    @DisplayName("Mutation eventually changes trees")
    void changes() {
        SubtreeMutation mutation = mutation(1.0, 3, 8);
        Individual parent = new Individual(table.node("*", table.node("x1"), table.node("x0")));
        int changed = 0;
        for (int i = 0; i < 50; i++) {
            if (!parent.getGenome().equals(mutation.mutate(parent).getGenome())) {
                changed++;
            }
        }
        assertTrue(changed > 10, "changed: " + changed);
    }

    @Test
    @DisplayName("Invalid parameters")
    void invalid() {
        assertThrows(InvalidConfigurationException.class, () -> mutation(2.0, 3, 1));
        assertThrows(InvalidConfigurationException.class, () -> mutation(0.5, 0, 1));
    }
}
