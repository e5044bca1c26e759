package io.github.manjago.arbor.fitness;

import io.github.manjago.arbor.core.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FitnessCasesTest {

    private static FitnessCases rows(int n) {
        double[][] inputs = new double[n][];
        double[] targets = new double[n];
        for (int i = 0; i < n; i++) {
            inputs[i] = new double[] {i, -i};
            targets[i] = i * 10;
        }
        return new FitnessCases(inputs, targets);
    }

    @Test
    @DisplayName("Split keeps row order, floor of the fraction trains")
    void split() {
        DataSplit split = rows(10).split(0.7);

        assertEquals(7, split.train().size());
        assertEquals(3, split.test().size());
        assertEquals(0.0, split.train().target(0));
        assertEquals(60.0, split.train().target(6));
        assertEquals(70.0, split.test().target(0));
        assertArrayEquals(new double[] {9, -9}, split.test().input(2));
    }

    @Test
    @DisplayName("Split rounds the training share down")
    void splitFloors() {
        DataSplit split = rows(3).split(0.5);
        assertEquals(1, split.train().size());
        assertEquals(2, split.test().size());
    }

    @Test
    @DisplayName("Tiny tables may leave the training set empty")
    void splitEmptyTrain() {
        DataSplit split = rows(1).split(0.7);
        assertTrue(split.train().isEmpty());
        assertEquals(1, split.test().size());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 1.0, -0.5, 1.5, Double.NaN})
    @DisplayName("Fraction outside (0, 1) is rejected")
    void badFraction(double fraction) {
        assertThrows(InvalidConfigurationException.class, () -> rows(5).split(fraction));
    }

    @Test
    @DisplayName("Input rows are copied in and out")
    void defensiveCopies() {
        double[] row = {1, 2};
        FitnessCases cases = new FitnessCases(new double[][] {row}, new double[] {3});
        row[0] = 99;
        assertEquals(1.0, cases.input(0)[0]);

        cases.input(0)[1] = 99;
        assertEquals(2.0, cases.input(0)[1]);
    }

    @Test
    @DisplayName("Rows must agree in width and count")
    void shapeChecks() {
        assertThrows(IllegalArgumentException.class,
                () -> new FitnessCases(new double[][] {{1, 2}, {3}}, new double[] {1, 2}));
        assertThrows(IllegalArgumentException.class,
                () -> new FitnessCases(new double[][] {{1, 2}}, new double[] {1, 2}));
    }

    @Test
    @DisplayName("Width is the number of inputs")
    void width() {
        assertEquals(2, rows(4).width());
        assertEquals(0, new FitnessCases(new double[0][], new double[0]).width());
    }
}
