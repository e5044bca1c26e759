package io.github.manjago.arbor.fitness;

import io.github.manjago.arbor.core.EmptyFitnessCaseSetException;
import io.github.manjago.arbor.core.MalformedConstantException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExemplarLoaderTest {

    private final ExemplarLoader loader = new ExemplarLoader();

    @Nested
    @DisplayName("Well-formed input")
    class WellFormed {

        @Test
        @DisplayName("Last column is the target, the rest are inputs")
        void columns() {
            FitnessCases cases = loader.parse("""
                    x0,x1,y
                    1,2,3
                    -1.5,0,2.25
                    """);

            assertEquals(2, cases.size());
            assertEquals(2, cases.width());
            assertArrayEquals(new double[] {1, 2}, cases.input(0));
            assertEquals(3.0, cases.target(0));
            assertArrayEquals(new double[] {-1.5, 0}, cases.input(1));
            assertEquals(2.25, cases.target(1));
        }

        @Test
        @DisplayName("Spaces around cells are ignored")
        void spaces() {
            FitnessCases cases = loader.parse("a, b\n 1 , 2 \n");
            assertEquals(1.0, cases.input(0)[0]);
            assertEquals(2.0, cases.target(0));
        }

        @Test
        @DisplayName("Other delimiters")
        void delimiter() {
            FitnessCases cases = new ExemplarLoader(';').parse("x0;y\n4;16\n");
            assertEquals(16.0, cases.target(0));
        }

        @Test
        @DisplayName("Loads a table from disk")
        void loadFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("cases.csv");
            Files.writeString(file, "x0,x1,y\n0,0,0\n1,1,2\n2,0,4\n");

            FitnessCases cases = loader.load(file);
            assertEquals(3, cases.size());
            assertEquals(4.0, cases.target(2));
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class Malformed {

        @Test
        @DisplayName("Non-numeric cell names the cell and its column")
        void notANumber() {
            MalformedConstantException e = assertThrows(MalformedConstantException.class,
                    () -> loader.parse("x0,y\n1,2\nfoo,3\n"));
            assertTrue(e.getMessage().contains("'foo'"), e.getMessage());
            assertTrue(e.getMessage().contains("'x0'"), e.getMessage());
        }

        @Test
        @DisplayName("Blank header name")
        void blankHeader() {
            MalformedConstantException e = assertThrows(MalformedConstantException.class,
                    () -> loader.parse("x0,,y\n1,2,3\n"));
            assertTrue(e.getMessage().startsWith("<text>: bad header"), e.getMessage());
        }

        @Test
        @DisplayName("Unterminated quote in a data row")
        void unterminatedQuote() {
            MalformedConstantException e = assertThrows(MalformedConstantException.class,
                    () -> loader.parse("x0,x1,y\n1,\"2,3\n"));
            assertTrue(e.getMessage().startsWith("<text> near line"), e.getMessage());
        }

        @Test
        @DisplayName("Unterminated quote in the header")
        void unterminatedHeaderQuote() {
            assertThrows(MalformedConstantException.class, () -> loader.parse("x0,\"y\n1,2\n"));
        }

        @Test
        @DisplayName("Ragged row")
        void ragged() {
            assertThrows(MalformedConstantException.class, () -> loader.parse("x0,x1,y\n1,2\n"));
        }

        @Test
        @DisplayName("Single column has no inputs")
        void singleColumn() {
            assertThrows(MalformedConstantException.class, () -> loader.parse("y\n1\n"));
        }

        @Test
        @DisplayName("Header without rows")
        void noRows() {
            assertThrows(EmptyFitnessCaseSetException.class, () -> loader.parse("x0,y\n"));
        }

        @Test
        @DisplayName("Missing file is an I/O error")
        void missingFile(@TempDir Path dir) {
            assertThrows(NoSuchFileException.class, () -> loader.load(dir.resolve("absent.csv")));
        }
    }
}
