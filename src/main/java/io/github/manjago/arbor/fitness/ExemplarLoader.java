package io.github.manjago.arbor.fitness;

import io.github.manjago.arbor.core.EmptyFitnessCaseSetException;
import io.github.manjago.arbor.core.MalformedConstantException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reads fitness cases from a delimited file.
 *
 * <h2>Format:</h2>
 * <pre>
 * x0,x1,y          ; header row, names are informational
 * 1.0,2.0,3.0      ; inputs..., target
 * 0.5,-1.0,-0.5
 * </pre>
 * Every cell must be numeric and every row as wide as the header.
 */
public final class ExemplarLoader {

    private static final Logger log = LoggerFactory.getLogger(ExemplarLoader.class);

    private final CSVFormat format;

    public ExemplarLoader() {
        this(',');
    }

    public ExemplarLoader(char delimiter) {
        this.format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .build();
    }

    /**
     * Load cases from a file.
     */
    public FitnessCases load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            FitnessCases cases = parse(reader, file.toString());
            log.info("Read {} fitness cases ({} inputs) from {}", cases.size(), cases.width(), file);
            return cases;
        }
    }

    /**
     * Load cases from in-memory text.
     */
    public FitnessCases parse(String text) {
        try {
            return parse(new StringReader(text), "<text>");
        } catch (IOException e) {
            // no I/O happens on a string: this is a syntax error in the header row
            throw new MalformedConstantException("<text>: " + e.getMessage(), e);
        }
    }

    private FitnessCases parse(Reader reader, String source) throws IOException {
        CSVParser parser;
        try {
            parser = format.parse(reader);
        } catch (IllegalArgumentException e) {
            // blank or duplicate header names
            throw new MalformedConstantException(source + ": bad header: " + e.getMessage(), e);
        }
        try (parser) {
            List<String> headers = parser.getHeaderNames();
            if (headers.size() < 2) {
                throw new MalformedConstantException(String.format(
                        "%s: need at least one input column and a target column, header is %s", source, headers));
            }
            log.debug("Reading {} headers: {}", source, headers);

            List<double[]> inputs = new ArrayList<>();
            List<Double> targets = new ArrayList<>();
            Iterator<CSVRecord> records = parser.iterator();
            CSVRecord record;
            while ((record = nextRecord(records, parser, source)) != null) {
                long row = record.getRecordNumber();
                if (record.size() != headers.size()) {
                    throw new MalformedConstantException(String.format(
                            "%s row %d: %d columns, header has %d", source, row, record.size(), headers.size()));
                }
                double[] values = new double[record.size()];
                for (int col = 0; col < record.size(); col++) {
                    values[col] = parseCell(record.get(col), source, row, headers.get(col));
                }
                int last = values.length - 1;
                double[] in = new double[last];
                System.arraycopy(values, 0, in, 0, last);
                inputs.add(in);
                targets.add(values[last]);
            }
            if (targets.isEmpty()) {
                throw new EmptyFitnessCaseSetException(source + " has no data rows");
            }

            double[] t = new double[targets.size()];
            for (int i = 0; i < t.length; i++) {
                t[i] = targets.get(i);
            }
            return new FitnessCases(inputs.toArray(new double[0][]), t);
        }
    }

    /**
     * Next record, or null at the end. The record iterator reports syntax
     * errors such as an unterminated quote as {@link UncheckedIOException}.
     */
    private static CSVRecord nextRecord(Iterator<CSVRecord> records, CSVParser parser, String source) {
        try {
            return records.hasNext() ? records.next() : null;
        } catch (UncheckedIOException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new MalformedConstantException(String.format(
                    "%s near line %d: %s", source, parser.getCurrentLineNumber(), cause.getMessage()), cause);
        }
    }

    private static double parseCell(String cell, String source, long row, String column) {
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new MalformedConstantException(String.format(
                    "%s row %d column '%s': '%s' is not a number", source, row, column, cell), e);
        }
    }
}
