package com.example.retrain.data;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the cleaned dataset CSV: a header row, then numeric columns.
 *
 * <p>
 * The target column is the first of {@link #TARGET_CANDIDATES} present in the header; every
 * other column is a feature. Rows with the wrong column count or a non-numeric cell are
 * skipped and counted.
 * </p>
 */
@Slf4j
public class DatasetReader {

    public static final List<String> TARGET_CANDIDATES = List.of("target", "MedHouseVal");

    public Dataset read(Path csv) throws IOException {
        try (BufferedReader r = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
            String header = r.readLine();
            if (header == null || header.isBlank()) {
                throw new IllegalArgumentException("Dataset " + csv + " has no header row");
            }
            String[] cols = splitRow(header);
            int targetIdx = targetIndex(cols, csv);

            List<String> featureNames = new ArrayList<>(cols.length - 1);
            for (int i = 0; i < cols.length; i++) {
                if (i != targetIdx) featureNames.add(cols[i]);
            }

            List<double[]> x = new ArrayList<>();
            List<Double> y = new ArrayList<>();
            int skipped = 0;
            String line;
            while ((line = r.readLine()) != null) {
                if (line.isBlank()) continue;
                String[] cells = splitRow(line);
                if (cells.length != cols.length) {
                    skipped++;
                    continue;
                }
                try {
                    double[] row = new double[cols.length - 1];
                    int j = 0;
                    for (int i = 0; i < cells.length; i++) {
                        if (i != targetIdx) row[j++] = Double.parseDouble(cells[i]);
                    }
                    double label = Double.parseDouble(cells[targetIdx]);
                    x.add(row);
                    y.add(label);
                } catch (NumberFormatException e) {
                    skipped++;
                }
            }
            if (skipped > 0) {
                log.warn("Skipped {} malformed rows in {}", skipped, csv);
            }
            return new Dataset(featureNames, x, y.stream().mapToDouble(Double::doubleValue).toArray());
        }
    }

    private static int targetIndex(String[] cols, Path csv) {
        for (String candidate : TARGET_CANDIDATES) {
            for (int i = 0; i < cols.length; i++) {
                if (candidate.equals(cols[i])) return i;
            }
        }
        throw new IllegalArgumentException("Dataset " + csv + " has none of the target columns " + TARGET_CANDIDATES);
    }

    private static String[] splitRow(String line) {
        String[] cells = line.split(",", -1);
        for (int i = 0; i < cells.length; i++) {
            cells[i] = cells[i].trim();
        }
        return cells;
    }
}
