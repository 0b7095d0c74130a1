package com.kinetic.modeller.simulation;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.codegen.util.FileWriteUtil;

import lombok.Value;

/**
 * Sampled trajectory: a header of labels and rows of {@code [t, y0..yn-1]}.
 */
@Value
public class SimulationResult {
    List<String> labels;
    List<double[]> rows;
    long stepsTaken;

    public double[] lastRow() {
        if (rows.isEmpty()) {
            throw new IllegalStateException("Simulation produced no rows");
        }
        return rows.get(rows.size() - 1);
    }

    /**
     * Value of the labelled column in the last row.
     */
    public double finalValue(String label) {
        int column = labels.indexOf(label);
        if (column < 0) {
            throw new IllegalArgumentException("No column labelled " + label);
        }
        return lastRow()[column];
    }

    public List<String> toCsvLines() {
        List<String> lines = new ArrayList<>(rows.size() + 1);
        lines.add(String.join(",", labels));
        for (double[] row : rows) {
            lines.add(toCsv(row));
        }
        return lines;
    }

    public void writeCsv(Path file) throws IOException {
        FileWriteUtil.safeWriteLines(file, toCsvLines());
    }

    static String toCsv(double[] row) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(row[i]);
        }
        return sb.toString();
    }
}
