package com.kinetic.modeller.analysis;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.codegen.util.FileWriteUtil;

import lombok.Value;

@Value
public class SensitivityResult {
    public static final String PARAMETER = "Parameter";
    public static final String CHANGE = "Change";

    List<String> labels;
    List<SensitivityRow> rows;
    List<String> skippedParameters;

    public List<String> header() {
        List<String> header = new ArrayList<>();
        header.add(PARAMETER);
        header.add(CHANGE);
        header.addAll(labels);
        return header;
    }

    public List<SensitivityRow> rowsFor(String parameter) {
        return rows.stream().filter(r -> r.getParameter().equals(parameter)).toList();
    }

    public List<String> toCsvLines() {
        List<String> lines = new ArrayList<>();
        lines.add(String.join(",", header()));
        for (SensitivityRow row : rows) {
            StringBuilder sb = new StringBuilder();
            sb.append(row.getParameter()).append(',').append(row.getChange());
            for (double value : row.getValues()) {
                sb.append(',').append(value);
            }
            lines.add(sb.toString());
        }
        return lines;
    }

    public void writeCsv(Path file) throws IOException {
        FileWriteUtil.safeWriteLines(file, toCsvLines());
    }
}
