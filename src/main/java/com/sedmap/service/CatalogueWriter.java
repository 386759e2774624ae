package com.sedmap.service;

import com.sedmap.model.Catalogue;
import com.sedmap.model.Engine;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes catalogues as whitespace separated ASCII tables: {@code <base>.in} without
 * header for LePhare, {@code <base>.mag} with a line of column names for Cigale.
 */
public class CatalogueWriter {

    private static final Logger log = LoggerFactory.getLogger(CatalogueWriter.class);

    /** Writes {@code catalogue} in {@code directory} (created if needed) and returns the file. */
    public Path write(Catalogue catalogue, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(catalogue.fileName());
        List<String> names = catalogue.getColumnNames();
        double[][] columns = new double[names.size()][];
        boolean[] integer = new boolean[names.size()];
        for (int c = 0; c < names.size(); c++) {
            columns[c] = catalogue.values(names.get(c));
            integer[c] = catalogue.isInteger(names.get(c));
        }

        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            if (catalogue.engine == Engine.CIGALE) {
                w.write(String.join(" ", names));
                w.newLine();
            }
            StringBuilder line = new StringBuilder();
            for (int r = 0; r < catalogue.getRowCount(); r++) {
                line.setLength(0);
                for (int c = 0; c < columns.length; c++) {
                    if (c > 0) line.append(' ');
                    line.append(format(columns[c][r], integer[c]));
                }
                w.write(line.toString());
                w.newLine();
            }
        }
        log.info("Wrote {} rows to {}", catalogue.getRowCount(), file);
        return file;
    }

    static String format(double v, boolean integer) {
        if (Double.isNaN(v)) return "nan";
        if (integer) return Long.toString(Math.round(v));
        return Double.toString(v);
    }
}
