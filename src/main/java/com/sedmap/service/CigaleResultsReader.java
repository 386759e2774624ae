package com.sedmap.service;

import com.sedmap.model.Column;
import com.sedmap.model.DataTable;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.TableHDU;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the {@code results.fits} table written by Cigale. The {@code id} column is
 * the identifier column; every other numeric scalar column is kept under its own name
 * (for instance {@code bayes.stellar.m_star}).
 */
public class CigaleResultsReader {

    private static final Logger log = LoggerFactory.getLogger(CigaleResultsReader.class);

    public static final String ID_COLUMN = "id";

    public DataTable read(File file) throws IOException, FitsException {
        try (Fits fits = new Fits(file)) {
            TableHDU<?> table = null;
            for (BasicHDU<?> hdu : fits.read()) {
                if (hdu instanceof TableHDU) {
                    table = (TableHDU<?>) hdu;
                    break;
                }
            }
            if (table == null) throw new IOException("No table extension found in " + file);

            List<Column> columns = new ArrayList<>();
            boolean hasId = false;
            for (int c = 0; c < table.getNCols(); c++) {
                String name = table.getColumnName(c);
                double[] values = toDouble(table.getColumn(c));
                if (name == null || values == null) {
                    log.debug("Skipping non numeric column {} of {}", name, file.getName());
                    continue;
                }
                if (name.equals(ID_COLUMN)) {
                    columns.add(Column.ofIdentifiers(ID_COLUMN, values));
                    hasId = true;
                } else {
                    columns.add(Column.of(name, values));
                }
            }
            log.info("Read {} columns from {}", columns.size(), file);
            return new DataTable(columns, hasId ? ID_COLUMN : null);
        }
    }

    /** 1D numeric (or numeric text) column as doubles, null for anything else. */
    static double[] toDouble(Object col) {
        if (col instanceof double[]) return ((double[]) col).clone();
        double[] d;
        if (col instanceof float[]) {
            float[] a = (float[]) col; d = new double[a.length];
            for (int i = 0; i < a.length; i++) d[i] = a[i];
        } else if (col instanceof long[]) {
            long[] a = (long[]) col; d = new double[a.length];
            for (int i = 0; i < a.length; i++) d[i] = a[i];
        } else if (col instanceof int[]) {
            int[] a = (int[]) col; d = new double[a.length];
            for (int i = 0; i < a.length; i++) d[i] = a[i];
        } else if (col instanceof short[]) {
            short[] a = (short[]) col; d = new double[a.length];
            for (int i = 0; i < a.length; i++) d[i] = a[i];
        } else if (col instanceof String[]) {
            String[] a = (String[]) col; d = new double[a.length];
            for (int i = 0; i < a.length; i++) {
                try {
                    d[i] = Double.parseDouble(a[i].trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        } else {
            return null;
        }
        return d;
    }
}
