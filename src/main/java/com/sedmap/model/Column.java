package com.sedmap.model;

import com.sedmap.exception.ConfigurationException;
import com.sedmap.exception.ShapeMismatchException;

public final class Column {

    public final String name;
    public final String unit;
    public final boolean integer;
    private final double[] values;
    private final double[] errors;

    public Column(String name, double[] values, double[] errors, String unit, boolean integer) {
        if (name == null || name.isEmpty()) throw new ConfigurationException("Column name must not be empty");
        if (values == null) throw new ConfigurationException("Column " + name + " has no values");
        if (errors != null && errors.length != values.length) {
            throw new ShapeMismatchException("Column " + name + " has " + values.length + " values but " + errors.length + " errors");
        }
        this.name = name;
        this.values = values.clone();
        this.errors = errors == null ? null : errors.clone();
        this.unit = unit;
        this.integer = integer;
    }

    public static Column of(String name, double[] values) {
        return new Column(name, values, null, null, false);
    }

    public static Column withErrors(String name, double[] values, double[] errors, String unit) {
        return new Column(name, values, errors, unit, false);
    }

    public static Column ofIntegers(String name, long[] values) {
        double[] d = new double[values.length];
        for (int i = 0; i < values.length; i++) d[i] = values[i];
        return new Column(name, d, null, null, true);
    }

    /**
     * Identifier column from parsed values. Every value must be a whole number in
     * {@code [0, Integer.MAX_VALUE]}, the range of flattened pixel positions.
     */
    public static Column ofIdentifiers(String name, double[] values) {
        for (int r = 0; r < values.length; r++) checkIdentifier(name, r, values[r]);
        return new Column(name, values, null, null, true);
    }

    static int checkIdentifier(String name, int row, double v) {
        if (Double.isNaN(v) || v < 0 || v > Integer.MAX_VALUE || v != Math.rint(v)) {
            throw new ConfigurationException("Row " + row + " of column " + name + " has identifier " + v
                    + " which is not a pixel position");
        }
        return (int) v;
    }

    public double[] getValues() { return values.clone(); }
    public double[] getErrors() { return errors == null ? null : errors.clone(); }
    public boolean hasErrors() { return errors != null; }
    public int length() { return values.length; }

    double value(int row) { return values[row]; }
}
