package com.sedmap.model;

import com.sedmap.exception.ConfigurationException;
import com.sedmap.exception.ShapeMismatchException;

/**
 * Dimensions of a 2D map. Pixels are flattened in row-major order, so the flat
 * position of {@code (row, column)} is {@code row * columns + column}.
 */
public final class Shape {

    public final int rows;
    public final int columns;

    public Shape(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new ConfigurationException("Shape must be strictly positive, got (" + rows + ", " + columns + ")");
        }
        this.rows = rows;
        this.columns = columns;
    }

    public static Shape of(double[][] matrix) {
        if (matrix == null || matrix.length == 0 || matrix[0] == null || matrix[0].length == 0) {
            throw new ConfigurationException("Matrix is empty");
        }
        int width = matrix[0].length;
        for (int y = 1; y < matrix.length; y++) {
            if (matrix[y] == null || matrix[y].length != width) {
                throw new ShapeMismatchException("Row " + y + " has length "
                        + (matrix[y] == null ? 0 : matrix[y].length) + " but row 0 has length " + width);
            }
        }
        return new Shape(matrix.length, width);
    }

    public static Shape of(boolean[][] mask) {
        if (mask == null || mask.length == 0 || mask[0] == null || mask[0].length == 0) {
            throw new ConfigurationException("Mask is empty");
        }
        int width = mask[0].length;
        for (int y = 1; y < mask.length; y++) {
            if (mask[y] == null || mask[y].length != width) {
                throw new ShapeMismatchException("Mask row " + y + " has length "
                        + (mask[y] == null ? 0 : mask[y].length) + " but row 0 has length " + width);
            }
        }
        return new Shape(mask.length, width);
    }

    public int size() {
        return rows * columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Shape)) return false;
        Shape other = (Shape) o;
        return rows == other.rows && columns == other.columns;
    }

    @Override
    public int hashCode() {
        return 31 * rows + columns;
    }

    @Override
    public String toString() {
        return "(" + rows + ", " + columns + ")";
    }
}
