package com.sedmap.service;

import com.sedmap.exception.EmptyInputException;
import com.sedmap.exception.ShapeMismatchException;
import com.sedmap.model.Band;
import com.sedmap.model.CleaningMethod;
import com.sedmap.model.Shape;
import java.util.List;

/**
 * Per pixel steps of the pipeline. None of them modifies its inputs and none of
 * them throws on NaN, zero or negative pixel values.
 */
public final class PixelMaps {

    private PixelMaps() {}

    public static final class FluxVariance {
        public final double[][] flux;
        public final double[][] variance;

        public FluxVariance(double[][] flux, double[][] variance) {
            this.flux = flux;
            this.variance = variance;
        }
    }

    /**
     * Masks both maps, then replaces pixels where the flux or the variance is negative.
     * Both values of such a pixel are replaced: by 0 with {@link CleaningMethod#ZERO},
     * by the smallest flux among the non masked, non negative pixels of these maps with
     * {@link CleaningMethod#MIN} (0 when there is none).
     */
    public static FluxVariance clean(double[][] flux, double[][] variance, boolean[][] mask, CleaningMethod method) {
        double[][] data = Band.masked(flux, mask);
        double[][] var = Band.masked(variance, mask);
        checkSameShape(data, var, "when cleaning");

        double replacement = 0;
        if (method == CleaningMethod.MIN) {
            double min = Double.POSITIVE_INFINITY;
            for (int y = 0; y < data.length; y++) {
                for (int x = 0; x < data[y].length; x++) {
                    double d = data[y][x];
                    if (d >= 0 && var[y][x] >= 0 && d < min) min = d;
                }
            }
            replacement = Double.isInfinite(min) ? 0 : min;
        }

        // NaN never compares below 0, so masked pixels stay masked
        for (int y = 0; y < data.length; y++) {
            for (int x = 0; x < data[y].length; x++) {
                if (data[y][x] < 0 || var[y][x] < 0) {
                    data[y][x] = replacement;
                    var[y][x] = replacement;
                }
            }
        }
        return new FluxVariance(data, var);
    }

    /** Poisson variance term {@code |ref| * factor / exposureTime}. */
    public static double[][] poissonVariance(double[][] reference, double exposureTime, double factor) {
        double[][] out = new double[reference.length][];
        for (int y = 0; y < reference.length; y++) {
            out[y] = new double[reference[y].length];
            for (int x = 0; x < reference[y].length; x++) {
                out[y][x] = Math.abs(reference[y][x]) * factor / exposureTime;
            }
        }
        return out;
    }

    public static double[][] add(double[][] a, double[][] b) {
        checkSameShape(a, b, "when adding maps");
        double[][] out = Band.copy(a);
        for (int y = 0; y < out.length; y++) {
            for (int x = 0; x < out[y].length; x++) out[y][x] += b[y][x];
        }
        return out;
    }

    /**
     * Pixel wise mean of the given maps ignoring NaN values. Pixels that are NaN in
     * every map get {@code fill}.
     */
    public static double[][] meanMap(List<double[][]> maps, double fill) {
        if (maps.isEmpty()) throw new EmptyInputException("Cannot average an empty list of maps");
        Shape shape = Shape.of(maps.get(0));
        for (double[][] m : maps) checkSameShape(maps.get(0), m, "when averaging maps");

        double[][] out = new double[shape.rows][shape.columns];
        for (int y = 0; y < shape.rows; y++) {
            for (int x = 0; x < shape.columns; x++) {
                double sum = 0;
                int n = 0;
                for (double[][] m : maps) {
                    double v = m[y][x];
                    if (!Double.isNaN(v)) {
                        sum += v;
                        n++;
                    }
                }
                out[y][x] = n == 0 ? fill : sum / n;
            }
        }
        return out;
    }

    /**
     * Divides by {@code norm} where it is non zero and multiplies by {@code factor}
     * everywhere. The variance gets the squared coefficients.
     */
    public static FluxVariance normalize(FluxVariance maps, double[][] norm, double factor) {
        checkSameShape(maps.flux, norm, "between data and normalization map");
        double[][] data = Band.copy(maps.flux);
        double[][] var = Band.copy(maps.variance);
        for (int y = 0; y < data.length; y++) {
            for (int x = 0; x < data[y].length; x++) {
                double n = norm[y][x];
                double coeff = n != 0 ? factor / n : factor;
                data[y][x] *= coeff;
                var[y][x] *= coeff * coeff;
            }
        }
        return new FluxVariance(data, var);
    }

    public static double[] flatten(double[][] map) {
        Shape shape = Shape.of(map);
        double[] out = new double[shape.size()];
        for (int y = 0; y < shape.rows; y++) {
            System.arraycopy(map[y], 0, out, y * shape.columns, shape.columns);
        }
        return out;
    }

    public static boolean[] finite(double[] flux, double[] variance) {
        boolean[] out = new boolean[flux.length];
        for (int i = 0; i < flux.length; i++) {
            out[i] = isFinite(flux[i]) && isFinite(variance[i]);
        }
        return out;
    }

    public static int[] indicesOf(boolean[] selection) {
        int n = 0;
        for (boolean b : selection) if (b) n++;
        int[] out = new int[n];
        int k = 0;
        for (int i = 0; i < selection.length; i++) if (selection[i]) out[k++] = i;
        return out;
    }

    public static double[] select(double[] values, int[] indices) {
        double[] out = new double[indices.length];
        for (int i = 0; i < indices.length; i++) out[i] = values[indices[i]];
        return out;
    }

    private static boolean isFinite(double v) {
        return !Double.isNaN(v) && !Double.isInfinite(v);
    }

    private static void checkSameShape(double[][] a, double[][] b, String context) {
        Shape sa = Shape.of(a);
        Shape sb = Shape.of(b);
        if (!sa.equals(sb)) throw new ShapeMismatchException(sa, sb, context);
    }
}
