package com.sedmap.model;

import com.sedmap.exception.ConfigurationException;
import com.sedmap.exception.ShapeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Data of a single filter: flux map, variance map, optional Poisson reference map
 * (data convolved by the square of the PSF), zeropoint and optional exposure time.
 *
 * <p>The variance unit is expected to be the square of the flux unit. The zeropoint
 * is the AB magnitude zeropoint of the flux map. Instances are immutable: matrices
 * are copied on the way in and on the way out.
 */
public final class Band {

    private static final Logger log = LoggerFactory.getLogger(Band.class);

    private final String name;
    private final double[][] flux;
    private final double[][] variance;
    private final double[][] poissonReference;
    private final double zeropoint;
    private final Double exposureTime;
    private final Shape shape;

    public Band(String name, double[][] flux, double[][] variance, double zeropoint) {
        this(name, flux, variance, zeropoint, null, null);
    }

    public Band(String name, double[][] flux, double[][] variance, double zeropoint,
                double[][] poissonReference, Double exposureTime) {
        if (name == null || name.trim().isEmpty()) {
            throw new ConfigurationException("Band name must not be blank");
        }
        if (flux == null || variance == null) {
            throw new ConfigurationException("Band " + name + " needs both a flux and a variance map");
        }
        if (Double.isNaN(zeropoint) || Double.isInfinite(zeropoint)) {
            throw new ConfigurationException("Band " + name + " has a non finite zeropoint");
        }
        if (exposureTime != null && !(exposureTime > 0)) {
            throw new ConfigurationException("Band " + name + " has exposure time " + exposureTime + " but it must be positive");
        }

        Shape fluxShape = Shape.of(flux);
        Shape varShape = Shape.of(variance);
        if (!fluxShape.equals(varShape)) {
            throw new ShapeMismatchException(fluxShape, varShape, "in band " + name);
        }
        if (poissonReference != null) {
            Shape refShape = Shape.of(poissonReference);
            if (!fluxShape.equals(refShape)) {
                throw new ShapeMismatchException(fluxShape, refShape, "in band " + name);
            }
        }

        this.name = name;
        this.flux = copy(flux);
        this.variance = copy(variance);
        this.poissonReference = poissonReference == null ? null : copy(poissonReference);
        this.zeropoint = zeropoint;
        this.exposureTime = exposureTime;
        this.shape = fluxShape;

        if (poissonReference == null) {
            log.debug("Band {}: no Poisson reference map, Poisson noise is assumed to be in the variance map", name);
        } else if (exposureTime == null) {
            log.warn("Band {} has a Poisson reference map but no exposure time. Poisson noise cannot be computed", name);
        }
    }

    /**
     * Copy of {@code matrix} where masked positions are NaN. The input is not modified
     * and applying the same mask twice gives the same result.
     */
    public static double[][] masked(double[][] matrix, boolean[][] mask) {
        Shape matrixShape = Shape.of(matrix);
        Shape maskShape = Shape.of(mask);
        if (!matrixShape.equals(maskShape)) {
            throw new ShapeMismatchException(matrixShape, maskShape, "when applying mask");
        }
        double[][] out = copy(matrix);
        for (int y = 0; y < out.length; y++) {
            for (int x = 0; x < out[y].length; x++) {
                if (mask[y][x]) out[y][x] = Double.NaN;
            }
        }
        return out;
    }

    public static double[][] copy(double[][] matrix) {
        double[][] out = new double[matrix.length][];
        for (int y = 0; y < matrix.length; y++) out[y] = matrix[y].clone();
        return out;
    }

    /** True when both a Poisson reference and an exposure time are available. */
    public boolean hasShotNoiseInputs() {
        return poissonReference != null && exposureTime != null;
    }

    public String getName() { return name; }
    public double[][] getFlux() { return copy(flux); }
    public double[][] getVariance() { return copy(variance); }
    public double[][] getPoissonReference() { return poissonReference == null ? null : copy(poissonReference); }
    public double getZeropoint() { return zeropoint; }
    public Double getExposureTime() { return exposureTime; }
    public Shape getShape() { return shape; }

    @Override
    public String toString() {
        return "Band[" + name + ", shape=" + shape + ", zpt=" + zeropoint + "]";
    }
}
