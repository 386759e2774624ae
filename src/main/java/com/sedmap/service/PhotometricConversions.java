package com.sedmap.service;

import com.sedmap.model.Measurement;

/**
 * Conversions between detector counts, AB magnitudes and physical flux densities.
 *
 * <p>Magnitudes follow {@code m = -2.5 log10(d) + zpt} with error {@code 1.08 * err / d}.
 * Flux densities in erg/s/cm2/Hz follow {@code f = d * 10^(-(zpt + 48.6) / 2.5)}, the
 * same factor being applied to the error.
 */
public final class PhotometricConversions {

    /** Coefficient of the magnitude error, approximately 2.5 / ln(10). */
    public static final double MAG_ERROR_COEFFICIENT = 1.08;

    /** AB magnitude of a 1 erg/s/cm2/Hz source, negated. */
    public static final double AB_OFFSET = 48.6;

    /** 1 erg/s/cm2/Hz expressed in mJy. */
    public static final double MJY_PER_CGS = 1e26;

    private PhotometricConversions() {}

    public static Measurement fluxToMagnitude(double value, double sigma, double zeropoint) {
        if (!(value > 0)) {
            throw new IllegalArgumentException("value must be strictly positive to get a magnitude, got " + value);
        }
        return new Measurement(-2.5 * Math.log10(value) + zeropoint, MAG_ERROR_COEFFICIENT * sigma / value);
    }

    public static Measurement magnitudeToFlux(double magnitude, double sigmaMagnitude, double zeropoint) {
        double value = Math.pow(10, (zeropoint - magnitude) / 2.5);
        return new Measurement(value, sigmaMagnitude * value / MAG_ERROR_COEFFICIENT);
    }

    public static Measurement countToPhysicalFluxDensity(double value, double sigma, double zeropoint) {
        double factor = physicalFactor(zeropoint);
        return new Measurement(value * factor, sigma * factor);
    }

    public static Measurement physicalFluxDensityToCount(double value, double sigma, double zeropoint) {
        double factor = physicalFactor(zeropoint);
        return new Measurement(value / factor, sigma / factor);
    }

    /** In place magnitude conversion of two parallel arrays. All values must be positive. */
    public static void fluxToMagnitude(double[] values, double[] sigmas, double zeropoint) {
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            values[i] = -2.5 * Math.log10(v) + zeropoint;
            sigmas[i] = MAG_ERROR_COEFFICIENT * sigmas[i] / v;
        }
    }

    /** In place flux density conversion of two parallel arrays. */
    public static void countToPhysicalFluxDensity(double[] values, double[] sigmas, double zeropoint) {
        double factor = physicalFactor(zeropoint);
        for (int i = 0; i < values.length; i++) {
            values[i] *= factor;
            sigmas[i] *= factor;
        }
    }

    public static double cgsToMilliJansky(double cgs) {
        return cgs * MJY_PER_CGS;
    }

    public static double milliJanskyToCgs(double mJy) {
        return mJy / MJY_PER_CGS;
    }

    private static double physicalFactor(double zeropoint) {
        return Math.pow(10, -(zeropoint + AB_OFFSET) / 2.5);
    }
}
