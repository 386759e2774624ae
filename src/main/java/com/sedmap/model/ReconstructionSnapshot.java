package com.sedmap.model;

import com.sedmap.exception.ConfigurationException;
import com.sedmap.exception.ShapeMismatchException;

/**
 * Bookkeeping needed to turn a results table back into maps: image shape, scale
 * factor and normalization map (absent when the data were not normalized).
 * It is a copy, independent of the band set it was taken from.
 */
public final class ReconstructionSnapshot {

    private final Shape shape;
    private final double scaleFactor;
    private final double[][] normalizationMap;
    private final Engine engine;

    public ReconstructionSnapshot(Shape shape, double scaleFactor, double[][] normalizationMap, Engine engine) {
        if (shape == null) throw new ConfigurationException("A snapshot needs a shape");
        if (!(scaleFactor > 0) || Double.isInfinite(scaleFactor)) {
            throw new ConfigurationException("scaleFactor has value " + scaleFactor + " but it must be strictly positive");
        }
        if (normalizationMap != null && !Shape.of(normalizationMap).equals(shape)) {
            throw new ShapeMismatchException(shape, Shape.of(normalizationMap), "for the normalization map");
        }
        this.shape = shape;
        this.scaleFactor = scaleFactor;
        this.normalizationMap = normalizationMap == null ? null : Band.copy(normalizationMap);
        this.engine = engine;
    }

    public Shape getShape() { return shape; }
    public double getScaleFactor() { return scaleFactor; }
    public double[][] getNormalizationMap() { return normalizationMap == null ? null : Band.copy(normalizationMap); }
    public boolean isNormalized() { return normalizationMap != null; }
    /** Engine the data were prepared for, may be null when unknown. */
    public Engine getEngine() { return engine; }
}
