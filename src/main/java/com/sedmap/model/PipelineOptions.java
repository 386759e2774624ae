package com.sedmap.model;

import com.sedmap.exception.ConfigurationException;

/** Options of a {@code configure} call. Every setter validates its argument. */
public final class PipelineOptions {

    public static final double DEFAULT_SCALE_FACTOR = 100;

    private CleaningMethod cleaningMethod = CleaningMethod.ZERO;
    private ValidPixelPolicy validPixelPolicy = ValidPixelPolicy.FIRST_BAND;
    private final ConstrainedValue<Double> scaleFactor = ConstrainedValue
            .atLeast("scaleFactor", DEFAULT_SCALE_FACTOR, 0.0)
            .withRule(v -> v > 0 && !v.isInfinite(), "it must be strictly positive and finite");
    private final ConstrainedValue<Double> poissonFactor = ConstrainedValue
            .atLeast("poissonFactor", 0.0, 0.0)
            .withRule(v -> !v.isNaN() && !v.isInfinite(), "it must be finite");

    public static PipelineOptions defaults() {
        return new PipelineOptions();
    }

    /** Independent copy with the same settings. */
    public PipelineOptions copy() {
        return new PipelineOptions()
                .cleaningMethod(cleaningMethod)
                .validPixelPolicy(validPixelPolicy)
                .scaleFactor(getScaleFactor())
                .poissonFactor(getPoissonFactor());
    }

    public PipelineOptions cleaningMethod(CleaningMethod method) {
        if (method == null) throw new ConfigurationException("cleaningMethod must not be null");
        this.cleaningMethod = method;
        return this;
    }

    public PipelineOptions validPixelPolicy(ValidPixelPolicy policy) {
        if (policy == null) throw new ConfigurationException("validPixelPolicy must not be null");
        this.validPixelPolicy = policy;
        return this;
    }

    public PipelineOptions scaleFactor(double factor) {
        scaleFactor.set(factor);
        return this;
    }

    /** Coefficient applied to the Poisson variance term; 0 disables it. */
    public PipelineOptions poissonFactor(double factor) {
        poissonFactor.set(factor);
        return this;
    }

    public CleaningMethod getCleaningMethod() { return cleaningMethod; }
    public ValidPixelPolicy getValidPixelPolicy() { return validPixelPolicy; }
    public double getScaleFactor() { return scaleFactor.get(); }
    public double getPoissonFactor() { return poissonFactor.get(); }

    @Override
    public String toString() {
        return String.format("clean=%s, scale=%s, poisson=%s, pixels=%s",
                cleaningMethod, scaleFactor, poissonFactor, validPixelPolicy);
    }
}
