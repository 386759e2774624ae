package com.sedmap.model;

/**
 * Everything a pipeline run derives from a band set. Instances are immutable so
 * that the table, normalization map, scale factor and pixel index always belong
 * to the same run.
 */
public final class PipelineResult {

    private final Engine engine;
    private final PipelineOptions options;
    private final DataTable table;
    private final double[][] normalizationMap;
    private final double scaleFactor;
    private final int[] validPixelIndex;

    public PipelineResult(Engine engine, PipelineOptions options, DataTable table, double[][] normalizationMap,
                          double scaleFactor, int[] validPixelIndex) {
        this.engine = engine;
        this.options = options;
        this.table = table;
        this.normalizationMap = normalizationMap == null ? null : Band.copy(normalizationMap);
        this.scaleFactor = scaleFactor;
        this.validPixelIndex = validPixelIndex.clone();
    }

    public Engine getEngine() { return engine; }
    public PipelineOptions getOptions() { return options; }
    public DataTable getTable() { return table; }
    public double[][] getNormalizationMap() { return normalizationMap == null ? null : Band.copy(normalizationMap); }
    public double getScaleFactor() { return scaleFactor; }
    public int[] getValidPixelIndex() { return validPixelIndex.clone(); }
}
