package com.sedmap.service;

import com.sedmap.model.ResultMap;
import com.sedmap.model.Shape;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.measure.Measurements;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;
import java.io.File;
import java.io.IOException;

/**
 * Quick look at reconstructed maps with ImageJ: summary statistics over the pixels
 * that have a value, and TIFF previews.
 */
public class MapStatisticsService {

    public static class MapStatistics {
        public final int validPixels;
        public final double mean;
        public final double min;
        public final double max;
        public final double stdDev;

        public MapStatistics(int validPixels, double mean, double min, double max, double stdDev) {
            this.validPixels = validPixels;
            this.mean = mean;
            this.min = min;
            this.max = max;
            this.stdDev = stdDev;
        }

        @Override
        public String toString() {
            return String.format("%d px, mean %.4g, min %.4g, max %.4g, std %.4g", validPixels, mean, min, max, stdDev);
        }
    }

    /** Float image of the map, row 0 at the top. NaN pixels stay NaN. */
    public FloatProcessor toProcessor(ResultMap map) {
        double[][] data = map.getData();
        Shape shape = map.getShape();
        FloatProcessor ip = new FloatProcessor(shape.columns, shape.rows);
        float[] px = (float[]) ip.getPixels();
        for (int y = 0; y < shape.rows; y++)
            for (int x = 0; x < shape.columns; x++)
                px[y * shape.columns + x] = (float) data[y][x];
        ip.resetMinAndMax();
        return ip;
    }

    public MapStatistics statistics(ResultMap map) {
        int valid = 0;
        for (double[] row : map.getData())
            for (double v : row)
                if (!Double.isNaN(v)) valid++;
        if (valid == 0) return new MapStatistics(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN);

        // Float statistics skip NaN pixels
        ImageStatistics stats = ImageStatistics.getStatistics(toProcessor(map),
                Measurements.MEAN | Measurements.MIN_MAX | Measurements.STD_DEV, null);
        return new MapStatistics(valid, stats.mean, stats.min, stats.max, stats.stdDev);
    }

    public void saveTiff(ResultMap map, File output) throws IOException {
        ImagePlus imp = new ImagePlus(map.name, toProcessor(map));
        if (!new FileSaver(imp).saveAsTiff(output.getAbsolutePath())) {
            throw new IOException("Could not write TIFF preview " + output);
        }
    }
}
