package com.sedmap.service;

import com.sedmap.exception.ConfigurationException;
import com.sedmap.exception.ShapeMismatchException;
import com.sedmap.model.Column;
import com.sedmap.model.DataTable;
import com.sedmap.model.ReconstructionSnapshot;
import com.sedmap.model.ResultMap;
import com.sedmap.model.Shape;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds 2D maps from an engine results table. Each row is put back at the pixel
 * given by the identifier column, divided by the scale factor and multiplied by the
 * normalization map where the latter is non zero. Pixels without a row are NaN.
 *
 * <p>The shape, scale factor and normalization map come from a snapshot copied with
 * {@link #link}, or are passed explicitly to {@link #toImage(String, Shape, Double, double[][])}.
 */
public class ResultReconstructor {

    private static final Logger log = LoggerFactory.getLogger(ResultReconstructor.class);

    private final DataTable results;
    private final int[] ids;
    private ReconstructionSnapshot linked;

    public ResultReconstructor(DataTable results) {
        if (results == null) throw new ConfigurationException("results table must not be null");
        if (results.getIdColumn() == null) {
            throw new ConfigurationException("Results table has no identifier column to locate pixels");
        }
        this.results = results;
        this.ids = results.ids();
    }

    public ResultReconstructor link(BandSet bandSet) {
        return link(bandSet.snapshot());
    }

    public ResultReconstructor link(ReconstructionSnapshot snapshot) {
        this.linked = snapshot;
        log.debug("Linked snapshot: shape {}, scale factor {}, normalized {}", snapshot.getShape(),
                snapshot.getScaleFactor(), snapshot.isNormalized());
        return this;
    }

    public ResultMap toImage(String column) {
        return toImage(column, null, null, null);
    }

    /**
     * Map of {@code column}. Null arguments fall back to the linked snapshot; without one,
     * the scale factor defaults to 1 and no normalization is applied.
     */
    public ResultMap toImage(String column, Shape shape, Double scaleFactor, double[][] normalizationMap) {
        Shape s = shape != null ? shape : linked == null ? null : linked.getShape();
        if (s == null) {
            throw new ConfigurationException("No shape given and no band set linked: cannot build map of " + column);
        }
        double scale = scaleFactor != null ? scaleFactor : linked == null ? 1 : linked.getScaleFactor();
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new ConfigurationException("scaleFactor has value " + scale + " but it must be strictly positive");
        }
        double[][] norm = normalizationMap != null ? normalizationMap
                : linked == null ? null : linked.getNormalizationMap();
        if (norm != null && !Shape.of(norm).equals(s)) {
            throw new ShapeMismatchException(s, Shape.of(norm), "between map shape and normalization map");
        }

        Column c = results.column(column);
        double[] values = c.getValues();

        double[] flat = new double[s.size()];
        Arrays.fill(flat, Double.NaN);
        for (int i = 0; i < ids.length; i++) {
            int pos = ids[i];
            if (pos < 0 || pos >= flat.length) {
                throw new ShapeMismatchException("Row " + i + " points to pixel " + pos + " which is outside shape " + s);
            }
            flat[pos] = values[i] / scale;
        }

        double[][] map = new double[s.rows][s.columns];
        for (int y = 0; y < s.rows; y++) {
            System.arraycopy(flat, y * s.columns, map[y], 0, s.columns);
        }

        if (norm != null) {
            for (int y = 0; y < s.rows; y++) {
                for (int x = 0; x < s.columns; x++) {
                    if (norm[y][x] != 0) map[y][x] *= norm[y][x];
                }
            }
        }
        return new ResultMap(column, map, c.unit);
    }

    public DataTable getResults() {
        return results;
    }

    public ReconstructionSnapshot getLinkedSnapshot() {
        return linked;
    }
}
