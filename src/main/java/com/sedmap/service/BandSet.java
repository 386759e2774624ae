package com.sedmap.service;

import com.sedmap.exception.ConfigurationException;
import com.sedmap.exception.EmptyInputException;
import com.sedmap.exception.ShapeMismatchException;
import com.sedmap.exception.UnsupportedEngineException;
import com.sedmap.model.Band;
import com.sedmap.model.Catalogue;
import com.sedmap.model.Column;
import com.sedmap.model.ConstrainedValue;
import com.sedmap.model.DataTable;
import com.sedmap.model.Engine;
import com.sedmap.model.PipelineOptions;
import com.sedmap.model.PipelineResult;
import com.sedmap.model.ReconstructionSnapshot;
import com.sedmap.model.Shape;
import com.sedmap.model.ValidPixelPolicy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered set of bands sharing one bad pixel mask, turned into a per pixel table
 * for a SED fitting engine.
 *
 * <p>Nothing is computed until {@link #configure(Engine, PipelineOptions)} is called.
 * Each call reruns the whole pipeline and replaces the table, normalization map,
 * scale factor and pixel index together; if it fails, the previous results stay.
 *
 * <p>Pipeline, for each band:
 * <ol>
 *   <li>mask bad pixels and replace negative values ({@link PixelMaps#clean})</li>
 *   <li>add the Poisson variance term when the band has the inputs for it</li>
 *   <li>LePhare only: divide by the mean flux map and multiply by the scale factor</li>
 *   <li>flatten and keep the valid pixels</li>
 *   <li>flag zero (or negative) flux and variance entries as missing</li>
 *   <li>convert to magnitudes (LePhare) or mJy (Cigale)</li>
 * </ol>
 */
public class BandSet {

    private static final Logger log = LoggerFactory.getLogger(BandSet.class);

    /** 2^53 - 1 is the largest Context value a double column holds exactly. */
    public static final int MAX_CONTEXT_BANDS = 53;

    private final List<Band> bands;
    private final boolean[][] mask;
    private final Shape shape;
    private final double redshift;

    // Replaced in one assignment, never updated in place
    private volatile PipelineResult result;

    public BandSet(List<Band> bands, boolean[][] mask) {
        this(bands, mask, 0);
    }

    public BandSet(List<Band> bands, boolean[][] mask, double redshift) {
        if (bands == null) throw new ConfigurationException("bands must not be null");
        if (mask == null) throw new ConfigurationException("A mask is required, use an all false mask to keep every pixel");
        this.redshift = ConstrainedValue.atLeast("redshift", redshift, 0.0)
                .withRule(z -> !z.isNaN() && !z.isInfinite(), "it must be finite").get();

        this.bands = Collections.unmodifiableList(buildBands(bands));
        if (this.bands.isEmpty()) {
            throw new EmptyInputException("At least one band is needed to build a band set");
        }

        Shape reference = this.bands.get(0).getShape();
        for (Band b : this.bands.subList(1, this.bands.size())) {
            if (!b.getShape().equals(reference)) {
                throw new ShapeMismatchException(b.getShape(), reference, "in band list (band " + b.getName() + ")");
            }
        }
        Shape maskShape = Shape.of(mask);
        if (!maskShape.equals(reference)) {
            throw new ShapeMismatchException(maskShape, reference, "between mask and bands");
        }
        this.mask = new boolean[mask.length][];
        for (int y = 0; y < mask.length; y++) this.mask[y] = mask[y].clone();
        this.shape = reference;
    }

    private static List<Band> buildBands(List<Band> input) {
        List<Band> out = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < input.size(); i++) {
            Band b = input.get(i);
            if (b == null) {
                log.warn("Band at position {} has no data. Skipping it", i);
            } else if (!names.add(b.getName())) {
                log.warn("Band {} already present in band list. Skipping it", b.getName());
            } else {
                out.add(b);
            }
        }
        return out;
    }

    public PipelineResult configure(Engine engine) {
        return configure(engine, PipelineOptions.defaults());
    }

    /** Runs the full pipeline for {@code engine} and makes its output the current state. */
    public PipelineResult configure(Engine engine, PipelineOptions options) {
        if (engine == null) throw new UnsupportedEngineException("null");
        PipelineOptions opts = options == null ? PipelineOptions.defaults() : options.copy();

        PipelineResult next = run(engine, opts);
        this.result = next;

        log.info("Built {} table: {} bands, {} valid pixels out of {} ({})", engine.getKey(), bands.size(),
                next.getValidPixelIndex().length, shape.size(), opts);
        return next;
    }

    private PipelineResult run(Engine engine, PipelineOptions options) {
        int nb = bands.size();
        if (engine.hasContextColumn() && nb > MAX_CONTEXT_BANDS) {
            throw new ConfigurationException("Context column cannot encode " + nb + " bands, at most "
                    + MAX_CONTEXT_BANDS + " are supported");
        }

        // Shared reference for every band, computed from the masked raw flux
        double[][] norm = null;
        double scaleFactor = 1;
        if (engine.normalizes()) {
            List<double[][]> maskedFlux = new ArrayList<>(nb);
            for (Band b : bands) maskedFlux.add(Band.masked(b.getFlux(), mask));
            norm = PixelMaps.meanMap(maskedFlux, 0);
            scaleFactor = options.getScaleFactor();
        }

        double[][] flatFlux = new double[nb][];
        double[][] flatVar = new double[nb][];
        for (int i = 0; i < nb; i++) {
            Band band = bands.get(i);
            PixelMaps.FluxVariance maps = PixelMaps.clean(band.getFlux(), band.getVariance(), mask, options.getCleaningMethod());
            maps = addShotNoise(band, maps, options.getPoissonFactor());
            if (norm != null) maps = PixelMaps.normalize(maps, norm, scaleFactor);
            flatFlux[i] = PixelMaps.flatten(maps.flux);
            flatVar[i] = PixelMaps.flatten(maps.variance);
        }

        int[] valid = validPixels(flatFlux, flatVar, options.getValidPixelPolicy());
        if (valid.length == 0) {
            throw new EmptyInputException("No valid pixel left after masking");
        }

        List<Column> columns = new ArrayList<>();
        long[] ids = new long[valid.length];
        for (int i = 0; i < valid.length; i++) ids[i] = valid[i];
        columns.add(Column.ofIntegers(engine.getIdColumn(), ids));

        for (int i = 0; i < nb; i++) {
            Band band = bands.get(i);
            double[] values = PixelMaps.select(flatFlux[i], valid);
            double[] errors = PixelMaps.select(flatVar[i], valid);
            toEngineUnits(engine, values, errors, band.getZeropoint());
            columns.add(Column.withErrors(band.getName(), values, errors, engine.getValueUnit()));
        }

        if (engine.hasContextColumn()) {
            long[] context = new long[valid.length];
            Arrays.fill(context, (1L << nb) - 1);
            columns.add(Column.ofIntegers(engine.getContextColumn(), context));
        }
        double[] z = new double[valid.length];
        Arrays.fill(z, redshift);
        columns.add(Column.of(engine.getRedshiftColumn(), z));

        DataTable table = new DataTable(columns, engine.getIdColumn());
        return new PipelineResult(engine, options, table, norm, scaleFactor, valid);
    }

    private PixelMaps.FluxVariance addShotNoise(Band band, PixelMaps.FluxVariance maps, double poissonFactor) {
        if (poissonFactor == 0) return maps;
        if (!band.hasShotNoiseInputs()) {
            log.debug("Band {}: no Poisson reference or exposure time, no Poisson noise added", band.getName());
            return maps;
        }
        log.debug("Band {}: adding Poisson noise (factor {}, exposure time {})", band.getName(), poissonFactor, band.getExposureTime());
        double[][] poisson = PixelMaps.poissonVariance(band.getPoissonReference(), band.getExposureTime(), poissonFactor);
        return new PixelMaps.FluxVariance(maps.flux, PixelMaps.add(maps.variance, poisson));
    }

    private static int[] validPixels(double[][] flatFlux, double[][] flatVar, ValidPixelPolicy policy) {
        boolean[] keep = PixelMaps.finite(flatFlux[0], flatVar[0]);
        if (policy == ValidPixelPolicy.ALL_BANDS) {
            for (int i = 1; i < flatFlux.length; i++) {
                boolean[] other = PixelMaps.finite(flatFlux[i], flatVar[i]);
                for (int p = 0; p < keep.length; p++) keep[p] &= other[p];
            }
        }
        return PixelMaps.indicesOf(keep);
    }

    /**
     * Converts flux and variance (in place) into the engine's value and error. Entries with
     * a non positive or NaN flux or variance (NaN happens in later bands with the first band
     * policy) are set to NaN first; LePhare then gets its -99 sentinel for them.
     */
    private static void toEngineUnits(Engine engine, double[] values, double[] variances, double zeropoint) {
        boolean[] missing = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            missing[i] = !(values[i] > 0) || !(variances[i] > 0);
            if (missing[i]) {
                values[i] = Double.NaN;
                variances[i] = Double.NaN;
            }
            variances[i] = Math.sqrt(variances[i]);
        }

        if (engine == Engine.LEPHARE) {
            PhotometricConversions.fluxToMagnitude(values, variances, zeropoint);
            for (int i = 0; i < values.length; i++) {
                if (missing[i]) {
                    values[i] = Engine.MISSING_SENTINEL;
                    variances[i] = Engine.MISSING_SENTINEL;
                }
            }
        } else {
            PhotometricConversions.countToPhysicalFluxDensity(values, variances, zeropoint);
            for (int i = 0; i < values.length; i++) {
                values[i] = PhotometricConversions.cgsToMilliJansky(values[i]);
                variances[i] = PhotometricConversions.cgsToMilliJansky(variances[i]);
            }
        }
    }

    /** Catalogue laid out for the engine of the last {@code configure} call. */
    public Catalogue toCatalogue(String baseName) {
        PipelineResult current = current();
        return CatalogueProjection.forEngine(current.getEngine()).project(current.getTable(), baseName);
    }

    /** Copy of the bookkeeping needed to rebuild maps from the engine results. */
    public ReconstructionSnapshot snapshot() {
        PipelineResult current = current();
        return new ReconstructionSnapshot(shape, current.getScaleFactor(), current.getNormalizationMap(), current.getEngine());
    }

    private PipelineResult current() {
        PipelineResult current = result;
        if (current == null) throw new IllegalStateException("Band set has not been configured for an engine yet");
        return current;
    }

    public boolean isConfigured() { return result != null; }
    public PipelineResult getResult() { return current(); }
    public Engine getEngine() { return current().getEngine(); }
    public DataTable getTable() { return current().getTable(); }
    public double[][] getNormalizationMap() { return current().getNormalizationMap(); }
    public double getScaleFactor() { return current().getScaleFactor(); }
    public int[] getValidPixelIndex() { return current().getValidPixelIndex(); }
    public List<Band> getBands() { return bands; }
    public Shape getShape() { return shape; }
    public double getRedshift() { return redshift; }

    public boolean[][] getMask() {
        boolean[][] out = new boolean[mask.length][];
        for (int y = 0; y < mask.length; y++) out[y] = mask[y].clone();
        return out;
    }
}
