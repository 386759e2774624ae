package com.sedmap.service;

import com.sedmap.exception.ConfigurationException;
import com.sedmap.model.Engine;
import com.sedmap.model.ReconstructionSnapshot;
import com.sedmap.model.Shape;
import java.io.File;
import java.io.IOException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves the reconstruction bookkeeping to a FITS file so that maps can be rebuilt
 * by another process once the engine has finished. The image holds the normalization
 * map (zeros when the data were not normalized, the image then only carries the shape).
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    static final String KEY_SCALE = "SCALEFAC";
    static final String KEY_HAS_NORM = "HASNORM";
    static final String KEY_ENGINE = "ENGINE";

    public void save(ReconstructionSnapshot snapshot, File output) throws IOException, FitsException {
        Shape shape = snapshot.getShape();
        double[][] image = snapshot.isNormalized() ? snapshot.getNormalizationMap() : new double[shape.rows][shape.columns];
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(image);
            Header header = hdu.getHeader();
            header.addValue(KEY_SCALE, snapshot.getScaleFactor(), "scale factor applied to the catalogue data");
            header.addValue(KEY_HAS_NORM, snapshot.isNormalized(), "image is the normalization map");
            if (snapshot.getEngine() != null) header.addValue(KEY_ENGINE, snapshot.getEngine().getKey(), "SED fitting engine");
            fits.addHDU(hdu);
            FitsMapWriter.write(fits, output);
        }
        log.info("Saved reconstruction snapshot to {}", output);
    }

    public ReconstructionSnapshot load(File input) throws IOException, FitsException {
        try (Fits fits = new Fits(input)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new IOException("File " + input + " has no primary HDU");
            Header header = hdu.getHeader();
            if (!header.containsKey(KEY_SCALE)) {
                throw new ConfigurationException("File " + input + " is not a reconstruction snapshot (no " + KEY_SCALE + " key)");
            }
            double[][] image = FitsBandLoader.toDouble(hdu.getKernel(), 0, 1, input);
            boolean normalized = header.getBooleanValue(KEY_HAS_NORM, false);
            String engine = header.getStringValue(KEY_ENGINE);
            return new ReconstructionSnapshot(Shape.of(image), header.getDoubleValue(KEY_SCALE, 1),
                    normalized ? image : null, engine == null ? null : Engine.fromName(engine));
        }
    }
}
