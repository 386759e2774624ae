package com.sedmap.service;

import com.sedmap.exception.ConfigurationException;
import com.sedmap.model.Band;
import java.io.File;
import java.io.IOException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads bands and masks from FITS images.
 */
public class FitsBandLoader {

    private static final Logger log = LoggerFactory.getLogger(FitsBandLoader.class);

    /** Header keys tried, in order, for the exposure time. */
    static final String[] EXPOSURE_KEYS = {"TEXPTIME", "EXPTIME", "EXPOSURE"};

    /**
     * Band from a flux file, a variance file and an optional Poisson reference file,
     * all read from their primary HDU. The exposure time comes from the flux header.
     */
    public Band loadBand(String name, File flux, File variance, double zeropoint, File poissonReference)
            throws IOException, FitsException {
        return loadBand(name, flux, 0, variance, 0, zeropoint, poissonReference, 0);
    }

    public Band loadBand(String name, File flux, int fluxHdu, File variance, int varianceHdu, double zeropoint,
                         File poissonReference, int poissonHdu) throws IOException, FitsException {
        double[][] data = readImage(flux, fluxHdu);
        double[][] var = readImage(variance, varianceHdu);
        double[][] ref = null;
        Double exposure = null;
        if (poissonReference != null) {
            ref = readImage(poissonReference, poissonHdu);
            exposure = readExposureTime(flux, fluxHdu);
            if (exposure == null) {
                log.warn("Header of {} has none of the keys {}", flux.getName(), String.join(", ", EXPOSURE_KEYS));
            }
        }
        log.info("Loaded band {} from {}", name, flux.getName());
        return new Band(name, data, var, zeropoint, ref, exposure);
    }

    /** Non zero (or NaN) pixels are bad pixels. */
    public boolean[][] loadMask(File file) throws IOException, FitsException {
        double[][] data = readImage(file, 0);
        boolean[][] mask = new boolean[data.length][data[0].length];
        for (int y = 0; y < data.length; y++) {
            for (int x = 0; x < data[0].length; x++) {
                mask[y][x] = data[y][x] != 0;
            }
        }
        return mask;
    }

    public double[][] readImage(File file, int hduIndex) throws IOException, FitsException {
        if (hduIndex < 0) throw new ConfigurationException("HDU index has value " + hduIndex + " but it must be >= 0");
        try (Fits fits = new Fits(file)) {
            BasicHDU<?> hdu = fits.getHDU(hduIndex);
            if (hdu == null) {
                throw new IOException("Extension number " + hduIndex + " for file " + file + " too large");
            }
            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0);
            double bscale = header.getDoubleValue("BSCALE", 1);
            return toDouble(hdu.getKernel(), bzero, bscale, file);
        }
    }

    /** Exposure time from the header, or null when no known key is present or it is not positive. */
    public Double readExposureTime(File file, int hduIndex) throws IOException, FitsException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?> hdu = fits.getHDU(hduIndex);
            if (hdu == null) return null;
            Header header = hdu.getHeader();
            for (String key : EXPOSURE_KEYS) {
                if (header.containsKey(key)) {
                    double t = header.getDoubleValue(key, 0);
                    return t > 0 ? t : null;
                }
            }
            return null;
        }
    }

    static double[][] toDouble(Object k, double bzero, double bscale, File source) {
        int rows;
        double[][] d;
        if (k instanceof double[][]) {
            double[][] a = (double[][]) k; rows = a.length; d = new double[rows][];
            for (int i = 0; i < rows; i++) { d[i] = new double[a[i].length]; for (int j = 0; j < a[i].length; j++) d[i][j] = bzero + bscale * a[i][j]; }
        } else if (k instanceof float[][]) {
            float[][] a = (float[][]) k; rows = a.length; d = new double[rows][];
            for (int i = 0; i < rows; i++) { d[i] = new double[a[i].length]; for (int j = 0; j < a[i].length; j++) d[i][j] = bzero + bscale * a[i][j]; }
        } else if (k instanceof long[][]) {
            long[][] a = (long[][]) k; rows = a.length; d = new double[rows][];
            for (int i = 0; i < rows; i++) { d[i] = new double[a[i].length]; for (int j = 0; j < a[i].length; j++) d[i][j] = bzero + bscale * a[i][j]; }
        } else if (k instanceof int[][]) {
            int[][] a = (int[][]) k; rows = a.length; d = new double[rows][];
            for (int i = 0; i < rows; i++) { d[i] = new double[a[i].length]; for (int j = 0; j < a[i].length; j++) d[i][j] = bzero + bscale * a[i][j]; }
        } else if (k instanceof short[][]) {
            short[][] a = (short[][]) k; rows = a.length; d = new double[rows][];
            for (int i = 0; i < rows; i++) { d[i] = new double[a[i].length]; for (int j = 0; j < a[i].length; j++) d[i][j] = bzero + bscale * a[i][j]; }
        } else if (k instanceof byte[][]) {
            // FITS bytes are unsigned
            byte[][] a = (byte[][]) k; rows = a.length; d = new double[rows][];
            for (int i = 0; i < rows; i++) { d[i] = new double[a[i].length]; for (int j = 0; j < a[i].length; j++) d[i][j] = bzero + bscale * (a[i][j] & 0xFF); }
        } else {
            throw new ConfigurationException("File " + source + " does not contain a 2D image (kernel "
                    + (k == null ? "empty" : k.getClass().getSimpleName()) + ")");
        }
        if (rows == 0) throw new ConfigurationException("File " + source + " contains an empty image");
        return d;
    }
}
