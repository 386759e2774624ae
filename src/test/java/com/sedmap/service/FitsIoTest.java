package com.sedmap.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sedmap.exception.ConfigurationException;
import com.sedmap.model.Band;
import com.sedmap.model.DataTable;
import com.sedmap.model.Engine;
import com.sedmap.model.ReconstructionSnapshot;
import com.sedmap.model.ResultMap;
import com.sedmap.model.Shape;
import java.io.File;
import java.nio.file.Path;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FitsIoTest {

    @TempDir
    Path dir;

    private File image(String name, Object data, String key, double value) throws Exception {
        File file = dir.resolve(name).toFile();
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            if (key != null) hdu.getHeader().addValue(key, value, "");
            fits.addHDU(hdu);
            FitsMapWriter.write(fits, file);
        }
        return file;
    }

    @Test
    void loadsBandWithExposureTime() throws Exception {
        File flux = image("flux.fits", new double[][]{{1, 2}, {3, 4}}, "EXPTIME", 120);
        File var = image("var.fits", new float[][]{{0.5f, 0.5f}, {0.5f, 0.5f}}, null, 0);
        File ref = image("ref.fits", new double[][]{{1, 1}, {1, 1}}, null, 0);

        FitsBandLoader loader = new FitsBandLoader();
        Band band = loader.loadBand("F435W", flux, var, 25.68, ref);

        assertThat(band.getFlux()).isDeepEqualTo(new double[][]{{1, 2}, {3, 4}});
        assertThat(band.getVariance()[1][1]).isEqualTo(0.5);
        assertThat(band.getExposureTime()).isEqualTo(120.0);
        assertThat(band.hasShotNoiseInputs()).isTrue();

        Band noRef = loader.loadBand("F435W", flux, var, 25.68, null);
        assertThat(noRef.getExposureTime()).isNull();
    }

    @Test
    void appliesScalingOfIntegerImages() throws Exception {
        File file = image("counts.fits", new int[][]{{0, 2}, {4, 6}}, "BSCALE", 0.5);
        double[][] data = new FitsBandLoader().readImage(file, 0);
        assertThat(data).isDeepEqualTo(new double[][]{{0, 1}, {2, 3}});
    }

    @Test
    void nonZeroMaskPixelsAreBad() throws Exception {
        File file = image("mask.fits", new short[][]{{0, 1}, {0, 0}}, null, 0);
        boolean[][] mask = new FitsBandLoader().loadMask(file);
        assertThat(mask[0]).containsExactly(false, true);
        assertThat(mask[1]).containsExactly(false, false);
    }

    @Test
    void missingExtensionIsReported() throws Exception {
        File file = image("one.fits", new double[][]{{1}}, null, 0);
        assertThatThrownBy(() -> new FitsBandLoader().readImage(file, 3)).hasMessageContaining("3");
        assertThatThrownBy(() -> new FitsBandLoader().readImage(file, -1)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void writesMapWithUnitAndParameter() throws Exception {
        File file = dir.resolve("maps/mass.fits").toFile();
        new FitsMapWriter().write(new ResultMap("mass_best", new double[][]{{1e9, Double.NaN}}, "Msun"), file);

        try (Fits fits = new Fits(file)) {
            Header header = fits.getHDU(0).getHeader();
            assertThat(header.getStringValue("BUNIT")).isEqualTo("Msun");
            assertThat(header.getStringValue("PARAM")).isEqualTo("mass_best");
        }
        double[][] data = new FitsBandLoader().readImage(file, 0);
        assertThat(data[0][0]).isEqualTo(1e9);
        assertThat(data[0][1]).isNaN();
    }

    @Test
    void snapshotRoundTrip() throws Exception {
        SnapshotStore store = new SnapshotStore();
        File file = dir.resolve("snap.fits").toFile();

        ReconstructionSnapshot normalized = new ReconstructionSnapshot(new Shape(2, 3), 100,
                new double[][]{{1, 2, 0}, {4, 5, 6}}, Engine.LEPHARE);
        store.save(normalized, file);
        ReconstructionSnapshot back = store.load(file);
        assertThat(back.getShape()).isEqualTo(new Shape(2, 3));
        assertThat(back.getScaleFactor()).isEqualTo(100);
        assertThat(back.getNormalizationMap()).isDeepEqualTo(normalized.getNormalizationMap());
        assertThat(back.getEngine()).isEqualTo(Engine.LEPHARE);

        store.save(new ReconstructionSnapshot(new Shape(3, 1), 1, null, Engine.CIGALE), file);
        back = store.load(file);
        assertThat(back.isNormalized()).isFalse();
        assertThat(back.getShape()).isEqualTo(new Shape(3, 1));
        assertThat(back.getEngine()).isEqualTo(Engine.CIGALE);
    }

    @Test
    void plainImageIsNotASnapshot() throws Exception {
        File file = image("plain.fits", new double[][]{{1}}, null, 0);
        assertThatThrownBy(() -> new SnapshotStore().load(file)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void readsCigaleResultsTable() throws Exception {
        File file = dir.resolve("results.fits").toFile();
        try (Fits fits = new Fits()) {
            BinaryTableHDU hdu = (BinaryTableHDU) Fits.makeHDU(new Object[]{
                    new long[]{4, 1}, new double[]{1e10, 2e9}, new float[]{0.5f, 1.5f}});
            hdu.setColumnName(0, "id", "");
            hdu.setColumnName(1, "bayes.stellar.m_star", "");
            hdu.setColumnName(2, "best.reduced_chi_square", "");
            fits.addHDU(hdu);
            FitsMapWriter.write(fits, file);
        }

        DataTable table = new CigaleResultsReader().read(file);
        assertThat(table.getIdColumn()).isEqualTo("id");
        assertThat(table.ids()).containsExactly(4, 1);
        assertThat(table.column("bayes.stellar.m_star").getValues()).containsExactly(1e10, 2e9);
        assertThat(table.column("best.reduced_chi_square").getValues()).containsExactly(0.5, 1.5);
    }

    @Test
    void numericTextColumnsAreParsed() {
        assertThat(CigaleResultsReader.toDouble(new String[]{" 1.5", "2"})).containsExactly(1.5, 2);
        assertThat(CigaleResultsReader.toDouble(new String[]{"abc"})).isNull();
        assertThat(CigaleResultsReader.toDouble(new boolean[]{true})).isNull();
    }
}
