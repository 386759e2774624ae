package com.sedmap.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.sedmap.exception.ColumnLookupException;
import com.sedmap.exception.ConfigurationException;
import com.sedmap.exception.ShapeMismatchException;
import com.sedmap.model.Band;
import com.sedmap.model.Column;
import com.sedmap.model.DataTable;
import com.sedmap.model.Engine;
import com.sedmap.model.ResultMap;
import com.sedmap.model.Shape;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ResultReconstructorTest {

    private static DataTable results(long[] ids, double[] values) {
        return new DataTable(Arrays.asList(
                Column.ofIntegers("ID", ids),
                new Column("mass_best", values, null, "Msun", false)), "ID");
    }

    @Test
    void normalizedFluxGoesBackToTheInputMap() {
        double[][] flux = {{1, 2}, {3, 4}};
        Band a = new Band("A", flux, new double[][]{{1, 1}, {1, 1}}, 25);
        Band b = new Band("B", new double[][]{{3, 2}, {1, 6}}, new double[][]{{1, 1}, {1, 1}}, 25);
        boolean[][] mask = {{true, false}, {false, false}};
        BandSet set = new BandSet(Arrays.asList(a, b), mask);
        set.configure(Engine.LEPHARE);

        // Magnitudes back to normalized fluxes, as an engine output column would be
        DataTable table = set.getTable();
        double[] mags = table.column("A").getValues();
        double[] errs = table.column("A").getErrors();
        double[] normalized = new double[mags.length];
        for (int i = 0; i < mags.length; i++) {
            normalized[i] = PhotometricConversions.magnitudeToFlux(mags[i], errs[i], 25).value;
        }
        long[] ids = new long[mags.length];
        for (int i = 0; i < ids.length; i++) ids[i] = table.ids()[i];

        ResultMap map = new ResultReconstructor(new DataTable(Arrays.asList(
                Column.ofIntegers("ID", ids), Column.of("A", normalized)), "ID")).link(set).toImage("A");

        assertThat(map.get(0, 0)).isNaN();
        assertThat(map.get(0, 1)).isCloseTo(2, within(1e-9));
        assertThat(map.get(1, 0)).isCloseTo(3, within(1e-9));
        assertThat(map.get(1, 1)).isCloseTo(4, within(1e-9));
    }

    @Test
    void rowsLandAtTheirPixelAndTheRestIsNaN() {
        ResultReconstructor r = new ResultReconstructor(results(new long[]{5, 0, 3}, new double[]{50, 10, 30}));
        ResultMap map = r.toImage("mass_best", new Shape(2, 3), 10.0, null);

        assertThat(map.get(0, 0)).isEqualTo(1);
        assertThat(map.get(1, 0)).isEqualTo(3);
        assertThat(map.get(1, 2)).isEqualTo(5);
        assertThat(map.get(0, 1)).isNaN();
        assertThat(map.get(0, 2)).isNaN();
        assertThat(map.unit).isEqualTo("Msun");
        assertThat(map.getShape()).isEqualTo(new Shape(2, 3));
    }

    @Test
    void normalizationMapZerosAreLeftAlone() {
        ResultReconstructor r = new ResultReconstructor(results(new long[]{0, 1}, new double[]{4, 6}));
        ResultMap map = r.toImage("mass_best", new Shape(1, 2), 2.0, new double[][]{{3, 0}});
        assertThat(map.getData()).isDeepEqualTo(new double[][]{{6, 3}});
    }

    @Test
    void defaultsToScaleOneWithoutSnapshot() {
        ResultReconstructor r = new ResultReconstructor(results(new long[]{1}, new double[]{7}));
        assertThat(r.toImage("mass_best", new Shape(1, 2), null, null).get(0, 1)).isEqualTo(7);
    }

    @Test
    void needsAShape() {
        ResultReconstructor r = new ResultReconstructor(results(new long[]{0}, new double[]{1}));
        assertThatThrownBy(() -> r.toImage("mass_best")).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rejectsInconsistentInputs() {
        ResultReconstructor r = new ResultReconstructor(results(new long[]{0, 9}, new double[]{1, 2}));
        assertThatThrownBy(() -> r.toImage("mass_best", new Shape(2, 2), 1.0, null))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("9");
        assertThatThrownBy(() -> r.toImage("mass_best", new Shape(3, 4), 1.0, new double[][]{{1}}))
                .isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> r.toImage("sfr_best", new Shape(3, 4), 1.0, null))
                .isInstanceOf(ColumnLookupException.class);
        assertThatThrownBy(() -> r.toImage("mass_best", new Shape(3, 4), 0.0, null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void resultsNeedAnIdentifierColumn() {
        DataTable noId = new DataTable(Arrays.asList(Column.of("x", new double[]{1})), null);
        assertThatThrownBy(() -> new ResultReconstructor(noId)).isInstanceOf(ConfigurationException.class);
    }
}
