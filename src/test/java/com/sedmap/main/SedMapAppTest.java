package com.sedmap.main;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.sedmap.model.ResultMap;
import com.sedmap.service.FitsBandLoader;
import com.sedmap.service.FitsMapWriter;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SedMapAppTest {

    @TempDir
    Path dir;

    private String fits(String name, double[][] data) throws Exception {
        File file = dir.resolve(name).toFile();
        new FitsMapWriter().write(new ResultMap(name, data, null), file);
        return file.getPath();
    }

    @Test
    void prepareThenReconstructLePhareMaps() throws Exception {
        String flux = fits("flux.fits", new double[][]{{1, 2}, {3, 4}});
        String var = fits("var.fits", new double[][]{{1, 1}, {1, 1}});
        String mask = fits("mask.fits", new double[][]{{0, 0}, {1, 0}});
        Path out = dir.resolve("run");

        int status = new SedMapApp().run(new String[]{"prepare",
                "--engine", "lephare", "--band", "F435W:" + flux + ":" + var + ":25.5",
                "--mask", mask, "--redshift", "0.002", "--clean", "zero", "--scale", "10",
                "--poisson", "0", "--pixels", "first_band", "--name", "ngc628", "--out", out.toString()});
        assertThat(status).isZero();

        List<String> rows = Files.readAllLines(out.resolve("ngc628.in"));
        assertThat(rows).hasSize(3);
        assertThat(out.resolve("ngc628" + SedMapApp.SNAPSHOT_SUFFIX)).exists();

        // One band: the normalization map is the flux itself, a mass of 10 at every pixel gives the flux back
        List<String> lephareOut = new ArrayList<>();
        lephareOut.add("# Output format                       #");
        lephareOut.add("# IDENT  1  , MASS_BEST  2  ,");
        lephareOut.add("#######################################");
        for (String row : rows) lephareOut.add(row.split(" ")[0] + " 1.0");
        Path results = dir.resolve("ngc628.out");
        Files.write(results, lephareOut);

        status = new SedMapApp().run(new String[]{"reconstruct", "--engine", "lephare",
                "--results", results.toString(), "--snapshot", out.resolve("ngc628" + SedMapApp.SNAPSHOT_SUFFIX).toString(),
                "--column", "mass_best", "--out", out.resolve("maps").toString()});
        assertThat(status).isZero();

        double[][] map = new FitsBandLoader().readImage(out.resolve("maps/mass_best.fits").toFile(), 0);
        assertThat(map[0][0]).isCloseTo(1, within(1e-9));
        assertThat(map[0][1]).isCloseTo(2, within(1e-9));
        assertThat(map[1][0]).isNaN();
        assertThat(map[1][1]).isCloseTo(4, within(1e-9));
    }

    @Test
    void badArgumentsAndErrorsGiveNonZeroStatus() throws Exception {
        assertThat(new SedMapApp().run(new String[]{})).isEqualTo(2);
        assertThat(new SedMapApp().run(new String[]{"prepare", "--name", "x"})).isEqualTo(2);
        assertThat(new SedMapApp().run(new String[]{"--help"})).isZero();

        String flux = fits("f.fits", new double[][]{{1}});
        assertThat(new SedMapApp().run(new String[]{"prepare", "--engine", "eazy",
                "--band", "u:" + flux + ":" + flux + ":25", "--name", "x", "--out", dir.toString()})).isEqualTo(1);
        assertThat(new SedMapApp().run(new String[]{"prepare", "--engine", "cigale",
                "--band", "u:" + flux, "--name", "x", "--out", dir.toString()})).isEqualTo(1);

        String band = "u:" + flux + ":" + flux + ":25";
        assertThat(new SedMapApp().run(new String[]{"prepare", "--engine", "lephare", "--band", band,
                "--clean", "median", "--name", "x", "--out", dir.toString()})).isEqualTo(2);
        assertThat(new SedMapApp().run(new String[]{"prepare", "--engine", "lephare", "--band", band,
                "--pixels", "some_bands", "--name", "x", "--out", dir.toString()})).isEqualTo(2);
    }
}
