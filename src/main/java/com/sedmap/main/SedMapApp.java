package com.sedmap.main;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.sedmap.exception.ConfigurationException;
import com.sedmap.exception.EngineRunException;
import com.sedmap.exception.SedMapException;
import com.sedmap.model.AppConfig;
import com.sedmap.model.Band;
import com.sedmap.model.Catalogue;
import com.sedmap.model.CleaningMethod;
import com.sedmap.model.DataTable;
import com.sedmap.model.Engine;
import com.sedmap.model.PipelineOptions;
import com.sedmap.model.ReconstructionSnapshot;
import com.sedmap.model.ResultMap;
import com.sedmap.model.ValidPixelPolicy;
import com.sedmap.service.BandSet;
import com.sedmap.service.CatalogueWriter;
import com.sedmap.service.CigaleResultsReader;
import com.sedmap.service.EngineRunner;
import com.sedmap.service.FitsBandLoader;
import com.sedmap.service.FitsMapWriter;
import com.sedmap.service.LePhareOutputReader;
import com.sedmap.service.MapStatisticsService;
import com.sedmap.service.ResultReconstructor;
import com.sedmap.service.SnapshotStore;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import nom.tam.fits.FitsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 * prepare     bands + mask -> catalogue file + reconstruction snapshot
 * fit         run LePhare or Cigale on a prepared directory
 * reconstruct engine results + snapshot -> FITS maps
 * config      store default options
 * </pre>
 */
public class SedMapApp {

    private static final Logger log = LoggerFactory.getLogger(SedMapApp.class);

    static final String SNAPSHOT_SUFFIX = "_snapshot.fits";

    @Parameters(commandDescription = "Build the engine catalogue from FITS bands")
    static class PrepareCommand {
        @Parameter(names = "--engine", description = "lephare or cigale")
        String engine;

        @Parameter(names = "--band", required = true,
                description = "NAME:flux.fits:variance.fits:zeropoint[:poisson.fits], repeat for each band")
        List<String> bands = new ArrayList<>();

        @Parameter(names = "--mask", description = "FITS mask, non zero pixels are excluded")
        String mask;

        @Parameter(names = "--redshift", description = "Redshift of the galaxy")
        double redshift = 0;

        @Parameter(names = "--clean", description = "ZERO or MIN")
        String cleaningMethod;

        @Parameter(names = "--scale", description = "Scale factor (LePhare)")
        Double scaleFactor;

        @Parameter(names = "--poisson", description = "Poisson variance factor, 0 to disable")
        Double poissonFactor;

        @Parameter(names = "--pixels", description = "FIRST_BAND or ALL_BANDS")
        String validPixelPolicy;

        @Parameter(names = "--name", required = true, description = "Catalogue base name")
        String name;

        @Parameter(names = "--out", description = "Output directory")
        String output = ".";
    }

    @Parameters(commandDescription = "Run a SED fitting engine in a working directory")
    static class FitCommand {
        @Parameter(names = "--engine", description = "lephare or cigale")
        String engine;

        @Parameter(names = "--param", description = "LePhare parameter file")
        String paramFile;

        @Parameter(names = "--workdir", required = true, description = "Working directory of the engine")
        String workDir;

        @Parameter(names = "--log", description = "Log file, relative to the working directory")
        String logFile = "engine.log";

        @Parameter(names = "--skip-preparation", description = "Skip LePhare model, filter and magnitude generation")
        boolean skipPreparation = false;
    }

    @Parameters(commandDescription = "Rebuild maps from engine results")
    static class ReconstructCommand {
        @Parameter(names = "--engine", description = "Engine that produced the results, defaults to the snapshot's")
        String engine;

        @Parameter(names = "--results", required = true, description = "LePhare .out file or Cigale results.fits")
        String results;

        @Parameter(names = "--snapshot", required = true, description = "Snapshot written by prepare")
        String snapshot;

        @Parameter(names = "--column", required = true, description = "Results column, repeat for each map")
        List<String> columns = new ArrayList<>();

        @Parameter(names = "--out", description = "Output directory")
        String output = ".";

        @Parameter(names = "--tiff", description = "Also write TIFF previews")
        boolean tiff = false;
    }

    @Parameters(commandDescription = "Store default options")
    static class ConfigCommand {
        @Parameter(names = "--engine") String engine;
        @Parameter(names = "--clean") String cleaningMethod;
        @Parameter(names = "--scale") Double scaleFactor;
        @Parameter(names = "--poisson") Double poissonFactor;
        @Parameter(names = "--pixels") String validPixelPolicy;
        @Parameter(names = "--lephare-dir") String lePhareDir;
        @Parameter(names = "--cigale") String cigaleCommand;
        @Parameter(names = "--timeout-minutes") Long timeoutMinutes;
    }

    @Parameter(names = {"-h", "--help"}, help = true)
    boolean help;

    public static void main(String[] args) {
        System.exit(new SedMapApp().run(args));
    }

    int run(String[] args) {
        PrepareCommand prepare = new PrepareCommand();
        FitCommand fit = new FitCommand();
        ReconstructCommand reconstruct = new ReconstructCommand();
        ConfigCommand config = new ConfigCommand();
        JCommander jc = JCommander.newBuilder()
                .programName("sed-mapper")
                .addObject(this)
                .addCommand("prepare", prepare)
                .addCommand("fit", fit)
                .addCommand("reconstruct", reconstruct)
                .addCommand("config", config)
                .build();
        try {
            jc.parse(args);
        } catch (ParameterException e) {
            log.error(e.getMessage());
            jc.usage();
            return 2;
        }
        if (help || jc.getParsedCommand() == null) {
            jc.usage();
            return help ? 0 : 2;
        }

        try {
            switch (jc.getParsedCommand()) {
                case "prepare": prepare(prepare); break;
                case "fit": fit(fit); break;
                case "reconstruct": reconstruct(reconstruct); break;
                default: config(config); break;
            }
            return 0;
        } catch (ParameterException e) {
            log.error(e.getMessage());
            jc.getCommands().get(jc.getParsedCommand()).usage();
            return 2;
        } catch (SedMapException | EngineRunException e) {
            log.error(e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("{} failed", jc.getParsedCommand(), e);
            return 1;
        }
    }

    Path prepare(PrepareCommand cmd) throws Exception {
        Engine engine = cmd.engine == null ? AppConfig.getEngine() : Engine.fromName(cmd.engine);
        FitsBandLoader loader = new FitsBandLoader();

        List<Band> bands = new ArrayList<>();
        for (String band : cmd.bands) bands.add(loadBand(loader, band));

        boolean[][] mask = cmd.mask == null
                ? new boolean[bands.get(0).getShape().rows][bands.get(0).getShape().columns]
                : loader.loadMask(new File(cmd.mask));

        BandSet bandSet = new BandSet(bands, mask, cmd.redshift);
        bandSet.configure(engine, options(cmd));

        Path out = Paths.get(cmd.output);
        Catalogue catalogue = bandSet.toCatalogue(cmd.name);
        Path file = new CatalogueWriter().write(catalogue, out);
        new SnapshotStore().save(bandSet.snapshot(), out.resolve(cmd.name + SNAPSHOT_SUFFIX).toFile());
        return file;
    }

    static PipelineOptions options(PrepareCommand cmd) {
        PipelineOptions opts = AppConfig.pipelineOptions();
        if (cmd.cleaningMethod != null) opts.cleaningMethod(option(CleaningMethod.class, "--clean", cmd.cleaningMethod));
        if (cmd.scaleFactor != null) opts.scaleFactor(cmd.scaleFactor);
        if (cmd.poissonFactor != null) opts.poissonFactor(cmd.poissonFactor);
        if (cmd.validPixelPolicy != null) opts.validPixelPolicy(option(ValidPixelPolicy.class, "--pixels", cmd.validPixelPolicy));
        return opts;
    }

    static <E extends Enum<E>> E option(Class<E> type, String flag, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ParameterException("Invalid value " + value + " for " + flag + ", expected one of "
                    + Arrays.toString(type.getEnumConstants()));
        }
    }

    static Band loadBand(FitsBandLoader loader, String arg) throws IOException, FitsException {
        String[] parts = arg.split(":");
        if (parts.length != 4 && parts.length != 5) {
            throw new ConfigurationException("Band must be NAME:flux:variance:zeropoint[:poisson], got " + arg);
        }
        double zpt;
        try {
            zpt = Double.parseDouble(parts[3]);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Zeropoint of band " + parts[0] + " is not a number: " + parts[3]);
        }
        File poisson = parts.length == 5 ? new File(parts[4]) : null;
        return loader.loadBand(parts[0], new File(parts[1]), new File(parts[2]), zpt, poisson);
    }

    void fit(FitCommand cmd) throws EngineRunException {
        Engine engine = cmd.engine == null ? AppConfig.getEngine() : Engine.fromName(cmd.engine);
        Path workDir = Paths.get(cmd.workDir);
        Path logFile = workDir.resolve(cmd.logFile);
        EngineRunner runner = new EngineRunner(Duration.ofMinutes(AppConfig.getEngineTimeoutMinutes()))
                .withVariable("LEPHAREDIR", AppConfig.getLePhareDir());

        if (engine == Engine.LEPHARE) {
            if (cmd.paramFile == null) throw new ConfigurationException("LePhare needs a parameter file (--param)");
            runner.runLePhare(Paths.get(cmd.paramFile), workDir, logFile, cmd.skipPreparation);
        } else {
            runner.run(EngineRunner.cigaleCommand(AppConfig.getCigaleCommand()), workDir, logFile);
        }
        log.info("{} finished, log in {}", engine.getKey(), logFile);
    }

    List<Path> reconstruct(ReconstructCommand cmd) throws Exception {
        SnapshotStore store = new SnapshotStore();
        ReconstructionSnapshot snapshot = store.load(new File(cmd.snapshot));
        Engine engine = cmd.engine != null ? Engine.fromName(cmd.engine)
                : snapshot.getEngine() != null ? snapshot.getEngine() : AppConfig.getEngine();

        DataTable results = engine == Engine.LEPHARE
                ? new LePhareOutputReader().read(Paths.get(cmd.results))
                : new CigaleResultsReader().read(new File(cmd.results));
        ResultReconstructor reconstructor = new ResultReconstructor(results).link(snapshot);

        Path out = Paths.get(cmd.output);
        Files.createDirectories(out);
        FitsMapWriter writer = new FitsMapWriter();
        MapStatisticsService stats = new MapStatisticsService();
        List<Path> written = new ArrayList<>();
        for (String column : cmd.columns) {
            ResultMap map = reconstructor.toImage(column);
            String base = column.replaceAll("[^A-Za-z0-9_.-]", "_");
            Path file = out.resolve(base + ".fits");
            writer.write(map, file.toFile());
            written.add(file);
            log.info("Map {}: {}", column, stats.statistics(map));
            if (cmd.tiff) stats.saveTiff(map, out.resolve(base + ".tif").toFile());
        }
        return written;
    }

    void config(ConfigCommand cmd) {
        if (cmd.engine != null) AppConfig.setEngine(Engine.fromName(cmd.engine));
        if (cmd.cleaningMethod != null) AppConfig.setCleaningMethod(option(CleaningMethod.class, "--clean", cmd.cleaningMethod));
        if (cmd.scaleFactor != null) AppConfig.setScaleFactor(PipelineOptions.defaults().scaleFactor(cmd.scaleFactor).getScaleFactor());
        if (cmd.poissonFactor != null) AppConfig.setPoissonFactor(PipelineOptions.defaults().poissonFactor(cmd.poissonFactor).getPoissonFactor());
        if (cmd.validPixelPolicy != null) AppConfig.setValidPixelPolicy(option(ValidPixelPolicy.class, "--pixels", cmd.validPixelPolicy));
        if (cmd.lePhareDir != null) AppConfig.setLePhareDir(cmd.lePhareDir);
        if (cmd.cigaleCommand != null) AppConfig.setCigaleCommand(cmd.cigaleCommand);
        if (cmd.timeoutMinutes != null) AppConfig.setEngineTimeoutMinutes(cmd.timeoutMinutes);
        log.info("Defaults: engine {}, {}", AppConfig.getEngine().getKey(), AppConfig.pipelineOptions());
    }
}
