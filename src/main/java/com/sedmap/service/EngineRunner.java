package com.sedmap.service;

import com.sedmap.exception.EngineRunException;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the external SED fitting programs. Each command runs in an explicit working
 * directory; the JVM's own working directory is never changed. Standard output and
 * error are appended to a log file.
 */
public class EngineRunner {

    private static final Logger log = LoggerFactory.getLogger(EngineRunner.class);

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{?([A-Za-z_][A-Za-z0-9_]*)}?");

    /** Steps of a LePhare run: model libraries, filters, predicted magnitudes, fit. */
    public enum LePhareStep {
        QSO_MODELS(true, "sedtolib", "-t", "QSO"),
        STAR_MODELS(true, "sedtolib", "-t", "Stellar"),
        GALAXY_MODELS(true, "sedtolib", "-t", "Galaxy"),
        FILTERS(true, "filter"),
        QSO_MAGNITUDES(true, "mag_gal", "-t", "Q"),
        STAR_MAGNITUDES(true, "mag_star"),
        GALAXY_MAGNITUDES(true, "mag_gal", "-t", "G"),
        FIT(false, "zphota");

        public final boolean preparation;
        private final String program;
        private final String[] args;

        LePhareStep(boolean preparation, String program, String... args) {
            this.preparation = preparation;
            this.program = program;
            this.args = args;
        }

        public List<String> command(Path paramFile) {
            List<String> cmd = new ArrayList<>();
            cmd.add("$LEPHAREDIR/source/" + program);
            Collections.addAll(cmd, args);
            cmd.add("-c");
            cmd.add(paramFile.toString());
            return cmd;
        }
    }

    private final Map<String, String> environment = new HashMap<>();
    private final Duration timeout;

    public EngineRunner(Duration timeout) {
        this.timeout = timeout;
    }

    /** Extra environment variable for the child processes, also used to expand the executable path. */
    public EngineRunner withVariable(String name, String value) {
        if (value != null && !value.isEmpty()) environment.put(name, value);
        return this;
    }

    public static List<String> cigaleCommand(String executable) {
        List<String> cmd = new ArrayList<>();
        cmd.add(executable);
        cmd.add("run");
        return cmd;
    }

    /** Runs the LePhare steps in order; model generation steps are skipped when asked. */
    public void runLePhare(Path paramFile, Path workingDirectory, Path logFile, boolean skipPreparation)
            throws EngineRunException {
        for (LePhareStep step : LePhareStep.values()) {
            if (skipPreparation && step.preparation) {
                log.info("Skipping LePhare step {}", step);
                continue;
            }
            run(step.command(paramFile), workingDirectory, logFile);
        }
    }

    /**
     * Runs one command and waits for it.
     *
     * @return the exit status, always 0
     * @throws EngineRunException if the executable is missing, the process fails, times out
     *                            or exits with a non zero status
     */
    public int run(List<String> command, Path workingDirectory, Path logFile) throws EngineRunException {
        if (command == null || command.isEmpty()) throw new EngineRunException("Empty command");
        if (!Files.isDirectory(workingDirectory)) {
            throw new EngineRunException("Working directory " + workingDirectory + " does not exist");
        }

        List<String> cmd = new ArrayList<>(command);
        String executable = expand(cmd.get(0));
        if (!isExecutable(executable)) {
            throw new EngineRunException("Script/executable " + command.get(0) + " (expanded as " + executable + ") not found");
        }
        cmd.set(0, executable);

        ProcessBuilder pb = new ProcessBuilder(cmd)
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        pb.environment().putAll(environment);

        log.info("Running {} in {}", String.join(" ", cmd), workingDirectory);
        try {
            Process p = pb.start();
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                throw new EngineRunException(cmd.get(0) + " did not finish within " + timeout);
            }
            int status = p.exitValue();
            if (status != 0) {
                throw new EngineRunException(cmd.get(0) + " exited with status " + status + ", see " + logFile);
            }
            return status;
        } catch (IOException e) {
            throw new EngineRunException("Could not start " + cmd.get(0), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineRunException("Interrupted while waiting for " + cmd.get(0), e);
        }
    }

    /** Replaces {@code $VAR} and {@code ${VAR}} with configured or system environment values. */
    String expand(String text) {
        Matcher m = VARIABLE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = environment.get(m.group(1));
            if (value == null) value = System.getenv(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? m.group() : value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static boolean isExecutable(String executable) {
        if (executable.contains(File.separator)) {
            return Files.isExecutable(Paths.get(executable));
        }
        String path = System.getenv("PATH");
        if (path == null) return false;
        for (String dir : path.split(File.pathSeparator)) {
            if (Files.isExecutable(Paths.get(dir, executable))) return true;
        }
        return false;
    }
}
