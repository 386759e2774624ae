package com.sedmap.model;

import java.util.Locale;
import java.util.prefs.Preferences;

/**
 * User defaults stored with {@link Preferences}. Command line flags override them.
 */
public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // Pipeline
    private static final String KEY_ENGINE = "engine";
    private static final String KEY_CLEANING = "cleaning_method";
    private static final String KEY_SCALE = "scale_factor";
    private static final String KEY_POISSON = "poisson_factor";
    private static final String KEY_PIXEL_POLICY = "valid_pixel_policy";

    // External engines
    private static final String KEY_LEPHARE_DIR = "lephare_dir";
    private static final String KEY_CIGALE_CMD = "cigale_command";
    private static final String KEY_TIMEOUT = "engine_timeout_minutes";

    public static Engine getEngine() { return Engine.fromName(prefs.get(KEY_ENGINE, Engine.LEPHARE.getKey())); }
    public static void setEngine(Engine v) { prefs.put(KEY_ENGINE, v.getKey()); }

    public static CleaningMethod getCleaningMethod() {
        return CleaningMethod.valueOf(prefs.get(KEY_CLEANING, CleaningMethod.ZERO.name()).toUpperCase(Locale.ROOT));
    }
    public static void setCleaningMethod(CleaningMethod v) { prefs.put(KEY_CLEANING, v.name()); }

    public static double getScaleFactor() { return prefs.getDouble(KEY_SCALE, PipelineOptions.DEFAULT_SCALE_FACTOR); }
    public static void setScaleFactor(double v) { prefs.putDouble(KEY_SCALE, v); }

    public static double getPoissonFactor() { return prefs.getDouble(KEY_POISSON, 0); }
    public static void setPoissonFactor(double v) { prefs.putDouble(KEY_POISSON, v); }

    public static ValidPixelPolicy getValidPixelPolicy() {
        return ValidPixelPolicy.valueOf(prefs.get(KEY_PIXEL_POLICY, ValidPixelPolicy.FIRST_BAND.name()).toUpperCase(Locale.ROOT));
    }
    public static void setValidPixelPolicy(ValidPixelPolicy v) { prefs.put(KEY_PIXEL_POLICY, v.name()); }

    /** LePhare installation, used to expand {@code $LEPHAREDIR} in commands. */
    public static String getLePhareDir() {
        String env = System.getenv("LEPHAREDIR");
        return prefs.get(KEY_LEPHARE_DIR, env == null ? "" : env);
    }
    public static void setLePhareDir(String v) { prefs.put(KEY_LEPHARE_DIR, v); }

    public static String getCigaleCommand() { return prefs.get(KEY_CIGALE_CMD, "pcigale"); }
    public static void setCigaleCommand(String v) { prefs.put(KEY_CIGALE_CMD, v); }

    public static long getEngineTimeoutMinutes() { return prefs.getLong(KEY_TIMEOUT, 24 * 60); }
    public static void setEngineTimeoutMinutes(long v) { prefs.putLong(KEY_TIMEOUT, v); }

    /** Options built from the stored defaults. */
    public static PipelineOptions pipelineOptions() {
        return PipelineOptions.defaults()
                .cleaningMethod(getCleaningMethod())
                .scaleFactor(getScaleFactor())
                .poissonFactor(getPoissonFactor())
                .validPixelPolicy(getValidPixelPolicy());
    }
}
