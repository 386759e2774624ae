package com.sedmap.model;

import com.sedmap.exception.UnsupportedEngineException;
import java.util.Locale;

/**
 * SED fitting engines the pipeline can prepare data for. Each engine selects the
 * engine dependent steps of the pipeline and the names of its catalogue columns.
 */
public enum Engine {

    /** Normalize and scale, then convert to AB magnitudes. Missing entries are written as -99. */
    LEPHARE("lephare", true, "ID", "zs", "Context", "in", "mag") {
        @Override
        public String errorColumnName(String band) {
            return "e_" + band;
        }
    },

    /** Flux densities in mJy, no normalization. */
    CIGALE("cigale", false, "id", "redshift", null, "mag", "mJy") {
        @Override
        public String errorColumnName(String band) {
            return band + "_err";
        }
    };

    /** Value written by LePhare tables for entries that must not be fitted. */
    public static final double MISSING_SENTINEL = -99;

    private final String key;
    private final boolean normalizes;
    private final String idColumn;
    private final String redshiftColumn;
    private final String contextColumn;
    private final String catalogueExtension;
    private final String valueUnit;

    Engine(String key, boolean normalizes, String idColumn, String redshiftColumn, String contextColumn,
           String catalogueExtension, String valueUnit) {
        this.key = key;
        this.normalizes = normalizes;
        this.idColumn = idColumn;
        this.redshiftColumn = redshiftColumn;
        this.contextColumn = contextColumn;
        this.catalogueExtension = catalogueExtension;
        this.valueUnit = valueUnit;
    }

    public abstract String errorColumnName(String band);

    /** Case insensitive lookup by engine name. */
    public static Engine fromName(String name) {
        if (name != null) {
            String wanted = name.trim().toLowerCase(Locale.ROOT);
            for (Engine e : values()) {
                if (e.key.equals(wanted)) return e;
            }
        }
        throw new UnsupportedEngineException(name);
    }

    public String getKey() { return key; }
    public boolean normalizes() { return normalizes; }
    public String getIdColumn() { return idColumn; }
    public String getRedshiftColumn() { return redshiftColumn; }
    public String getContextColumn() { return contextColumn; }
    public boolean hasContextColumn() { return contextColumn != null; }
    public String getCatalogueExtension() { return catalogueExtension; }
    public String getValueUnit() { return valueUnit; }
}
