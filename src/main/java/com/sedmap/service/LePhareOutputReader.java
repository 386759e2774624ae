package com.sedmap.service;

import com.sedmap.model.Column;
import com.sedmap.model.DataTable;
import com.sedmap.model.Engine;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads LePhare {@code .out} files.
 *
 * <p>The header holds {@code # KEY : value} configuration lines up to the
 * {@code # Output format} line, then {@code # NAME index, NAME index, ...} lines giving
 * the 1-based column of each output parameter, closed by a line of {@code #}. The
 * {@code IDENT} parameter becomes the {@code ID} identifier column. Known parameters
 * stored as log10 are converted back to linear values, and their -99 (failed fit)
 * entries become NaN.
 */
public class LePhareOutputReader {

    private static final Logger log = LoggerFactory.getLogger(LePhareOutputReader.class);

    public static final String ID_COLUMN = "ID";

    private static final String FORMAT_LINE = "# Output format";

    /** Known output parameters: table name, unit, and whether LePhare writes them as log10. */
    public enum OutputParam {
        Z_BEST("z_best", "", false),
        Z_ML("z_ML", "", false),
        CHI_BEST("chi2", "", false),
        MOD_BEST("Mod_best", "", false),
        EXTLAW_BEST("Ext_law_best", "", false),
        EBV_BEST("E(B-V)_best", "", false),
        SCALE_BEST("scale_best", "", false),
        NBAND_USED("nband", "", false),
        CONTEXT("context", "", false),
        ZSPEC("zspec", "", false),
        AGE_BEST("age_best", "yr", false),
        AGE_INF("age_inf", "yr", false),
        AGE_MED("age_median", "yr", false),
        AGE_SUP("age_sup", "yr", false),
        LDUST_BEST("luminosity_dust_best", "erg/s", false),
        LDUST_INF("luminosity_dust_inf", "erg/s", false),
        LDUST_MED("luminosity_dust_med", "erg/s", false),
        LDUST_SUP("luminosity_dust_sup", "erg/s", false),
        MASS_BEST("mass_best", "Msun", true),
        MASS_INF("mass_inf", "Msun", true),
        MASS_MED("mass_med", "Msun", true),
        MASS_SUP("mass_sup", "Msun", true),
        SFR_BEST("sfr_best", "Msun/yr", true),
        SFR_INF("sfr_inf", "Msun/yr", true),
        SFR_MED("sfr_med", "Msun/yr", true),
        SFR_SUP("sfr_sup", "Msun/yr", true),
        SSFR_BEST("ssfr_best", "1/yr", true),
        SSFR_INF("ssfr_inf", "1/yr", true),
        SSFR_MED("ssfr_med", "1/yr", true),
        SSFR_SUP("ssfr_sup", "1/yr", true);

        public final String tableName;
        public final String unit;
        public final boolean log;

        OutputParam(String tableName, String unit, boolean log) {
            this.tableName = tableName;
            this.unit = unit;
            this.log = log;
        }

        static OutputParam find(String name) {
            for (OutputParam p : values()) if (p.name().equals(name)) return p;
            return null;
        }
    }

    private final Map<String, String> config = new LinkedHashMap<>();

    public DataTable read(Path file) throws IOException {
        config.clear();
        Map<String, Integer> colMap = new LinkedHashMap<>();
        List<double[]> rows = new ArrayList<>();

        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            boolean formatFound = false;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.startsWith(FORMAT_LINE)) {
                    formatFound = true;
                    break;
                }
                int colon = line.lastIndexOf(':');
                if (line.startsWith("#") && colon > 0) {
                    String key = strip(line.substring(0, colon));
                    config.put(key, line.substring(colon + 1).replace("#", "").trim());
                }
            }
            if (!formatFound) throw new IOException("Output format line could not be reached in " + file);

            boolean headerClosed = false;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.matches("#{3,}")) {
                    headerClosed = true;
                    break;
                }
                for (String item : strip(line).split(",")) {
                    String[] kv = item.trim().split("\\s+");
                    if (kv.length != 2) continue;
                    colMap.put(kv[0], Integer.parseInt(kv[1]));
                }
            }
            if (!headerClosed) throw new IOException("End of LePhare output header could not be reached in " + file);

            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] tok = line.split("\\s+");
                double[] row = new double[tok.length];
                for (int i = 0; i < tok.length; i++) row[i] = parse(tok[i]);
                rows.add(row);
            }
        }

        List<Column> columns = new ArrayList<>();
        String idName = null;
        for (Map.Entry<String, Integer> e : colMap.entrySet()) {
            int index = e.getValue() - 1;
            double[] values = new double[rows.size()];
            for (int r = 0; r < rows.size(); r++) {
                double[] row = rows.get(r);
                if (index >= row.length) {
                    throw new IOException("Row " + r + " of " + file + " has no column " + e.getValue() + " (" + e.getKey() + ")");
                }
                values[r] = row[index];
            }

            if (e.getKey().equals("IDENT")) {
                columns.add(Column.ofIdentifiers(ID_COLUMN, values));
                idName = ID_COLUMN;
                continue;
            }

            for (int r = 0; r < values.length; r++) {
                if (values[r] <= Engine.MISSING_SENTINEL) values[r] = Double.NaN;
            }
            OutputParam param = OutputParam.find(e.getKey());
            if (param == null) {
                log.debug("Unknown LePhare output parameter {}, keeping its name", e.getKey());
                columns.add(Column.of(e.getKey(), values));
            } else {
                if (param.log) {
                    for (int r = 0; r < values.length; r++) values[r] = Math.pow(10, values[r]);
                }
                columns.add(new Column(param.tableName, values, null, param.unit.isEmpty() ? null : param.unit, false));
            }
        }
        log.info("Read {} rows and {} columns from {}", rows.size(), columns.size(), file);
        return new DataTable(columns, idName);
    }

    /** Configuration found in the header of the last file read. */
    public Map<String, String> getConfig() {
        return Collections.unmodifiableMap(config);
    }

    private static String strip(String s) {
        return s.replaceAll("^[#,\\s]+", "").replaceAll("[#,\\s]+$", "");
    }

    private static double parse(String token) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
