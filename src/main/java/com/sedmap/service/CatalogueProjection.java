package com.sedmap.service;

import com.sedmap.exception.ConfigurationException;
import com.sedmap.model.Catalogue;
import com.sedmap.model.Column;
import com.sedmap.model.DataTable;
import com.sedmap.model.Engine;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lays a pipeline table out the way an engine reads it. Only names and column
 * order change; values are copied as they are.
 *
 * <ul>
 *   <li>LePhare: {@code ID, b1, e_b1, b2, e_b2, ..., Context, zs}</li>
 *   <li>Cigale: {@code id, redshift, b1, b2, ..., b1_err, b2_err, ...}</li>
 * </ul>
 */
public final class CatalogueProjection {

    private final Engine engine;
    private final Catalogue.Layout defaultLayout;

    private CatalogueProjection(Engine engine, Catalogue.Layout defaultLayout) {
        this.engine = engine;
        this.defaultLayout = defaultLayout;
    }

    public static CatalogueProjection forEngine(Engine engine) {
        if (engine == null) throw new ConfigurationException("engine must not be null");
        return new CatalogueProjection(engine,
                engine == Engine.LEPHARE ? Catalogue.Layout.INTERLEAVED : Catalogue.Layout.GROUPED);
    }

    public Catalogue project(DataTable table, String baseName) {
        return project(table, baseName, defaultLayout);
    }

    public Catalogue project(DataTable table, String baseName, Catalogue.Layout layout) {
        if (baseName == null || baseName.trim().isEmpty()) {
            throw new ConfigurationException("Catalogue base name must not be blank");
        }
        if (layout == null) throw new ConfigurationException("layout must not be null");

        Column id = table.column(engine.getIdColumn());
        Column z = table.column(engine.getRedshiftColumn());
        Column context = engine.hasContextColumn() ? table.column(engine.getContextColumn()) : null;

        List<Column> bands = new ArrayList<>();
        for (Column c : table.getColumns()) {
            if (c.hasErrors()) bands.add(c);
        }

        Map<String, double[]> out = new LinkedHashMap<>();
        List<String> integers = new ArrayList<>();
        out.put(id.name, id.getValues());
        integers.add(id.name);
        if (engine == Engine.CIGALE) out.put(z.name, z.getValues());

        if (layout == Catalogue.Layout.INTERLEAVED) {
            for (Column b : bands) {
                out.put(b.name, b.getValues());
                out.put(engine.errorColumnName(b.name), b.getErrors());
            }
        } else {
            for (Column b : bands) out.put(b.name, b.getValues());
            for (Column b : bands) out.put(engine.errorColumnName(b.name), b.getErrors());
        }

        if (context != null) {
            out.put(context.name, context.getValues());
            integers.add(context.name);
        }
        if (engine != Engine.CIGALE) out.put(z.name, z.getValues());

        return new Catalogue(baseName.trim(), engine, layout, out, integers);
    }

    public Engine getEngine() {
        return engine;
    }
}
