package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.model.CatalogModel;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.Hierarchy;
import org.iceforge.runa.olap.model.HierarchyDef;
import org.iceforge.runa.olap.model.HierarchyLevel;
import org.iceforge.runa.olap.model.LevelDef;
import org.iceforge.runa.olap.model.StarSchemaDef;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only view of the three hierarchies and the star schema they are mapped onto.
 */
public class HierarchyCatalog {

    private final Map<Dimension, Hierarchy> hierarchies;
    private final StarSchemaDef schema;

    public HierarchyCatalog(Map<Dimension, Hierarchy> hierarchies, StarSchemaDef schema) {
        this.hierarchies = new EnumMap<>(hierarchies);
        this.schema = Objects.requireNonNull(schema, "schema");
        for (Dimension d : Dimension.values()) {
            if (!this.hierarchies.containsKey(d)) {
                throw new IllegalStateException("Catalog has no hierarchy for dimension '" + d.key() + "'");
            }
        }
    }

    /**
     * Builds and validates a catalog from its YAML form.
     *
     * @throws IllegalStateException if a hierarchy is missing, has fewer than two levels, non-contiguous ranks or
     *                               duplicate level names
     */
    public static HierarchyCatalog from(CatalogModel model) {
        Objects.requireNonNull(model);
        if (model.getSchema() == null) {
            throw new IllegalStateException("Catalog has no star schema section");
        }
        Map<String, HierarchyDef> defs = model.getHierarchies() == null ? Map.of() : model.getHierarchies();

        Map<Dimension, Hierarchy> hierarchies = new EnumMap<>(Dimension.class);
        for (Map.Entry<String, HierarchyDef> e : defs.entrySet()) {
            Dimension dimension = Dimension.lookup(e.getKey());
            if (dimension == null) {
                throw new IllegalStateException("Catalog hierarchy '" + e.getKey() + "' is not one of geography, time, product");
            }
            hierarchies.put(dimension, toHierarchy(dimension, e.getValue()));
        }
        return new HierarchyCatalog(hierarchies, model.getSchema());
    }

    private static Hierarchy toHierarchy(Dimension dimension, HierarchyDef def) {
        List<LevelDef> levelDefs = def == null || def.getLevels() == null ? List.of() : def.getLevels();
        List<HierarchyLevel> levels = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (LevelDef ld : levelDefs) {
            if (ld.getName() == null || ld.getColumn() == null) {
                throw new IllegalStateException("Level in hierarchy '" + dimension.key() + "' needs both name and column");
            }
            if (!names.add(ld.getName().toLowerCase(Locale.ROOT))) {
                throw new IllegalStateException("Duplicate level '" + ld.getName() + "' in hierarchy '" + dimension.key() + "'");
            }
            levels.add(new HierarchyLevel(ld.getName(), ld.getRank(), ld.getColumn(), ld.getAliases()));
        }
        levels.sort(Comparator.comparingInt(HierarchyLevel::rank));
        try {
            return new Hierarchy(dimension, levels);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid catalog: " + ex.getMessage(), ex);
        }
    }

    public Hierarchy hierarchy(Dimension dimension) {
        return hierarchies.get(dimension);
    }

    public StarSchemaDef schema() {
        return schema;
    }

    public int maxRank(Dimension dimension) {
        return hierarchy(dimension).maxRank();
    }

    public HierarchyLevel level(Dimension dimension, int rank) {
        return hierarchy(dimension).level(rank);
    }

    /**
     * @throws UnknownLevelException if the hierarchy has no level with that name or alias
     */
    public HierarchyLevel level(Dimension dimension, String levelName) {
        Hierarchy h = hierarchy(dimension);
        return h.find(levelName).orElseThrow(() -> new UnknownLevelException(
                "Unknown level '" + levelName + "' for " + dimension.key() + ". Must be one of: "
                        + h.levels().stream().map(HierarchyLevel::name).toList()));
    }

    /**
     * @throws UnknownLevelException if the name is not a dimension
     */
    public Dimension dimension(String dimensionName) {
        Dimension d = Dimension.lookup(dimensionName);
        if (d == null) {
            throw new UnknownLevelException("Unknown dimension '" + dimensionName + "'. Must be one of: geography, time, product");
        }
        return d;
    }

    /**
     * Finds the dimension owning a level name, for filters given by level only (e.g. "Year").
     */
    public Dimension dimensionOfLevel(String levelName) {
        for (Dimension d : Dimension.values()) {
            if (hierarchy(d).find(levelName).isPresent()) {
                return d;
            }
        }
        throw new UnknownLevelException("No hierarchy has a level named '" + levelName + "'");
    }
}
