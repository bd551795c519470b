package org.iceforge.runa.olap.model;

import java.util.Locale;

/**
 * The three analysis dimensions. Declaration order is the column order of every request and result row.
 */
public enum Dimension {
    GEOGRAPHY("geography", "geo"),
    TIME("time", "time"),
    PRODUCT("product", "product");

    private final String key;
    private final String shortName;

    Dimension(String key, String shortName) {
        this.key = key;
        this.shortName = shortName;
    }

    /**
     * Key of the hierarchy in the catalog YAML.
     */
    public String key() {
        return key;
    }

    /**
     * Prefix used for result column aliases, e.g. {@code geo_value}.
     */
    public String shortName() {
        return shortName;
    }

    /**
     * Accepts the enum name, the catalog key or the short name, ignoring case.
     *
     * @return the dimension, or {@code null} if nothing matches
     */
    public static Dimension lookup(String name) {
        if (name == null) {
            return null;
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (Dimension d : values()) {
            if (d.key.equals(n) || d.shortName.equals(n) || d.name().toLowerCase(Locale.ROOT).equals(n)) {
                return d;
            }
        }
        return null;
    }
}
