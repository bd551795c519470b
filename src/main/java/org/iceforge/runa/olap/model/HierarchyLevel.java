package org.iceforge.runa.olap.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One level of a hierarchy. Rank 0 is the most detailed level.
 */
public record HierarchyLevel(String name, int rank, String columnRef, List<String> aliases) {

    public HierarchyLevel {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(columnRef, "columnRef");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public boolean matches(String levelName) {
        if (levelName == null) {
            return false;
        }
        String n = levelName.trim().toLowerCase(Locale.ROOT);
        if (name.toLowerCase(Locale.ROOT).equals(n)) {
            return true;
        }
        return aliases.stream().anyMatch(a -> a.toLowerCase(Locale.ROOT).equals(n));
    }
}
