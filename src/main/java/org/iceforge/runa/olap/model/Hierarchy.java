package org.iceforge.runa.olap.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered levels of one dimension. {@code levels().get(i).rank() == i} always holds.
 */
public record Hierarchy(Dimension dimension, List<HierarchyLevel> levels) {

    public Hierarchy {
        Objects.requireNonNull(dimension, "dimension");
        levels = List.copyOf(levels);
        if (levels.size() < 2) {
            throw new IllegalArgumentException("Hierarchy '" + dimension.key() + "' needs at least 2 levels, got " + levels.size());
        }
        for (int i = 0; i < levels.size(); i++) {
            if (levels.get(i).rank() != i) {
                throw new IllegalArgumentException("Hierarchy '" + dimension.key() + "' has level '" + levels.get(i).name()
                        + "' at position " + i + " with rank " + levels.get(i).rank());
            }
        }
    }

    public int maxRank() {
        return levels.size() - 1;
    }

    public HierarchyLevel level(int rank) {
        if (rank < 0 || rank > maxRank()) {
            throw new IllegalArgumentException("Rank " + rank + " outside [0, " + maxRank() + "] for " + dimension.key());
        }
        return levels.get(rank);
    }

    public Optional<HierarchyLevel> find(String levelName) {
        return levels.stream().filter(l -> l.matches(levelName)).findFirst();
    }
}
