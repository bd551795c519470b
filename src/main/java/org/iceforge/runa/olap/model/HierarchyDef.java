package org.iceforge.runa.olap.model;

import java.util.List;

public class HierarchyDef {
    private String description;
    private List<LevelDef> levels; // listed most aggregated first, as analysts read them

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<LevelDef> getLevels() {
        return levels;
    }

    public void setLevels(List<LevelDef> levels) {
        this.levels = levels;
    }
}
