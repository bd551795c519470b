package org.iceforge.runa.olap.model;

import java.util.Map;

public class CatalogModel {
    private StarSchemaDef schema;
    private Map<String, HierarchyDef> hierarchies;

    public StarSchemaDef getSchema() {
        return schema;
    }

    public void setSchema(StarSchemaDef schema) {
        this.schema = schema;
    }

    public Map<String, HierarchyDef> getHierarchies() {
        return hierarchies;
    }

    public void setHierarchies(Map<String, HierarchyDef> hierarchies) {
        this.hierarchies = hierarchies;
    }
}
