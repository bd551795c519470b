package org.iceforge.runa.olap.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Equality filter on one level, e.g. {"level":"Year","value":2019}.
 */
public class FilterRequest {

    @NotBlank
    private String level;

    @NotNull
    private Object value;

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }
}
