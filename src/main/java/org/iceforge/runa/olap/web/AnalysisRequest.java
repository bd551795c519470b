package org.iceforge.runa.olap.web;

import jakarta.validation.Valid;

public class AnalysisRequest {

    /**
     * Replaces the session filter for this one run when present.
     */
    @Valid
    private FilterRequest filter;

    public FilterRequest getFilter() {
        return filter;
    }

    public void setFilter(FilterRequest filter) {
        this.filter = filter;
    }
}
